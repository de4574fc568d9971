package com.draupnir.policy.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for policy template generation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateRequest {

    @JsonProperty("app")
    private String app;

    @JsonProperty("namespace")
    private String namespace;

    /**
     * "port/protocol" entries, e.g. "8080/TCP"; protocol defaults to TCP
     */
    @JsonProperty("ingressPorts")
    private List<String> ingressPorts;

    @JsonProperty("egressFqdns")
    private List<String> egressFqdns;
}
