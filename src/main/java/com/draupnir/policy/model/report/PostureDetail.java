package com.draupnir.policy.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One scanned policy in the posture checklist
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostureDetail {

    @JsonProperty("path")
    private String path;

    @JsonProperty("kind")
    private String kind;

    /**
     * Some ingress or egress rule carries populated toPorts
     */
    @JsonProperty("l7")
    private boolean hasL7;

    @JsonProperty("dns_handled")
    private boolean dnsHandled;
}
