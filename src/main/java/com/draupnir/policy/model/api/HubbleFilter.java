package com.draupnir.policy.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hubble flow query, as a CLI line and as structured filters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HubbleFilter {

    @JsonProperty("cli")
    private String cli;

    @JsonProperty("filters")
    private Filters filters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Filters {

        @JsonProperty("from")
        private String from;

        @JsonProperty("to")
        private String to;

        @JsonProperty("verdict")
        private String verdict;
    }
}
