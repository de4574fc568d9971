package com.draupnir.policy.model.api;

import com.draupnir.policy.model.report.PostureDetail;
import com.draupnir.policy.model.report.PostureStats;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * JSON export model for a posture scan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostureExport {

    @JsonProperty("generatedAt")
    private Instant generatedAt;

    @JsonProperty("dataDir")
    private String dataDir;

    @JsonProperty("pathGlob")
    private String pathGlob;

    @JsonProperty("stats")
    private PostureStats stats;

    @JsonProperty("details")
    private List<PostureDetail> details;
}
