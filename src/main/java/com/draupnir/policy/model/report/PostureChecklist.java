package com.draupnir.policy.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Zero-trust posture checklist for a set of policies
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PostureChecklist {

    @JsonProperty("stats")
    private PostureStats stats = new PostureStats();

    @JsonProperty("details")
    private List<PostureDetail> details = new ArrayList<>();
}
