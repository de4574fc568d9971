package com.draupnir.policy.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A line that matched a text search
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    @JsonProperty("path")
    private String path;

    /**
     * 1-based
     */
    @JsonProperty("line_no")
    private int lineNo;

    @JsonProperty("line")
    private String line;
}
