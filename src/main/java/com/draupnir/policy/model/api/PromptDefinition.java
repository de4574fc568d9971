package com.draupnir.policy.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canned instruction text a client can hand to its model
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptDefinition {

    @JsonProperty("name")
    private String name;

    @JsonProperty("text")
    private String text;
}
