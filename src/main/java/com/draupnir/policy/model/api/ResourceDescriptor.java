package com.draupnir.policy.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A data-directory file published as a readable resource
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceDescriptor {

    /**
     * file:// URI of the absolute path
     */
    @JsonProperty("uri")
    private String uri;

    /**
     * Path relative to the data directory
     */
    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    /**
     * Null when the extension is not one we know
     */
    @JsonProperty("mimeType")
    private String mimeType;
}
