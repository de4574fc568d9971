package com.draupnir.policy.yaml;

import com.draupnir.policy.model.document.DocumentNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Renders document trees back to block YAML.
 * <p>
 * {@link #render} keeps key order, for output meant to be read by people.
 * {@link #renderCanonical} sorts keys, so text-based heuristics see the same
 * text for the same content.
 */
public class DocumentRenderer {

    private final ObjectMapper orderedMapper;
    private final ObjectMapper canonicalMapper;

    public DocumentRenderer() {
        this.orderedMapper = new ObjectMapper(createFactory());
        this.canonicalMapper = new ObjectMapper(createFactory())
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    private static YAMLFactory createFactory() {
        return YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
    }

    public String render(DocumentNode node) {
        return write(orderedMapper, node);
    }

    public String renderCanonical(DocumentNode node) {
        return write(canonicalMapper, node);
    }

    private static String write(ObjectMapper mapper, DocumentNode node) {
        try {
            return mapper.writeValueAsString(node.toPlainObject());
        } catch (JsonProcessingException e) {
            // plain maps, lists and scalars always serialize
            throw new IllegalStateException("Failed to render document: " + e.getMessage(), e);
        }
    }
}
