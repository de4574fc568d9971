package com.draupnir.policy.yaml;

import com.draupnir.policy.model.PolicyDocument;
import com.draupnir.policy.model.document.DocumentNode;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.document.NullNode;
import com.draupnir.policy.model.document.ScalarNode;
import com.draupnir.policy.model.document.SequenceNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses YAML (and therefore JSON) policy text into a {@link DocumentNode} tree.
 * <p>
 * A file must hold a single document. Empty text parses to {@link NullNode}.
 */
@Slf4j
public class PolicyDocumentParser {

    private final ObjectMapper yamlMapper;

    public PolicyDocumentParser() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * @param path    relative path, used in messages only
     * @param content file text
     * @throws PolicyParseException on malformed YAML or more than one document
     */
    public PolicyDocument parse(String path, String content) throws PolicyParseException {
        List<JsonNode> documents = new ArrayList<>();
        try (MappingIterator<JsonNode> it = yamlMapper.readerFor(JsonNode.class).readValues(content)) {
            while (it.hasNextValue()) {
                documents.add(it.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to parse {}: {}", path, e.getMessage());
            throw new PolicyParseException(path, "Invalid YAML in " + path + ": " + e.getMessage(), e);
        }

        if (documents.size() > 1) {
            throw new PolicyParseException(path,
                    "Expected a single document in " + path + " but found " + documents.size(), null);
        }

        DocumentNode root = documents.isEmpty() ? NullNode.INSTANCE : convert(documents.get(0));
        return new PolicyDocument(path, root);
    }

    /**
     * Map a Jackson tree onto the document model
     */
    static DocumentNode convert(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullNode.INSTANCE;
        }
        if (node.isObject()) {
            MappingNode mapping = MappingNode.create();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                mapping.put(field.getKey(), convert(field.getValue()));
            }
            return mapping;
        }
        if (node.isArray()) {
            SequenceNode sequence = SequenceNode.create();
            for (JsonNode item : node) {
                sequence.add(convert(item));
            }
            return sequence;
        }
        if (node.isBoolean()) {
            return ScalarNode.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return ScalarNode.of(node.numberValue());
        }
        return ScalarNode.of(node.asText());
    }
}
