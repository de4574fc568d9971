package com.draupnir.policy.model.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value node. Keys keep document order.
 */
public final class MappingNode extends DocumentNode {

    private final Map<String, DocumentNode> fields = new LinkedHashMap<>();

    public static MappingNode create() {
        return new MappingNode();
    }

    @Override
    public Type getType() {
        return Type.MAPPING;
    }

    @Override
    public boolean isTruthy() {
        return !fields.isEmpty();
    }

    @Override
    public Optional<MappingNode> asMapping() {
        return Optional.of(this);
    }

    public MappingNode put(String key, DocumentNode value) {
        fields.put(key, value == null ? NullNode.INSTANCE : value);
        return this;
    }

    public MappingNode put(String key, String value) {
        return put(key, ScalarNode.of(value));
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public Optional<DocumentNode> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<MappingNode> mapping(String key) {
        return field(key).flatMap(DocumentNode::asMapping);
    }

    public Optional<SequenceNode> sequence(String key) {
        return field(key).flatMap(DocumentNode::asSequence);
    }

    /**
     * Scalar text of a field; absent for missing, null or non-scalar values.
     */
    public Optional<String> text(String key) {
        return field(key).flatMap(DocumentNode::asScalar).map(ScalarNode::asText);
    }

    /**
     * True when the key is present and its value is truthy.
     */
    public boolean isSet(String key) {
        return field(key).map(DocumentNode::isTruthy).orElse(false);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    public Map<String, DocumentNode> entries() {
        return Collections.unmodifiableMap(fields);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public Object toPlainObject() {
        Map<String, Object> plain = new LinkedHashMap<>();
        fields.forEach((key, value) -> plain.put(key, value.toPlainObject()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MappingNode && fields.equals(((MappingNode) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
