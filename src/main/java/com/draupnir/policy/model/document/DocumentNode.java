package com.draupnir.policy.model.document;

import java.util.Optional;

/**
 * Parsed policy content as a tagged tree: mapping, sequence, scalar or null.
 * <p>
 * Every accessor is lenient: asking a node for something it is not returns an empty
 * {@link Optional} instead of failing, so missing or mistyped fields read as absent.
 */
public abstract class DocumentNode {

    public enum Type {
        MAPPING,
        SEQUENCE,
        SCALAR,
        NULL
    }

    DocumentNode() {
    }

    public abstract Type getType();

    /**
     * Truthiness as policy authors expect it: empty collections, empty strings,
     * zero, false and null are all "not set".
     */
    public abstract boolean isTruthy();

    /**
     * Convert to plain Java values (LinkedHashMap, ArrayList, String/Number/Boolean, null)
     * for serialization.
     */
    public abstract Object toPlainObject();

    public boolean isMapping() {
        return getType() == Type.MAPPING;
    }

    public boolean isSequence() {
        return getType() == Type.SEQUENCE;
    }

    public boolean isScalar() {
        return getType() == Type.SCALAR;
    }

    public boolean isNull() {
        return getType() == Type.NULL;
    }

    public Optional<MappingNode> asMapping() {
        return Optional.empty();
    }

    public Optional<SequenceNode> asSequence() {
        return Optional.empty();
    }

    public Optional<ScalarNode> asScalar() {
        return Optional.empty();
    }

    /**
     * Field lookup that is only meaningful on mappings.
     */
    public Optional<DocumentNode> get(String key) {
        return asMapping().flatMap(mapping -> mapping.field(key));
    }
}
