package com.draupnir.policy.model.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Ordered list node.
 */
public final class SequenceNode extends DocumentNode {

    private final List<DocumentNode> items = new ArrayList<>();

    public static SequenceNode create() {
        return new SequenceNode();
    }

    public static SequenceNode of(DocumentNode... nodes) {
        SequenceNode sequence = new SequenceNode();
        for (DocumentNode node : nodes) {
            sequence.add(node);
        }
        return sequence;
    }

    @Override
    public Type getType() {
        return Type.SEQUENCE;
    }

    @Override
    public boolean isTruthy() {
        return !items.isEmpty();
    }

    @Override
    public Optional<SequenceNode> asSequence() {
        return Optional.of(this);
    }

    public SequenceNode add(DocumentNode node) {
        items.add(node == null ? NullNode.INSTANCE : node);
        return this;
    }

    public List<DocumentNode> items() {
        return Collections.unmodifiableList(items);
    }

    public Stream<DocumentNode> stream() {
        return items.stream();
    }

    /**
     * Only the items that are mappings; anything else is skipped.
     */
    public Stream<MappingNode> mappings() {
        return items.stream().flatMap(item -> item.asMapping().stream());
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Object toPlainObject() {
        List<Object> plain = new ArrayList<>(items.size());
        for (DocumentNode item : items) {
            plain.add(item.toPlainObject());
        }
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SequenceNode && items.equals(((SequenceNode) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
