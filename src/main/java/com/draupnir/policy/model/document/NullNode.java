package com.draupnir.policy.model.document;

/**
 * Explicit null, or an empty document.
 */
public final class NullNode extends DocumentNode {

    public static final NullNode INSTANCE = new NullNode();

    private NullNode() {
    }

    @Override
    public Type getType() {
        return Type.NULL;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public Object toPlainObject() {
        return null;
    }

    @Override
    public String toString() {
        return "null";
    }
}
