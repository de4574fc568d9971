package com.draupnir.policy.model;

import java.util.Optional;

/**
 * Policy kinds the validator understands. Anything else is treated as unrecognized.
 */
public enum PolicyKind {

    CILIUM_NETWORK_POLICY("CiliumNetworkPolicy"),
    CILIUM_CLUSTERWIDE_NETWORK_POLICY("CiliumClusterwideNetworkPolicy");

    private final String kindName;

    PolicyKind(String kindName) {
        this.kindName = kindName;
    }

    public String getKindName() {
        return kindName;
    }

    /**
     * Exact, case-sensitive lookup by the document's {@code kind} value
     */
    public static Optional<PolicyKind> fromKindName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PolicyKind kind : values()) {
            if (kind.kindName.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
