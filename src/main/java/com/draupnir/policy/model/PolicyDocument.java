package com.draupnir.policy.model;

import com.draupnir.policy.model.document.DocumentNode;
import com.draupnir.policy.model.document.MappingNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * One loaded document: where it came from plus its parsed tree
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicyDocument {

    /**
     * Forward-slash path relative to the data directory
     */
    private String path;

    private DocumentNode root;

    public Optional<MappingNode> rootMapping() {
        return root == null ? Optional.empty() : root.asMapping();
    }

    /**
     * Raw {@code kind} value when it is a scalar
     */
    public Optional<String> rawKind() {
        return rootMapping().flatMap(mapping -> mapping.text("kind"));
    }

    public Optional<PolicyKind> kind() {
        return rawKind().flatMap(PolicyKind::fromKindName);
    }
}
