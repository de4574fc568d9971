package com.draupnir.policy.service;

import com.draupnir.policy.model.api.ResourceDescriptor;

import java.util.List;

/**
 * Used when resource publishing is switched off
 */
public class DisabledResourceCatalog implements ResourceCatalog {

    @Override
    public List<ResourceDescriptor> listResources(PolicyWorkspace workspace) {
        return List.of();
    }

    @Override
    public String readResource(PolicyWorkspace workspace, String uri) {
        throw new UnsupportedOperationException("Resources are disabled on this server");
    }
}
