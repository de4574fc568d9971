package com.draupnir.policy.service;

import com.draupnir.policy.corpus.CorpusException;
import com.draupnir.policy.model.api.ResourceDescriptor;

import java.util.List;

/**
 * How data files are published as resources. The implementation is chosen once,
 * when the service is created.
 */
public interface ResourceCatalog {

    String FILE_SCHEME = "file://";

    List<ResourceDescriptor> listResources(PolicyWorkspace workspace) throws CorpusException;

    String readResource(PolicyWorkspace workspace, String uri) throws CorpusException;

    static ResourceCatalog create(boolean exposeResources) {
        return exposeResources ? new FileResourceCatalog() : new DisabledResourceCatalog();
    }
}
