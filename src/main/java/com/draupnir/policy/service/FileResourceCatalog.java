package com.draupnir.policy.service;

import com.draupnir.policy.corpus.CorpusEntry;
import com.draupnir.policy.corpus.CorpusException;
import com.draupnir.policy.model.api.ResourceDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Publishes every data file under a file:// URI of its absolute path.
 * Reads go through the workspace sandbox.
 */
@Slf4j
public class FileResourceCatalog implements ResourceCatalog {

    private static final Map<String, String> MIME_TYPES = Map.of(
            ".txt", "text/plain",
            ".md", "text/markdown",
            ".json", "application/json",
            ".csv", "text/csv",
            ".yaml", "application/yaml",
            ".yml", "application/yaml");

    @Override
    public List<ResourceDescriptor> listResources(PolicyWorkspace workspace) throws CorpusException {
        List<ResourceDescriptor> resources = workspace.getCorpus().entries().stream()
                .map(entry -> describe(workspace, entry))
                .collect(Collectors.toList());
        log.debug("Listed {} resources under {}", resources.size(), workspace.getRoot());
        return resources;
    }

    @Override
    public String readResource(PolicyWorkspace workspace, String uri) throws CorpusException {
        if (uri == null || !uri.startsWith(FILE_SCHEME)) {
            throw new IllegalArgumentException("Only file:// URIs are supported");
        }
        return workspace.readText(uri.substring(FILE_SCHEME.length()));
    }

    private ResourceDescriptor describe(PolicyWorkspace workspace, CorpusEntry entry) {
        return ResourceDescriptor.builder()
                .uri(FILE_SCHEME + entry.getAbsolutePath())
                .name(entry.getRelativePath())
                .description(String.format("Static file '%s' from %s", entry.getRelativePath(), workspace.getRoot()))
                .mimeType(guessMimeType(entry))
                .build();
    }

    static String guessMimeType(CorpusEntry entry) {
        return MIME_TYPES.get(entry.extension());
    }
}
