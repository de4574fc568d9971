package com.draupnir.policy.service;

import com.draupnir.policy.corpus.CorpusEntry;
import com.draupnir.policy.corpus.CorpusException;
import com.draupnir.policy.corpus.CorpusReadException;
import com.draupnir.policy.corpus.FileCorpus;
import com.draupnir.policy.model.PolicyDocument;
import com.draupnir.policy.sandbox.PathAccessDeniedException;
import com.draupnir.policy.sandbox.PathSandbox;
import com.draupnir.policy.yaml.PolicyDocumentParser;
import lombok.Getter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Everything bound to one data directory. Immutable; a reload builds a new one.
 */
@Getter
public class PolicyWorkspace {

    private final Path root;
    private final PathSandbox sandbox;
    private final FileCorpus corpus;
    private final PolicyDocumentParser parser;

    public PolicyWorkspace(Path root) {
        this.sandbox = new PathSandbox(root);
        this.root = sandbox.getRoot();
        this.corpus = new FileCorpus(sandbox);
        this.parser = new PolicyDocumentParser();
    }

    /**
     * Sandbox check, symlink check, then read
     */
    public String readText(String userPath) throws CorpusException {
        Path resolved = sandbox.resolve(userPath);
        try {
            sandbox.verifyRealPath(resolved);
        } catch (IOException e) {
            throw new CorpusReadException(userPath, "Failed to resolve " + userPath + ": " + e.getMessage(), e);
        }
        return corpus.readText(resolved);
    }

    /**
     * Read and parse a user-named file; the document keeps the path as given
     */
    public PolicyDocument loadDocument(String userPath) throws CorpusException {
        return parser.parse(userPath, readText(userPath));
    }

    /**
     * Read a file found by walking the corpus. A symlink leaving the root is a read
     * failure here, so corpus-wide callers skip it like any other unreadable file.
     */
    public String readEntry(CorpusEntry entry) throws CorpusException {
        String relative = entry.getRelativePath();
        try {
            sandbox.verifyRealPath(entry.getAbsolutePath());
        } catch (PathAccessDeniedException e) {
            throw new CorpusReadException(relative, e.getMessage(), null);
        } catch (IOException e) {
            throw new CorpusReadException(relative, "Failed to resolve " + relative + ": " + e.getMessage(), e);
        }
        return corpus.readText(entry);
    }

    /**
     * Read and parse a file found by walking the corpus
     */
    public PolicyDocument load(CorpusEntry entry) throws CorpusException {
        return parser.parse(entry.getRelativePath(), readEntry(entry));
    }
}
