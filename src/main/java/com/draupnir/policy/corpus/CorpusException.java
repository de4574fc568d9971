package com.draupnir.policy.corpus;

import java.io.IOException;

/**
 * Base failure for loading a file from the data directory.
 * Fatal for single-file operations, skipped by corpus-wide scans.
 */
public class CorpusException extends IOException {

    private final String path;

    public CorpusException(String path, String message) {
        super(message);
        this.path = path;
    }

    public CorpusException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * Relative path of the file involved
     */
    public String getPath() {
        return path;
    }
}
