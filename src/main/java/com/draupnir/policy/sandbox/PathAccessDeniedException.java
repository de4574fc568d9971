package com.draupnir.policy.sandbox;

/**
 * A requested path resolves outside the data directory.
 */
public class PathAccessDeniedException extends SecurityException {

    private final String requestedPath;

    public PathAccessDeniedException(String requestedPath, String message) {
        super(message);
        this.requestedPath = requestedPath;
    }

    public String getRequestedPath() {
        return requestedPath;
    }
}
