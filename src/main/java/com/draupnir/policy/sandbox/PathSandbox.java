package com.draupnir.policy.sandbox;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Confines user-supplied paths to a single root directory.
 * <p>
 * {@link #resolve(String)} is purely lexical: the path is joined with the root,
 * {@code .} and {@code ..} are collapsed, and the result must be the root itself or
 * nested under it. {@link #verifyRealPath(Path)} additionally follows symlinks of a file
 * that exists, so a link pointing out of the root is rejected before anything is read.
 */
@Slf4j
public class PathSandbox {

    private final Path root;

    public PathSandbox(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Resolve a user path against the root.
     *
     * @param userPath relative (or absolute) path, '/' or '\' separated
     * @return absolute, normalized path inside the root
     * @throws PathAccessDeniedException if the path escapes the root or is malformed
     */
    public Path resolve(String userPath) {
        if (userPath == null) {
            throw new PathAccessDeniedException(null, "Path is required");
        }
        String normalizedRequest = userPath.replace('\\', '/');
        Path target;
        try {
            Path requested = Paths.get(normalizedRequest);
            target = requested.isAbsolute()
                    ? requested.normalize()
                    : root.resolve(requested).normalize();
        } catch (InvalidPathException e) {
            throw new PathAccessDeniedException(userPath, "Invalid path: " + userPath);
        }

        if (!target.startsWith(root)) {
            log.warn("Rejected path outside data dir: {} (root: {})", userPath, root);
            throw new PathAccessDeniedException(userPath,
                    "Access outside data dir is not allowed: " + userPath);
        }
        return target;
    }

    /**
     * Reject an existing path whose real location (symlinks followed) leaves the root.
     * Missing paths pass; the caller reports them as not found.
     */
    public void verifyRealPath(Path resolved) throws IOException {
        if (!Files.exists(resolved)) {
            return;
        }
        Path realRoot = Files.exists(root) ? root.toRealPath() : root;
        Path realTarget = resolved.toRealPath();
        if (!realTarget.startsWith(realRoot)) {
            log.warn("Rejected symlink escaping data dir: {} -> {}", resolved, realTarget);
            throw new PathAccessDeniedException(resolved.toString(),
                    "Access outside data dir is not allowed: " + root.relativize(resolved));
        }
    }

    /**
     * Forward-slash path of a file under the root, e.g. {@code policies/web.yaml}
     */
    public String relativize(Path absolute) {
        Path relative = root.relativize(absolute.toAbsolutePath().normalize());
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part.toString());
        }
        return sb.toString();
    }
}
