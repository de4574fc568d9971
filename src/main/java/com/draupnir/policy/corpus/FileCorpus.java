package com.draupnir.policy.corpus;

import com.draupnir.policy.sandbox.PathSandbox;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The regular files under the data directory, addressed by relative path.
 * Reads are strict UTF-8.
 */
@Slf4j
public class FileCorpus {

    private final PathSandbox sandbox;

    public FileCorpus(PathSandbox sandbox) {
        this.sandbox = sandbox;
    }

    public Path getRoot() {
        return sandbox.getRoot();
    }

    /**
     * Every regular file under the root, recursively, ordered by relative path.
     * A missing root is an empty corpus.
     */
    public List<CorpusEntry> entries() throws CorpusReadException {
        Path root = sandbox.getRoot();
        if (!Files.isDirectory(root)) {
            log.debug("Data dir does not exist: {}", root);
            return List.of();
        }

        try (Stream<Path> paths = Files.walk(root)) {
            List<CorpusEntry> entries = paths
                    .filter(Files::isRegularFile)
                    .map(p -> new CorpusEntry(sandbox.relativize(p), p))
                    .sorted(Comparator.comparing(CorpusEntry::getRelativePath))
                    .collect(Collectors.toList());
            log.debug("Found {} files under {}", entries.size(), root);
            return entries;
        } catch (IOException | UncheckedIOException e) {
            throw new CorpusReadException("", "Failed to list data dir " + root + ": " + e.getMessage(), e);
        }
    }

    /**
     * Relative paths of {@link #entries()}
     */
    public List<String> relativePaths() throws CorpusReadException {
        return entries().stream()
                .map(CorpusEntry::getRelativePath)
                .collect(Collectors.toList());
    }

    /**
     * Read a file already resolved through the sandbox.
     *
     * @throws CorpusFileNotFoundException when the file does not exist
     * @throws CorpusReadException on I/O errors, directories and non UTF-8 content
     */
    public String readText(Path absolute) throws CorpusException {
        String relative = sandbox.relativize(absolute);
        if (!Files.exists(absolute)) {
            throw new CorpusFileNotFoundException(relative);
        }
        if (!Files.isRegularFile(absolute)) {
            throw new CorpusReadException(relative, "Not a regular file: " + relative, null);
        }
        try {
            return Files.readString(absolute, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new CorpusFileNotFoundException(relative);
        } catch (CharacterCodingException e) {
            throw new CorpusReadException(relative, "File is not valid UTF-8 text: " + relative, e);
        } catch (IOException e) {
            throw new CorpusReadException(relative, "Failed to read " + relative + ": " + e.getMessage(), e);
        }
    }

    public String readText(CorpusEntry entry) throws CorpusException {
        return readText(entry.getAbsolutePath());
    }
}
