package com.draupnir.policy.corpus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.Locale;

/**
 * A regular file found under the data directory
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorpusEntry {

    /**
     * Forward-slash path relative to the root
     */
    private String relativePath;

    private Path absolutePath;

    /**
     * Lower-cased extension including the dot, or "" when there is none
     */
    public String extension() {
        String name = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    public boolean isYaml() {
        String ext = extension();
        return ".yaml".equals(ext) || ".yml".equals(ext);
    }
}
