package com.draupnir.policy.service;

import com.draupnir.policy.sandbox.PathSandbox;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Unpacks a ZIP archive of policy files into a data directory.
 * Every entry name is checked before anything is written, so an archive with an entry
 * that would land outside the destination is rejected as a whole.
 */
@Slf4j
public class CorpusImporter {

    /**
     * @return number of files written
     * @throws IOException if the archive is missing or cannot be read
     * @throws com.draupnir.policy.sandbox.PathAccessDeniedException for an entry escaping {@code dest}
     */
    public int importArchive(Path zipPath, Path dest) throws IOException {
        Path zip = zipPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(zip)) {
            throw new IOException("ZIP not found: " + zip);
        }

        PathSandbox sandbox = new PathSandbox(dest);
        List<String> names = entryNames(zip);
        names.forEach(sandbox::resolve);
        log.debug("Checked {} entries of {}", names.size(), zip);

        Files.createDirectories(sandbox.getRoot());
        int files = 0;

        log.info("Unzipping {} -> {}", zip, sandbox.getRoot());
        try (InputStream in = Files.newInputStream(zip);
             ZipInputStream zis = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                Path target = sandbox.resolve(entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Path parent = target.getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    Files.copy(zis, target, StandardCopyOption.REPLACE_EXISTING);
                    files++;
                    log.debug("Extracted {}", entry.getName());
                }
                zis.closeEntry();
            }
        }

        log.info("Unzipped {} files from {} -> {}", files, zip, sandbox.getRoot());
        return files;
    }

    private List<String> entryNames(Path zip) throws IOException {
        List<String> names = new ArrayList<>();
        try (InputStream in = Files.newInputStream(zip);
             ZipInputStream zis = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
