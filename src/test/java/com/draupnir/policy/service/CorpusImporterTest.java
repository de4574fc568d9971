package com.draupnir.policy.service;

import com.draupnir.policy.sandbox.PathAccessDeniedException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class CorpusImporterTest {

    @TempDir
    Path workDir;

    private final CorpusImporter importer = new CorpusImporter();

    private Path zip(String name, String... entries) throws IOException {
        Path zip = workDir.resolve(name);
        try (OutputStream out = Files.newOutputStream(zip);
             ZipOutputStream zos = new ZipOutputStream(out)) {
            for (int i = 0; i < entries.length; i += 2) {
                zos.putNextEntry(new ZipEntry(entries[i]));
                if (entries[i + 1] != null) {
                    zos.write(entries[i + 1].getBytes(StandardCharsets.UTF_8));
                }
                zos.closeEntry();
            }
        }
        return zip;
    }

    @Test
    @DisplayName("Archive files are unpacked under the destination")
    void testImport() throws IOException {
        Path archive = zip("policies.zip",
                "prod/", null,
                "prod/web.yaml", "kind: CiliumNetworkPolicy\n",
                "README.md", "# policies\n");
        Path dest = workDir.resolve("data");

        int files = importer.importArchive(archive, dest);

        assertEquals(2, files);
        assertEquals("kind: CiliumNetworkPolicy\n", Files.readString(dest.resolve("prod/web.yaml")));
        assertTrue(Files.isRegularFile(dest.resolve("README.md")));
    }

    @Test
    @DisplayName("Entries escaping the destination are rejected")
    void testZipSlip() throws IOException {
        Path archive = zip("evil.zip", "../escaped.txt", "boom");
        Path dest = workDir.resolve("data");

        assertThrows(PathAccessDeniedException.class, () -> importer.importArchive(archive, dest));
        assertFalse(Files.exists(workDir.resolve("escaped.txt")));
    }

    @Test
    @DisplayName("An escaping entry later in the archive leaves nothing extracted")
    void testZipSlipWritesNothing() throws IOException {
        Path archive = zip("mixed.zip",
                "prod/web.yaml", "kind: CiliumNetworkPolicy\n",
                "prod/../../escaped.txt", "boom");
        Path dest = workDir.resolve("data");

        assertThrows(PathAccessDeniedException.class, () -> importer.importArchive(archive, dest));
        assertFalse(Files.exists(dest.resolve("prod/web.yaml")));
        assertFalse(Files.exists(workDir.resolve("escaped.txt")));
    }

    @Test
    @DisplayName("Missing archive is an IOException")
    void testMissingArchive() {
        IOException e = assertThrows(IOException.class,
                () -> importer.importArchive(workDir.resolve("nope.zip"), workDir.resolve("data")));
        assertTrue(e.getMessage().startsWith("ZIP not found"));
    }
}
