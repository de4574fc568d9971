package com.draupnir.policy.cli;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Commands run in-process with captured output
 */
class CommandLineInterfaceTest {

    @TempDir
    Path dataDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private CommandLineInterface cli;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(dataDir.resolve("web.yaml"), "kind: CiliumNetworkPolicy\n"
                + "metadata: {name: web}\n"
                + "spec:\n"
                + "  egress:\n"
                + "    - toFQDNs: [{matchName: api.example.com}]\n"
                + "      toPorts: [{ports: [{port: '443'}]}]\n");
        Files.writeString(dataDir.resolve("bad.yaml"), "kind: CiliumNetworkPolicy\nmetadata: {}\nspec: {}\n");

        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new CommandLineInterface(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return cli.execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("No arguments prints help")
    void testHelp() {
        assertEquals(CommandLineInterface.EXIT_OK, run());
        assertTrue(stdout().contains("USAGE:"));
    }

    @Test
    @DisplayName("List and policies print one path per line")
    void testListAndPolicies() {
        assertEquals(0, run("-d", dataDir.toString(), "list"));
        assertEquals("bad.yaml\nweb.yaml\n", stdout().replace("\r\n", "\n"));

        out.reset();
        assertEquals(0, run("-d", dataDir.toString(), "policies"));
        assertEquals("bad.yaml\nweb.yaml\n", stdout().replace("\r\n", "\n"));
    }

    @Test
    @DisplayName("Validate exits 0 for a clean policy and 2 when it has errors")
    void testValidateExitCodes() {
        assertEquals(CommandLineInterface.EXIT_OK, run("-d", dataDir.toString(), "validate", "web.yaml"));
        assertTrue(stdout().contains("\"errors\" : [ ]"));

        out.reset();
        assertEquals(CommandLineInterface.EXIT_INVALID, run("-d", dataDir.toString(), "validate", "bad.yaml"));
        assertTrue(stdout().contains("metadata.name is required"));
    }

    @Test
    @DisplayName("Failures print Error: and exit 1")
    void testErrors() {
        assertEquals(CommandLineInterface.EXIT_ERROR, run("-d", dataDir.toString(), "read", "../etc/passwd"));
        assertTrue(stderr().startsWith("Error: Access outside data dir is not allowed"));

        err.reset();
        assertEquals(CommandLineInterface.EXIT_ERROR, run("-d", dataDir.toString(), "validate", "missing.yaml"));
        assertTrue(stderr().startsWith("Error: File not found"));

        err.reset();
        assertEquals(CommandLineInterface.EXIT_ERROR, run("-d", dataDir.toString(), "frobnicate"));
        assertTrue(stderr().contains("Unknown command"));

        err.reset();
        assertEquals(CommandLineInterface.EXIT_ERROR, run("-d", dataDir.toString(), "validate"));
        assertTrue(stderr().contains("Usage: validate <path>"));
    }

    @Test
    @DisplayName("Checklist prints JSON and writes the requested exports")
    void testChecklistExports() {
        Path xlsx = dataDir.resolveSibling(dataDir.getFileName() + "-posture.xlsx");
        Path json = dataDir.resolveSibling(dataDir.getFileName() + "-posture.json");
        try {
            assertEquals(0, run("-d", dataDir.toString(), "checklist", "-o", xlsx.toString(), "-j", json.toString()));
            assertTrue(stdout().contains("\"dns_ok\" : 1"));
            assertTrue(Files.isRegularFile(xlsx));
            assertTrue(Files.isRegularFile(json));
        } finally {
            xlsx.toFile().delete();
            json.toFile().delete();
        }
    }

    @Test
    @DisplayName("Template renders YAML from options")
    void testTemplate() {
        assertEquals(0, run("template", "-a", "api", "-n", "prod", "--ports", "8080/TCP", "--fqdns", "api.stripe.com"));
        String yaml = stdout();
        assertTrue(yaml.contains("name: api-ztp"));
        assertTrue(yaml.contains("port: \"8080\""));
        assertTrue(yaml.contains("matchName: api.stripe.com"));

        err.reset();
        assertEquals(CommandLineInterface.EXIT_ERROR, run("template", "-n", "prod"));
        assertTrue(stderr().contains("app is required"));
    }

    @Test
    @DisplayName("Import unpacks an archive into the destination")
    void testImport(@TempDir Path work) throws IOException {
        Path zip = work.resolve("p.zip");
        try (OutputStream os = Files.newOutputStream(zip);
             ZipOutputStream zos = new ZipOutputStream(os)) {
            zos.putNextEntry(new ZipEntry("team/a.yaml"));
            zos.write("kind: CiliumNetworkPolicy\n".getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        Path dest = work.resolve("data");

        assertEquals(0, run("import", "--zip", zip.toString(), "--dest", dest.toString()));
        assertTrue(Files.isRegularFile(dest.resolve("team/a.yaml")));
        assertTrue(stdout().startsWith("Unzipped 1 files"));
    }

    @Test
    @DisplayName("Hubble and prompts")
    void testHubbleAndPrompts() {
        assertEquals(0, run("hubble", "--src", "prod/web", "--verdict", "DROPPED"));
        assertTrue(stdout().contains("hubble observe --from prod/web --verdict DROPPED"));

        out.reset();
        assertEquals(0, run("prompts"));
        assertTrue(stdout().contains("hardening-review"));

        out.reset();
        assertEquals(0, run("prompts", "write-cilium-policy"));
        assertTrue(stdout().startsWith("Draft a CiliumNetworkPolicy"));
    }
}
