package com.draupnir.policy.api;

import com.draupnir.policy.config.PolicyRulesConfig;
import com.draupnir.policy.model.api.HubbleFilter;
import com.draupnir.policy.model.report.SearchHit;
import com.draupnir.policy.service.PolicyKnowledgeService;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import javax.ws.rs.core.Response;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorpusResourceTest {

    @TempDir
    Path dataDir;

    private CorpusResource resource;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(dataDir.resolve("notes.txt"), "allow dns\nDeny ALL\n");
        resource = new CorpusResource();
        resource.knowledgeService = new PolicyKnowledgeService(dataDir, PolicyRulesConfig.defaults(), false);
    }

    @Test
    @DisplayName("Files can be listed, read and searched")
    @SuppressWarnings("unchecked")
    void testFiles() {
        assertEquals(List.of("notes.txt"), resource.listFiles(null).getEntity());
        assertEquals("allow dns\nDeny ALL\n", resource.readFile("notes.txt").getEntity());

        List<SearchHit> hits = (List<SearchHit>) resource.search("deny", "**/*").getEntity();
        assertEquals(1, hits.size());
        assertEquals(2, hits.get(0).getLineNo());
    }

    @Test
    @DisplayName("Read errors carry the error body")
    @SuppressWarnings("unchecked")
    void testReadErrors() {
        Response denied = resource.readFile("../x");
        assertEquals(403, denied.getStatus());
        assertTrue(((Map<String, String>) denied.getEntity()).get("error").startsWith("Access outside data dir"));

        assertEquals(404, resource.readFile("missing.txt").getStatus());
        assertEquals(400, resource.readFile(null).getStatus());
        assertEquals(400, resource.search("", "**/*").getStatus());
    }

    @Test
    @DisplayName("Resource reads are refused when resources are disabled")
    void testResourcesDisabled() {
        assertEquals(List.of(), resource.listResources().getEntity());
        assertEquals(404, resource.readResource("file://" + dataDir.resolve("notes.txt")).getStatus());
    }

    @Test
    @DisplayName("Health, prompts and hubble")
    void testMisc() {
        assertTrue(((String) resource.health().getEntity()).startsWith("OK: data_dir="));
        assertEquals(200, resource.getPrompt("write-cilium-policy").getStatus());
        assertEquals(404, resource.getPrompt("nope").getStatus());

        HubbleFilter filter = (HubbleFilter) resource.hubbleFilters("a", "b", null).getEntity();
        assertEquals("hubble observe --from a --to b", filter.getCli());
    }

    @Test
    @DisplayName("Reload switches the data dir")
    void testReload(@TempDir Path other) {
        assertEquals(400, resource.reload(Map.of()).getStatus());

        Response response = resource.reload(Map.of("dataDir", other.toString()));
        assertEquals(200, response.getStatus());
        assertEquals(other.toAbsolutePath().normalize(), resource.knowledgeService.getDataDir());
    }
}
