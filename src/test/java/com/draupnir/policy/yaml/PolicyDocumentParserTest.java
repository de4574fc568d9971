package com.draupnir.policy.yaml;

import com.draupnir.policy.model.PolicyDocument;
import com.draupnir.policy.model.PolicyKind;
import com.draupnir.policy.model.document.DocumentNode;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.document.ScalarNode;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class PolicyDocumentParserTest {

    private final PolicyDocumentParser parser = new PolicyDocumentParser();

    @Test
    @DisplayName("Policy YAML becomes a mapping tree with recognized kind")
    void testParsePolicy() throws PolicyParseException {
        String yaml = "apiVersion: cilium.io/v2\n"
                + "kind: CiliumNetworkPolicy\n"
                + "metadata:\n"
                + "  name: web\n"
                + "spec:\n"
                + "  egress:\n"
                + "    - toPorts:\n"
                + "        - ports:\n"
                + "            - port: 53\n"
                + "              protocol: UDP\n";

        PolicyDocument document = parser.parse("web.yaml", yaml);

        assertEquals("web.yaml", document.getPath());
        assertEquals(PolicyKind.CILIUM_NETWORK_POLICY, document.kind().orElseThrow());
        MappingNode root = document.rootMapping().orElseThrow();
        assertEquals("web", root.mapping("metadata").flatMap(m -> m.text("name")).orElseThrow());

        DocumentNode port = root.mapping("spec").orElseThrow()
                .sequence("egress").orElseThrow().mappings().findFirst().orElseThrow()
                .sequence("toPorts").orElseThrow().mappings().findFirst().orElseThrow()
                .sequence("ports").orElseThrow().mappings().findFirst().orElseThrow()
                .field("port").orElseThrow();
        ScalarNode scalar = port.asScalar().orElseThrow();
        assertTrue(scalar.isNumber());
        assertEquals("53", scalar.asText());
    }

    @Test
    @DisplayName("JSON input is accepted")
    void testParseJson() throws PolicyParseException {
        PolicyDocument document = parser.parse("p.json",
                "{\"kind\": \"CiliumClusterwideNetworkPolicy\", \"spec\": {}}");
        assertEquals(PolicyKind.CILIUM_CLUSTERWIDE_NETWORK_POLICY, document.kind().orElseThrow());
    }

    @Test
    @DisplayName("Empty text is a null document")
    void testParseEmpty() throws PolicyParseException {
        PolicyDocument document = parser.parse("empty.yaml", "");
        assertTrue(document.getRoot().isNull());
        assertTrue(document.rootMapping().isEmpty());
        assertTrue(document.kind().isEmpty());
    }

    @Test
    @DisplayName("Scalar and sequence roots are kept, not rejected")
    void testNonMappingRoot() throws PolicyParseException {
        assertTrue(parser.parse("list.yaml", "- a\n- b\n").getRoot().isSequence());
        assertTrue(parser.parse("scalar.yaml", "just text\n").getRoot().isScalar());
    }

    @Test
    @DisplayName("Malformed YAML raises PolicyParseException with the path")
    void testParseMalformed() {
        PolicyParseException e = assertThrows(PolicyParseException.class,
                () -> parser.parse("bad.yaml", "kind: [unclosed\n"));
        assertEquals("bad.yaml", e.getPath());
        assertTrue(e.getMessage().contains("bad.yaml"));
    }

    @Test
    @DisplayName("More than one document is a parse error")
    void testMultiDocument() {
        assertThrows(PolicyParseException.class,
                () -> parser.parse("multi.yaml", "kind: A\n---\nkind: B\n"));
    }

    @Test
    @DisplayName("Unknown kind parses but is not recognized")
    void testUnknownKind() throws PolicyParseException {
        PolicyDocument document = parser.parse("pod.yaml", "kind: Pod\n");
        assertEquals("Pod", document.rawKind().orElseThrow());
        assertTrue(document.kind().isEmpty());
    }
}
