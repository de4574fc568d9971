package com.draupnir.policy.validation;

import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.yaml.DocumentRenderer;
import com.draupnir.policy.yaml.PolicyDocumentParser;
import com.draupnir.policy.yaml.PolicyParseException;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class RuleInspectorTest {

    private final PolicyDocumentParser parser = new PolicyDocumentParser();
    private final RuleInspector inspector = new RuleInspector(new DocumentRenderer());

    private MappingNode spec(String yaml) throws PolicyParseException {
        return parser.parse("spec.yaml", yaml).rootMapping().orElseThrow();
    }

    @Test
    @DisplayName("Empty toPorts entries do not count as L7 ports")
    void testEmptyToPorts() throws PolicyParseException {
        MappingNode spec = spec("ingress:\n  - toPorts: [{}]\n");
        assertFalse(inspector.directionHasL7Ports(spec, RuleInspector.INGRESS));

        MappingNode withRules = spec("ingress:\n  - toPorts: [{rules: {http: [{method: GET}]}}]\n");
        assertTrue(inspector.directionHasL7Ports(withRules, RuleInspector.INGRESS));
    }

    @Test
    @DisplayName("Posture L7 signal is the union of both directions")
    void testUnionOfDirections() throws PolicyParseException {
        MappingNode spec = spec("ingress:\n  - {}\n"
                + "egress:\n  - toPorts: [{ports: [{port: '443'}]}]\n");
        assertFalse(inspector.directionHasL7Ports(spec, RuleInspector.INGRESS));
        assertTrue(inspector.anyRuleHasL7Ports(spec));
    }

    @Test
    @DisplayName("Non-mapping rules and a non-list direction are ignored")
    void testLenientShapes() throws PolicyParseException {
        assertEquals(0, inspector.rules(spec("ingress: [a, 1, null]\n"), RuleInspector.INGRESS).count());
        assertEquals(0, inspector.rules(spec("ingress: oops\n"), RuleInspector.INGRESS).count());
    }

    @Test
    @DisplayName("DNS is handled by toFQDNs or a literal port 53 in any spelling")
    void testRuleHandlesDns() throws PolicyParseException {
        assertTrue(inspector.anyRuleHandlesDns(spec("egress:\n  - toFQDNs: [{matchName: a.com}]\n")));
        assertTrue(inspector.anyRuleHandlesDns(spec("egress:\n  - toPorts: [{ports: [{port: 53}]}]\n")));
        assertTrue(inspector.anyRuleHandlesDns(spec("egress:\n  - toPorts: [{ports: [{port: '53'}]}]\n")));
        assertFalse(inspector.anyRuleHandlesDns(spec("egress:\n  - toPorts: [{ports: [{port: '5353'}]}]\n")));
    }

    @Test
    @DisplayName("Egress DNS mention is a plain substring check")
    void testEgressMentionsDnsSubstring() throws PolicyParseException {
        MappingNode spec = spec("egress:\n  - toCIDR: [10.0.53.0/24]\n");
        // known weakness: any "53" in the rendered egress counts
        assertTrue(inspector.egressMentionsDns(spec.field(RuleInspector.EGRESS).orElseThrow()));

        MappingNode noDns = spec("egress:\n  - toCIDR: [10.0.0.0/8]\n");
        assertFalse(inspector.egressMentionsDns(noDns.field(RuleInspector.EGRESS).orElseThrow()));
    }
}
