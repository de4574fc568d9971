package com.draupnir.policy.template;

import com.draupnir.policy.model.PolicyDocument;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.document.SequenceNode;
import com.draupnir.policy.model.report.ValidationReport;
import com.draupnir.policy.validation.PolicyValidator;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PolicyTemplateGeneratorTest {

    private final PolicyTemplateGenerator generator = new PolicyTemplateGenerator();

    @Test
    @DisplayName("Defaults allow 80/TCP and 443/TCP in and kube-dns UDP/53 out")
    @SuppressWarnings("unchecked")
    void testDefaults() {
        MappingNode policy = generator.generate("web", "prod", null, null);

        assertEquals("cilium.io/v2", policy.text("apiVersion").orElseThrow());
        assertEquals("CiliumNetworkPolicy", policy.text("kind").orElseThrow());
        assertEquals("web-ztp", policy.mapping("metadata").flatMap(m -> m.text("name")).orElseThrow());
        assertEquals("prod", policy.mapping("metadata").flatMap(m -> m.text("namespace")).orElseThrow());

        MappingNode spec = policy.mapping("spec").orElseThrow();
        Map<String, Object> selector = (Map<String, Object>) spec.mapping("endpointSelector").orElseThrow().toPlainObject();
        assertEquals(Map.of("matchLabels", Map.of(PolicyTemplateGenerator.NAMESPACE_LABEL, "prod", "app", "web")), selector);

        MappingNode ingress = spec.sequence("ingress").orElseThrow().mappings().findFirst().orElseThrow();
        assertEquals(List.of(
                Map.of("ports", List.of(Map.of("port", "80", "protocol", "TCP"))),
                Map.of("ports", List.of(Map.of("port", "443", "protocol", "TCP")))),
                ingress.sequence("toPorts").orElseThrow().toPlainObject());

        SequenceNode egress = spec.sequence("egress").orElseThrow();
        assertEquals(2, egress.size());
        assertEquals(List.of(Map.of("matchName", "*.amazonaws.com")),
                egress.mappings().findFirst().orElseThrow().sequence("toFQDNs").orElseThrow().toPlainObject());

        MappingNode dns = egress.mappings().skip(1).findFirst().orElseThrow();
        assertEquals(List.of(Map.of("ports", List.of(Map.of("port", "53", "protocol", "UDP")))),
                dns.sequence("toPorts").orElseThrow().toPlainObject());
        assertTrue(dns.toString().contains("kube-dns"));
    }

    @Test
    @DisplayName("Explicit ports and FQDNs replace the defaults; DNS rule stays")
    void testExplicitValues() {
        MappingNode policy = generator.generate("api", "staging", List.of("8080", "9090/UDP"), List.of("api.stripe.com"));
        MappingNode spec = policy.mapping("spec").orElseThrow();

        assertEquals(List.of(
                Map.of("ports", List.of(Map.of("port", "8080", "protocol", "TCP"))),
                Map.of("ports", List.of(Map.of("port", "9090", "protocol", "UDP")))),
                spec.sequence("ingress").orElseThrow().mappings().findFirst().orElseThrow()
                        .sequence("toPorts").orElseThrow().toPlainObject());
        assertEquals(2, spec.sequence("egress").orElseThrow().size());
    }

    @Test
    @DisplayName("Keys come out in policy order")
    void testKeyOrder() {
        MappingNode policy = generator.generate("web", "prod", null, null);
        assertEquals(List.of("apiVersion", "kind", "metadata", "spec"), List.copyOf(policy.keys()));
    }

    @Test
    @DisplayName("Generated policy validates without errors or warnings")
    void testTemplateValidates() {
        MappingNode policy = generator.generate("web", "prod", null, null);
        ValidationReport report = new PolicyValidator().validate(new PolicyDocument("web-ztp.yaml", policy));

        assertTrue(report.getErrors().isEmpty());
        assertTrue(report.getWarnings().isEmpty(), () -> "Unexpected warnings: " + report.getWarnings());
    }

    @Test
    @DisplayName("Malformed port specs and blank names are rejected")
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> PolicyTemplateGenerator.portRule("80/TCP/x"));
        assertThrows(IllegalArgumentException.class, () -> PolicyTemplateGenerator.portRule("/TCP"));
        assertThrows(IllegalArgumentException.class, () -> PolicyTemplateGenerator.portRule("80/"));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(" ", "prod", null, null));
        assertThrows(IllegalArgumentException.class, () -> generator.generate("web", null, null, null));
    }
}
