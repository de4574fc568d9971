package com.draupnir.policy.validation;

import com.draupnir.policy.config.PolicyRulesConfig;
import com.draupnir.policy.model.PolicyDocument;
import com.draupnir.policy.model.PolicyKind;
import com.draupnir.policy.model.document.DocumentNode;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.report.ValidationReport;
import com.draupnir.policy.yaml.DocumentRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Structural validation and zero-trust hardening hints for one Cilium policy.
 * <p>
 * Checks run in a fixed order. A structural failure (root not a mapping, unknown kind,
 * no spec) stops the run; a missing metadata.name is reported and validation goes on.
 * Heuristic findings are warnings and never stop anything. Nothing here throws for
 * a bad document: every problem ends up in the report.
 */
@Slf4j
public class PolicyValidator {

    public static final String ROOT_NOT_MAPPING = "YAML root must be a mapping";
    public static final String UNRECOGNIZED_KIND = "Not a Cilium {CNP|CCNP} kind";
    public static final String NAME_REQUIRED = "metadata.name is required";
    public static final String SPEC_REQUIRED = "spec is required";
    public static final String NO_RULES = "No ingress/egress rules present (might not enforce anything)";
    public static final String INGRESS_NO_PORTS = "Ingress has no L4/L7 ports (coarse allow?)";
    public static final String EGRESS_NO_PORTS = "Egress has no L4/L7 ports (coarse allow?)";
    public static final String NO_DNS_EGRESS = "No explicit DNS egress (add kube-dns:53 or toFQDNs)";

    private static final List<String> METADATA_FIELDS = List.of("name", "namespace", "labels");

    private final PolicyRulesConfig rules;
    private final RuleInspector inspector;

    public PolicyValidator() {
        this(PolicyRulesConfig.defaults());
    }

    public PolicyValidator(PolicyRulesConfig rules) {
        this(rules, new RuleInspector(new DocumentRenderer()));
    }

    public PolicyValidator(PolicyRulesConfig rules, RuleInspector inspector) {
        this.rules = rules;
        this.inspector = inspector;
    }

    public ValidationReport validate(PolicyDocument document) {
        ValidationReport report = new ValidationReport(document.getPath());

        Optional<MappingNode> rootMapping = document.rootMapping();
        if (rootMapping.isEmpty()) {
            report.addError(ROOT_NOT_MAPPING);
            return finish(report);
        }
        MappingNode root = rootMapping.get();

        report.setKind(root.field("kind").map(DocumentNode::toPlainObject).orElse(null));
        if (PolicyKind.fromKindName(root.text("kind").orElse(null)).isEmpty()) {
            report.addError(UNRECOGNIZED_KIND);
            return finish(report);
        }

        MappingNode metadata = root.mapping("metadata").orElseGet(MappingNode::create);
        if (!metadata.containsKey("name")) {
            report.addError(NAME_REQUIRED);
        }
        for (String field : METADATA_FIELDS) {
            metadata.field(field).ifPresent(value -> report.getMetadata().put(field, value.toPlainObject()));
        }

        MappingNode spec = root.mapping("spec").orElse(null);
        if (spec == null || spec.isEmpty()) {
            report.addError(SPEC_REQUIRED);
            return finish(report);
        }

        boolean hasIngress = spec.isSet(RuleInspector.INGRESS);
        boolean hasEgress = spec.isSet(RuleInspector.EGRESS);
        report.setSummary(new ValidationReport.RuleSummary(hasIngress, hasEgress));

        if (!hasIngress && !hasEgress) {
            report.addWarning(NO_RULES);
        }

        if (rules.isRequireL7Ports()) {
            if (hasIngress && !inspector.directionHasL7Ports(spec, RuleInspector.INGRESS)) {
                report.addWarning(INGRESS_NO_PORTS);
            }
            if (hasEgress && !inspector.directionHasL7Ports(spec, RuleInspector.EGRESS)) {
                report.addWarning(EGRESS_NO_PORTS);
            }
        }

        if (hasEgress && rules.isRequireDnsEgress()
                && !inspector.egressMentionsDns(spec.field(RuleInspector.EGRESS).get())) {
            report.addWarning(NO_DNS_EGRESS);
        }

        if (hasEgress && rules.isForbidWildcardFqdns()) {
            for (String fqdn : inspector.wildcardFqdns(spec)) {
                report.addWarning("Egress FQDN '" + fqdn + "' uses a wildcard");
            }
        }

        return finish(report);
    }

    private ValidationReport finish(ValidationReport report) {
        log.debug("Validated {}: {} errors, {} warnings",
                report.getPath(), report.getErrors().size(), report.getWarnings().size());
        return report;
    }
}
