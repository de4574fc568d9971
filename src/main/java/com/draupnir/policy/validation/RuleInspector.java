package com.draupnir.policy.validation;

import com.draupnir.policy.model.document.DocumentNode;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.document.SequenceNode;
import com.draupnir.policy.yaml.DocumentRenderer;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Heuristics over Cilium ingress/egress rule lists, shared by the validator and the
 * posture scan.
 * <p>
 * The DNS checks are substring scans of the rendered YAML. They can be fooled by a
 * "53" that is not a port (an IP, a label value); that weakness is known and kept.
 */
public class RuleInspector {

    public static final String INGRESS = "ingress";
    public static final String EGRESS = "egress";

    private static final List<String> DNS_PORT_TOKENS = List.of("port: 53", "port: '53'", "port: \"53\"");

    private final DocumentRenderer renderer;

    public RuleInspector(DocumentRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Mapping rules of one direction; a missing or non-list direction yields nothing
     * and non-mapping items are skipped.
     */
    public Stream<MappingNode> rules(MappingNode spec, String direction) {
        return spec.sequence(direction)
                .map(SequenceNode::mappings)
                .orElseGet(Stream::empty);
    }

    /**
     * Some toPorts entry of the rule has populated ports or rules
     */
    public boolean hasPopulatedToPorts(MappingNode rule) {
        return rule.sequence("toPorts")
                .map(toPorts -> toPorts.mappings()
                        .anyMatch(tp -> tp.isSet("ports") || tp.isSet("rules")))
                .orElse(false);
    }

    /**
     * Some rule of the direction has populated toPorts
     */
    public boolean directionHasL7Ports(MappingNode spec, String direction) {
        return rules(spec, direction).anyMatch(this::hasPopulatedToPorts);
    }

    /**
     * Union over ingress and egress
     */
    public boolean anyRuleHasL7Ports(MappingNode spec) {
        return Stream.concat(rules(spec, INGRESS), rules(spec, EGRESS))
                .anyMatch(this::hasPopulatedToPorts);
    }

    /**
     * Egress content mentions "53" or toFQDNs anywhere in its rendered text
     */
    public boolean egressMentionsDns(DocumentNode egress) {
        String text = renderer.renderCanonical(egress);
        return text.contains("53") || text.contains("toFQDNs");
    }

    /**
     * The rule pins FQDNs or carries a literal DNS port
     */
    public boolean ruleHandlesDns(MappingNode rule) {
        if (rule.isSet("toFQDNs")) {
            return true;
        }
        String text = renderer.renderCanonical(rule);
        return DNS_PORT_TOKENS.stream().anyMatch(text::contains);
    }

    public boolean anyRuleHandlesDns(MappingNode spec) {
        return Stream.concat(rules(spec, INGRESS), rules(spec, EGRESS))
                .anyMatch(this::ruleHandlesDns);
    }

    /**
     * matchName / matchPattern values of egress toFQDNs selectors containing '*'
     */
    public List<String> wildcardFqdns(MappingNode spec) {
        return rules(spec, EGRESS)
                .flatMap(rule -> rule.sequence("toFQDNs").map(SequenceNode::mappings).orElseGet(Stream::empty))
                .flatMap(selector -> Stream.of(selector.text("matchName"), selector.text("matchPattern"))
                        .flatMap(Optional::stream))
                .filter(value -> value.contains("*"))
                .collect(Collectors.toList());
    }
}
