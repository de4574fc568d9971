package com.draupnir.policy.service;

import com.draupnir.policy.model.api.PromptDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Review and authoring prompts offered to clients
 */
public class PromptCatalog {

    public static final String HARDENING_REVIEW = "hardening-review";
    public static final String WRITE_CILIUM_POLICY = "write-cilium-policy";

    private static final List<PromptDefinition> PROMPTS = List.of(
            new PromptDefinition(HARDENING_REVIEW,
                    "You are a senior platform engineer reviewing Cilium policies for zero-trust.\n"
                            + "Checklist: default-deny posture, least-privilege, L7 toPorts, DNS egress, "
                            + "health & kube-dns, FQDN pinning, auditability.\n"
                            + "Provide findings and prioritized fixes (P0/P1/P2)."),
            new PromptDefinition(WRITE_CILIUM_POLICY,
                    "Draft a CiliumNetworkPolicy for a new app. Collect: app, namespace, ingress ports, egress FQDNs.\n"
                            + "Emit YAML only, with comments explaining key choices."));

    public List<PromptDefinition> list() {
        return PROMPTS;
    }

    public Optional<PromptDefinition> find(String name) {
        return PROMPTS.stream()
                .filter(prompt -> prompt.getName().equals(name))
                .findFirst();
    }
}
