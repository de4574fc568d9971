package com.draupnir.policy.posture;

import com.draupnir.policy.corpus.CorpusEntry;
import com.draupnir.policy.corpus.CorpusException;
import com.draupnir.policy.corpus.GlobMatcher;
import com.draupnir.policy.model.PolicyDocument;
import com.draupnir.policy.model.PolicyKind;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.report.PostureChecklist;
import com.draupnir.policy.model.report.PostureDetail;
import com.draupnir.policy.model.report.PostureStats;
import com.draupnir.policy.validation.RuleInspector;
import com.draupnir.policy.yaml.DocumentRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a corpus of Cilium policies to a zero-trust posture checklist.
 * <p>
 * Best effort: files that do not match, are not YAML, fail to load or parse, or are
 * not a recognized policy kind are left out without being reported. Unlike the
 * validator, the L7 signal is the union of ingress and egress.
 */
@Slf4j
public class PostureAggregator {

    private final RuleInspector inspector;

    public PostureAggregator() {
        this(new RuleInspector(new DocumentRenderer()));
    }

    public PostureAggregator(RuleInspector inspector) {
        this.inspector = inspector;
    }

    /**
     * @param entries corpus files in iteration order; detail rows keep this order
     * @param pattern path glob; null or empty selects every file
     * @param source  loader for entries that pass the path filters
     */
    public PostureChecklist scan(List<CorpusEntry> entries, String pattern, DocumentSource source) {
        PostureStats stats = new PostureStats();
        List<PostureDetail> details = new ArrayList<>();
        int skipped = 0;

        for (CorpusEntry entry : entries) {
            String path = entry.getRelativePath();
            if (pattern != null && !pattern.isEmpty() && !GlobMatcher.matches(path, pattern)) {
                continue;
            }
            if (!entry.isYaml()) {
                continue;
            }

            PolicyDocument document;
            try {
                document = source.load(entry);
            } catch (CorpusException e) {
                log.debug("Skipping {} in posture scan: {}", path, e.getMessage());
                skipped++;
                continue;
            }

            Optional<MappingNode> root = document.rootMapping();
            Optional<PolicyKind> kind = document.kind();
            if (root.isEmpty() || kind.isEmpty()) {
                continue;
            }

            stats.incrementTotal();
            if (kind.get() == PolicyKind.CILIUM_NETWORK_POLICY) {
                stats.incrementCnp();
            } else {
                stats.incrementCcnp();
            }

            MappingNode spec = root.get().mapping("spec").orElseGet(MappingNode::create);
            boolean l7 = inspector.anyRuleHasL7Ports(spec);
            boolean dns = inspector.anyRuleHandlesDns(spec);
            if (l7) {
                stats.incrementWithL7();
            }
            if (dns) {
                stats.incrementDnsOk();
            }

            details.add(PostureDetail.builder()
                    .path(path)
                    .kind(kind.get().getKindName())
                    .hasL7(l7)
                    .dnsHandled(dns)
                    .build());
        }

        log.info("Posture scan: {} policies ({} CNP, {} CCNP), {} with L7, {} with DNS handled, {} unreadable",
                stats.getTotal(), stats.getCnpCount(), stats.getCcnpCount(),
                stats.getWithL7Count(), stats.getDnsOkCount(), skipped);
        return new PostureChecklist(stats, details);
    }
}
