package com.draupnir.policy.service;

import com.draupnir.policy.config.ConfigLoader;
import com.draupnir.policy.config.PolicyRulesConfig;
import com.draupnir.policy.config.ServerSettings;
import com.draupnir.policy.corpus.CorpusEntry;
import com.draupnir.policy.corpus.CorpusException;
import com.draupnir.policy.corpus.GlobMatcher;
import com.draupnir.policy.model.PolicyDocument;
import com.draupnir.policy.model.api.HubbleFilter;
import com.draupnir.policy.model.api.PromptDefinition;
import com.draupnir.policy.model.api.ResourceDescriptor;
import com.draupnir.policy.model.document.MappingNode;
import com.draupnir.policy.model.report.PostureChecklist;
import com.draupnir.policy.model.report.SearchHit;
import com.draupnir.policy.model.report.ValidationReport;
import com.draupnir.policy.posture.PostureAggregator;
import com.draupnir.policy.template.PolicyTemplateGenerator;
import com.draupnir.policy.validation.PolicyValidator;
import com.draupnir.policy.validation.RuleInspector;
import com.draupnir.policy.yaml.DocumentRenderer;
import lombok.extern.slf4j.Slf4j;

import javax.enterprise.context.ApplicationScoped;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Query, search and validation operations over the policy data directory.
 * <p>
 * Every call reads the current workspace once and works against that snapshot, so a
 * concurrent {@link #reload(Path)} never mixes two roots within one operation.
 * Single-file operations propagate {@link CorpusException}s; corpus-wide operations skip
 * files that cannot be read or parsed.
 */
@Slf4j
@ApplicationScoped
public class PolicyKnowledgeService {

    public static final String DEFAULT_SEARCH_GLOB = "**/*";
    public static final String DEFAULT_POLICY_GLOB = "**/*.{yml,yaml}";

    private volatile PolicyWorkspace workspace;

    private final ResourceCatalog resourceCatalog;
    private final PolicyValidator validator;
    private final PostureAggregator aggregator;
    private final PolicyTemplateGenerator templateGenerator;
    private final DocumentRenderer renderer;
    private final PromptCatalog promptCatalog;
    private final HubbleFilterBuilder hubbleFilterBuilder;

    public PolicyKnowledgeService() {
        this(ServerSettings.getInstance());
    }

    public PolicyKnowledgeService(ServerSettings settings) {
        this(settings.getDataDir(), new ConfigLoader().load(settings.getRulesFile()), settings.isExposeResources());
    }

    public PolicyKnowledgeService(Path dataDir, PolicyRulesConfig rules, boolean exposeResources) {
        this.renderer = new DocumentRenderer();
        RuleInspector inspector = new RuleInspector(renderer);
        this.validator = new PolicyValidator(rules, inspector);
        this.aggregator = new PostureAggregator(inspector);
        this.templateGenerator = new PolicyTemplateGenerator();
        this.promptCatalog = new PromptCatalog();
        this.hubbleFilterBuilder = new HubbleFilterBuilder();
        this.resourceCatalog = ResourceCatalog.create(exposeResources);
        this.workspace = new PolicyWorkspace(dataDir);
        log.info("Policy service initialized: data_dir={}, resources={}",
                workspace.getRoot(), resourceCatalog.getClass().getSimpleName());
    }

    public Path getDataDir() {
        return workspace.getRoot();
    }

    /**
     * Point the service at another data directory
     */
    public void reload(Path dataDir) {
        PolicyWorkspace next = new PolicyWorkspace(dataDir);
        this.workspace = next;
        log.info("Reloaded data dir: {}", next.getRoot());
    }

    public String healthcheck() {
        return "OK: data_dir=" + workspace.getRoot();
    }

    /**
     * @param pattern glob over relative paths; null or empty lists everything
     */
    public List<String> list(String pattern) throws CorpusException {
        List<String> files = workspace.getCorpus().relativePaths();
        if (pattern == null || pattern.isEmpty()) {
            return files;
        }
        return files.stream()
                .filter(path -> GlobMatcher.matches(path, pattern))
                .collect(Collectors.toList());
    }

    public String readText(String path) throws CorpusException {
        return workspace.readText(path);
    }

    /**
     * Case-insensitive substring search, line by line. Files that are not UTF-8 text are
     * skipped.
     */
    public List<SearchHit> search(String query, String pathGlob) throws CorpusException {
        PolicyWorkspace ws = workspace;
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<SearchHit> hits = new ArrayList<>();

        for (CorpusEntry entry : ws.getCorpus().entries()) {
            String path = entry.getRelativePath();
            if (pathGlob != null && !pathGlob.isEmpty() && !GlobMatcher.matches(path, pathGlob)) {
                continue;
            }
            String text;
            try {
                text = ws.readEntry(entry);
            } catch (CorpusException e) {
                log.debug("Skipping {} in search: {}", path, e.getMessage());
                continue;
            }
            List<String> lines = text.lines().collect(Collectors.toList());
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.toLowerCase(Locale.ROOT).contains(needle)) {
                    hits.add(new SearchHit(path, i + 1, line));
                }
            }
        }

        log.debug("Search '{}' in '{}': {} hits", query, pathGlob, hits.size());
        return hits;
    }

    /**
     * YAML files under the glob that parse to a recognized Cilium policy kind
     */
    public List<String> listPolicyLikeFiles(String pathGlob) throws CorpusException {
        return loadPolicies(workspace, pathGlob).stream()
                .map(PolicyDocument::getPath)
                .collect(Collectors.toList());
    }

    public ValidationReport validate(String path) throws CorpusException {
        PolicyDocument document = workspace.loadDocument(path);
        ValidationReport report = validator.validate(document);
        log.info("Validated {}: {} errors, {} warnings",
                path, report.getErrors().size(), report.getWarnings().size());
        return report;
    }

    /**
     * Validation reports for every policy-like file under the glob
     */
    public List<ValidationReport> validatePolicies(String pathGlob) throws CorpusException {
        return loadPolicies(workspace, pathGlob).stream()
                .map(validator::validate)
                .collect(Collectors.toList());
    }

    public PostureChecklist scanPosture(String pathGlob) throws CorpusException {
        PolicyWorkspace ws = workspace;
        return aggregator.scan(ws.getCorpus().entries(), pathGlob, ws::load);
    }

    public MappingNode generateTemplate(String app, String namespace, List<String> ingressPorts, List<String> egressFqdns) {
        return templateGenerator.generate(app, namespace, ingressPorts, egressFqdns);
    }

    /**
     * Template as YAML text, keys in policy order
     */
    public String renderTemplate(String app, String namespace, List<String> ingressPorts, List<String> egressFqdns) {
        return renderer.render(generateTemplate(app, namespace, ingressPorts, egressFqdns));
    }

    public List<ResourceDescriptor> listResources() throws CorpusException {
        return resourceCatalog.listResources(workspace);
    }

    public String readResource(String uri) throws CorpusException {
        return resourceCatalog.readResource(workspace, uri);
    }

    public HubbleFilter hubbleFilters(String src, String dst, String verdict) {
        return hubbleFilterBuilder.build(src, dst, verdict);
    }

    public List<PromptDefinition> prompts() {
        return promptCatalog.list();
    }

    public Optional<PromptDefinition> prompt(String name) {
        return promptCatalog.find(name);
    }

    private List<PolicyDocument> loadPolicies(PolicyWorkspace ws, String pathGlob) throws CorpusException {
        List<PolicyDocument> policies = new ArrayList<>();
        for (CorpusEntry entry : ws.getCorpus().entries()) {
            if (pathGlob != null && !pathGlob.isEmpty() && !GlobMatcher.matches(entry.getRelativePath(), pathGlob)) {
                continue;
            }
            if (!entry.isYaml()) {
                continue;
            }
            try {
                PolicyDocument document = ws.load(entry);
                if (document.kind().isPresent()) {
                    policies.add(document);
                }
            } catch (CorpusException e) {
                log.debug("Skipping {}: {}", entry.getRelativePath(), e.getMessage());
            }
        }
        return policies;
    }
}
