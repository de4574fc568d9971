package com.draupnir.policy.cli;

import com.draupnir.policy.config.ConfigLoader;
import com.draupnir.policy.config.PolicyRulesConfig;
import com.draupnir.policy.config.ServerSettings;
import com.draupnir.policy.corpus.CorpusException;
import com.draupnir.policy.model.api.PromptDefinition;
import com.draupnir.policy.model.report.PostureChecklist;
import com.draupnir.policy.model.report.SearchHit;
import com.draupnir.policy.model.report.ValidationReport;
import com.draupnir.policy.report.PostureExcelReportGenerator;
import com.draupnir.policy.service.CorpusImporter;
import com.draupnir.policy.service.JsonResultExporter;
import com.draupnir.policy.service.PolicyKnowledgeService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.*;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command Line Interface handler for Draupnir
 *
 * Usage:
 *   java -jar draupnir.jar [OPTIONS] COMMAND [ARGS]
 *
 * Examples:
 *   java -jar draupnir.jar -d ./policies validate prod/api.yaml
 *   java -jar draupnir.jar checklist -o posture.xlsx
 */
@Slf4j
public class CommandLineInterface {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INVALID = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper jsonMapper;
    private Options options;

    public CommandLineInterface() {
        this(System.out, System.err);
    }

    public CommandLineInterface(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        initializeOptions();
    }

    private void initializeOptions() {
        options = new Options();

        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Display help information")
                .build());

        options.addOption(Option.builder("d")
                .longOpt("data-dir")
                .hasArg()
                .argName("dir")
                .desc("Policy data directory (default: $" + ServerSettings.DATA_DIR_ENV + " or ./data)")
                .build());

        options.addOption(Option.builder("f")
                .longOpt("rules")
                .hasArg()
                .argName("rules-file")
                .desc("Path to policy rules file (default: ./" + ConfigLoader.DEFAULT_CONFIG + ")")
                .build());

        options.addOption(Option.builder("g")
                .longOpt("glob")
                .hasArg()
                .argName("glob")
                .desc("Path glob for search, policies and checklist")
                .build());

        options.addOption(Option.builder("o")
                .longOpt("output")
                .hasArg()
                .argName("excel-file")
                .desc("Export the posture checklist to an Excel file (e.g., posture.xlsx)")
                .build());

        options.addOption(Option.builder("j")
                .longOpt("json")
                .hasArg()
                .argName("json-file")
                .desc("Export the posture checklist to a JSON file")
                .build());

        options.addOption(Option.builder("a")
                .longOpt("app")
                .hasArg()
                .argName("app")
                .desc("Application label for template")
                .build());

        options.addOption(Option.builder("n")
                .longOpt("namespace")
                .hasArg()
                .argName("namespace")
                .desc("Namespace for template")
                .build());

        options.addOption(Option.builder()
                .longOpt("ports")
                .hasArg()
                .argName("port/proto,...")
                .desc("Template ingress ports (default: 80/TCP,443/TCP)")
                .build());

        options.addOption(Option.builder()
                .longOpt("fqdns")
                .hasArg()
                .argName("fqdn,...")
                .desc("Template egress FQDNs (default: *.amazonaws.com)")
                .build());

        options.addOption(Option.builder()
                .longOpt("src")
                .hasArg()
                .argName("endpoint")
                .desc("Hubble source filter")
                .build());

        options.addOption(Option.builder()
                .longOpt("dst")
                .hasArg()
                .argName("endpoint")
                .desc("Hubble destination filter")
                .build());

        options.addOption(Option.builder()
                .longOpt("verdict")
                .hasArg()
                .argName("verdict")
                .desc("Hubble verdict filter (FORWARDED, DROPPED, ...)")
                .build());

        options.addOption(Option.builder("z")
                .longOpt("zip")
                .hasArg()
                .argName("zip-file")
                .desc("Policy archive to import")
                .build());

        options.addOption(Option.builder()
                .longOpt("dest")
                .hasArg()
                .argName("dir")
                .desc("Import destination (default: data directory)")
                .build());
    }

    /**
     * @return process exit code
     */
    public int execute(String[] args) {
        if (args.length == 0) {
            printHelp();
            return EXIT_OK;
        }

        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (cmd.hasOption("h") || cmd.getArgList().isEmpty()) {
            printHelp();
            return EXIT_OK;
        }

        List<String> arguments = cmd.getArgList();
        String command = arguments.get(0);
        List<String> commandArgs = arguments.subList(1, arguments.size());

        try {
            return dispatch(command, commandArgs, cmd);
        } catch (CorpusException | SecurityException | IllegalArgumentException | UnsupportedOperationException e) {
            log.debug("Command '{}' failed", command, e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (Exception e) {
            log.error("Command '{}' failed", command, e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int dispatch(String command, List<String> commandArgs, CommandLine cmd) throws Exception {
        if ("import".equals(command)) {
            return importArchive(cmd);
        }

        PolicyKnowledgeService service = createService(cmd);
        String glob = cmd.getOptionValue("g");

        switch (command) {
            case "health":
                out.println(service.healthcheck());
                return EXIT_OK;
            case "list":
                service.list(commandArgs.isEmpty() ? glob : commandArgs.get(0)).forEach(out::println);
                return EXIT_OK;
            case "read":
                out.print(service.readText(requireArg(commandArgs, "read <path>")));
                return EXIT_OK;
            case "search":
                return search(service, requireArg(commandArgs, "search <query>"),
                        glob != null ? glob : PolicyKnowledgeService.DEFAULT_SEARCH_GLOB);
            case "policies":
                service.listPolicyLikeFiles(glob != null ? glob : PolicyKnowledgeService.DEFAULT_POLICY_GLOB)
                        .forEach(out::println);
                return EXIT_OK;
            case "validate":
                return validate(service, requireArg(commandArgs, "validate <path>"));
            case "checklist":
                return checklist(service, glob != null ? glob : PolicyKnowledgeService.DEFAULT_POLICY_GLOB, cmd);
            case "template":
                out.print(service.renderTemplate(
                        cmd.getOptionValue("a"),
                        cmd.getOptionValue("n"),
                        splitList(cmd.getOptionValue("ports")),
                        splitList(cmd.getOptionValue("fqdns"))));
                return EXIT_OK;
            case "hubble":
                printJson(service.hubbleFilters(cmd.getOptionValue("src"), cmd.getOptionValue("dst"), cmd.getOptionValue("verdict")));
                return EXIT_OK;
            case "prompts":
                return prompts(service, commandArgs);
            default:
                err.println("Error: Unknown command '" + command + "'");
                err.println("Run with --help for usage");
                return EXIT_ERROR;
        }
    }

    private PolicyKnowledgeService createService(CommandLine cmd) {
        ServerSettings settings = ServerSettings.getInstance();
        Path dataDir = cmd.hasOption("d")
                ? Paths.get(cmd.getOptionValue("d")).toAbsolutePath().normalize()
                : settings.getDataDir();
        String rulesFile = cmd.getOptionValue("f", settings.getRulesFile());

        PolicyRulesConfig rules = new ConfigLoader().load(rulesFile);
        return new PolicyKnowledgeService(dataDir, rules, settings.isExposeResources());
    }

    private int search(PolicyKnowledgeService service, String query, String glob) throws CorpusException {
        List<SearchHit> hits = service.search(query, glob);
        for (SearchHit hit : hits) {
            out.printf("%s:%d: %s%n", hit.getPath(), hit.getLineNo(), hit.getLine());
        }
        return EXIT_OK;
    }

    private int validate(PolicyKnowledgeService service, String path) throws CorpusException, IOException {
        ValidationReport report = service.validate(path);
        printJson(report);
        return report.isValid() ? EXIT_OK : EXIT_INVALID;
    }

    private int checklist(PolicyKnowledgeService service, String glob, CommandLine cmd) throws CorpusException, IOException {
        PostureChecklist checklist = service.scanPosture(glob);
        printJson(checklist);

        String excelOutput = cmd.getOptionValue("o");
        if (excelOutput != null) {
            List<ValidationReport> findings = service.validatePolicies(glob);
            new PostureExcelReportGenerator().generateReport(checklist, findings, excelOutput);
            err.println("📊 Excel report written: " + excelOutput);
        }

        String jsonOutput = cmd.getOptionValue("j");
        if (jsonOutput != null) {
            new JsonResultExporter().exportToJson(checklist, service.getDataDir(), glob, new File(jsonOutput));
            err.println("📄 JSON export written: " + jsonOutput);
        }
        return EXIT_OK;
    }

    private int prompts(PolicyKnowledgeService service, List<String> commandArgs) {
        if (commandArgs.isEmpty()) {
            for (PromptDefinition prompt : service.prompts()) {
                out.println(prompt.getName());
            }
            return EXIT_OK;
        }
        String name = commandArgs.get(0);
        Optional<PromptDefinition> prompt = service.prompt(name);
        if (prompt.isEmpty()) {
            err.println("Error: Unknown prompt '" + name + "'");
            return EXIT_ERROR;
        }
        out.println(prompt.get().getText());
        return EXIT_OK;
    }

    private int importArchive(CommandLine cmd) throws IOException {
        String zip = cmd.getOptionValue("z");
        if (zip == null) {
            throw new IllegalArgumentException("import requires --zip <zip-file>");
        }
        Path dest;
        if (cmd.hasOption("dest")) {
            dest = Paths.get(cmd.getOptionValue("dest"));
        } else if (cmd.hasOption("d")) {
            dest = Paths.get(cmd.getOptionValue("d"));
        } else {
            dest = ServerSettings.getInstance().getDataDir();
        }

        int files = new CorpusImporter().importArchive(Paths.get(zip), dest);
        out.println("Unzipped " + files + " files -> " + dest.toAbsolutePath().normalize());
        return EXIT_OK;
    }

    private void printJson(Object value) throws IOException {
        out.println(jsonMapper.writeValueAsString(value));
    }

    private static String requireArg(List<String> commandArgs, String usage) {
        if (commandArgs.isEmpty()) {
            throw new IllegalArgumentException("Missing argument. Usage: " + usage);
        }
        return commandArgs.get(0);
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private void printHelp() {
        out.println("Draupnir - Cilium Network Policy Validation Tool");
        out.println();
        out.println("USAGE:");
        out.println("  java -jar draupnir.jar [OPTIONS] COMMAND [ARGS]");
        out.println();
        out.println("COMMANDS:");
        out.println("  health                  Print the configured data directory");
        out.println("  list [GLOB]             List data files, optionally filtered by glob");
        out.println("  read PATH               Print a data file");
        out.println("  search QUERY            Case-insensitive search (-g to restrict files)");
        out.println("  policies                List Cilium policy files (-g to restrict files)");
        out.println("  validate PATH           Validate one policy; exit code 2 when it has errors");
        out.println("  checklist               Zero-trust posture checklist (-o xlsx, -j json)");
        out.println("  template                Generate a policy (-a APP -n NS [--ports] [--fqdns])");
        out.println("  hubble                  Hubble observe filters (--src --dst --verdict)");
        out.println("  prompts [NAME]          List review prompts or print one");
        out.println("  import                  Unzip a policy archive (--zip FILE [--dest DIR])");
        out.println();
        out.println("OPTIONS:");
        out.println("  -h, --help              Display this help message");
        out.println("  -d, --data-dir DIR      Policy data directory");
        out.println("                          (default: $" + ServerSettings.DATA_DIR_ENV + " or ./data)");
        out.println("  -f, --rules FILE        Path to policy rules file");
        out.println("                          (default: ./" + ConfigLoader.DEFAULT_CONFIG + ")");
        out.println("  -g, --glob GLOB         Path glob, e.g. **/*.{yml,yaml}");
        out.println("  -o, --output FILE       Export checklist to Excel (e.g., posture.xlsx)");
        out.println("  -j, --json FILE         Export checklist to JSON");
        out.println();
        out.println("EXAMPLES:");
        out.println("  # Validate one policy");
        out.println("  java -jar draupnir.jar -d ./policies validate prod/api-cnp.yaml");
        out.println();
        out.println("  # Posture checklist with Excel export");
        out.println("  java -jar draupnir.jar checklist -g 'prod/**/*.yaml' -o posture.xlsx");
        out.println();
        out.println("  # Generate a template");
        out.println("  java -jar draupnir.jar template -a api -n prod --ports 8080/TCP --fqdns api.stripe.com");
        out.println();
    }
}
