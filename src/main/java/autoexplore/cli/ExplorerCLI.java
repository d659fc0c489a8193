package autoexplore.cli;

import autoexplore.explorer.ExplorerConfig;
import autoexplore.learning.JsonFilePolicyStore;
import autoexplore.learning.PolicyStatistics;
import autoexplore.learning.QLearningPolicy;
import autoexplore.model.ExplorationIssue;
import autoexplore.model.ExplorationResult;
import autoexplore.model.ExplorationResultIO;
import autoexplore.model.ExplorationStatus;
import autoexplore.model.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point over the artifacts an exploration leaves behind.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code autoexplore policy-stats}  print statistics of a policy store</li>
 *   <li>{@code autoexplore policy-export} print or write the learned values as JSON</li>
 *   <li>{@code autoexplore policy-merge}  blend an externally trained table into a store</li>
 *   <li>{@code autoexplore show-result}   summarize a saved exploration result</li>
 *   <li>{@code autoexplore config}        print the effective {@code explorer.*} settings</li>
 *   <li>{@code autoexplore version}       print build version</li>
 * </ul>
 *
 * <p>Main class wired into the fat-JAR manifest by maven-shade-plugin.
 */
@Command(
        name        = "autoexplore",
        description = "Autonomous mobile-app exploration: policy store and result tooling",
        version     = ExplorerCLI.VERSION,
        mixinStandardHelpOptions = true,
        subcommands = {
                ExplorerCLI.PolicyStatsCommand.class,
                ExplorerCLI.PolicyExportCommand.class,
                ExplorerCLI.PolicyMergeCommand.class,
                ExplorerCLI.ShowResultCommand.class,
                ExplorerCLI.ConfigCommand.class,
                ExplorerCLI.VersionCommand.class
        }
)
public class ExplorerCLI implements Callable<Integer> {

    static final String VERSION = "1.0.0-SNAPSHOT";

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new ExplorerCLI()).execute(args);
        System.exit(exit);
    }

    /** Store path from {@code --store}, or the configured default. */
    static Path resolveStore(Path option) {
        return option != null ? option : new ExplorerConfig().getPolicyStorePath();
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Loads a policy store and prints its statistics and dangerous patterns.
     */
    @Command(
            name        = "policy-stats",
            description = "Print statistics of a policy store",
            mixinStandardHelpOptions = true
    )
    static class PolicyStatsCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(names = {"-s", "--store"}, description = "Policy store file (default: explorer.policy.store)")
        Path store;

        @Override
        public Integer call() throws IOException {
            PrintWriter out = spec.commandLine().getOut();
            Path file = resolveStore(store);
            if (!Files.exists(file)) {
                spec.commandLine().getErr().println("Policy store not found: " + file.toAbsolutePath());
                return 1;
            }
            try (JsonFilePolicyStore policyStore = JsonFilePolicyStore.open(file)) {
                QLearningPolicy policy = new QLearningPolicy(policyStore);
                PolicyStatistics stats = policy.getStatistics();
                out.printf("Store              : %s%n", file.toAbsolutePath());
                out.printf("Entries            : %d%n", stats.tableSize());
                out.printf("Total visits       : %d%n", stats.totalVisits());
                out.printf("Screens known      : %d%n", stats.screensKnown());
                out.printf("Total actions      : %d%n", stats.totalActions());
                out.printf("Average value      : %.3f (min %.3f, max %.3f)%n",
                        stats.averageValue(), stats.minValue(), stats.maxValue());
                out.printf("Exploration rate   : %.3f%n", stats.epsilon());
                out.printf("Dangerous patterns : %d%n", stats.dangerousPatterns());
                for (String pattern : policy.getDangerousPatterns()) {
                    out.printf("  - %s%n", pattern);
                }
            }
            return 0;
        }
    }

    /**
     * Exports the learned values as a flat, key-sorted JSON object.
     */
    @Command(
            name        = "policy-export",
            description = "Export learned values as JSON",
            mixinStandardHelpOptions = true
    )
    static class PolicyExportCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(PolicyExportCommand.class);

        @Spec
        CommandSpec spec;

        @Option(names = {"-s", "--store"}, description = "Policy store file (default: explorer.policy.store)")
        Path store;

        @Option(names = {"-o", "--output"}, description = "Write to this file instead of stdout")
        Path output;

        @Override
        public Integer call() throws IOException {
            Path file = resolveStore(store);
            if (!Files.exists(file)) {
                spec.commandLine().getErr().println("Policy store not found: " + file.toAbsolutePath());
                return 1;
            }
            String json;
            try (JsonFilePolicyStore policyStore = JsonFilePolicyStore.open(file)) {
                json = new QLearningPolicy(policyStore).exportQTableJson();
            }
            if (output == null) {
                spec.commandLine().getOut().println(json);
            } else {
                Files.writeString(output, json);
                log.info("Exported policy values from {} to {}", file, output);
                spec.commandLine().getOut().println("Exported to " + output.toAbsolutePath());
            }
            return 0;
        }
    }

    /**
     * Blends an externally trained table into a store: new keys are copied,
     * known keys become {@code 0.7 external + 0.3 local}.
     */
    @Command(
            name        = "policy-merge",
            description = "Merge an exported or externally trained table into a policy store",
            mixinStandardHelpOptions = true
    )
    static class PolicyMergeCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(names = {"-s", "--store"}, description = "Policy store file (default: explorer.policy.store)")
        Path store;

        @Parameters(index = "0", description = "JSON table to merge")
        Path input;

        @Override
        public Integer call() throws IOException {
            if (!Files.exists(input)) {
                spec.commandLine().getErr().println("Input not found: " + input.toAbsolutePath());
                return 1;
            }
            Path file = resolveStore(store);
            int merged;
            try (JsonFilePolicyStore policyStore = JsonFilePolicyStore.open(file)) {
                merged = new QLearningPolicy(policyStore).mergeQTable(Files.readString(input));
            }
            if (merged == 0) {
                spec.commandLine().getErr().println("Nothing merged from " + input);
                return 2;
            }
            spec.commandLine().getOut().printf("Merged %d values into %s%n", merged, file.toAbsolutePath());
            return 0;
        }
    }

    /**
     * Prints a summary of a saved exploration result.
     */
    @Command(
            name        = "show-result",
            description = "Summarize a saved exploration result",
            mixinStandardHelpOptions = true
    )
    static class ShowResultCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Path to result JSON file")
        Path resultFile;

        @Option(names = {"-i", "--issues"}, description = "List every issue")
        boolean listIssues;

        @Override
        public Integer call() throws IOException {
            PrintWriter out = spec.commandLine().getOut();
            if (!Files.exists(resultFile)) {
                spec.commandLine().getErr().println("Result file not found: " + resultFile.toAbsolutePath());
                return 1;
            }
            ExplorationResult result = ExplorationResultIO.read(resultFile);
            out.printf("Package     : %s%n", result.getPackageName());
            out.printf("Status      : %s%n", result.getStatus());
            out.printf("Pass        : %d%n", result.getPassNumber());
            out.printf("Screens     : %d%n", result.getScreens().size());
            out.printf("Transitions : %d%n", result.getTransitions().size());
            out.printf("Coverage    : %s%n", result.getCoverage().summary());
            if (result.getErrorMessage() != null) {
                out.printf("Error       : %s%n", result.getErrorMessage());
            }

            Map<IssueType, Integer> byType = new EnumMap<>(IssueType.class);
            for (ExplorationIssue issue : result.getIssues()) {
                byType.merge(issue.getType(), 1, Integer::sum);
            }
            out.printf("Issues      : %d%n", result.getIssues().size());
            byType.forEach((type, count) -> out.printf("  %-20s %d%n", type, count));
            if (listIssues) {
                for (ExplorationIssue issue : result.getIssues()) {
                    out.printf("  %s%n", issue);
                }
            }
            return result.getStatus() == ExplorationStatus.ERROR ? 2 : 0;
        }
    }

    /**
     * Prints the effective {@code explorer.*} settings after local overrides.
     */
    @Command(name = "config", description = "Print effective explorer settings", mixinStandardHelpOptions = true)
    static class ConfigCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            new ExplorerConfig().asMap()
                    .forEach((k, v) -> spec.commandLine().getOut().printf("%s = %s%n", k, v));
            return 0;
        }
    }

    @Command(name = "version", description = "Print version information")
    static class VersionCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            out.println("AutoExplore " + VERSION);
            out.println("Java " + System.getProperty("java.version"));
            return 0;
        }
    }
}
