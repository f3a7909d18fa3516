package co.fanki.filegraph.config;

import co.fanki.filegraph.analysis.application.DependencyAnalysisService;
import co.fanki.filegraph.analysis.application.DependencyAnalysisService.AnalysisRun;
import co.fanki.filegraph.analysis.domain.FileUnit;
import co.fanki.filegraph.copy.application.CopyOptions;
import co.fanki.filegraph.copy.application.CopyStats;
import co.fanki.filegraph.copy.application.FileCopyService;
import co.fanki.filegraph.report.domain.ExtractOptions;
import co.fanki.filegraph.shared.DomainException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The {@code analyze} and {@code copy} commands.
 *
 * <p>Exit codes: 0 on success, 1 when the command failed (including a copy
 * with per-file errors) and 2 on a usage error.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class AnalyzerCommandLine implements CommandLineRunner,
        ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalyzerCommandLine.class);

    /** Exit code of a successful command. */
    public static final int SUCCESS = 0;

    /** Exit code of a command that failed. */
    public static final int FAILURE = 1;

    /** Exit code of a malformed command line. */
    public static final int USAGE = 2;

    private static final String ANALYZE = "analyze";
    private static final String COPY = "copy";
    private static final String DEFAULT_CONFIG = "./config.json";

    private final AnalyzerConfigLoader configLoader;
    private final DependencyAnalysisService analysisService;
    private final FileCopyService copyService;
    private final PrintStream out;

    private int exitCode = SUCCESS;

    /**
     * Creates a new command line writing to standard output.
     *
     * @param theConfigLoader loads the config file
     * @param theAnalysisService runs analyses
     * @param theCopyService copies listed files
     */
    @Autowired
    public AnalyzerCommandLine(final AnalyzerConfigLoader theConfigLoader,
            final DependencyAnalysisService theAnalysisService,
            final FileCopyService theCopyService) {
        this(theConfigLoader, theAnalysisService, theCopyService, System.out);
    }

    AnalyzerCommandLine(final AnalyzerConfigLoader theConfigLoader,
            final DependencyAnalysisService theAnalysisService,
            final FileCopyService theCopyService, final PrintStream theOut) {
        this.configLoader = theConfigLoader;
        this.analysisService = theAnalysisService;
        this.copyService = theCopyService;
        this.out = theOut;
    }

    @Override
    public void run(final String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one command.
     *
     * @param args the command name followed by its options
     * @return the exit code
     */
    int execute(final String... args) {
        final List<String> arguments = new ArrayList<>();
        for (final String arg : args) {
            // Spring Boot passes its own --spring.* properties through.
            if (!arg.startsWith("--spring.")) {
                arguments.add(arg);
            }
        }

        if (arguments.isEmpty()) {
            printUsage();
            return USAGE;
        }

        final String command = arguments.get(0);
        final String[] options = arguments.subList(1, arguments.size())
                .toArray(new String[0]);

        final CommandLineParser parser = new DefaultParser();
        try {
            switch (command) {
                case ANALYZE:
                    return analyze(parser.parse(analyzeOptions(), options));
                case COPY:
                    return copy(parser.parse(copyOptions(), options));
                default:
                    out.println("Unknown command: " + command);
                    printUsage();
                    return USAGE;
            }
        } catch (final ParseException e) {
            out.println(e.getMessage());
            printUsage();
            return USAGE;
        } catch (final DomainException e) {
            LOG.error("{} [{}]", e.getMessage(), e.getErrorCode());
            return FAILURE;
        } catch (final IOException e) {
            LOG.error("I/O error: {}", e.getMessage(), e);
            return FAILURE;
        } catch (final RuntimeException e) {
            LOG.error("Unexpected failure", e);
            return FAILURE;
        }
    }

    private int analyze(final CommandLine cmd) throws IOException {
        final AnalyzerConfig config = configLoader.load(
                Paths.get(cmd.getOptionValue("config", DEFAULT_CONFIG)));

        final List<FileUnit> entryPoints = cmd.hasOption("entry")
                ? List.of(FileUnit.entryPoint(config.pwd(),
                        cmd.getOptionValue("entry"), List.of()))
                : config.entryPointUnits();

        final AnalysisRun run = analysisService.analyze(config, entryPoints,
                outputDir(cmd, config));

        out.println(run.report().content());
        LOG.info("Analysis saved to {}", run.reportFile().toAbsolutePath());
        return SUCCESS;
    }

    private int copy(final CommandLine cmd) throws IOException {
        final AnalyzerConfig config = configLoader.load(
                Paths.get(cmd.getOptionValue("config", DEFAULT_CONFIG)));

        final ExtractOptions extract = new ExtractOptions(
                !cmd.hasOption("no-read"),
                !cmd.hasOption("no-write"),
                !cmd.hasOption("no-exec"),
                !cmd.hasOption("no-binary"),
                cmd.hasOption("include-errors"));

        final CopyStats stats = copyService.copy(config,
                Paths.get(cmd.getOptionValue("input")),
                Paths.get(cmd.getOptionValue("output")),
                new CopyOptions(extract, cmd.hasOption("dry-run"),
                        cmd.hasOption("verbose")));

        out.printf(Locale.ROOT, "Total: %d, copied: %d, skipped: %d,"
                + " missing: %d, errors: %d, success rate: %.1f%%%n",
                stats.total(),
                stats.copied(), stats.skipped(), stats.missing(),
                stats.errors(), stats.successRate() * 100);

        return stats.hasErrors() ? FAILURE : SUCCESS;
    }

    private static Path outputDir(final CommandLine cmd,
            final AnalyzerConfig config) {
        if (cmd.hasOption("output")) {
            return Paths.get(cmd.getOptionValue("output"));
        }
        if (config.outDir() != null && !config.outDir().isBlank()) {
            return Paths.get(config.outDir());
        }
        return Paths.get(".");
    }

    private static Options analyzeOptions() {
        final Options options = new Options();
        options.addOption("e", "entry", true,
                "Single entry point, resolved against the config pwd");
        options.addOption("c", "config", true,
                "Config file (default: " + DEFAULT_CONFIG + ")");
        options.addOption("o", "output", true,
                "Directory the report is written to");
        return options;
    }

    private static Options copyOptions() {
        final Options options = new Options();
        options.addOption(Option.builder("i").longOpt("input").hasArg()
                .required().desc("Analysis report (.md) or plain file list")
                .build());
        options.addOption(Option.builder("o").longOpt("output").hasArg()
                .required().desc("Directory the files are copied into")
                .build());
        options.addOption("c", "config", true,
                "Config file (default: " + DEFAULT_CONFIG + ")");
        options.addOption(null, "dry-run", false,
                "Show what would be copied without copying");
        options.addOption("v", "verbose", false, "Log every file");
        options.addOption(null, "no-read", false, "Skip the files read");
        options.addOption(null, "no-write", false, "Skip the files written");
        options.addOption(null, "no-exec", false, "Skip the executables");
        options.addOption(null, "no-binary", false, "Skip the binaries");
        options.addOption(null, "include-errors", false,
                "Also copy the files listed under errors");
        return options;
    }

    private void printUsage() {
        final HelpFormatter formatter = new HelpFormatter();
        final PrintWriter writer = new PrintWriter(out);
        writer.println("Usage: file-dependency-analyzer <command> [options]");
        writer.println();
        formatter.printHelp(writer, formatter.getWidth(), ANALYZE,
                "Analyze the configured entry points", analyzeOptions(),
                formatter.getLeftPadding(), formatter.getDescPadding(), null,
                true);
        writer.println();
        formatter.printHelp(writer, formatter.getWidth(), COPY,
                "Copy the files listed in a report", copyOptions(),
                formatter.getLeftPadding(), formatter.getDescPadding(), null,
                true);
        writer.flush();
    }

}
