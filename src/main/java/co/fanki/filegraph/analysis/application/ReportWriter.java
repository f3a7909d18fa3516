package co.fanki.filegraph.analysis.application;

import co.fanki.filegraph.report.domain.AnalysisReport;
import co.fanki.filegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes reports as timestamped markdown files.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReportWriter.class);

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Clock clock;

    /**
     * Creates a new writer.
     *
     * @param theClock the clock the file names are taken from
     */
    public ReportWriter(final Clock theClock) {
        this.clock = Preconditions.requireNonNull(theClock,
                "Clock is required");
    }

    /**
     * Writes a report into a directory, creating the directory if needed.
     *
     * @param report the report
     * @param outDir the target directory
     * @return the file written, {@code analysis-yyyyMMdd-HHmmss.md}
     * @throws IOException if the file cannot be written
     */
    public Path write(final AnalysisReport report, final Path outDir)
            throws IOException {
        Preconditions.requireNonNull(report, "Report is required");
        Preconditions.requireNonNull(outDir, "Output directory is required");

        Files.createDirectories(outDir);

        final String name = "analysis-"
                + LocalDateTime.now(clock).format(TIMESTAMP) + ".md";
        final Path file = outDir.resolve(name);

        Files.writeString(file, report.content(), StandardCharsets.UTF_8);

        LOG.info("Report written to {}", file.toAbsolutePath());
        return file;
    }

}
