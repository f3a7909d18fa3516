package co.fanki.filegraph.analysis.application;

import co.fanki.filegraph.analysis.domain.FileAnalyzer;
import co.fanki.filegraph.analysis.domain.FileTypeDetector;
import co.fanki.filegraph.analysis.domain.FileUnit;
import co.fanki.filegraph.config.AnalyzerConfig;
import co.fanki.filegraph.graph.domain.GraphBuilder;
import co.fanki.filegraph.graph.domain.TraversalResult;
import co.fanki.filegraph.path.domain.PathMapper;
import co.fanki.filegraph.report.domain.AnalysisReport;
import co.fanki.filegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a dependency analysis and writes its report.
 *
 * <p>Every run builds its own path mapper, analyzer and graph builder from
 * the configuration it is given; nothing is shared between runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DependencyAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DependencyAnalysisService.class);

    private final FileAnalyzerFactory analyzerFactory;

    private final FileTypeDetector typeDetector;

    private final ReportWriter reportWriter;

    private final int maxIterations;

    /**
     * Creates a new DependencyAnalysisService.
     *
     * @param theAnalyzerFactory creates the analyzer of each run
     * @param theTypeDetector detects binaries among executed files
     * @param theReportWriter writes the report file
     * @param theMaxIterations the iteration cap of a run
     */
    public DependencyAnalysisService(
            final FileAnalyzerFactory theAnalyzerFactory,
            final FileTypeDetector theTypeDetector,
            final ReportWriter theReportWriter,
            @Value("${analyzer.max-iterations:100}")
            final int theMaxIterations) {
        this.analyzerFactory = theAnalyzerFactory;
        this.typeDetector = theTypeDetector;
        this.reportWriter = theReportWriter;
        this.maxIterations = theMaxIterations;
    }

    /**
     * Analyzes the given entry points.
     *
     * @param config the run configuration, for its path mappings
     * @param entryPoints the files to start from
     * @param outDir where the report is written
     * @return the outcome of the run
     * @throws IOException if the report cannot be written
     * @throws co.fanki.filegraph.shared.ConfigurationException if there is
     *         nothing to analyze or the configuration is invalid
     */
    public AnalysisRun analyze(final AnalyzerConfig config,
            final List<FileUnit> entryPoints, final Path outDir)
            throws IOException {
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.requireNonNull(outDir, "Output directory is required");
        Preconditions.requireConfiguration(
                entryPoints != null && !entryPoints.isEmpty(),
                "No entry points configured, pass --entry or add"
                        + " 'entryPoints' to the config file");

        final PathMapper pathMapper = new PathMapper(config.pathMappings());
        final FileAnalyzer analyzer = analyzerFactory.create();
        final GraphBuilder builder = new GraphBuilder(pathMapper, analyzer,
                typeDetector, maxIterations);

        final TraversalResult result = builder.run(entryPoints);

        LOG.info("Found {} read, {} written, {} executed files and {} errors",
                result.readFiles().size(), result.writeFiles().size(),
                result.executeFiles().size(), result.errors().size());

        final AnalysisReport report = AnalysisReport.of(result);
        final Path reportFile = reportWriter.write(report, outDir);

        return new AnalysisRun(result, report, reportFile);
    }

    /**
     * Outcome of one analysis run.
     *
     * @param result the traversal result
     * @param report the rendered report
     * @param reportFile where the report was written
     */
    public record AnalysisRun(TraversalResult result, AnalysisReport report,
            Path reportFile) {
    }

}
