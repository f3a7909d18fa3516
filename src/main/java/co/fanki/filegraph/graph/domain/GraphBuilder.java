package co.fanki.filegraph.graph.domain;

import co.fanki.filegraph.analysis.domain.AnalysisOutcome;
import co.fanki.filegraph.analysis.domain.AnalysisRecord;
import co.fanki.filegraph.analysis.domain.AnalysisRequest;
import co.fanki.filegraph.analysis.domain.ErrorKind;
import co.fanki.filegraph.analysis.domain.ExecuteEntry;
import co.fanki.filegraph.analysis.domain.FileAnalyzer;
import co.fanki.filegraph.analysis.domain.FileError;
import co.fanki.filegraph.analysis.domain.FileTypeDetector;
import co.fanki.filegraph.analysis.domain.FileUnit;
import co.fanki.filegraph.analysis.domain.PathEntry;
import co.fanki.filegraph.path.domain.PathMapper;
import co.fanki.filegraph.path.domain.PathNormalizer;
import co.fanki.filegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.function.Function;

/**
 * Discovers the dependency graph reachable from a set of entry points.
 *
 * <p>Files are taken from a FIFO worklist one at a time. Each file is
 * analyzed at most once: a path already visited is dropped when it is
 * dequeued, not when it is enqueued, so the same program may sit in the
 * worklist several times. Executables an analysis reports are typed and
 * pushed back on the worklist; binaries are recorded but never analyzed.
 * The traversal ends when the worklist is empty or after
 * {@code maxIterations} dequeues, whichever comes first.</p>
 *
 * <p>A file that cannot be found or analyzed becomes an error entry and a
 * node without edges; the traversal always continues.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphBuilder.class);

    private final PathMapper pathMapper;

    private final FileAnalyzer analyzer;

    private final FileTypeDetector typeDetector;

    private final int maxIterations;

    /**
     * Creates a new graph builder for one run.
     *
     * @param thePathMapper maps analyzed-system paths to local paths
     * @param theAnalyzer finds the dependencies of one file
     * @param theTypeDetector tells binaries from analyzable files
     * @param theMaxIterations the maximum number of dequeues
     */
    public GraphBuilder(final PathMapper thePathMapper,
            final FileAnalyzer theAnalyzer,
            final FileTypeDetector theTypeDetector,
            final int theMaxIterations) {
        this.pathMapper = Preconditions.requireNonNull(thePathMapper,
                "Path mapper is required");
        this.analyzer = Preconditions.requireNonNull(theAnalyzer,
                "File analyzer is required");
        this.typeDetector = Preconditions.requireNonNull(theTypeDetector,
                "File type detector is required");
        this.maxIterations = Preconditions.requirePositive(theMaxIterations,
                "Max iterations must be positive");
    }

    /**
     * Runs the traversal.
     *
     * @param entryPoints the files to start from, in order
     * @return the graph and the aggregated findings
     */
    public TraversalResult run(final List<FileUnit> entryPoints) {
        Preconditions.requireNoNulls(entryPoints, "Entry points are required");

        LOG.info("Starting traversal from {} entry points (max {} iterations)",
                entryPoints.size(), maxIterations);

        return new Traversal(entryPoints).run();
    }

    /** State of a single run, owned by one thread. */
    private final class Traversal {

        private final Queue<FileUnit> worklist;
        private final Set<String> visited = new HashSet<>();
        private final DependencyGraph graph = new DependencyGraph();
        private final List<PathEntry> readFiles = new ArrayList<>();
        private final List<PathEntry> writeFiles = new ArrayList<>();
        private final List<ExecuteEntry> executeFiles = new ArrayList<>();
        private final List<FileError> errors = new ArrayList<>();
        private final List<String> roots;

        private Traversal(final List<FileUnit> entryPoints) {
            this.worklist = new ArrayDeque<>(entryPoints);
            final Set<String> rootPaths = new LinkedHashSet<>();
            for (final FileUnit entryPoint : entryPoints) {
                rootPaths.add(PathNormalizer.resolve(entryPoint.pwd(),
                        entryPoint.path()));
            }
            this.roots = new ArrayList<>(rootPaths);
        }

        private TraversalResult run() {
            int iterations = 0;

            while (!worklist.isEmpty() && iterations < maxIterations) {
                iterations++;
                LOG.info("Processing {} / {}...", iterations,
                        iterations + worklist.size() - 1);
                process(worklist.poll());
            }

            if (!worklist.isEmpty()) {
                LOG.warn("Stopped after {} iterations with {} files left;"
                        + " the graph is incomplete", iterations,
                        worklist.size());
            }

            LOG.info("Traversal finished: {} files analyzed, {} edges",
                    graph.nodeCount(), graph.edgeCount());

            return new TraversalResult(
                    graph.freeze(),
                    roots,
                    uniqueByPath(readFiles, PathEntry::path),
                    uniqueByPath(writeFiles, PathEntry::path),
                    uniqueByPath(executeFiles, ExecuteEntry::path),
                    errors,
                    iterations,
                    worklist.size(),
                    maxIterations);
        }

        private void process(final FileUnit unit) {
            final String absolutePath = PathNormalizer.resolve(unit.pwd(),
                    unit.path());

            if (!visited.add(absolutePath)) {
                LOG.debug("Skipping already analyzed file {}", absolutePath);
                return;
            }

            if (unit.isBinary()) {
                LOG.info("Skipping binary file {} with type {}",
                        pathMapper.map(absolutePath), unit.fileType());
                return;
            }

            graph.addNode(absolutePath);

            final String localPath = pathMapper.map(absolutePath);
            LOG.info("Analyzing file {}", unit.path());
            LOG.debug("Working directory: {}, absolute path: {},"
                    + " local path: {}", unit.pwd(), absolutePath, localPath);

            final String content = readContent(unit, absolutePath, localPath);
            if (content == null) {
                return;
            }

            final AnalysisOutcome outcome = analyze(new AnalysisRequest(
                    unit.pwd(), absolutePath, localPath, content,
                    unit.args()));

            if (!outcome.success()) {
                LOG.warn("Analysis failed for {}: {}", absolutePath,
                        outcome.errorMessage());
                errors.add(new FileError(absolutePath, unit.pwd(),
                        outcome.errorMessage(), ErrorKind.ORACLE));
                return;
            }

            record(unit, absolutePath, outcome.record());
        }

        private String readContent(final FileUnit unit,
                final String absolutePath, final String localPath) {
            try {
                final Path file = Paths.get(localPath);
                if (!Files.isRegularFile(file)) {
                    LOG.warn("File does not exist: {} (mapped to {})",
                            absolutePath, localPath);
                    errors.add(new FileError(absolutePath, unit.pwd(),
                            "File does not exist: " + localPath,
                            ErrorKind.RESOLUTION));
                    return null;
                }
                return new String(Files.readAllBytes(file),
                        StandardCharsets.UTF_8);
            } catch (final IOException | InvalidPathException e) {
                LOG.warn("Cannot read {}: {}", localPath, e.getMessage());
                errors.add(new FileError(absolutePath, unit.pwd(),
                        "Cannot read " + localPath + ": " + e.getMessage(),
                        ErrorKind.RESOLUTION));
                return null;
            }
        }

        private AnalysisOutcome analyze(final AnalysisRequest request) {
            try {
                final AnalysisOutcome outcome = analyzer.analyze(request);
                return outcome != null ? outcome
                        : AnalysisOutcome.failure("Analyzer returned nothing");
            } catch (final RuntimeException e) {
                LOG.error("Analyzer failed on {}", request.absolutePath(), e);
                return AnalysisOutcome.failure(e.getClass().getSimpleName()
                        + ": " + e.getMessage());
            }
        }

        private void record(final FileUnit unit, final String absolutePath,
                final AnalysisRecord analysis) {

            readFiles.addAll(analysis.readFiles());
            writeFiles.addAll(analysis.writeFiles());
            errors.addAll(analysis.errors());

            for (final PathEntry read : analysis.readFiles()) {
                graph.addEdge(absolutePath, Edge.read(
                        PathNormalizer.resolve(unit.pwd(), read.path())));
            }
            for (final PathEntry write : analysis.writeFiles()) {
                graph.addEdge(absolutePath, Edge.write(
                        PathNormalizer.resolve(unit.pwd(), write.path())));
            }

            for (final ExecuteEntry execute : analysis.executeFiles()) {
                final String pwd = execute.pwd().isBlank()
                        ? unit.pwd() : execute.pwd();
                final String target = PathNormalizer.resolve(pwd,
                        execute.path());
                final String fileType = detectType(target);

                final ExecuteEntry typed = new ExecuteEntry(execute.path(),
                        pwd, execute.args(), execute.description(), fileType);

                executeFiles.add(typed);
                graph.addEdge(absolutePath, Edge.execute(target, fileType));
                worklist.add(new FileUnit(pwd, execute.path(), execute.args(),
                        fileType));
            }

            LOG.info("Analysis of {} complete: {} read, {} written,"
                    + " {} executed, {} errors", absolutePath,
                    analysis.readFiles().size(), analysis.writeFiles().size(),
                    analysis.executeFiles().size(), analysis.errors().size());
        }

        private String detectType(final String absolutePath) {
            try {
                return typeDetector.detect(pathMapper.map(absolutePath))
                        .orElse(null);
            } catch (final RuntimeException e) {
                LOG.warn("Cannot determine the type of {}: {}", absolutePath,
                        e.getMessage());
                return null;
            }
        }
    }

    private static <T> List<T> uniqueByPath(final List<T> entries,
            final Function<T, String> path) {
        final Set<String> seen = new HashSet<>();
        final List<T> unique = new ArrayList<>();
        for (final T entry : entries) {
            if (seen.add(path.apply(entry))) {
                unique.add(entry);
            }
        }
        return unique;
    }

}
