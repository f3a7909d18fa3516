package co.fanki.filegraph.copy.application;

import co.fanki.filegraph.config.AnalyzerConfig;
import co.fanki.filegraph.path.domain.PathMapper;
import co.fanki.filegraph.path.domain.PathNormalizer;
import co.fanki.filegraph.report.domain.ReportFileListExtractor;
import co.fanki.filegraph.shared.ConfigurationException;
import co.fanki.filegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;

/**
 * Copies the files listed in a report, or in a plain list, out of the
 * mapped local tree into an output directory.
 *
 * <p>The output keeps the absolute layout of the analyzed system: a file
 * known as {@code /opt/app/run.sh} lands in
 * {@code <output>/opt/app/run.sh}. One failing file never stops the
 * run; it is counted and logged.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class FileCopyService {

    private static final Logger LOG = LoggerFactory.getLogger(
            FileCopyService.class);

    private final ReportFileListExtractor extractor;

    /**
     * Creates a new FileCopyService.
     *
     * @param theExtractor reads the file list out of the input
     */
    public FileCopyService(final ReportFileListExtractor theExtractor) {
        this.extractor = Preconditions.requireNonNull(theExtractor,
                "Extractor is required");
    }

    /**
     * Copies every listed file.
     *
     * @param config the configuration with the pwd and the path mappings
     * @param input the report ({@code .md}) or plain file list
     * @param outputDir the directory to copy into
     * @param options what to copy and how
     * @return the counters of the run
     * @throws IOException if the input cannot be read
     * @throws ConfigurationException if the input does not exist
     */
    public CopyStats copy(final AnalyzerConfig config, final Path input,
            final Path outputDir, final CopyOptions options)
            throws IOException {
        Preconditions.requireNonNull(config, "Config is required");
        Preconditions.requireNonNull(input, "Input file is required");
        Preconditions.requireNonNull(outputDir, "Output directory is required");
        Preconditions.requireNonNull(options, "Copy options are required");

        if (!Files.isRegularFile(input)) {
            throw new ConfigurationException("Input file not found: "
                    + input);
        }

        final List<String> paths = extractor.extract(
                input.getFileName().toString(),
                Files.readString(input, StandardCharsets.UTF_8),
                options.extract());

        final PathMapper pathMapper = new PathMapper(config.pathMappings());

        LOG.info("Processing {} files from {} into {}", paths.size(), input,
                outputDir);
        if (options.dryRun()) {
            LOG.info("Dry run, no file will be copied");
        }

        int copied = 0;
        int skipped = 0;
        int missing = 0;
        int errors = 0;

        for (final String path : paths) {
            final String absolutePath = PathNormalizer.resolve(config.pwd(),
                    path);
            final String localPath = pathMapper.map(absolutePath);
            if (options.verbose()) {
                LOG.info("Mapping {} -> {}", absolutePath, localPath);
            }

            try {
                switch (copyOne(absolutePath, localPath, outputDir, options)) {
                    case COPIED:
                        copied++;
                        break;
                    case SKIPPED:
                        skipped++;
                        break;
                    default:
                        missing++;
                        break;
                }
            } catch (final IOException | InvalidPathException e) {
                errors++;
                LOG.error("Error copying {}: {}", localPath, e.getMessage());
            }
        }

        final CopyStats stats = new CopyStats(paths.size(), copied, skipped,
                missing, errors);

        LOG.info("Copy summary: {} total, {} copied, {} skipped, {} missing,"
                + " {} errors, success rate {}%", stats.total(),
                stats.copied(), stats.skipped(), stats.missing(),
                stats.errors(),
                String.format(Locale.ROOT, "%.1f", stats.successRate() * 100));

        return stats;
    }

    private Result copyOne(final String absolutePath, final String localPath,
            final Path outputDir, final CopyOptions options)
            throws IOException {

        final Path source = Paths.get(localPath);
        if (!Files.exists(source)) {
            LOG.warn("File not found: {}", localPath);
            return Result.MISSING;
        }

        final Path target = outputDir.resolve(absolutePath.substring(1));

        if (Files.exists(target) && isUpToDate(source, target)) {
            if (options.verbose()) {
                LOG.info("Skipping unchanged {}", target);
            }
            return Result.SKIPPED;
        }

        if (options.dryRun()) {
            LOG.info("Would copy {} -> {}", localPath, target);
            return Result.COPIED;
        }

        final Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.COPY_ATTRIBUTES);

        if (options.verbose()) {
            LOG.info("Copied {}", target);
        }
        return Result.COPIED;
    }

    private static boolean isUpToDate(final Path source, final Path target)
            throws IOException {
        return Files.getLastModifiedTime(source)
                        .compareTo(Files.getLastModifiedTime(target)) <= 0
                && Files.size(source) == Files.size(target);
    }

    private enum Result { COPIED, SKIPPED, MISSING }

}
