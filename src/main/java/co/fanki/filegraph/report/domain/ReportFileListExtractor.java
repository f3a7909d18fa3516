package co.fanki.filegraph.report.domain;

import co.fanki.filegraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the list of file paths back out of an analysis report.
 *
 * <p>Only the overview sections are looked at: a {@code ###} header
 * selects the section and every {@code - **path**} item below it is
 * collected when that section is enabled. Plain text lists, one path per
 * line, are supported too.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReportFileListExtractor {

    private static final Pattern LIST_ITEM = Pattern.compile(
            "^\\s*-\\s*\\*\\*([^*]+)\\*\\*");

    private enum Section { READ, WRITE, EXECUTABLE, BINARY, ERROR }

    /**
     * Extracts the paths of a markdown report.
     *
     * @param content the report text
     * @param options the sections to include
     * @return the unique paths in the order they appear
     */
    public List<String> extract(final String content,
            final ExtractOptions options) {
        Preconditions.requireNonNull(content, "Report content is required");
        Preconditions.requireNonNull(options, "Extract options are required");

        final Set<String> paths = new LinkedHashSet<>();
        Section current = null;

        for (final String line : content.split("\\r?\\n")) {
            final String trimmed = line.trim();

            if (trimmed.startsWith("###")) {
                current = section(trimmed);
                continue;
            }
            if (current == null || !enabled(current, options)) {
                continue;
            }

            final Matcher item = LIST_ITEM.matcher(line);
            if (item.find()) {
                paths.add(item.group(1).trim());
            }
        }
        return new ArrayList<>(paths);
    }

    /**
     * Extracts the paths of a report or a plain list, depending on the
     * file name.
     *
     * @param fileName the name of the input file
     * @param content its content
     * @param options the sections to include, for markdown input
     * @return the unique paths in the order they appear
     */
    public List<String> extract(final String fileName, final String content,
            final ExtractOptions options) {
        Preconditions.requireNonNull(fileName, "File name is required");
        if (isMarkdown(fileName)) {
            return extract(content, options);
        }
        final Set<String> paths = new LinkedHashSet<>();
        for (final String line : content.split("\\r?\\n")) {
            final String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                paths.add(trimmed);
            }
        }
        return new ArrayList<>(paths);
    }

    /**
     * Checks if a file name denotes a markdown report.
     *
     * @param fileName the file name or path
     * @return true for a {@code .md} extension, in any case
     */
    public static boolean isMarkdown(final String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(".md");
    }

    private static Section section(final String header) {
        if (header.contains(OverviewRenderer.READ_FILES)) {
            return Section.READ;
        }
        if (header.contains(OverviewRenderer.WRITTEN_FILES)) {
            return Section.WRITE;
        }
        if (header.contains(OverviewRenderer.EXECUTABLES)) {
            return Section.EXECUTABLE;
        }
        if (header.contains(OverviewRenderer.BINARIES)) {
            return Section.BINARY;
        }
        if (header.contains(OverviewRenderer.ERRORS)) {
            return Section.ERROR;
        }
        return null;
    }

    private static boolean enabled(final Section section,
            final ExtractOptions options) {
        switch (section) {
            case READ:
                return options.readFiles();
            case WRITE:
                return options.writeFiles();
            case EXECUTABLE:
                return options.executables();
            case BINARY:
                return options.binaries();
            default:
                return options.errors();
        }
    }

}
