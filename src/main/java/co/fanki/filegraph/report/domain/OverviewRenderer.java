package co.fanki.filegraph.report.domain;

import co.fanki.filegraph.analysis.domain.ExecuteEntry;
import co.fanki.filegraph.analysis.domain.FileError;
import co.fanki.filegraph.analysis.domain.PathEntry;
import co.fanki.filegraph.graph.domain.TraversalResult;
import co.fanki.filegraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Renders the markdown overview of a traversal: the files read, written
 * and executed, the binaries, and the errors.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class OverviewRenderer {

    /** Section titles, also recognized by {@link ReportFileListExtractor}. */
    public static final String READ_FILES = "Read Files";
    public static final String WRITTEN_FILES = "Written Files";
    public static final String EXECUTABLES = "Executables";
    public static final String BINARIES = "Binaries";
    public static final String ERRORS = "Errors";

    private static final String SEPARATOR = " — ";

    /**
     * Renders the overview.
     *
     * @param result the traversal result
     * @return the markdown sections, separated by blank lines
     */
    public String render(final TraversalResult result) {
        Preconditions.requireNonNull(result, "Traversal result is required");

        final List<String> sections = new ArrayList<>();

        if (result.truncated()) {
            sections.add("> **Truncated:** the analysis stopped after "
                    + result.maxIterations() + " iterations; "
                    + result.remaining()
                    + " files were left unanalyzed and the graph is"
                    + " incomplete.");
        }

        section(sections, READ_FILES, result.readFiles(), PathEntry::path,
                this::pathEntry);
        section(sections, WRITTEN_FILES, result.writeFiles(), PathEntry::path,
                this::pathEntry);

        final List<ExecuteEntry> executables = new ArrayList<>();
        final List<ExecuteEntry> binaries = new ArrayList<>();
        for (final ExecuteEntry entry : result.executeFiles()) {
            (entry.isBinary() ? binaries : executables).add(entry);
        }
        section(sections, EXECUTABLES, executables, ExecuteEntry::path,
                this::executeEntry);
        section(sections, BINARIES, binaries, ExecuteEntry::path,
                this::executeEntry);

        section(sections, ERRORS, result.errors(), FileError::path,
                error -> "- **" + error.path() + "**" + SEPARATOR
                        + error.error());

        return String.join("\n\n", sections);
    }

    private <T> void section(final List<String> sections, final String title,
            final List<T> entries, final Function<T, String> path,
            final Function<T, String> line) {
        if (entries.isEmpty()) {
            return;
        }
        final List<T> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(path));

        final StringBuilder text = new StringBuilder("### ").append(title);
        for (final T entry : sorted) {
            text.append('\n').append(line.apply(entry));
        }
        sections.add(text.toString());
    }

    private String pathEntry(final PathEntry entry) {
        final StringBuilder line = new StringBuilder("- **")
                .append(entry.path()).append("**");
        if (entry.description() != null) {
            line.append(SEPARATOR).append(entry.description());
        }
        return line.toString();
    }

    private String executeEntry(final ExecuteEntry entry) {
        final StringBuilder line = new StringBuilder("- **")
                .append(entry.path()).append("**");
        if (entry.fileType() != null) {
            line.append(" (").append(entry.fileType()).append(')');
        }
        if (entry.description() != null) {
            line.append(SEPARATOR).append(entry.description());
        }
        if (!entry.args().isEmpty()) {
            line.append(" (args: ").append(String.join(" ", entry.args()))
                    .append(')');
        }
        return line.toString();
    }

}
