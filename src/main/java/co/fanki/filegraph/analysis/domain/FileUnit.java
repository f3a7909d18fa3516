package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;

import java.util.List;

/**
 * A file waiting in the worklist to be analyzed.
 *
 * <p>Units come from the configured entry points or from the executables
 * an analysis reported. {@code fileType} is null for scripts and source
 * files; it holds the detected type of an opaque binary, which is never
 * sent to the analyzer.</p>
 *
 * @param pwd the working directory the file was referenced from
 * @param path the path as written by whoever referenced it
 * @param args the arguments the file is invoked with
 * @param fileType the detected binary type, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileUnit(String pwd, String path, List<String> args,
        String fileType) {

    /**
     * Creates a file unit, validating path and arguments.
     */
    public FileUnit {
        Preconditions.requireNonBlank(path, "File path is required");
        pwd = pwd == null ? "" : pwd;
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * Creates a unit for a configured entry point.
     *
     * @param pwd the working directory of the entry point
     * @param path the entry point path
     * @param args the arguments the entry point is run with
     * @return the unit, never binary
     */
    public static FileUnit entryPoint(final String pwd, final String path,
            final List<String> args) {
        return new FileUnit(pwd, path, args, null);
    }

    /**
     * Checks if this unit was classified as a binary at discovery time.
     *
     * @return true when a file type is set
     */
    public boolean isBinary() {
        return fileType != null;
    }
}
