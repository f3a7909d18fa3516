package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;

import java.util.List;

/**
 * A program, script or library an analyzed unit runs or imports.
 *
 * @param path the referenced path, as reported
 * @param pwd the working directory the program runs in
 * @param args the arguments it is invoked with
 * @param description what the program does, or null
 * @param fileType the detected binary type, or null for text files
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExecuteEntry(String path, String pwd, List<String> args,
        String description, String fileType) {

    /** Creates an execute entry, requiring the path. */
    public ExecuteEntry {
        Preconditions.requireNonBlank(path, "Entry path is required");
        pwd = pwd == null ? "" : pwd;
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * Checks if the referenced program is an opaque binary.
     *
     * @return true when a file type was detected
     */
    public boolean isBinary() {
        return fileType != null;
    }
}
