package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;

/**
 * A problem with one file, recorded without stopping the traversal.
 *
 * @param path the path the problem concerns
 * @param pwd the working directory it was seen from
 * @param error the error message
 * @param kind where the error came from
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileError(String path, String pwd, String error,
        ErrorKind kind) {

    /** Creates a file error. */
    public FileError {
        Preconditions.requireNonBlank(path, "Error path is required");
        Preconditions.requireNonNull(kind, "Error kind is required");
        pwd = pwd == null ? "" : pwd;
        error = error == null || error.isBlank() ? "Unknown error" : error;
    }
}
