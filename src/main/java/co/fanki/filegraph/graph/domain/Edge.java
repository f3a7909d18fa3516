package co.fanki.filegraph.graph.domain;

import co.fanki.filegraph.shared.Preconditions;

/**
 * A dependency from an analyzed file to a file it references.
 *
 * @param path the canonical absolute path of the referenced file
 * @param action how the file is used
 * @param fileType the binary type of an executed file, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Edge(String path, EdgeAction action, String fileType) {

    /** Creates an edge. */
    public Edge {
        Preconditions.requireNonBlank(path, "Edge path is required");
        Preconditions.requireNonNull(action, "Edge action is required");
        Preconditions.require(fileType == null || action == EdgeAction.EXECUTE,
                "Only execute edges carry a file type");
    }

    /**
     * Creates a read edge.
     *
     * @param path the canonical path read
     * @return the edge
     */
    public static Edge read(final String path) {
        return new Edge(path, EdgeAction.READ, null);
    }

    /**
     * Creates a write edge.
     *
     * @param path the canonical path written
     * @return the edge
     */
    public static Edge write(final String path) {
        return new Edge(path, EdgeAction.WRITE, null);
    }

    /**
     * Creates an execute edge.
     *
     * @param path the canonical path executed
     * @param fileType the binary type, or null for a script
     * @return the edge
     */
    public static Edge execute(final String path, final String fileType) {
        return new Edge(path, EdgeAction.EXECUTE, fileType);
    }
}
