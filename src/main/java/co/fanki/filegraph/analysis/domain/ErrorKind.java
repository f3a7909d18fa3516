package co.fanki.filegraph.analysis.domain;

/**
 * Where a per-file error came from.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ErrorKind {

    /** The file does not exist or cannot be read after mapping. */
    RESOLUTION,

    /** The analyzer failed or answered with something unusable. */
    ORACLE,

    /** The analyzer itself reported the error inside a valid answer. */
    REPORTED
}
