package co.fanki.filegraph.graph.domain;

/**
 * How an analyzed file uses a referenced file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeAction {

    /** The file is read. */
    READ,

    /** The file is written. */
    WRITE,

    /** The file is run or imported. */
    EXECUTE
}
