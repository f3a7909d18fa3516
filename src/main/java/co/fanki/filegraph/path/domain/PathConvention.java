package co.fanki.filegraph.path.domain;

/**
 * The path syntax a converted path is emitted in.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum PathConvention {

    /** Forward slashes, no drive letters. */
    UNIX,

    /** Backslashes, drive letters such as {@code C:}. */
    WINDOWS

}
