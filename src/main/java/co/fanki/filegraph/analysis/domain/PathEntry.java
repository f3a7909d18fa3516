package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;

/**
 * A file an analyzed unit reads or writes.
 *
 * @param path the referenced path, as reported
 * @param description what the file is used for, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PathEntry(String path, String description) {

    /** Creates a path entry, requiring the path. */
    public PathEntry {
        Preconditions.requireNonBlank(path, "Entry path is required");
    }
}
