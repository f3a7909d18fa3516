package co.fanki.filegraph.copy.application;

import co.fanki.filegraph.report.domain.ExtractOptions;

/**
 * How a copy run behaves.
 *
 * @param extract which report sections to copy
 * @param dryRun count the files without copying them
 * @param verbose log every mapped path and skipped file
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CopyOptions(ExtractOptions extract, boolean dryRun,
        boolean verbose) {

    /** Creates copy options, defaulting the sections. */
    public CopyOptions {
        extract = extract == null ? ExtractOptions.defaults() : extract;
    }
}
