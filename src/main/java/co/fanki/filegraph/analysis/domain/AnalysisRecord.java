package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;

import java.util.List;

/**
 * What the analyzer found in one file.
 *
 * @param readFiles files loaded by the file itself, e.g. configuration
 * @param writeFiles files it writes, e.g. logs or queues
 * @param executeFiles programs and libraries it runs or imports; these
 *        may carry further dependencies and are analyzed in turn
 * @param errors problems the analyzer ran into
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisRecord(
        List<PathEntry> readFiles,
        List<PathEntry> writeFiles,
        List<ExecuteEntry> executeFiles,
        List<FileError> errors) {

    /** Creates a record, copying every list. */
    public AnalysisRecord {
        readFiles = List.copyOf(Preconditions.requireNonNull(readFiles,
                "Read files are required"));
        writeFiles = List.copyOf(Preconditions.requireNonNull(writeFiles,
                "Write files are required"));
        executeFiles = List.copyOf(Preconditions.requireNonNull(executeFiles,
                "Execute files are required"));
        errors = List.copyOf(Preconditions.requireNonNull(errors,
                "Errors are required"));
    }

    /**
     * Creates a record without any finding.
     *
     * @return the empty record
     */
    public static AnalysisRecord empty() {
        return new AnalysisRecord(List.of(), List.of(), List.of(), List.of());
    }
}
