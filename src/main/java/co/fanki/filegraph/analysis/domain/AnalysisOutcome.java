package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;

/**
 * Result of analyzing one file: either a record or an error message.
 *
 * @param success whether the analysis produced a record
 * @param record the record on success, null otherwise
 * @param errorMessage why the analysis failed, null on success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisOutcome(
        boolean success,
        AnalysisRecord record,
        String errorMessage) {

    /**
     * Creates a successful outcome.
     *
     * @param record the analysis record
     * @return the success outcome
     */
    public static AnalysisOutcome success(final AnalysisRecord record) {
        Preconditions.requireNonNull(record, "Analysis record is required");
        return new AnalysisOutcome(true, record, null);
    }

    /**
     * Creates a failed outcome.
     *
     * @param errorMessage the reason of the failure
     * @return the failure outcome
     */
    public static AnalysisOutcome failure(final String errorMessage) {
        return new AnalysisOutcome(false, null,
                errorMessage == null ? "Analysis failed" : errorMessage);
    }
}
