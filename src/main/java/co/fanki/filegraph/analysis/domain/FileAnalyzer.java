package co.fanki.filegraph.analysis.domain;

/**
 * Finds the files a single file reads, writes and executes.
 *
 * <p>Implementations must not throw for a file they cannot make sense of;
 * they return {@link AnalysisOutcome#failure} and the traversal records the
 * error and moves on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FileAnalyzer {

    /**
     * Analyzes one file.
     *
     * @param request the file and its context
     * @return the outcome, never null
     */
    AnalysisOutcome analyze(AnalysisRequest request);
}
