package co.fanki.filegraph.report.domain;

import co.fanki.filegraph.graph.domain.TraversalResult;
import co.fanki.filegraph.shared.Preconditions;

/**
 * The markdown report of one analysis run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisReport {

    private final String content;

    private AnalysisReport(final String theContent) {
        this.content = theContent;
    }

    /**
     * Builds the report of a traversal.
     *
     * @param result the traversal result
     * @return the report
     */
    public static AnalysisReport of(final TraversalResult result) {
        Preconditions.requireNonNull(result, "Traversal result is required");

        final String overview = new OverviewRenderer().render(result);
        final String tree = new TreeRenderer().render(result.graph(),
                result.roots());

        return new AnalysisReport(String.join("\n",
                "# Analysis Result",
                "",
                "## Overview",
                overview,
                "",
                "## Dependency Graph",
                tree));
    }

    /**
     * Returns the markdown text.
     *
     * @return the report content
     */
    public String content() {
        return content;
    }

    @Override
    public String toString() {
        return content;
    }

}
