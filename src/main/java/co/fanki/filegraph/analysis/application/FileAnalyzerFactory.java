package co.fanki.filegraph.analysis.application;

import co.fanki.filegraph.analysis.domain.FileAnalyzer;

/**
 * Creates the analyzer of one run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FileAnalyzerFactory {

    /**
     * Creates a new analyzer.
     *
     * @return the analyzer
     * @throws co.fanki.filegraph.shared.ConfigurationException if the
     *         analyzer settings are incomplete
     */
    FileAnalyzer create();

}
