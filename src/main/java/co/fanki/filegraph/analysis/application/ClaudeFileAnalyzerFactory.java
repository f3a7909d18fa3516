package co.fanki.filegraph.analysis.application;

import co.fanki.filegraph.analysis.domain.ClaudeFileAnalyzer;
import co.fanki.filegraph.analysis.domain.FileAnalyzer;
import co.fanki.filegraph.shared.Preconditions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates {@link ClaudeFileAnalyzer} instances from the application
 * properties.
 *
 * <p>The API key is only checked when an analyzer is created, so commands
 * that never analyze a file run without one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ClaudeFileAnalyzerFactory implements FileAnalyzerFactory {

    private final String apiKey;

    private final String model;

    private final long maxTokens;

    /**
     * Creates a new factory.
     *
     * @param theApiKey the Anthropic API key, may be empty
     * @param theModel the model identifier
     * @param theMaxTokens the maximum tokens of a reply
     */
    public ClaudeFileAnalyzerFactory(
            @Value("${claude.api-key:}") final String theApiKey,
            @Value("${claude.model:claude-sonnet-4-5-20250929}")
            final String theModel,
            @Value("${claude.max-tokens:4096}") final long theMaxTokens) {
        this.apiKey = theApiKey;
        this.model = theModel;
        this.maxTokens = theMaxTokens;
    }

    @Override
    public FileAnalyzer create() {
        Preconditions.requireConfiguration(apiKey != null && !apiKey.isBlank(),
                "Claude API key not configured, set ANTHROPIC_API_KEY");
        return new ClaudeFileAnalyzer(apiKey, model, maxTokens);
    }

}
