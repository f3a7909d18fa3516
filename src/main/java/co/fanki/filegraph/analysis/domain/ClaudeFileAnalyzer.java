package co.fanki.filegraph.analysis.domain;

import co.fanki.filegraph.shared.Preconditions;
import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.anthropic.models.messages.Message;
import com.anthropic.models.messages.MessageCreateParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes a file's dependencies using the Claude API.
 *
 * <p>Sends one message per file holding the file content, its working
 * directory and its arguments, and asks for a single JSON object listing
 * the files it reads, writes and executes. The reply goes through
 * {@link AnalysisResponseParser}; transport failures and unusable replies
 * both come back as {@link AnalysisOutcome#failure}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ClaudeFileAnalyzer implements FileAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ClaudeFileAnalyzer.class);

    private static final String SYSTEM_PROMPT = """
            You analyze scripts and source files and list every file they \
            touch. The lists are used to build a dependency graph of the \
            files a software system needs.

            Classify each referenced file as exactly one of:
            1. readFiles: loaded directly by THIS file into memory, such as \
            configuration read with open() or sourced settings. These \
            cannot pull in further dependencies.
            2. writeFiles: written by THIS file, such as logs or \
            file-based job queues.
            3. executeFiles: scripts and binaries this file runs, and \
            libraries it imports. These can have dependencies of their own.

            RULES:
            - A file passed as an argument to another program belongs to \
            that program, not to this file. For \
            `./monitor.pl -c ./config/settings.ini` list monitor.pl as an \
            execute file and do NOT list settings.ini.
            - Do not list system commands such as grep, date or ls. Do list \
            third-party binaries and scripts that are not part of the \
            operating system.
            - Infer library files from imports, e.g. perl `use mailer;` \
            implies a file mailer.pm.
            - Substitute variables and environment variables from the \
            surrounding context when possible.
            - Track working directory changes (cd, chdir, process.chdir) and \
            report every path as an absolute path using the known working \
            directory.
            - Record the arguments passed to every executed file.
            - Ignore commented-out code.

            YOUR RESPONSE MUST BE ONLY A SINGLE RAW JSON OBJECT:
            {
              "readFiles": [{"path": "/abs/path", "description": "why"}],
              "writeFiles": [{"path": "/abs/path", "description": "why"}],
              "executeFiles": [{"path": "/abs/path", \
            "pwd": "/abs/working/dir", "args": ["arg1"], \
            "description": "why"}],
              "errors": [{"path": "/abs/path", "pwd": "/abs/working/dir", \
            "error": "what went wrong"}]
            }
            All four arrays are required, use [] when empty.
            """;

    private static final String USER_PROMPT_TEMPLATE = """
            Analyze this file for ALL file operations.

            Current Working Directory: %s
            Main File: %s
            CLI Arguments: %s

            Main File Content:
            ```
            %s
            ```
            """;

    private final AnthropicClient client;

    private final String model;

    private final long maxTokens;

    private final AnalysisResponseParser parser;

    /**
     * Creates a new analyzer talking to the Claude API.
     *
     * @param apiKey the Anthropic API key
     * @param theModel the model identifier, e.g. claude-sonnet-4-5-20250929
     * @param theMaxTokens the maximum tokens of a reply
     */
    public ClaudeFileAnalyzer(final String apiKey, final String theModel,
            final long theMaxTokens) {
        this(AnthropicOkHttpClient.builder()
                        .apiKey(Preconditions.requireNonBlank(apiKey,
                                "API key is required"))
                        .build(),
                theModel, theMaxTokens);
    }

    /**
     * Creates a new analyzer on top of an existing client.
     *
     * @param theClient the Anthropic client
     * @param theModel the model identifier
     * @param theMaxTokens the maximum tokens of a reply
     */
    public ClaudeFileAnalyzer(final AnthropicClient theClient,
            final String theModel, final long theMaxTokens) {
        this.client = Preconditions.requireNonNull(theClient,
                "Anthropic client is required");
        this.model = Preconditions.requireNonBlank(theModel,
                "Model is required");
        Preconditions.require(theMaxTokens > 0,
                "Max tokens must be positive");
        this.maxTokens = theMaxTokens;
        this.parser = new AnalysisResponseParser();
    }

    @Override
    public AnalysisOutcome analyze(final AnalysisRequest request) {
        Preconditions.requireNonNull(request, "Analysis request is required");

        final String prompt = buildPrompt(request);

        LOG.debug("Analyzing file: {} (local {})", request.absolutePath(),
                request.localPath());

        try {
            final MessageCreateParams params = MessageCreateParams.builder()
                    .maxTokens(maxTokens)
                    .temperature(0.0)
                    .system(SYSTEM_PROMPT)
                    .addUserMessage(prompt)
                    .model(model)
                    .build();

            final Message response = client.messages().create(params);

            final String rawContent = response.content().stream()
                    .flatMap(block -> block.text().stream())
                    .map(textBlock -> textBlock.text())
                    .reduce("", String::concat);

            return parser.parse(rawContent);

        } catch (final Exception e) {
            LOG.error("Claude API call failed for {}: {}",
                    request.absolutePath(), e.getMessage());
            return AnalysisOutcome.failure("Claude API call failed: "
                    + e.getMessage());
        }
    }

    /**
     * Builds the user prompt for one file.
     *
     * @param request the file to analyze
     * @return the prompt text
     */
    static String buildPrompt(final AnalysisRequest request) {
        final String args = request.args().isEmpty()
                ? "none" : String.join(" ", request.args());
        return String.format(USER_PROMPT_TEMPLATE, request.pwd(),
                request.absolutePath(), args, request.content());
    }

}
