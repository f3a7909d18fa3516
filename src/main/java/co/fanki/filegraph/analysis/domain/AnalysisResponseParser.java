package co.fanki.filegraph.analysis.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the analyzer's free-text reply into an {@link AnalysisRecord}.
 *
 * <p>The reply is expected to hold one JSON object, possibly wrapped in a
 * markdown code fence or surrounded by prose. Parsing never throws: a
 * reply that is not JSON, or JSON that does not have the expected shape,
 * yields {@link AnalysisOutcome#failure} naming the problem.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisResponseParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisResponseParser.class);

    private static final Pattern CODE_BLOCK = Pattern.compile(
            "```(?:json)?\\n?([\\s\\S]*?)\\n?```");

    private static final Pattern JSON_OBJECT = Pattern.compile(
            "\\{[\\s\\S]*\\}");

    private final ObjectMapper mapper;

    /** Creates a parser with a default object mapper. */
    public AnalysisResponseParser() {
        this(new ObjectMapper());
    }

    /**
     * Creates a parser.
     *
     * @param theMapper the object mapper used to read the JSON
     */
    public AnalysisResponseParser(final ObjectMapper theMapper) {
        this.mapper = theMapper;
    }

    /**
     * Parses a raw reply.
     *
     * @param rawContent the text the analyzer answered with
     * @return the parsed record, or a failure describing what is wrong
     */
    public AnalysisOutcome parse(final String rawContent) {
        if (rawContent == null || rawContent.isBlank()) {
            return AnalysisOutcome.failure("Empty analysis response");
        }

        final String json = extractJson(rawContent);

        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (final JsonProcessingException e) {
            LOG.warn("Failed to parse analysis JSON: {}",
                    e.getOriginalMessage());
            return AnalysisOutcome.failure("Invalid JSON in analysis response: "
                    + e.getOriginalMessage());
        }

        if (root == null || !root.isObject()) {
            return AnalysisOutcome.failure(
                    "Analysis response is not a JSON object");
        }

        final List<String> violations = new ArrayList<>();

        final List<PathEntry> readFiles = pathEntries(root, "readFiles",
                violations);
        final List<PathEntry> writeFiles = pathEntries(root, "writeFiles",
                violations);
        final List<ExecuteEntry> executeFiles = executeEntries(root,
                violations);
        final List<FileError> errors = errorEntries(root, violations);

        if (!violations.isEmpty()) {
            LOG.warn("Analysis response does not match the schema: {}",
                    violations);
            return AnalysisOutcome.failure(
                    "Analysis response does not match the schema: "
                            + String.join("; ", violations));
        }

        return AnalysisOutcome.success(new AnalysisRecord(
                readFiles, writeFiles, executeFiles, errors));
    }

    private String extractJson(final String text) {
        final Matcher codeBlock = CODE_BLOCK.matcher(text);
        if (codeBlock.find()) {
            return codeBlock.group(1);
        }
        final Matcher object = JSON_OBJECT.matcher(text);
        if (object.find()) {
            return object.group();
        }
        return text;
    }

    private List<PathEntry> pathEntries(final JsonNode root,
            final String field, final List<String> violations) {

        final JsonNode array = requireArray(root, field, violations);
        final List<PathEntry> entries = new ArrayList<>();

        for (int i = 0; i < array.size(); i++) {
            final JsonNode node = array.get(i);
            final String location = field + "[" + i + "]";
            final String path = requireText(node, "path", location,
                    violations);
            if (path != null) {
                entries.add(new PathEntry(path,
                        optionalText(node, "description")));
            }
        }
        return entries;
    }

    private List<ExecuteEntry> executeEntries(final JsonNode root,
            final List<String> violations) {

        final JsonNode array = requireArray(root, "executeFiles", violations);
        final List<ExecuteEntry> entries = new ArrayList<>();

        for (int i = 0; i < array.size(); i++) {
            final JsonNode node = array.get(i);
            final String location = "executeFiles[" + i + "]";
            final String path = requireText(node, "path", location,
                    violations);
            final String pwd = requireString(node, "pwd", location,
                    violations);
            final List<String> args = requireStringArray(node, "args",
                    location, violations);
            if (path != null && pwd != null && args != null) {
                entries.add(new ExecuteEntry(path, pwd, args,
                        optionalText(node, "description"), null));
            }
        }
        return entries;
    }

    private List<FileError> errorEntries(final JsonNode root,
            final List<String> violations) {

        final JsonNode array = requireArray(root, "errors", violations);
        final List<FileError> entries = new ArrayList<>();

        for (int i = 0; i < array.size(); i++) {
            final JsonNode node = array.get(i);
            final String location = "errors[" + i + "]";
            final String path = requireText(node, "path", location,
                    violations);
            final String pwd = requireString(node, "pwd", location,
                    violations);
            final String error = requireText(node, "error", location,
                    violations);
            if (path != null && pwd != null && error != null) {
                entries.add(new FileError(path, pwd, error,
                        ErrorKind.REPORTED));
            }
        }
        return entries;
    }

    private JsonNode requireArray(final JsonNode root, final String field,
            final List<String> violations) {
        final JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            violations.add("'" + field + "' must be an array");
            return mapper.createArrayNode();
        }
        return node;
    }

    private String requireText(final JsonNode node, final String field,
            final String location, final List<String> violations) {
        final JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            violations.add(location + "." + field + " must be a non-empty"
                    + " string");
            return null;
        }
        return value.asText();
    }

    private String requireString(final JsonNode node, final String field,
            final String location, final List<String> violations) {
        final JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual()) {
            violations.add(location + "." + field + " must be a string");
            return null;
        }
        return value.asText();
    }

    private List<String> requireStringArray(final JsonNode node,
            final String field, final String location,
            final List<String> violations) {
        final JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isArray()) {
            violations.add(location + "." + field + " must be an array");
            return null;
        }
        final List<String> result = new ArrayList<>();
        for (final JsonNode item : value) {
            if (!item.isTextual()) {
                violations.add(location + "." + field
                        + " must only hold strings");
                return null;
            }
            result.add(item.asText());
        }
        return result;
    }

    private String optionalText(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank()
                ? value.asText() : null;
    }

}
