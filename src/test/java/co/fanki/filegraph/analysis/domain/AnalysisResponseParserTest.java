package co.fanki.filegraph.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisResponseParser}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisResponseParserTest {

    private static final String VALID_JSON = """
            {
              "readFiles": [{"path": "/etc/app.ini", "description": "settings"}],
              "writeFiles": [{"path": "/var/log/app.log"}],
              "executeFiles": [{"path": "/opt/bin/helper.pl", "pwd": "/opt",
                "args": ["-v"], "description": "helper"}],
              "errors": [{"path": "/opt/missing.sh", "pwd": "",
                "error": "cannot resolve $HOME"}]
            }
            """;

    private final AnalysisResponseParser parser = new AnalysisResponseParser();

    @Test
    void whenParsing_givenPlainJson_shouldReturnRecord() {
        final AnalysisOutcome outcome = parser.parse(VALID_JSON);

        assertTrue(outcome.success());
        final AnalysisRecord record = outcome.record();
        assertEquals(List.of(new PathEntry("/etc/app.ini", "settings")),
                record.readFiles());
        assertEquals(List.of(new PathEntry("/var/log/app.log", null)),
                record.writeFiles());
        assertEquals(List.of(new ExecuteEntry("/opt/bin/helper.pl", "/opt",
                List.of("-v"), "helper", null)), record.executeFiles());
        assertEquals(1, record.errors().size());
        assertEquals(ErrorKind.REPORTED, record.errors().get(0).kind());
        assertEquals("", record.errors().get(0).pwd());
    }

    @Test
    void whenParsing_givenFencedJson_shouldExtractCodeBlock() {
        final String reply = "Here is the analysis:\n```json\n" + VALID_JSON
                + "\n```\nLet me know if you need more.";

        final AnalysisOutcome outcome = parser.parse(reply);

        assertTrue(outcome.success());
        assertEquals(1, outcome.record().executeFiles().size());
    }

    @Test
    void whenParsing_givenJsonSurroundedByProse_shouldExtractObject() {
        final String reply = "Sure. " + VALID_JSON + " Done.";

        final AnalysisOutcome outcome = parser.parse(reply);

        assertTrue(outcome.success());
        assertEquals(1, outcome.record().readFiles().size());
    }

    @Test
    void whenParsing_givenEmptyArrays_shouldReturnEmptyRecord() {
        final AnalysisOutcome outcome = parser.parse("""
                {"readFiles": [], "writeFiles": [], "executeFiles": [],
                 "errors": []}
                """);

        assertTrue(outcome.success());
        assertEquals(AnalysisRecord.empty(), outcome.record());
    }

    @Test
    void whenParsing_givenMalformedJson_shouldFailWithInvalidJson() {
        final AnalysisOutcome outcome = parser.parse("{\"readFiles\": [");

        assertFalse(outcome.success());
        assertNull(outcome.record());
        assertTrue(outcome.errorMessage().startsWith(
                "Invalid JSON in analysis response"));
    }

    @Test
    void whenParsing_givenBlankReply_shouldFail() {
        final AnalysisOutcome outcome = parser.parse("   ");

        assertFalse(outcome.success());
        assertEquals("Empty analysis response", outcome.errorMessage());
    }

    @Test
    void whenParsing_givenJsonArray_shouldFailAsNotAnObject() {
        final AnalysisOutcome outcome = parser.parse("[1, 2]");

        assertFalse(outcome.success());
        assertEquals("Analysis response is not a JSON object",
                outcome.errorMessage());
    }

    @Test
    void whenParsing_givenMissingArray_shouldNameTheField() {
        final AnalysisOutcome outcome = parser.parse("""
                {"readFiles": [], "writeFiles": [], "executeFiles": []}
                """);

        assertFalse(outcome.success());
        assertTrue(outcome.errorMessage().contains("'errors' must be an array"));
    }

    @Test
    void whenParsing_givenExecuteEntryWithoutArgs_shouldNameTheField() {
        final AnalysisOutcome outcome = parser.parse("""
                {"readFiles": [], "writeFiles": [],
                 "executeFiles": [{"path": "/a.sh", "pwd": "/"}],
                 "errors": []}
                """);

        assertFalse(outcome.success());
        assertTrue(outcome.errorMessage().contains(
                "executeFiles[0].args must be an array"));
    }

    @Test
    void whenParsing_givenNonStringArgument_shouldFail() {
        final AnalysisOutcome outcome = parser.parse("""
                {"readFiles": [], "writeFiles": [],
                 "executeFiles": [{"path": "/a.sh", "pwd": "/", "args": [1]}],
                 "errors": []}
                """);

        assertFalse(outcome.success());
        assertTrue(outcome.errorMessage().contains("must only hold strings"));
    }

    @Test
    void whenParsing_givenEntryWithoutPath_shouldFail() {
        final AnalysisOutcome outcome = parser.parse("""
                {"readFiles": [{"description": "no path"}], "writeFiles": [],
                 "executeFiles": [], "errors": []}
                """);

        assertFalse(outcome.success());
        assertTrue(outcome.errorMessage().contains("readFiles[0].path"));
    }
}
