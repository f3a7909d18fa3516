package co.fanki.filegraph.report.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ReportFileListExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReportFileListExtractorTest {

    private static final String REPORT = String.join("\n",
            "# Analysis Result",
            "",
            "## Overview",
            "### Read Files",
            "- **/etc/a.ini** — config",
            "- **/etc/shared.ini**",
            "",
            "### Written Files",
            "- **/var/log/run.log**",
            "",
            "### Executables",
            "- **/opt/helper.pl** — helper (args: -v)",
            "- **/etc/shared.ini**",
            "",
            "### Binaries",
            "- **/opt/tool** (elf)",
            "",
            "### Errors",
            "- **/opt/missing.sh** — File does not exist",
            "",
            "## Dependency Graph",
            "[E] /opt/run.sh",
            "└── [R] /etc/a.ini");

    private final ReportFileListExtractor extractor =
            new ReportFileListExtractor();

    @Test
    void whenExtracting_givenDefaults_shouldSkipErrorsAndDuplicates() {
        assertEquals(List.of("/etc/a.ini", "/etc/shared.ini",
                        "/var/log/run.log", "/opt/helper.pl", "/opt/tool"),
                extractor.extract(REPORT, ExtractOptions.defaults()));
    }

    @Test
    void whenExtracting_givenErrorsIncluded_shouldAddThem() {
        final List<String> paths = extractor.extract(REPORT,
                new ExtractOptions(true, true, true, true, true));

        assertTrue(paths.contains("/opt/missing.sh"));
    }

    @Test
    void whenExtracting_givenOnlyBinaries_shouldReturnBinaries() {
        assertEquals(List.of("/opt/tool"), extractor.extract(REPORT,
                new ExtractOptions(false, false, false, true, false)));
    }

    @Test
    void whenExtracting_givenUnknownSection_shouldIgnoreItsItems() {
        final String content = "### Notes\n- **/not/a/file**\n"
                + "### Read Files\n- **/etc/a.ini**";

        assertEquals(List.of("/etc/a.ini"),
                extractor.extract(content, ExtractOptions.defaults()));
    }

    @Test
    void whenExtracting_givenPlainList_shouldReadOnePathPerLine() {
        final String list = "/etc/a.ini\n\n  /opt/run.sh  \n/etc/a.ini\n";

        assertEquals(List.of("/etc/a.ini", "/opt/run.sh"),
                extractor.extract("files.txt", list,
                        ExtractOptions.defaults()));
    }

    @Test
    void whenExtracting_givenMarkdownFileName_shouldParseReport() {
        assertEquals(List.of("/opt/tool"), extractor.extract(
                "analysis.MD", REPORT,
                new ExtractOptions(false, false, false, true, false)));
    }

    @Test
    void whenCheckingMarkdown_givenOtherExtension_shouldBeFalse() {
        assertTrue(ReportFileListExtractor.isMarkdown("report.md"));
        assertFalse(ReportFileListExtractor.isMarkdown("files.txt"));
    }
}
