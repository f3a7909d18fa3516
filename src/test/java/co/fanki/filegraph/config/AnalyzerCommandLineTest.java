package co.fanki.filegraph.config;

import co.fanki.filegraph.analysis.application.DependencyAnalysisService;
import co.fanki.filegraph.analysis.application.DependencyAnalysisService.AnalysisRun;
import co.fanki.filegraph.analysis.domain.FileUnit;
import co.fanki.filegraph.copy.application.CopyOptions;
import co.fanki.filegraph.copy.application.CopyStats;
import co.fanki.filegraph.copy.application.FileCopyService;
import co.fanki.filegraph.graph.domain.DependencyGraph;
import co.fanki.filegraph.graph.domain.TraversalResult;
import co.fanki.filegraph.report.domain.AnalysisReport;
import co.fanki.filegraph.report.domain.ExtractOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalyzerCommandLine}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalyzerCommandLineTest {

    @TempDir
    private Path tempDir;

    private DependencyAnalysisService analysisService;
    private FileCopyService copyService;
    private ByteArrayOutputStream output;
    private AnalyzerCommandLine commandLine;
    private String configFile;

    @BeforeEach
    void setUp() throws IOException {
        analysisService = createMock(DependencyAnalysisService.class);
        copyService = createMock(FileCopyService.class);
        output = new ByteArrayOutputStream();
        commandLine = new AnalyzerCommandLine(
                new AnalyzerConfigLoader(new ObjectMapper()),
                analysisService, copyService,
                new PrintStream(output, true, StandardCharsets.UTF_8));
        configFile = Files.writeString(tempDir.resolve("config.json"), """
                {"pwd": "/opt", "outDir": "/reports",
                 "entryPoints": [{"pwd": "/opt", "path": "main.sh",
                   "args": []}]}
                """).toString();
    }

    @Test
    void whenExecuting_givenNoArguments_shouldPrintUsage() {
        assertEquals(AnalyzerCommandLine.USAGE, commandLine.execute());
        assertTrue(printed().contains("analyze"));
        assertTrue(printed().contains("copy"));
    }

    @Test
    void whenExecuting_givenUnknownCommand_shouldReturnUsageError() {
        assertEquals(AnalyzerCommandLine.USAGE,
                commandLine.execute("scan"));
        assertTrue(printed().contains("Unknown command: scan"));
    }

    @Test
    void whenCopying_givenMissingRequiredOption_shouldReturnUsageError() {
        assertEquals(AnalyzerCommandLine.USAGE,
                commandLine.execute("copy", "-c", configFile));
    }

    @Test
    void whenAnalyzing_givenMissingConfig_shouldFail() {
        replay(analysisService, copyService);

        assertEquals(AnalyzerCommandLine.FAILURE, commandLine.execute(
                "analyze", "-c", tempDir.resolve("none.json").toString()));
        verify(analysisService, copyService);
    }

    @Test
    void whenAnalyzing_givenEntryOption_shouldAnalyzeOnlyThatEntry()
            throws IOException {
        final Path out = tempDir.resolve("out");
        expect(analysisService.analyze(anyObject(AnalyzerConfig.class),
                eq(List.of(FileUnit.entryPoint("/opt", "bin/run.sh",
                        List.of()))),
                eq(out)))
                .andReturn(run(out));
        replay(analysisService, copyService);

        final int code = commandLine.execute("analyze", "-c", configFile,
                "--entry", "bin/run.sh", "-o", out.toString());

        assertEquals(AnalyzerCommandLine.SUCCESS, code);
        assertTrue(printed().contains("# Analysis Result"));
        verify(analysisService, copyService);
    }

    @Test
    void whenAnalyzing_givenNoOptions_shouldUseConfiguredEntriesAndOutDir()
            throws IOException {
        final Path out = Paths.get("/reports");
        expect(analysisService.analyze(anyObject(AnalyzerConfig.class),
                eq(List.of(FileUnit.entryPoint("/opt", "main.sh",
                        List.of()))),
                eq(out)))
                .andReturn(run(out));
        replay(analysisService, copyService);

        assertEquals(AnalyzerCommandLine.SUCCESS,
                commandLine.execute("analyze", "--config", configFile,
                        "--spring.main.banner-mode=off"));
        verify(analysisService, copyService);
    }

    @Test
    void whenCopying_givenFlags_shouldTranslateThemToOptions()
            throws IOException {
        final Path input = tempDir.resolve("analysis.md");
        final Path out = tempDir.resolve("copy");
        expect(copyService.copy(anyObject(AnalyzerConfig.class), eq(input),
                eq(out), eq(new CopyOptions(
                        new ExtractOptions(true, false, true, false, true),
                        true, false))))
                .andReturn(new CopyStats(2, 2, 0, 0, 0));
        replay(analysisService, copyService);

        final int code = commandLine.execute("copy", "-c", configFile,
                "-i", input.toString(), "-o", out.toString(), "--dry-run",
                "--no-write", "--no-binary", "--include-errors");

        assertEquals(AnalyzerCommandLine.SUCCESS, code);
        assertTrue(printed().contains("success rate: 100.0%"));
        verify(analysisService, copyService);
    }

    @Test
    void whenCopying_givenPerFileErrors_shouldFail() throws IOException {
        expect(copyService.copy(anyObject(AnalyzerConfig.class),
                anyObject(Path.class), anyObject(Path.class),
                anyObject(CopyOptions.class)))
                .andReturn(new CopyStats(2, 1, 0, 0, 1));
        replay(analysisService, copyService);

        assertEquals(AnalyzerCommandLine.FAILURE, commandLine.execute("copy",
                "-c", configFile, "-i", "files.txt", "-o", "out"));
        verify(analysisService, copyService);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static AnalysisRun run(final Path out) {
        final DependencyGraph graph = new DependencyGraph();
        graph.addNode("/opt/main.sh");
        final TraversalResult result = new TraversalResult(graph.freeze(),
                List.of("/opt/main.sh"), List.of(), List.of(), List.of(),
                List.of(), 1, 0, 100);
        return new AnalysisRun(result, AnalysisReport.of(result),
                out.resolve("analysis-20240101-000000.md"));
    }
}
