package co.fanki.filegraph.report.domain;

import co.fanki.filegraph.analysis.domain.ErrorKind;
import co.fanki.filegraph.analysis.domain.ExecuteEntry;
import co.fanki.filegraph.analysis.domain.FileError;
import co.fanki.filegraph.analysis.domain.PathEntry;
import co.fanki.filegraph.graph.domain.DependencyGraph;
import co.fanki.filegraph.graph.domain.TraversalResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link OverviewRenderer} and {@link AnalysisReport}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class OverviewRendererTest {

    private final OverviewRenderer renderer = new OverviewRenderer();

    @Test
    void whenRendering_givenAllSections_shouldSortEntriesWithinEach() {
        final TraversalResult result = result(
                List.of(new PathEntry("/etc/b.ini", null),
                        new PathEntry("/etc/a.ini", "main config")),
                List.of(new PathEntry("/var/log/run.log", "log")),
                List.of(new ExecuteEntry("/opt/helper.pl", "/opt",
                                List.of("-c", "x.ini"), "helper", null),
                        new ExecuteEntry("/opt/tool", "/opt", List.of(),
                                null, "elf")),
                List.of(new FileError("/opt/missing.sh", "/opt",
                        "File does not exist", ErrorKind.RESOLUTION)),
                0);

        assertEquals(String.join("\n",
                "### Read Files",
                "- **/etc/a.ini** — main config",
                "- **/etc/b.ini**",
                "",
                "### Written Files",
                "- **/var/log/run.log** — log",
                "",
                "### Executables",
                "- **/opt/helper.pl** — helper (args: -c x.ini)",
                "",
                "### Binaries",
                "- **/opt/tool** (elf)",
                "",
                "### Errors",
                "- **/opt/missing.sh** — File does not exist"),
                renderer.render(result));
    }

    @Test
    void whenRendering_givenEmptySections_shouldOmitThem() {
        final TraversalResult result = result(List.of(),
                List.of(new PathEntry("/tmp/out", null)), List.of(),
                List.of(), 0);

        assertEquals("### Written Files\n- **/tmp/out**",
                renderer.render(result));
    }

    @Test
    void whenRendering_givenTruncatedTraversal_shouldStartWithNote() {
        final TraversalResult result = result(List.of(), List.of(),
                List.of(), List.of(), 7);

        final String overview = renderer.render(result);

        assertTrue(overview.startsWith("> **Truncated:**"));
        assertTrue(overview.contains("100 iterations"));
        assertTrue(overview.contains("7 files"));
    }

    @Test
    void whenBuildingReport_givenResult_shouldJoinOverviewAndGraph() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addNode("/opt/run.sh");
        final TraversalResult result = new TraversalResult(graph.freeze(),
                List.of("/opt/run.sh"),
                List.of(new PathEntry("/etc/a.ini", null)), List.of(),
                List.of(), List.of(), 1, 0, 100);

        assertEquals(String.join("\n",
                "# Analysis Result",
                "",
                "## Overview",
                "### Read Files",
                "- **/etc/a.ini**",
                "",
                "## Dependency Graph",
                "[E] /opt/run.sh"),
                AnalysisReport.of(result).content());
    }

    private static TraversalResult result(final List<PathEntry> reads,
            final List<PathEntry> writes, final List<ExecuteEntry> executes,
            final List<FileError> errors, final int remaining) {
        return new TraversalResult(new DependencyGraph().freeze(), List.of(),
                reads, writes, executes, errors, 100, remaining, 100);
    }
}
