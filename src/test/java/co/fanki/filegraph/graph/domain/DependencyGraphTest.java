package co.fanki.filegraph.graph.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the DependencyGraph domain object.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DependencyGraphTest {

    @Test
    void whenAddingNode_givenDuplicatePath_shouldThrowException() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addNode("/opt/run.sh");

        assertThrows(IllegalArgumentException.class,
                () -> graph.addNode("/opt/run.sh"));
    }

    @Test
    void whenAddingEdge_givenUnknownNode_shouldThrowException() {
        final DependencyGraph graph = new DependencyGraph();

        assertThrows(IllegalArgumentException.class,
                () -> graph.addEdge("/opt/run.sh", Edge.read("/etc/a")));
    }

    @Test
    void whenAddingEdge_givenSameEdgeTwice_shouldKeepOne() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addNode("/opt/run.sh");

        graph.addEdge("/opt/run.sh", Edge.read("/etc/a"));
        graph.addEdge("/opt/run.sh", Edge.read("/etc/a"));
        graph.addEdge("/opt/run.sh", Edge.write("/etc/a"));

        assertEquals(2, graph.edges("/opt/run.sh").size());
        assertEquals(2, graph.edgeCount());
    }

    @Test
    void whenListingEdges_givenInsertionOrder_shouldKeepIt() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addNode("/run.sh");
        graph.addEdge("/run.sh", Edge.write("/z.log"));
        graph.addEdge("/run.sh", Edge.read("/a.ini"));

        assertEquals(List.of(Edge.write("/z.log"), Edge.read("/a.ini")),
                List.copyOf(graph.edges("/run.sh")));
    }

    @Test
    void whenListingEdges_givenUnknownNode_shouldReturnEmpty() {
        assertEquals(Set.of(), new DependencyGraph().edges("/nope"));
    }

    @Test
    void whenFreezing_givenGraph_shouldRejectChanges() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addNode("/run.sh");
        graph.addEdge("/run.sh", Edge.read("/a.ini"));

        final DependencyGraph frozen = graph.freeze();

        assertTrue(frozen.contains("/run.sh"));
        assertEquals(1, frozen.edgeCount());
        assertThrows(IllegalArgumentException.class,
                () -> frozen.addNode("/other.sh"));
        assertThrows(IllegalArgumentException.class,
                () -> frozen.addEdge("/run.sh", Edge.read("/b.ini")));
        assertThrows(UnsupportedOperationException.class,
                () -> frozen.edges("/run.sh").clear());
    }

    @Test
    void whenFreezing_givenLaterChangesToOriginal_shouldNotSeeThem() {
        final DependencyGraph graph = new DependencyGraph();
        graph.addNode("/run.sh");
        final DependencyGraph frozen = graph.freeze();

        graph.addNode("/other.sh");

        assertFalse(frozen.contains("/other.sh"));
    }

    @Test
    void whenCreatingEdge_givenFileTypeOnReadEdge_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new Edge("/a", EdgeAction.READ, "elf"));
    }
}
