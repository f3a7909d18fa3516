package co.fanki.filegraph.graph.domain;

import co.fanki.filegraph.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency map from every analyzed file to the files it references.
 *
 * <p>Keys are canonical absolute paths, kept in the order the files were
 * analyzed. A file is a key at most once; a file that failed analysis is
 * a key with no edges. Edges of a node keep the order they were reported
 * in and never repeat.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    private final Map<String, Set<Edge>> edges;

    private final boolean frozen;

    /** Creates an empty graph. */
    public DependencyGraph() {
        this.edges = new LinkedHashMap<>();
        this.frozen = false;
    }

    private DependencyGraph(final Map<String, Set<Edge>> theEdges) {
        this.edges = new LinkedHashMap<>();
        for (final Map.Entry<String, Set<Edge>> entry : theEdges.entrySet()) {
            this.edges.put(entry.getKey(),
                    Collections.unmodifiableSet(
                            new LinkedHashSet<>(entry.getValue())));
        }
        this.frozen = true;
    }

    /**
     * Adds an analyzed file as a node.
     *
     * @param path the canonical absolute path
     * @throws IllegalArgumentException if the node already exists or the
     *         graph is frozen
     */
    public void addNode(final String path) {
        Preconditions.require(!frozen, "Graph can no longer change");
        Preconditions.requireNonBlank(path, "Node path is required");
        Preconditions.require(!edges.containsKey(path),
                "Node already present: " + path);
        edges.put(path, new LinkedHashSet<>());
    }

    /**
     * Adds an edge leaving an existing node.
     *
     * @param from the canonical path of the analyzed file
     * @param edge the dependency
     */
    public void addEdge(final String from, final Edge edge) {
        Preconditions.require(!frozen, "Graph can no longer change");
        Preconditions.requireNonNull(edge, "Edge is required");
        final Set<Edge> nodeEdges = edges.get(from);
        Preconditions.require(nodeEdges != null, "Unknown node: " + from);
        nodeEdges.add(edge);
    }

    /**
     * Checks if a file was analyzed.
     *
     * @param path the canonical path
     * @return true when the path is a node
     */
    public boolean contains(final String path) {
        return edges.containsKey(path);
    }

    /**
     * Returns the edges leaving a node.
     *
     * @param path the canonical path
     * @return the edges in report order, empty for unknown nodes
     */
    public Set<Edge> edges(final String path) {
        final Set<Edge> nodeEdges = edges.get(path);
        return nodeEdges == null ? Set.of()
                : Collections.unmodifiableSet(nodeEdges);
    }

    /**
     * Returns every node in analysis order.
     *
     * @return the unmodifiable node set
     */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return edges.size();
    }

    /**
     * Returns the total number of edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        int count = 0;
        for (final Set<Edge> nodeEdges : edges.values()) {
            count += nodeEdges.size();
        }
        return count;
    }

    /**
     * Returns a copy of this graph that can no longer change.
     *
     * @return the read-only copy
     */
    public DependencyGraph freeze() {
        return new DependencyGraph(edges);
    }

}
