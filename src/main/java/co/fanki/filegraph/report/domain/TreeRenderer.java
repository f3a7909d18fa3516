package co.fanki.filegraph.report.domain;

import co.fanki.filegraph.graph.domain.DependencyGraph;
import co.fanki.filegraph.graph.domain.Edge;
import co.fanki.filegraph.graph.domain.EdgeAction;
import co.fanki.filegraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Renders a dependency graph as a text tree, one tree per entry point.
 *
 * <p>Each line carries a marker for how the file is used: {@code [R]} read,
 * {@code [W]} written, {@code [E]} executed and {@code [B]} an executed
 * binary. A file that already appears among its own ancestors is printed
 * once more with {@code [CIRCULAR]} and not expanded, so every tree is
 * finite even when the graph has cycles. A file reached from two
 * different branches is expanded under both.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TreeRenderer {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE = "│   ";
    private static final String SPACE = "    ";
    private static final String CIRCULAR = " [CIRCULAR]";

    private static final Comparator<Edge> CHILD_ORDER = Comparator
            .comparing(Edge::path)
            .thenComparing(Edge::action);

    /**
     * Renders the trees of the given roots.
     *
     * <p>Roots are sorted and those that are not nodes of the graph are
     * skipped. Trees are separated by one blank line.</p>
     *
     * @param graph the dependency graph
     * @param roots the canonical entry point paths
     * @return the rendered trees, empty when no root is in the graph
     */
    public String render(final DependencyGraph graph,
            final List<String> roots) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNoNulls(roots, "Roots are required");

        final List<String> sorted = new ArrayList<>(roots);
        sorted.sort(Comparator.naturalOrder());

        final List<String> trees = new ArrayList<>();
        for (final String root : sorted) {
            if (graph.contains(root)) {
                final List<String> lines = new ArrayList<>();
                lines.add(marker(EdgeAction.EXECUTE, null) + " " + root);
                renderChildren(graph, root, "", Ancestors.of(root), lines);
                trees.add(String.join("\n", lines));
            }
        }
        return String.join("\n\n", trees);
    }

    private void renderChildren(final DependencyGraph graph,
            final String node, final String prefix,
            final Ancestors ancestors, final List<String> lines) {

        final List<Edge> children = new ArrayList<>(graph.edges(node));
        children.sort(CHILD_ORDER);

        for (int i = 0; i < children.size(); i++) {
            final Edge child = children.get(i);
            final boolean last = i == children.size() - 1;
            final String line = prefix + (last ? LAST_BRANCH : BRANCH)
                    + marker(child.action(), child.fileType()) + " "
                    + child.path();

            if (ancestors.contains(child.path())) {
                lines.add(line + CIRCULAR);
                continue;
            }

            lines.add(line);
            if (graph.contains(child.path())) {
                renderChildren(graph, child.path(),
                        prefix + (last ? SPACE : PIPE),
                        ancestors.push(child.path()), lines);
            }
        }
    }

    private static String marker(final EdgeAction action,
            final String fileType) {
        switch (action) {
            case READ:
                return "[R]";
            case WRITE:
                return "[W]";
            default:
                return fileType != null ? "[B]" : "[E]";
        }
    }

    /** Immutable chain of the paths from a root down to a node. */
    private record Ancestors(String path, Ancestors parent) {

        static Ancestors of(final String root) {
            return new Ancestors(root, null);
        }

        Ancestors push(final String child) {
            return new Ancestors(child, this);
        }

        boolean contains(final String candidate) {
            for (Ancestors it = this; it != null; it = it.parent) {
                if (it.path.equals(candidate)) {
                    return true;
                }
            }
            return false;
        }
    }

}
