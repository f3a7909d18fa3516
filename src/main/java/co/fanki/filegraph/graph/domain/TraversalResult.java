package co.fanki.filegraph.graph.domain;

import co.fanki.filegraph.analysis.domain.ExecuteEntry;
import co.fanki.filegraph.analysis.domain.FileError;
import co.fanki.filegraph.analysis.domain.PathEntry;

import java.util.List;

/**
 * Everything a traversal found.
 *
 * @param graph the dependency graph, read-only
 * @param roots the canonical paths of the entry points
 * @param readFiles every file read, unique by path
 * @param writeFiles every file written, unique by path
 * @param executeFiles every file executed, unique by path
 * @param errors every per-file error, in the order they happened
 * @param iterations how many worklist items were taken
 * @param remaining how many items were left when the traversal stopped
 * @param maxIterations the iteration cap of the run
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TraversalResult(
        DependencyGraph graph,
        List<String> roots,
        List<PathEntry> readFiles,
        List<PathEntry> writeFiles,
        List<ExecuteEntry> executeFiles,
        List<FileError> errors,
        int iterations,
        int remaining,
        int maxIterations) {

    /** Creates a result, copying the lists. */
    public TraversalResult {
        roots = List.copyOf(roots);
        readFiles = List.copyOf(readFiles);
        writeFiles = List.copyOf(writeFiles);
        executeFiles = List.copyOf(executeFiles);
        errors = List.copyOf(errors);
    }

    /**
     * Checks if the iteration cap cut the traversal short.
     *
     * @return true when items were still waiting in the worklist
     */
    public boolean truncated() {
        return remaining > 0;
    }
}
