package co.fanki.filegraph.config;

import co.fanki.filegraph.analysis.domain.FileUnit;
import co.fanki.filegraph.path.domain.PathMapping;

import java.util.ArrayList;
import java.util.List;

/**
 * The per-run configuration file.
 *
 * <p>{@code pwd} is the working directory on the analyzed system that
 * relative entries are resolved against. {@code outDir} is optional; the
 * command line may override it.</p>
 *
 * @param pwd the working directory on the analyzed system
 * @param entryPoints the files to start the analysis from
 * @param pathMappings the rules translating analyzed paths to local ones
 * @param outDir where reports are written, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalyzerConfig(
        String pwd,
        List<EntryPoint> entryPoints,
        List<PathMapping> pathMappings,
        String outDir) {

    /** Creates a configuration, defaulting the missing lists. */
    public AnalyzerConfig {
        entryPoints = entryPoints == null ? List.of()
                : List.copyOf(entryPoints);
        pathMappings = pathMappings == null ? List.of()
                : List.copyOf(pathMappings);
    }

    /**
     * Returns the configured entry points as worklist units.
     *
     * @return the units, in configuration order
     */
    public List<FileUnit> entryPointUnits() {
        final List<FileUnit> units = new ArrayList<>();
        for (final EntryPoint entryPoint : entryPoints) {
            units.add(FileUnit.entryPoint(entryPoint.pwd(), entryPoint.path(),
                    entryPoint.args()));
        }
        return units;
    }

    /**
     * A configured entry point.
     *
     * @param pwd the working directory it runs in
     * @param path the file path
     * @param args the arguments it is run with
     */
    public record EntryPoint(String pwd, String path, List<String> args) {
    }
}
