package co.fanki.filegraph.path.domain;

import co.fanki.filegraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Translates paths seen on the analyzed system into local paths.
 *
 * <p>Rules are tried in the order they were configured and the first one
 * that matches wins, even when a later rule names a longer prefix.
 * Configuration authors list the specific prefixes first. A path no rule
 * matches is returned exactly as given.</p>
 *
 * <p>Every rule is validated on construction: a {@code from} that is not
 * a canonical Unix-style path would silently never match, so it is
 * rejected with a {@link co.fanki.filegraph.shared.ConfigurationException}
 * instead.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PathMapper {

    private static final Logger LOG = LoggerFactory.getLogger(PathMapper.class);

    private final List<PathMapping> mappings;

    /**
     * Creates a mapper over an ordered list of rules.
     *
     * @param theMappings the rules, most specific first
     * @throws co.fanki.filegraph.shared.ConfigurationException if the list
     *         is missing or a rule is malformed
     */
    public PathMapper(final List<PathMapping> theMappings) {
        Preconditions.requireConfiguration(theMappings != null,
                "Path mappings are required");
        for (int i = 0; i < theMappings.size(); i++) {
            validate(theMappings.get(i), i);
        }
        this.mappings = List.copyOf(theMappings);
    }

    /**
     * Maps a path to its local location.
     *
     * @param input the path in any convention
     * @return the mapped local path, or {@code input} unchanged when no
     *         rule matches
     */
    public String map(final String input) {
        Preconditions.requireNonNull(input, "Path to map is required");

        final String canonical = PathNormalizer.toCanonical(input);

        for (final PathMapping mapping : mappings) {
            if (mapping.matches(canonical)) {
                final String mapped = mapping.rewrite(canonical);
                LOG.debug("Mapped {} -> {} via {}", input, mapped,
                        mapping.from());
                return mapped;
            }
        }
        return input;
    }

    /**
     * Resolves a path against a working directory and maps the result.
     *
     * @param pwd the working directory the path was written in
     * @param path the path as written
     * @return the local path
     */
    public String resolveLocal(final String pwd, final String path) {
        return map(PathNormalizer.resolve(pwd, path));
    }

    /**
     * Returns the configured rules in match order.
     *
     * @return the unmodifiable rule list
     */
    public List<PathMapping> mappings() {
        return mappings;
    }

    private static void validate(final PathMapping mapping, final int index) {
        final String rule = "Path mapping #" + (index + 1);

        Preconditions.requireConfiguration(mapping != null, rule + " is empty");
        Preconditions.requireConfiguration(
                mapping.from() != null && !mapping.from().isBlank(),
                rule + " has no 'from' path");
        Preconditions.requireConfiguration(
                mapping.to() != null && !mapping.to().isBlank(),
                rule + " has no 'to' path");

        final String from = mapping.from();
        Preconditions.requireConfiguration(
                PathNormalizer.isUnixStyle(from),
                rule + " 'from' must be a Unix-style path (write C:\\dir"
                        + " as /c/dir), got: " + from);
        Preconditions.requireConfiguration(
                !PathNormalizer.ROOT.equals(from),
                rule + " 'from' must name a directory below the root");

        final String canonical = PathNormalizer.toCanonical(from);
        Preconditions.requireConfiguration(canonical.equals(from),
                rule + " 'from' is not canonical, use " + canonical
                        + " instead of " + from);
        Preconditions.requireConfiguration(!from.endsWith("/"),
                rule + " 'from' must not end with a separator: " + from);
    }

}
