package co.fanki.filegraph.path.domain;

/**
 * One translation rule from a canonical production prefix to a local path.
 *
 * <p>{@code from} is a canonical Unix-style prefix such as
 * {@code /opt/app} or {@code /c/autoimg}; {@code to} is where that tree
 * lives on this machine, written in either convention. Rules are checked
 * by {@link PathMapper} before use.</p>
 *
 * @param from the canonical prefix the rule applies to
 * @param to the local replacement for the prefix
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PathMapping(String from, String to) {

    /**
     * Checks whether this rule applies to a canonical path.
     *
     * @param canonicalPath the canonical path to test
     * @return true when the path is the prefix itself or lies below it
     */
    public boolean matches(final String canonicalPath) {
        return canonicalPath.equals(from)
                || canonicalPath.startsWith(from + "/");
    }

    /**
     * Replaces this rule's prefix in a matching canonical path.
     *
     * <p>A Windows-style target yields a backslash-separated result; any
     * other target is concatenated with the remainder verbatim.</p>
     *
     * @param canonicalPath a canonical path this rule {@link #matches}
     * @return the local path
     */
    public String rewrite(final String canonicalPath) {
        final String relative = canonicalPath.substring(from.length());
        if (PathNormalizer.isWindowsStyle(to)) {
            return (to.replace('\\', '/') + relative).replace('/', '\\');
        }
        return to + relative;
    }

}
