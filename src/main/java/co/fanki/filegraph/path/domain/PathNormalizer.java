package co.fanki.filegraph.path.domain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Converts paths written in any host convention into the canonical form
 * used for every comparison, and back.
 *
 * <p>A canonical path always starts with {@code /}, never contains a
 * backslash or a run of separators, and encodes a Windows drive as a
 * lowercase segment right after the root: {@code C:\Users\a} becomes
 * {@code /c/Users/a}. A trailing separator survives only when the input
 * had one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PathNormalizer {

    /** The canonical root. */
    public static final String ROOT = "/";

    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:");

    private static final Pattern DRIVE_SEGMENT = Pattern.compile("^/[a-z]/");

    private static final Pattern SEPARATOR_RUN = Pattern.compile("/+");

    private static final String UNC_PREFIX = "\\\\";

    private PathNormalizer() {
        // Utility class, not instantiable
    }

    /**
     * Converts a path in any convention to its canonical form.
     *
     * @param input the path as written; null or empty means the root
     * @return the canonical path, never null
     */
    public static String toCanonical(final String input) {
        if (input == null || input.isEmpty()) {
            return ROOT;
        }

        String normalized = input.replace('\\', '/');

        if (DRIVE_PREFIX.matcher(normalized).find()) {
            final char drive = Character.toLowerCase(normalized.charAt(0));
            String rest = normalized.substring(2);
            if (!rest.isEmpty() && !rest.startsWith("/")) {
                rest = "/" + rest;
            }
            normalized = "/" + drive + rest;
        } else if (normalized.startsWith("./")) {
            normalized = normalized.substring(1);
        } else if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }

        normalized = SEPARATOR_RUN.matcher(normalized).replaceAll("/");

        final boolean hadTrailingSeparator = input.endsWith("/")
                || input.endsWith("\\");
        if (normalized.length() > 1 && normalized.endsWith("/")
                && !hadTrailingSeparator) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }

        return normalized;
    }

    /**
     * Converts a canonical path into the given convention.
     *
     * <p>For {@link PathConvention#WINDOWS} a leading drive segment turns
     * back into a drive letter. A path without one cannot be pinned to a
     * drive, so it is emitted relative, prefixed with {@code .}.</p>
     *
     * @param input the canonical path
     * @param target the convention to emit
     * @return the converted path; {@code .} for an empty input
     */
    public static String fromCanonical(final String input,
            final PathConvention target) {
        if (input == null || input.isEmpty()) {
            return ".";
        }
        if (target == PathConvention.UNIX) {
            return input;
        }
        if (DRIVE_PREFIX.matcher(input).find()
                || input.startsWith(UNC_PREFIX)) {
            return input;
        }
        if (DRIVE_SEGMENT.matcher(input).find()) {
            final char drive = Character.toUpperCase(input.charAt(1));
            return drive + ":" + input.substring(2).replace('/', '\\');
        }

        final String windowsPath = input.replace('/', '\\');
        if (windowsPath.startsWith("\\")) {
            return "." + windowsPath;
        }
        return windowsPath;
    }

    /**
     * Checks whether a path is written in Windows style.
     *
     * @param input the path to check
     * @return true for a drive prefix, any backslash or a UNC prefix
     */
    public static boolean isWindowsStyle(final String input) {
        if (input == null) {
            return false;
        }
        return DRIVE_PREFIX.matcher(input).find()
                || input.contains("\\")
                || input.startsWith(UNC_PREFIX);
    }

    /**
     * Checks whether a path is an absolute Unix-style path.
     *
     * @param input the path to check
     * @return true when it starts with {@code /} and has neither a
     *         backslash nor a drive prefix
     */
    public static boolean isUnixStyle(final String input) {
        if (input == null) {
            return false;
        }
        return input.startsWith("/")
                && !input.contains("\\")
                && !DRIVE_PREFIX.matcher(input).find();
    }

    /**
     * Resolves a path as seen from a working directory.
     *
     * <p>Resolution is POSIX-like on every host: an absolute path ignores
     * the working directory, {@code .} segments vanish and {@code ..}
     * removes the previous segment without ever leaving the root. The
     * result has no trailing separator.</p>
     *
     * @param pwd the working directory, in any convention; blank means root
     * @param path the path to resolve, in any convention
     * @return the canonical absolute path
     */
    public static String resolve(final String pwd, final String path) {
        final String target = path == null ? "" : path;
        final String combined;
        if (isAbsolute(target)) {
            combined = target;
        } else {
            combined = (pwd == null ? "" : pwd) + "/" + target;
        }
        return collapseDotSegments(toCanonical(combined));
    }

    private static boolean isAbsolute(final String path) {
        return path.startsWith("/")
                || path.startsWith("\\")
                || DRIVE_PREFIX.matcher(path).find();
    }

    private static String collapseDotSegments(final String canonical) {
        final Deque<String> segments = new ArrayDeque<>();
        for (final String segment : canonical.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                segments.pollLast();
                continue;
            }
            segments.addLast(segment);
        }
        return ROOT + String.join("/", segments);
    }

}
