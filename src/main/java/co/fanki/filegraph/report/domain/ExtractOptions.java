package co.fanki.filegraph.report.domain;

/**
 * Selects which report sections contribute paths to a file list.
 *
 * @param readFiles include the files read
 * @param writeFiles include the files written
 * @param executables include the executed scripts
 * @param binaries include the executed binaries
 * @param errors include the paths that failed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtractOptions(
        boolean readFiles,
        boolean writeFiles,
        boolean executables,
        boolean binaries,
        boolean errors) {

    /**
     * Every section except the errors.
     *
     * @return the default options
     */
    public static ExtractOptions defaults() {
        return new ExtractOptions(true, true, true, true, false);
    }
}
