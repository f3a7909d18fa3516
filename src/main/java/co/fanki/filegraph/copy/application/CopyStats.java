package co.fanki.filegraph.copy.application;

/**
 * Counters of a copy run.
 *
 * @param total the number of listed files
 * @param copied files copied, or that would be copied in a dry run
 * @param skipped files whose copy was already up to date
 * @param missing files not found locally
 * @param errors files that failed to copy
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CopyStats(int total, int copied, int skipped, int missing,
        int errors) {

    /**
     * Returns the share of listed files present in the output.
     *
     * @return (copied + skipped) / total, 0 when nothing was listed
     */
    public double successRate() {
        return total == 0 ? 0.0 : (double) (copied + skipped) / total;
    }

    /**
     * Checks if any file failed to copy.
     *
     * @return true when errors is not zero
     */
    public boolean hasErrors() {
        return errors > 0;
    }
}
