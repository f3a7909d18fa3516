package co.fanki.filegraph.shared;

/**
 * Signals a configuration that cannot be used to start an analysis.
 *
 * <p>Raised while loading the configuration file or while building the
 * path mapper, always before the traversal starts. It is the only failure
 * that aborts a run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConfigurationException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code carried by every configuration exception. */
    public static final String ERROR_CODE = "CONFIGURATION_ERROR";

    /**
     * Creates a new configuration exception.
     *
     * @param message what is wrong with the configuration
     */
    public ConfigurationException(final String message) {
        super(message, ERROR_CODE);
    }

    /**
     * Creates a new configuration exception with its cause.
     *
     * @param message what is wrong with the configuration
     * @param cause the underlying cause, e.g. a JSON parse error
     */
    public ConfigurationException(final String message,
            final Throwable cause) {
        super(message, ERROR_CODE, cause);
    }

}
