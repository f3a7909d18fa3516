package co.fanki.filegraph.shared;

/**
 * Base exception for failures of the analyzer's domain rules.
 *
 * <p>Every domain exception carries an error code so the command line can
 * report the kind of failure without inspecting the message. Per-file
 * problems found during a traversal are not exceptions; they are recorded
 * as data and the run continues.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The code used when no specific one is given. */
    public static final String DEFAULT_ERROR_CODE = "DOMAIN_ERROR";

    private final String errorCode;

    /**
     * Creates a new domain exception with the default error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, DEFAULT_ERROR_CODE);
    }

    /**
     * Creates a new domain exception with a specific error code.
     *
     * @param message the error message
     * @param theErrorCode the error code, e.g. {@code CONFIGURATION_ERROR}
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception wrapping its cause.
     *
     * @param message the error message
     * @param theErrorCode the error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code, never null
     */
    public String getErrorCode() {
        return errorCode;
    }

}
