package io.github.yok.crmexport.client;

/**
 * Terminal failure of an API request.
 *
 * <p>
 * Raised when the retry budget for transient failures is exhausted, or immediately for failures
 * that retrying cannot fix (client errors other than 429, unparseable bodies). Aborts the run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param message description including method and URL
     * @param cause last failure observed
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
