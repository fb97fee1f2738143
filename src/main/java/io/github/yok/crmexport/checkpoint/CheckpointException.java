package io.github.yok.crmexport.checkpoint;

/**
 * Failure to persist resume state. Fatal to the run, since continuing would lose the resume point.
 *
 * @author Yasuharu.Okawauchi
 */
public class CheckpointException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception.
     *
     * @param message description including the file
     * @param cause underlying I/O failure
     */
    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
