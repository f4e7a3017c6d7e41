package io.github.drompincen.playdeck.runtime.error;

/**
 * Base of the platform's exceptions. Carries the formatted stack trace captured when the
 * exception crossed an {@link ExceptionWithTraceback} boundary.
 */
public class PMException extends RuntimeException {

    private String traceback;

    public PMException(String message) {
        super(message);
    }

    public PMException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getTraceback() { return traceback; }
    public void setTraceback(String traceback) { this.traceback = traceback; }
}
