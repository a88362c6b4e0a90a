package io.agentledger.error;

/**
 * Root of the coordination error taxonomy. {@link #code()} is the stable prefix recorded
 * as a task's {@code last_error}.
 */
public class CoordinationException extends RuntimeException {
    private final String code;

    public CoordinationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public CoordinationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    public String describe() {
        return code + ": " + getMessage();
    }
}
