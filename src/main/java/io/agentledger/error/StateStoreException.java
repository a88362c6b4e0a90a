package io.agentledger.error;

public class StateStoreException extends CoordinationException {
    public static final String CODE = "state_store_failed";

    public StateStoreException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    protected StateStoreException(String code, String message) {
        super(code, message);
    }
}
