package io.agentledger.error;

import java.nio.file.Path;

public final class LedgerWriteException extends CoordinationException {
    public static final String CODE = "ledger_write_failed";

    public LedgerWriteException(Path ledger, Throwable cause) {
        super(CODE, "Failed to append to ledger " + ledger
                + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()), cause);
    }
}
