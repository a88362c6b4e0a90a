package io.agentledger.error;

import java.nio.file.Path;

public final class StateNotFoundException extends StateStoreException {
    public static final String CODE = "not_found";

    private final Path path;

    public StateNotFoundException(Path path) {
        super(CODE, "File not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
