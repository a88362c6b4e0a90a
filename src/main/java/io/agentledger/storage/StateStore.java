package io.agentledger.storage;

import java.nio.file.Path;

/**
 * Durable, path-addressed storage for spec artifacts and the consolidated ledger.
 *
 * <p>All mutations are atomic: a reader sees either the previous content or the new
 * content of a path, never a partial write.
 */
public interface StateStore {
    boolean exists(Path path);

    /**
     * @throws io.agentledger.error.StateNotFoundException when {@code path} does not exist
     */
    String read(Path path);

    void write(Path path, String content);

    /**
     * Appends {@code content} as one unit unless {@code marker} already occurs in the target.
     *
     * @return {@code false} when the marker was found and nothing was appended
     */
    boolean appendIfAbsent(Path path, String marker, String content);

    default void append(Path path, String content) {
        appendIfAbsent(path, null, content);
    }

    /**
     * @return {@code true} when a file was removed
     */
    boolean delete(Path path);
}
