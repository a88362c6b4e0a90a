package io.agentledger.storage;

import io.agentledger.error.LedgerWriteException;
import io.agentledger.error.StateNotFoundException;
import io.agentledger.error.StateStoreException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double with failure injection: each counter makes the next N calls of that kind fail.
 */
public final class InMemoryStateStore implements StateStore {
    private final Map<Path, String> files = new LinkedHashMap<>();
    private final AtomicInteger appendFailures = new AtomicInteger(0);
    private final AtomicInteger deleteFailures = new AtomicInteger(0);
    private final AtomicInteger writeFailures = new AtomicInteger(0);
    private final AtomicInteger appendCalls = new AtomicInteger(0);

    public InMemoryStateStore failNextAppends(int count) {
        appendFailures.set(count);
        return this;
    }

    public InMemoryStateStore failNextDeletes(int count) {
        deleteFailures.set(count);
        return this;
    }

    public InMemoryStateStore failNextWrites(int count) {
        writeFailures.set(count);
        return this;
    }

    public int appendCalls() {
        return appendCalls.get();
    }

    @Override
    public synchronized boolean exists(Path path) {
        return files.containsKey(path);
    }

    @Override
    public synchronized String read(Path path) {
        String content = files.get(path);
        if (content == null) {
            throw new StateNotFoundException(path);
        }
        return content;
    }

    @Override
    public synchronized void write(Path path, String content) {
        if (writeFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StateStoreException("Failed to write " + path, new IOException("injected write failure"));
        }
        files.put(path, content);
    }

    @Override
    public synchronized boolean appendIfAbsent(Path path, String marker, String content) {
        appendCalls.incrementAndGet();
        if (appendFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new LedgerWriteException(path, new IOException("injected append failure"));
        }
        String existing = files.getOrDefault(path, "");
        if (marker != null && existing.contains(marker)) {
            return false;
        }
        files.put(path, existing + content);
        return true;
    }

    @Override
    public synchronized boolean delete(Path path) {
        if (deleteFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StateStoreException("Failed to delete " + path, new IOException("injected delete failure"));
        }
        return files.remove(path) != null;
    }
}
