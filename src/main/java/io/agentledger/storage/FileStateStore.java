package io.agentledger.storage;

import io.agentledger.error.LedgerWriteException;
import io.agentledger.error.StateNotFoundException;
import io.agentledger.error.StateStoreException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class FileStateStore implements StateStore {
    private static final String LOCK_DIR = ".locks";
    private static final String LOCK_SUFFIX = ".lock";
    private static final String TEMP_SUFFIX = ".tmp";

    private final ConcurrentMap<Path, Object> monitors = new ConcurrentHashMap<>();

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new StateNotFoundException(path);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read " + path, e);
        }
    }

    @Override
    public void write(Path path, String content) {
        try {
            withExclusiveLock(path, () -> {
                replaceAtomically(path, content);
                return null;
            });
        } catch (IOException e) {
            throw new StateStoreException("Failed to write " + path, e);
        }
    }

    @Override
    public boolean appendIfAbsent(Path path, String marker, String content) {
        try {
            return withExclusiveLock(path, () -> {
                String existing = Files.exists(path) ? Files.readString(path, StandardCharsets.UTF_8) : "";
                if (marker != null && existing.contains(marker)) {
                    return false;
                }
                replaceAtomically(path, existing + content);
                return true;
            });
        } catch (IOException e) {
            throw new LedgerWriteException(path, e);
        }
    }

    /**
     * Deleting a file also drops its lock file and in-process monitor.
     */
    @Override
    public boolean delete(Path path) {
        Path target = path.toAbsolutePath().normalize();
        try {
            while (true) {
                Object monitor = monitors.computeIfAbsent(target, ignored -> new Object());
                synchronized (monitor) {
                    if (monitors.get(target) != monitor) {
                        continue;
                    }
                    boolean deleted = underFileLock(target, () -> Files.deleteIfExists(target));
                    Files.deleteIfExists(lockFileFor(target));
                    monitors.remove(target, monitor);
                    return deleted;
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to delete " + path, e);
        }
    }

    int monitorCount() {
        return monitors.size();
    }

    private <T> T withExclusiveLock(Path path, IoAction<T> action) throws IOException {
        Path target = path.toAbsolutePath().normalize();
        while (true) {
            Object monitor = monitors.computeIfAbsent(target, ignored -> new Object());
            synchronized (monitor) {
                // a concurrent delete dropped this monitor
                if (monitors.get(target) != monitor) {
                    continue;
                }
                return underFileLock(target, action);
            }
        }
    }

    private static <T> T underFileLock(Path target, IoAction<T> action) throws IOException {
        Path lockFile = lockFileFor(target);
        Files.createDirectories(lockFile.getParent());
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock lock = channel.lock()) {
            return action.run();
        }
    }

    private static Path lockFileFor(Path target) {
        return target.resolveSibling(LOCK_DIR).resolve(target.getFileName() + LOCK_SUFFIX);
    }

    private static void replaceAtomically(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName() + ".", TEMP_SUFFIX);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @FunctionalInterface
    private interface IoAction<T> {
        T run() throws IOException;
    }
}
