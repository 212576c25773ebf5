package io.provtrack.runtime;

import io.provtrack.ProvTrackException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Exclusive process-level lock on the repository's lock file. */
public final class RepositoryLock implements AutoCloseable {
    private final FileChannel channel;
    private final FileLock lock;

    private RepositoryLock(FileChannel channel, FileLock lock) {
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Blocks until the lock is held.
     *
     * @throws ProvTrackException if this process already holds it or the file cannot be opened
     */
    public static RepositoryLock acquire(Path lockFile) {
        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            return new RepositoryLock(channel, channel.lock());
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel, e);
            throw new ProvTrackException("Repository is already locked by this process: " + lockFile, e);
        } catch (IOException e) {
            closeQuietly(channel, e);
            throw new ProvTrackException("Failed to lock repository: " + lockFile, e);
        }
    }

    @Override
    public void close() {
        try {
            lock.release();
            channel.close();
        } catch (IOException e) {
            throw new ProvTrackException("Failed to release repository lock", e);
        }
    }

    private static void closeQuietly(FileChannel channel, Exception primary) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
