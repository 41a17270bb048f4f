package com.example.compliance.repository;

import com.example.compliance.exception.PersistenceException;
import com.example.compliance.exception.RunInProgressException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on a project work directory: one writer per project, across processes.
 */
public final class RunLock implements AutoCloseable {

    public static final String FILE_NAME = ".run.lock";

    private final FileChannel channel;
    private final FileLock lock;

    private RunLock(FileChannel channel, FileLock lock) {
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @throws RunInProgressException if another run holds the lock
     */
    public static RunLock acquire(Path workDir, String projectId) {
        FileChannel channel = null;
        try {
            Files.createDirectories(workDir);
            channel = FileChannel.open(workDir.resolve(FILE_NAME),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw new RunInProgressException(projectId);
            }
            return new RunLock(channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel, e);
            throw new RunInProgressException(projectId);
        } catch (IOException e) {
            closeQuietly(channel, e);
            throw new PersistenceException("Unable to lock " + workDir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            lock.release();
            channel.close();
        } catch (IOException e) {
            throw new PersistenceException("Unable to release run lock: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(FileChannel channel, Exception primary) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
