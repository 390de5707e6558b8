package com.umitunal.hybridq.daemon;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * PID file guarded by an exclusive advisory file lock.
 */
public class FilePidLock implements PidFileLock {
    private static final Logger LOG = LogManager.getLogger(FilePidLock.class);

    @Override
    public Handle acquire(Path path) throws HybridQueueException {
        FileChannel channel = null;
        try {
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw alreadyRunning(path);
            }
            channel.truncate(0);
            channel.write(ByteBuffer.wrap((ProcessHandle.current().pid() + "\n").getBytes(StandardCharsets.US_ASCII)));
            channel.force(true);
            LOG.debug("Locked PID file {}", path);
            return new LockedFile(path, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw alreadyRunning(path);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new HybridQueueException(ErrorKind.CONFIG_CONFLICT,
                    "Cannot lock PID file " + path + ": " + e.getMessage(), e);
        }
    }

    private static HybridQueueException alreadyRunning(Path path) {
        return new HybridQueueException(ErrorKind.ALREADY_RUNNING,
                "Another daemon holds the PID file " + path);
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Failed to close PID file channel: {}", e.getMessage());
        }
    }

    private static final class LockedFile implements Handle {
        private final Path path;
        private final FileChannel channel;
        private final FileLock lock;

        private LockedFile(Path path, FileChannel channel, FileLock lock) {
            this.path = path;
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public Path getPath() {
            return path;
        }

        @Override
        public void close() {
            try {
                Files.deleteIfExists(path);
                lock.release();
            } catch (IOException e) {
                LOG.warn("Failed to release PID file {}: {}", path, e.getMessage());
            } finally {
                closeQuietly(channel);
            }
        }
    }
}
