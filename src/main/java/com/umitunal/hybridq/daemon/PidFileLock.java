package com.umitunal.hybridq.daemon;

import com.umitunal.hybridq.core.HybridQueueException;

import java.nio.file.Path;

/**
 * Exclusive PID file used by process supervisors to find a running daemon.
 */
public interface PidFileLock {

    /**
     * Lock the file and record this process's pid in it.
     *
     * @throws HybridQueueException ALREADY_RUNNING if another process holds the lock
     */
    Handle acquire(Path path) throws HybridQueueException;

    /**
     * A held lock. Closing it releases the lock and removes the file.
     */
    interface Handle extends AutoCloseable {
        Path getPath();

        @Override
        void close();
    }
}
