package com.umitunal.hybridq.queue;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobOutput;
import com.umitunal.hybridq.core.JobQueue;
import com.umitunal.hybridq.core.JobView;
import com.umitunal.hybridq.core.QueueMetrics;
import com.umitunal.hybridq.core.QueueState;
import com.umitunal.hybridq.model.WorkUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of JobQueue.
 * All mutations run under the write lock of a fair read/write lock, snapshots under its read lock,
 * so readers never see a half-applied transition and cannot starve writers.
 */
public class JobQueueManager implements JobQueue {
    private static final Logger LOG = LogManager.getLogger(JobQueueManager.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Map<Long, WorkUnit> jobs = new LinkedHashMap<>();
    private final Deque<WorkUnit> queued = new ArrayDeque<>();
    private final Deque<Long> finishedOrder = new ArrayDeque<>();
    private final List<Runnable> submitListeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final int retainFinished;

    private WorkUnit running;
    private QueueState state = QueueState.RUNNING;
    private Instant lastFinishedAt;
    private long lastId;

    public JobQueueManager() {
        this(0, Clock.systemUTC());
    }

    /**
     * @param retainFinished maximum number of terminal jobs kept for status queries, 0 keeps all
     * @param clock source of job timestamps
     */
    public JobQueueManager(int retainFinished, Clock clock) {
        if (retainFinished < 0) {
            throw new IllegalArgumentException("retainFinished must not be negative: " + retainFinished);
        }
        this.retainFinished = retainFinished;
        this.clock = clock;
    }

    @Override
    public long submit(String cmdline, Long expectedDuration, String notifyCmd) throws HybridQueueException {
        if (cmdline == null || cmdline.isBlank()) {
            throw new HybridQueueException(ErrorKind.INVALID_REQUEST, "Command line must not be empty");
        }
        if (expectedDuration != null && expectedDuration < 0) {
            throw new HybridQueueException(ErrorKind.INVALID_REQUEST,
                    "Expected duration must not be negative: " + expectedDuration);
        }
        String notify = notifyCmd == null || notifyCmd.isBlank() ? null : notifyCmd;

        long id;
        lock.writeLock().lock();
        try {
            id = ++lastId;
            WorkUnit unit = new WorkUnit(id, cmdline, expectedDuration, notify, clock.instant());
            jobs.put(id, unit);
            queued.addLast(unit);
        } finally {
            lock.writeLock().unlock();
        }

        LOG.debug("Queued job {}: {}", id, cmdline);
        for (Runnable listener : submitListeners) {
            listener.run();
        }
        return id;
    }

    @Override
    public List<JobView> snapshot() {
        lock.readLock().lock();
        try {
            List<JobView> views = new ArrayList<>(jobs.size());
            for (WorkUnit unit : jobs.values()) {
                views.add(unit.toView());
            }
            return List.copyOf(views);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public JobView tryStartNext() {
        lock.writeLock().lock();
        try {
            if (state != QueueState.RUNNING || running != null || queued.isEmpty()) {
                return null;
            }
            WorkUnit next = queued.pollFirst();
            Instant now = clock.instant();
            if (lastFinishedAt != null && now.isBefore(lastFinishedAt)) {
                now = lastFinishedAt;
            }
            try {
                next.start(now);
            } catch (HybridQueueException e) {
                // Only QUEUED units are ever in the deque
                throw new IllegalStateException("Queued job is not startable: " + next, e);
            }
            running = next;
            return next.toView();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public JobView completeJob(long id, int exitCode, JobOutput output) throws HybridQueueException {
        lock.writeLock().lock();
        try {
            WorkUnit unit = runningUnit(id);
            unit.complete(exitCode, output, clock.instant());
            return finish(unit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public JobView failJob(long id, String reason, JobOutput output) throws HybridQueueException {
        lock.writeLock().lock();
        try {
            WorkUnit unit = runningUnit(id);
            unit.fail(reason, output, clock.instant());
            return finish(unit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public JobView find(long id) {
        lock.readLock().lock();
        try {
            WorkUnit unit = jobs.get(id);
            return unit == null ? null : unit.toView();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public JobView remove(long id) throws HybridQueueException {
        lock.writeLock().lock();
        try {
            WorkUnit unit = existingUnit(id);
            if (!unit.getStatus().isTerminal()) {
                throw new HybridQueueException(ErrorKind.INVALID_TRANSITION,
                        "Job " + id + " is " + unit.getStatus() + " and cannot be removed");
            }
            jobs.remove(id);
            finishedOrder.remove(id);
            return unit.toView();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public QueueState getQueueState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public QueueState setQueueState(QueueState requested) {
        QueueState now;
        lock.writeLock().lock();
        try {
            if (requested == QueueState.RUNNING) {
                state = QueueState.RUNNING;
            } else {
                state = running != null ? QueueState.STOPPING : QueueState.STOPPED;
            }
            now = state;
        } finally {
            lock.writeLock().unlock();
        }

        LOG.info("Queue is now {}", now);
        if (now == QueueState.RUNNING) {
            for (Runnable listener : submitListeners) {
                listener.run();
            }
        }
        return now;
    }

    @Override
    public QueueMetrics getMetrics() {
        return QueueMetrics.of(snapshot());
    }

    @Override
    public void addSubmitListener(Runnable listener) {
        submitListeners.add(listener);
    }

    private WorkUnit existingUnit(long id) throws HybridQueueException {
        WorkUnit unit = jobs.get(id);
        if (unit == null) {
            throw new HybridQueueException(ErrorKind.NOT_FOUND, "No such job: " + id);
        }
        return unit;
    }

    private WorkUnit runningUnit(long id) throws HybridQueueException {
        WorkUnit unit = existingUnit(id);
        if (unit.getStatus() != Job.Status.RUNNING) {
            throw new HybridQueueException(ErrorKind.INVALID_TRANSITION,
                    "Job " + id + " is " + unit.getStatus() + ", not RUNNING");
        }
        return unit;
    }

    private JobView finish(WorkUnit unit) {
        running = null;
        lastFinishedAt = unit.getFinishedAt();
        if (state == QueueState.STOPPING) {
            state = QueueState.STOPPED;
            LOG.info("Queue is now {}", state);
        }
        finishedOrder.addLast(unit.getId());
        evictFinished();
        return unit.toView();
    }

    private void evictFinished() {
        if (retainFinished == 0) {
            return;
        }
        while (finishedOrder.size() > retainFinished) {
            Long evicted = finishedOrder.pollFirst();
            jobs.remove(evicted);
            LOG.debug("Evicted finished job {}", evicted);
        }
    }
}
