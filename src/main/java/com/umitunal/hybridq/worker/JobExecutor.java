package com.umitunal.hybridq.worker;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobOutput;
import com.umitunal.hybridq.core.JobQueue;
import com.umitunal.hybridq.core.JobView;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Takes jobs from the queue one at a time, in submission order, and runs them to termination.
 *
 * The executor sleeps until a submit wakes it or the poll interval passes. After each job it
 * asks the queue for the next one straight away.
 */
public class JobExecutor implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(JobExecutor.class);

    private final JobQueue queue;
    private final JobRunner runner;
    private final NotificationDispatcher notifier;
    private final long pollInterval;
    private final AtomicBoolean running;
    private final AtomicLong completedCount;
    private final AtomicLong failedCount;
    private final Semaphore wakeups;

    private volatile RunningJob current;
    private Thread executorThread;

    private JobExecutor(Builder builder) {
        this.queue = builder.queue;
        this.runner = builder.runner;
        this.notifier = builder.notifier;
        this.pollInterval = builder.pollInterval;
        this.running = new AtomicBoolean(false);
        this.completedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
        this.wakeups = new Semaphore(0);
    }

    /**
     * Start executing jobs in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            queue.addSubmitListener(this::wakeUp);
            executorThread = new Thread(this::run, "JobExecutor");
            executorThread.setDaemon(false);
            executorThread.start();
        }
    }

    /**
     * Stop the executor. A job still running is killed and resolves to FAILED.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        RunningJob job = current;
        if (job != null) {
            job.kill(true);
        }
        wakeUp();
        if (executorThread != null) {
            executorThread.interrupt();
            try {
                executorThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Signal that a job may have become available.
     */
    public void wakeUp() {
        if (wakeups.availablePermits() == 0) {
            wakeups.release();
        }
    }

    /**
     * Start the next job, if any, and run it to a terminal state.
     *
     * @return true if a job was run
     */
    public boolean processOne() throws InterruptedException {
        JobView job = queue.tryStartNext();
        if (job == null) {
            return false;
        }

        LOG.info("Running job {}: {}", job.getId(), job.getCmdline());
        RunningJob slot = new RunningJob(job.getId());
        current = slot;

        JobView finished;
        try {
            JobRunner.ExecutionResult result = runner.run(job, slot::attach);
            if (slot.isKillRequested()) {
                finished = fail(job, "Terminated on request, exit code " + result.getExitCode(), result.getOutput());
            } else if (result.isKilledBySignal()) {
                finished = fail(job, "Killed by signal " + result.getSignal(), result.getOutput());
            } else {
                finished = complete(job, result);
            }
        } catch (InterruptedException e) {
            JobView interrupted = fail(job, "Interrupted while the daemon was stopping", JobOutput.EMPTY);
            dispatchNotify(interrupted);
            throw e;
        } catch (HybridQueueException e) {
            finished = fail(job, e.getMessage(), JobOutput.EMPTY);
        } catch (Exception e) {
            finished = fail(job, e.toString(), JobOutput.EMPTY);
        } finally {
            current = null;
        }

        dispatchNotify(finished);
        return true;
    }

    private void dispatchNotify(JobView finished) {
        if (finished != null && notifier != null) {
            notifier.dispatch(finished);
        }
    }

    /**
     * Ask the running job to terminate. It resolves to FAILED once its process has exited.
     *
     * @throws HybridQueueException NOT_FOUND for an unknown job, INVALID_TRANSITION if it is not running
     */
    public void terminate(long jobId) throws HybridQueueException {
        JobView job = queue.find(jobId);
        if (job == null) {
            throw new HybridQueueException(ErrorKind.NOT_FOUND, "No such job: " + jobId);
        }
        RunningJob slot = current;
        if (job.getStatus() != Job.Status.RUNNING || slot == null || slot.jobId != jobId) {
            throw new HybridQueueException(ErrorKind.INVALID_TRANSITION,
                    "Job " + jobId + " is " + job.getStatus() + ", not RUNNING");
        }
        LOG.info("Terminating job {} on request", jobId);
        slot.kill(false);
    }

    private JobView complete(JobView job, JobRunner.ExecutionResult result) {
        try {
            JobView finished = queue.completeJob(job.getId(), result.getExitCode(), result.getOutput());
            completedCount.incrementAndGet();
            LOG.info("Job {} terminated with exit code {}", job.getId(), result.getExitCode());
            return finished;
        } catch (HybridQueueException e) {
            LOG.error("Could not record completion of job {}: {}", job.getId(), e.getMessage());
            return null;
        }
    }

    private JobView fail(JobView job, String reason, JobOutput output) {
        try {
            JobView finished = queue.failJob(job.getId(), reason, output);
            failedCount.incrementAndGet();
            LOG.info("Job {} failed: {}", job.getId(), reason);
            return finished;
        } catch (HybridQueueException e) {
            LOG.error("Could not record failure of job {}: {}", job.getId(), e.getMessage());
            return null;
        }
    }

    private void run() {
        while (running.get()) {
            try {
                boolean processed = processOne();

                if (!processed) {
                    wakeups.tryAcquire(pollInterval, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                LOG.error("Job executor error", e);
            }
        }
    }

    public long getCompletedCount() { return completedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
        if (notifier != null) {
            notifier.close();
        }
    }

    public static Builder builder(JobQueue queue, JobRunner runner) {
        return new Builder(queue, runner);
    }

    /**
     * The job currently held by the executor and the process running it.
     */
    private static final class RunningJob {
        private final long jobId;
        private ProcessHandle process;
        private boolean killRequested;
        private boolean forcibly;

        private RunningJob(long jobId) {
            this.jobId = jobId;
        }

        synchronized void attach(ProcessHandle process) {
            this.process = process;
            if (killRequested) {
                destroy();
            }
        }

        synchronized void kill(boolean forcibly) {
            this.killRequested = true;
            this.forcibly = this.forcibly || forcibly;
            if (process != null) {
                destroy();
            }
        }

        synchronized boolean isKillRequested() {
            return killRequested;
        }

        private void destroy() {
            if (forcibly) {
                process.destroyForcibly();
            } else {
                process.destroy();
            }
        }
    }

    public static class Builder {
        private final JobQueue queue;
        private final JobRunner runner;
        private NotificationDispatcher notifier;
        private long pollInterval = 1000; // 1 second

        private Builder(JobQueue queue, JobRunner runner) {
            this.queue = queue;
            this.runner = runner;
        }

        /**
         * Run notify commands of terminated jobs through this dispatcher.
         * Without one, notify commands are never executed.
         */
        public Builder withNotifier(NotificationDispatcher notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public JobExecutor build() {
            return new JobExecutor(this);
        }
    }
}
