package com.umitunal.hybridq.worker;

import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.protocol.MessageCodec;
import com.umitunal.hybridq.protocol.NotifyPayload;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a job's notify command after the job has terminated, feeding it the job as a JSON document
 * on standard input.
 *
 * Notify commands run one at a time on a dedicated thread. Their exit status is only logged;
 * a failing notify command never affects the job it reports on.
 */
public class NotificationDispatcher implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(NotificationDispatcher.class);

    private final MessageCodec codec;
    private final ExecutorService executor;

    public NotificationDispatcher(MessageCodec codec) {
        this.codec = codec;
        this.executor = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, "NotificationDispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedule the job's notify command, if it has one.
     *
     * @return completes with the notify command's exit code, or null if it has none or could not run
     */
    public CompletableFuture<Integer> dispatch(Job job) {
        if (job.getNotifyCmd() == null) {
            return CompletableFuture.completedFuture(null);
        }
        byte[] payload = codec.encodeNotify(NotifyPayload.of(job));
        return CompletableFuture.supplyAsync(() -> runNotifyCommand(job, payload), executor);
    }

    private Integer runNotifyCommand(Job job, byte[] payload) {
        List<String> argv = CommandResolver.split(job.getNotifyCmd());
        Process process;
        try {
            process = new ProcessBuilder(argv)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            LOG.error("Failed to run notify command for job {}: {}", job.getId(), e.getMessage());
            return null;
        }

        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload);
        } catch (IOException e) {
            LOG.warn("Notify command for job {} did not read its input: {}", job.getId(), e.getMessage());
        }

        try {
            int exitCode = process.waitFor();
            if (exitCode == 0) {
                LOG.info("Notify command for job {} succeeded", job.getId());
            } else {
                LOG.warn("Notify command for job {} exited with code {}", job.getId(), exitCode);
            }
            return exitCode;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while waiting for notify command of job {}", job.getId());
            return null;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
