package com.umitunal.hybridq.daemon;

import com.umitunal.hybridq.config.DaemonConfig;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.JobQueue;
import com.umitunal.hybridq.protocol.FrameCodec;
import com.umitunal.hybridq.protocol.MessageCodec;
import com.umitunal.hybridq.queue.JobQueueManager;
import com.umitunal.hybridq.transport.PlainTransport;
import com.umitunal.hybridq.transport.TlsTransport;
import com.umitunal.hybridq.transport.Transport;
import com.umitunal.hybridq.worker.CommandResolver;
import com.umitunal.hybridq.worker.JobExecutor;
import com.umitunal.hybridq.worker.NotificationDispatcher;
import com.umitunal.hybridq.worker.ProcessJobRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The daemon process: job queue, executor and network listener wired together.
 *
 * <pre>{@code
 * try (HybridQueueDaemon daemon = HybridQueueDaemon.create(config)) {
 *     daemon.start();
 *     daemon.awaitTermination();
 * }
 * }</pre>
 */
public class HybridQueueDaemon implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(HybridQueueDaemon.class);

    private final DaemonConfig config;
    private final PidFileLock pidFileLock;
    private final JobQueueManager queue;
    private final JobExecutor executor;
    private final DaemonController controller;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private PidFileLock.Handle pidFile;

    HybridQueueDaemon(DaemonConfig config, Transport transport, PidFileLock pidFileLock) {
        this.config = config;
        this.pidFileLock = pidFileLock;
        this.queue = new JobQueueManager(config.getRetainFinished(), Clock.systemUTC());

        MessageCodec codec = new MessageCodec();
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver(config.getAppKeys()),
                config.getWorkingDirectory(), config.getMaxOutputBytes());

        JobExecutor.Builder executorBuilder = JobExecutor.builder(queue, runner)
                .withPollInterval(config.getPollInterval());
        if (config.isAllowNotify()) {
            executorBuilder.withNotifier(new NotificationDispatcher(codec));
        }
        this.executor = executorBuilder.build();

        RequestDispatcher dispatcher = new RequestDispatcher(queue, executor, config.isAllowNotify());
        this.controller = new DaemonController(transport, config.getBindAddress(), config.getPort(),
                new FrameCodec(config.getMaxFrameBytes()), codec, dispatcher, config.isDumpProtocol());
    }

    /**
     * Validate the configuration and build the daemon. Nothing is bound yet.
     *
     * @throws HybridQueueException CONFIG_CONFLICT for conflicting options, TLS_ERROR for unusable key material
     */
    public static HybridQueueDaemon create(DaemonConfig config) throws HybridQueueException {
        config.validate();
        Transport transport = config.isInsecure()
                ? new PlainTransport()
                : TlsTransport.create(config.toTlsSettings());
        return new HybridQueueDaemon(config, transport, new FilePidLock());
    }

    /**
     * Take the PID file, bind the listening socket and start executing jobs.
     *
     * @throws HybridQueueException ALREADY_RUNNING if another daemon holds the PID file
     * @throws IOException if the port cannot be bound
     */
    public void start() throws HybridQueueException, IOException {
        if (config.getPidFile() != null) {
            pidFile = pidFileLock.acquire(config.getPidFile());
        }
        try {
            controller.start();
        } catch (IOException e) {
            releasePidFile();
            throw e;
        }
        executor.start();

        LOG.info("Daemon ready on port {} ({}), notify commands {}",
                controller.getLocalPort(), config.isInsecure() ? "insecure" : "TLS",
                config.isAllowNotify() ? "enabled" : "disabled");
        if (!config.getAppKeys().isEmpty()) {
            LOG.info("Application keys available: {}", config.getAppKeys().keySet());
        }
    }

    /**
     * Block until {@link #close()} has completed.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public JobQueue getQueue() {
        return queue;
    }

    public JobExecutor getExecutor() {
        return executor;
    }

    public int getLocalPort() {
        return controller.getLocalPort();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Shutting down daemon");
        controller.close();
        executor.close();
        releasePidFile();
        terminated.countDown();
    }

    private void releasePidFile() {
        if (pidFile != null) {
            pidFile.close();
            pidFile = null;
        }
    }
}
