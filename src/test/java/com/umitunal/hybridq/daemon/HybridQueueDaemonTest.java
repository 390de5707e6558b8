package com.umitunal.hybridq.daemon;

import com.umitunal.hybridq.client.QueueClient;
import com.umitunal.hybridq.config.ClientConfig;
import com.umitunal.hybridq.config.DaemonConfig;
import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobView;
import com.umitunal.hybridq.core.QueueState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class HybridQueueDaemonTest {

    @TempDir
    Path tempDir;

    private HybridQueueDaemon daemon;

    @BeforeEach
    void setUp() throws Exception {
        daemon = HybridQueueDaemon.create(baseConfig().build());
        daemon.start();
    }

    @AfterEach
    void tearDown() {
        if (daemon != null) {
            daemon.close();
        }
    }

    @Test
    @DisplayName("Should queue a job submitted over the network and report it")
    void testSubmitAndStatus() throws Exception {
        try (QueueClient client = client()) {
            // When
            long id = client.submit("sleep 5", 5L, null);
            List<JobView> jobs = client.queueStatus();

            // Then
            assertThat(jobs).extracting(JobView::getId).contains(id);
            JobView job = jobs.stream().filter(j -> j.getId() == id).findFirst().orElseThrow();
            assertThat(job.getCmdline()).isEqualTo("sleep 5");
            assertThat(job.getExpectedDuration()).isEqualTo(5L);
            assertThat(job.getStatus()).isIn(Job.Status.QUEUED, Job.Status.RUNNING);
        }
    }

    @Test
    @DisplayName("Should run submitted jobs and expose their results")
    void testExecution() throws Exception {
        try (QueueClient client = client()) {
            long id = client.submit("echo hello", null, null);

            await().atMost(5, TimeUnit.SECONDS).until(() -> status(client, id) == Job.Status.COMPLETED);

            JobView job = find(client.queueStatus(), id);
            assertThat(job.getExitCode()).isZero();
            assertThat(job.getStdout()).isEqualTo("hello\n");
            assertThat(job.getFinishedAt()).isAfter(job.getStartedAt());

            JobView removed = client.remove(id);
            assertThat(removed.getId()).isEqualTo(id);
            assertThat(client.queueStatus()).extracting(JobView::getId).doesNotContain(id);
        }
    }

    @Test
    @DisplayName("Should give every concurrent client its own job id and list all of them")
    void testConcurrentClients() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<Long>> submissions = new ArrayList<>();

        // When
        for (int i = 0; i < 12; i++) {
            int n = i;
            submissions.add(pool.submit(() -> {
                try (QueueClient client = client()) {
                    return client.submit("echo client-" + n, null, null);
                }
            }));
        }
        List<Long> ids = new ArrayList<>();
        for (Future<Long> submission : submissions) {
            ids.add(submission.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();

        // Then
        assertThat(ids).doesNotHaveDuplicates();
        try (QueueClient client = client()) {
            assertThat(client.queueStatus()).extracting(JobView::getId).containsAll(ids);
        }
    }

    @Test
    @DisplayName("Should report unknown jobs to the client without closing the connection")
    void testQueueErrors() throws Exception {
        try (QueueClient client = client()) {
            assertThatThrownBy(() -> client.remove(404))
                    .isInstanceOf(HybridQueueException.class)
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.NOT_FOUND);
            assertThatThrownBy(() -> client.kill(404))
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.NOT_FOUND);
            assertThatThrownBy(() -> client.submit("true", null, "tee /tmp/never"))
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_REQUEST);

            assertThat(client.queueStatus()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should drop a connection that sends a malformed frame and keep serving others")
    void testMalformedFrame() throws Exception {
        // Given
        try (Socket raw = new Socket(InetAddress.getLoopbackAddress(), daemon.getLocalPort())) {
            raw.setSoTimeout(5000);
            OutputStream out = raw.getOutputStream();
            InputStream in = raw.getInputStream();
            byte[] garbage = "this is not json".getBytes(StandardCharsets.UTF_8);

            // When
            out.write(new byte[]{(byte) garbage.length, 0, 0, 0});
            out.write(garbage);
            out.flush();

            // Then
            assertThat(in.read()).isEqualTo(-1);
        }

        try (QueueClient client = client()) {
            assertThat(client.queueStatus()).isEmpty();
            assertThat(client.submit("true", null, null)).isPositive();
        }
    }

    @Test
    @DisplayName("Should drop a connection announcing an oversized frame")
    void testOversizedFrame() throws Exception {
        try (Socket raw = new Socket(InetAddress.getLoopbackAddress(), daemon.getLocalPort())) {
            raw.setSoTimeout(5000);
            raw.getOutputStream().write(new byte[]{-1, -1, -1, 127});
            raw.getOutputStream().flush();

            assertThat(raw.getInputStream().read()).isEqualTo(-1);
        }
        assertThat(daemon.getQueue().snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Should answer status requests whose response outgrows the request frame limit")
    void testLargeStatusResponse() throws Exception {
        // Given
        daemon.close();
        daemon = HybridQueueDaemon.create(baseConfig().withMaxFrameBytes(4096).build());
        daemon.start();

        try (QueueClient client = client()) {
            List<Long> ids = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                ids.add(client.submit("seq 1 2000", null, null));
            }
            await().atMost(10, TimeUnit.SECONDS)
                    .until(() -> daemon.getQueue().getMetrics().getCompletedJobs() == 3);

            // When
            List<JobView> jobs = client.queueStatus();

            // Then
            assertThat(jobs).extracting(JobView::getId).containsExactlyElementsOf(ids);
            assertThat(jobs).allSatisfy(job -> assertThat(job.getStdout()).startsWith("1\n2\n").endsWith("2000\n"));
            int totalOutput = jobs.stream().mapToInt(job -> job.getStdout().length()).sum();
            assertThat(totalOutput).isGreaterThan(4096);
            // The connection stays usable afterwards
            assertThat(client.submit("true", null, null)).isGreaterThan(ids.get(2));
        }
    }

    @Test
    @DisplayName("Should hold submitted jobs while the queue is stopped")
    void testStopAndStartQueue() throws Exception {
        try (QueueClient client = client()) {
            // Given
            assertThat(client.queueState()).isEqualTo(QueueState.RUNNING);
            assertThat(client.setQueueState(QueueState.STOPPED)).isEqualTo(QueueState.STOPPED);

            // When
            long id = client.submit("true", null, null);

            // Then
            await().during(300, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS)
                    .until(() -> status(client, id) == Job.Status.QUEUED);
            assertThat(client.queueState()).isEqualTo(QueueState.STOPPED);

            assertThat(client.setQueueState(QueueState.RUNNING)).isEqualTo(QueueState.RUNNING);
            await().atMost(5, TimeUnit.SECONDS).until(() -> status(client, id) == Job.Status.COMPLETED);
        }
    }

    @Test
    @DisplayName("Should terminate a running job on request")
    void testKill() throws Exception {
        try (QueueClient client = client()) {
            long id = client.submit("sleep 30", null, null);
            await().atMost(5, TimeUnit.SECONDS).until(() -> status(client, id) == Job.Status.RUNNING);

            await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> client.kill(id));

            await().atMost(5, TimeUnit.SECONDS).until(() -> status(client, id) == Job.Status.FAILED);
            assertThat(find(client.queueStatus(), id).getFailureReason()).startsWith("Terminated on request");
        }
    }

    @Test
    @DisplayName("Should refuse to start a second daemon on the same PID file")
    void testPidFile() throws Exception {
        // Given
        daemon.close();
        Path pidFile = tempDir.resolve("hybridq.pid");
        daemon = HybridQueueDaemon.create(baseConfig().withPidFile(pidFile).build());
        daemon.start();

        // When
        HybridQueueDaemon second = HybridQueueDaemon.create(baseConfig().withPidFile(pidFile).build());

        // Then
        try {
            assertThatThrownBy(second::start)
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.ALREADY_RUNNING);
        } finally {
            second.close();
        }
        assertThat(pidFile).exists();
        daemon.close();
        assertThat(pidFile).doesNotExist();
    }

    @Test
    @DisplayName("Should refuse to build a daemon with --insecure and a CA certificate")
    void testConfigConflict() {
        DaemonConfig config = baseConfig().withCaCertificates(List.of(tempDir.resolve("ca.pem"))).build();

        assertThatThrownBy(() -> HybridQueueDaemon.create(config))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT);
    }

    private DaemonConfig.Builder baseConfig() {
        return DaemonConfig.newBuilder()
                .withInsecure(true)
                .withPort(0)
                .withBindAddress(InetAddress.getLoopbackAddress())
                .withPollInterval(50);
    }

    private QueueClient client() throws HybridQueueException {
        return QueueClient.create(ClientConfig.newBuilder()
                .withHost(InetAddress.getLoopbackAddress().getHostAddress())
                .withPort(daemon.getLocalPort())
                .withInsecure(true)
                .withTimeout(5000)
                .build());
    }

    private static Job.Status status(QueueClient client, long id) throws HybridQueueException {
        return find(client.queueStatus(), id).getStatus();
    }

    private static JobView find(List<JobView> jobs, long id) {
        return jobs.stream().filter(j -> j.getId() == id).findFirst().orElseThrow();
    }
}
