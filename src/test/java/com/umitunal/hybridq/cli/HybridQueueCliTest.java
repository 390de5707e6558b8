package com.umitunal.hybridq.cli;

import com.umitunal.hybridq.config.ClientConfig;
import com.umitunal.hybridq.config.DaemonConfig;
import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobView;
import com.umitunal.hybridq.protocol.FrameCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HybridQueueCliTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should exit with code 2 when --insecure meets --ca")
    void testConfigConflictExitCode() {
        // Given
        StringWriter err = new StringWriter();
        CommandLine cli = HybridQueueCli.newCommandLine();
        cli.setErr(new PrintWriter(err));

        // When
        int exitCode = cli.execute("--insecure", "--ca", tempDir.resolve("ca.pem").toString(), "daemon");

        // Then
        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("CONFIG_CONFLICT").contains("--insecure");
    }

    @Test
    @DisplayName("Should take conflicting settings from the configuration file as well")
    void testConfigFileConflict() throws Exception {
        Path config = tempDir.resolve("hybridq.json");
        Files.writeString(config, "{\"insecure\": true, \"client_cert\": \"/etc/client.p12\"}");
        StringWriter err = new StringWriter();
        CommandLine cli = HybridQueueCli.newCommandLine();
        cli.setErr(new PrintWriter(err));

        int exitCode = cli.execute("--config", config.toString(), "queue-status");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--client-cert");
    }

    @Test
    @DisplayName("Should exit with code 1 when the daemon is unreachable")
    void testUnreachableDaemon() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        CommandLine cli = HybridQueueCli.newCommandLine();
        cli.setErr(new PrintWriter(new StringWriter()));

        int exitCode = cli.execute("--insecure", "--host", "127.0.0.1", "--port", String.valueOf(port),
                "submit", "sleep", "5");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("Should take the frame limit from the command line or the configuration file")
    void testMaxFrameBytes() throws Exception {
        // Given
        Path config = tempDir.resolve("limits.json");
        Files.writeString(config, "{\"insecure\": true, \"max_frame_bytes\": 8192}");

        // When
        DaemonConfig fromOption = ((HybridQueueCli.Daemon) parse("--insecure", "--max-frame-bytes", "4096", "daemon"))
                .daemonConfig();
        DaemonConfig daemonDefault = ((HybridQueueCli.Daemon) parse("--insecure", "daemon")).daemonConfig();
        ClientConfig fromFile = ((HybridQueueCli.ClientCommand) parse("--config", config.toString(), "queue-status"))
                .clientConfig();
        ClientConfig clientDefault = ((HybridQueueCli.ClientCommand) parse("--insecure", "queue-state"))
                .clientConfig();

        // Then
        assertThat(fromOption.getMaxFrameBytes()).isEqualTo(4096);
        assertThat(daemonDefault.getMaxFrameBytes()).isEqualTo(FrameCodec.DEFAULT_MAX_FRAME_BYTES);
        assertThat(fromFile.getMaxFrameBytes()).isEqualTo(8192);
        assertThat(clientDefault.getMaxFrameBytes()).isEqualTo(FrameCodec.MAX_FRAME_BYTES);
    }

    @Test
    @DisplayName("Should offer commands to inspect, stop and start the queue")
    void testQueueStateCommands() {
        assertThat(HybridQueueCli.newCommandLine().getSubcommands())
                .containsKeys("queue-state", "stop-queue", "start-queue");
    }

    @Test
    @DisplayName("Should map error kinds to exit codes")
    void testExitCodes() {
        assertThat(HybridQueueCli.exitCodeFor(ErrorKind.CONFIG_CONFLICT)).isEqualTo(2);
        assertThat(HybridQueueCli.exitCodeFor(ErrorKind.NOT_FOUND)).isEqualTo(1);
        assertThat(HybridQueueCli.exitCodeFor(ErrorKind.TLS_ERROR)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should render one row per job with its result")
    void testJobTable() {
        // Given
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        List<JobView> jobs = List.of(
                new JobView(1, "sleep 5", 5L, null, Job.Status.COMPLETED, 0, null, t0, t0, t0, "done\n", ""),
                new JobView(2, "model run", null, null, Job.Status.FAILED, null, "Invalid application key: model",
                        t0, t0, t0, "", ""),
                new JobView(3, "sleep 9", null, null, Job.Status.QUEUED, null, null, t0, null, null, "", ""));

        // When
        String table = JobTable.render(jobs, true);

        // Then
        String[] lines = table.split("\n");
        assertThat(lines[0]).startsWith("ID").contains("STATUS").contains("CMDLINE");
        assertThat(table).contains("exit 0").contains("Invalid application key: model").contains("    done");
        assertThat(lines[lines.length - 1]).contains("QUEUED").contains("sleep 9");
    }

    private static Object parse(String... args) {
        CommandLine.ParseResult result = new CommandLine(new HybridQueueCli()).parseArgs(args);
        return result.subcommand().commandSpec().userObject();
    }
}
