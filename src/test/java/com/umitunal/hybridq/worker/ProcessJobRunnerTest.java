package com.umitunal.hybridq.worker;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class ProcessJobRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should capture output and exit code of a script")
    void testExitCodeAndOutput() throws Exception {
        // Given
        Path script = script("job.sh", "#!/bin/sh\necho out-line\necho err-line >&2\nexit 3\n");
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver());
        AtomicReference<ProcessHandle> started = new AtomicReference<>();

        // When
        JobRunner.ExecutionResult result = runner.run(job(script.toString()), started::set);

        // Then
        assertThat(result.getExitCode()).isEqualTo(3);
        assertThat(result.getOutput().getStdout()).isEqualTo("out-line\n");
        assertThat(result.getOutput().getStderr()).isEqualTo("err-line\n");
        assertThat(started.get()).isNotNull();
        assertThat(started.get().isAlive()).isFalse();
    }

    @Test
    @DisplayName("Should report the signal that ended the process")
    void testSignalledProcess() throws Exception {
        // Given
        Path script = script("self-kill.sh", "#!/bin/sh\nkill -9 $$\n");
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver());

        // When
        JobRunner.ExecutionResult result = runner.run(job(script.toString()), handle -> { });

        // Then
        assertThat(result.getExitCode()).isEqualTo(137);
        assertThat(result.isKilledBySignal()).isTrue();
        assertThat(result.getSignal()).isEqualTo(9);
    }

    @Test
    @DisplayName("Should map only statuses above 128 to signals")
    void testSignalOf() {
        assertThat(ProcessJobRunner.signalOf(0)).isZero();
        assertThat(ProcessJobRunner.signalOf(3)).isZero();
        assertThat(ProcessJobRunner.signalOf(128)).isZero();
        assertThat(ProcessJobRunner.signalOf(143)).isEqualTo(15);
        assertThat(ProcessJobRunner.signalOf(255)).isZero();
    }

    @Test
    @DisplayName("Should pass arguments without a shell")
    void testArguments() throws Exception {
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver());

        JobRunner.ExecutionResult result = runner.run(job("echo $HOME *"), handle -> { });

        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput().getStdout()).isEqualTo("$HOME *\n");
    }

    @Test
    @DisplayName("Should keep only the configured amount of output")
    void testTruncation() throws Exception {
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver(), null, 16);

        JobRunner.ExecutionResult result = runner.run(job("seq 1 100000"), handle -> { });

        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput().getStdout())
                .startsWith("1\n2\n3\n")
                .endsWith("[output truncated]");
    }

    @Test
    @DisplayName("Should start the process in the configured working directory")
    void testWorkingDirectory() throws Exception {
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver(), tempDir, 1024);

        JobRunner.ExecutionResult result = runner.run(job("pwd"), handle -> { });

        assertThat(Path.of(result.getOutput().getStdout().strip()).toRealPath())
                .isEqualTo(tempDir.toRealPath());
    }

    @Test
    @DisplayName("Should report a missing executable as a process error")
    void testLaunchFailure() {
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver());

        assertThatThrownBy(() -> runner.run(job("/nonexistent/hybridq-binary"), handle -> { }))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.PROCESS_ERROR)
                .hasMessageStartingWith("Failed to launch /nonexistent/hybridq-binary");
    }

    @Test
    @DisplayName("Should refuse commands outside the application keys")
    void testUnknownAppKey() {
        Path script = tempDir.resolve("never-run");
        ProcessJobRunner runner = new ProcessJobRunner(new CommandResolver(Map.of("model", script)));

        assertThatThrownBy(() -> runner.run(job("touch " + tempDir.resolve("marker")), handle -> { }))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.PROCESS_ERROR);
        assertThat(tempDir.resolve("marker")).doesNotExist();
    }

    private Path script(String name, String content) throws Exception {
        Path script = tempDir.resolve(name);
        Files.writeString(script, content);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    private static Job job(String cmdline) {
        Instant now = Instant.now();
        return new JobView(1, cmdline, null, null, Job.Status.RUNNING, null, null, now, now, null, null, null);
    }
}
