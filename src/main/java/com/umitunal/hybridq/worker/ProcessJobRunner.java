package com.umitunal.hybridq.worker;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobOutput;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.function.Consumer;

/**
 * Runs a job's command line as a child process, without a shell.
 * Standard input is closed immediately; standard output and error are captured up to a limit.
 */
public class ProcessJobRunner implements JobRunner {
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 64 * 1024;

    private static final String TRUNCATED = "\n[output truncated]";
    private static final int SIGNAL_EXIT_BASE = 128;
    private static final int MAX_SIGNAL = 64;
    private static final boolean WINDOWS = System.getProperty("os.name", "").startsWith("Windows");

    private final CommandResolver resolver;
    private final Path workingDirectory;
    private final int maxOutputBytes;

    public ProcessJobRunner(CommandResolver resolver) {
        this(resolver, null, DEFAULT_MAX_OUTPUT_BYTES);
    }

    /**
     * @param workingDirectory directory the process starts in, or null for the daemon's own
     * @param maxOutputBytes bytes kept per stream; the remainder is read and discarded
     */
    public ProcessJobRunner(CommandResolver resolver, Path workingDirectory, int maxOutputBytes) {
        this.resolver = resolver;
        this.workingDirectory = workingDirectory;
        this.maxOutputBytes = maxOutputBytes;
    }

    @Override
    public ExecutionResult run(Job job, Consumer<ProcessHandle> onStart)
            throws HybridQueueException, InterruptedException {
        List<String> argv = resolver.resolve(job.getCmdline());

        ProcessBuilder builder = new ProcessBuilder(argv);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new HybridQueueException(ErrorKind.PROCESS_ERROR,
                    "Failed to launch " + argv.get(0) + ": " + e.getMessage(), e);
        }
        onStart.accept(process.toHandle());

        FutureTask<String> stderr = new FutureTask<>(() -> readBounded(process.getErrorStream()));
        Thread stderrReader = new Thread(stderr, "job-" + job.getId() + "-stderr");
        stderrReader.setDaemon(true);
        stderrReader.start();

        try {
            process.getOutputStream().close();
            String stdout = readBounded(process.getInputStream());
            int exitCode = process.waitFor();
            return new ExecutionResult(exitCode, new JobOutput(stdout, stderr.get()), signalOf(exitCode));
        } catch (InterruptedException e) {
            process.destroyForcibly().waitFor();
            throw e;
        } catch (IOException | ExecutionException e) {
            process.destroyForcibly();
            throw new HybridQueueException(ErrorKind.PROCESS_ERROR,
                    "Lost contact with job " + job.getId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * The JDK reports a child ended by signal N as exit status 128 + N. A program that exits
     * with such a status by itself is indistinguishable and is counted as signalled too.
     */
    static int signalOf(int exitCode) {
        if (WINDOWS || exitCode <= SIGNAL_EXIT_BASE || exitCode > SIGNAL_EXIT_BASE + MAX_SIGNAL) {
            return 0;
        }
        return exitCode - SIGNAL_EXIT_BASE;
    }

    private String readBounded(InputStream in) throws IOException {
        ByteArrayOutputStream kept = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        boolean truncated = false;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            int room = maxOutputBytes - kept.size();
            if (read > room) {
                truncated = true;
            }
            if (room > 0) {
                kept.write(buffer, 0, Math.min(read, room));
            }
        }
        String text = kept.toString(StandardCharsets.UTF_8);
        return truncated ? text + TRUNCATED : text;
    }
}
