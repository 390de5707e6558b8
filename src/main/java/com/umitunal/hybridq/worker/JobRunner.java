package com.umitunal.hybridq.worker;

import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobOutput;

import java.util.function.Consumer;

/**
 * Runs a job to termination.
 */
@FunctionalInterface
public interface JobRunner {

    /**
     * Execute the job and wait for it to end.
     *
     * @param job the RUNNING job
     * @param onStart receives the live process as soon as it exists, so it can be terminated
     * @return the exit code and captured output
     * @throws Exception if the job could not be executed; the job then fails with the error as reason
     */
    ExecutionResult run(Job job, Consumer<ProcessHandle> onStart) throws Exception;

    /**
     * Result of a process that ran to termination.
     */
    class ExecutionResult {
        private final int exitCode;
        private final JobOutput output;
        private final int signal;

        public ExecutionResult(int exitCode, JobOutput output) {
            this(exitCode, output, 0);
        }

        /**
         * @param signal number of the signal that ended the process, 0 if it exited on its own
         */
        public ExecutionResult(int exitCode, JobOutput output, int signal) {
            this.exitCode = exitCode;
            this.output = output;
            this.signal = signal;
        }

        public int getExitCode() { return exitCode; }
        public JobOutput getOutput() { return output; }
        public int getSignal() { return signal; }
        public boolean isKilledBySignal() { return signal > 0; }

        public static ExecutionResult of(int exitCode) {
            return new ExecutionResult(exitCode, JobOutput.EMPTY);
        }
    }
}
