package com.umitunal.hybridq.core;

import java.util.Objects;

/**
 * Captured standard output and standard error of a job process.
 */
public final class JobOutput {
    public static final JobOutput EMPTY = new JobOutput("", "");

    private final String stdout;
    private final String stderr;

    public JobOutput(String stdout, String stderr) {
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
    }

    public String getStdout() { return stdout; }
    public String getStderr() { return stderr; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobOutput)) return false;
        JobOutput that = (JobOutput) o;
        return stdout.equals(that.stdout) && stderr.equals(that.stderr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stdout, stderr);
    }
}
