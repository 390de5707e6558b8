package com.umitunal.hybridq.cli;

import com.umitunal.hybridq.core.JobView;

import java.time.Instant;
import java.util.List;

/**
 * Plain text rendering of a queue snapshot.
 */
final class JobTable {
    private static final String ROW = "%-6s %-10s %-20s %-25s %s";

    private JobTable() {
    }

    static String render(List<JobView> jobs, boolean withOutput) {
        StringBuilder table = new StringBuilder(String.format(ROW, "ID", "STATUS", "RESULT", "SUBMITTED", "CMDLINE"));
        for (JobView job : jobs) {
            table.append('\n').append(String.format(ROW,
                    job.getId(), job.getStatus(), result(job), format(job.getSubmittedAt()), job.getCmdline()));
            if (withOutput && job.getStatus().isTerminal()) {
                appendOutput(table, "stdout", job.getStdout());
                appendOutput(table, "stderr", job.getStderr());
            }
        }
        return table.toString();
    }

    static String result(JobView job) {
        switch (job.getStatus()) {
            case COMPLETED:
                return "exit " + job.getExitCode();
            case FAILED:
                return job.getFailureReason();
            default:
                return "-";
        }
    }

    private static void appendOutput(StringBuilder table, String name, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        table.append("\n  ").append(name).append(":");
        for (String line : text.split("\n")) {
            table.append("\n    ").append(line);
        }
    }

    private static String format(Instant instant) {
        return instant == null ? "-" : instant.toString();
    }
}
