package com.umitunal.hybridq.model;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobOutput;
import com.umitunal.hybridq.core.JobView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class WorkUnitTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Should walk through queued, running and completed")
    void testLifecycle() throws Exception {
        // Given
        WorkUnit unit = new WorkUnit(1, "echo hi", 3L, null, T0);
        assertThat(unit.getStatus()).isEqualTo(Job.Status.QUEUED);
        assertThat(unit.getStartedAt()).isNull();

        // When
        unit.start(T0.plusSeconds(1));
        unit.complete(0, new JobOutput("hi\n", ""), T0.plusSeconds(2));

        // Then
        assertThat(unit.getStatus()).isEqualTo(Job.Status.COMPLETED);
        assertThat(unit.getExitCode()).isZero();
        assertThat(unit.getFailureReason()).isNull();
        assertThat(unit.getStdout()).isEqualTo("hi\n");
        assertThat(unit.getStartedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(unit.getFinishedAt()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    @DisplayName("Should record failure reason without exit code")
    void testFail() throws Exception {
        WorkUnit unit = new WorkUnit(2, "missing-binary", null, null, T0);
        unit.start(T0);

        unit.fail("Failed to launch missing-binary", null, T0.plusMillis(5));

        assertThat(unit.getStatus()).isEqualTo(Job.Status.FAILED);
        assertThat(unit.getExitCode()).isNull();
        assertThat(unit.getFailureReason()).isEqualTo("Failed to launch missing-binary");
        assertThat(unit.getStdout()).isEmpty();
    }

    @Test
    @DisplayName("Should reject completing a job that never started")
    void testInvalidTransition() {
        WorkUnit unit = new WorkUnit(3, "true", null, null, T0);

        assertThatThrownBy(() -> unit.complete(0, JobOutput.EMPTY, T0))
                .isInstanceOf(HybridQueueException.class)
                .hasFieldOrPropertyWithValue("kind", ErrorKind.INVALID_TRANSITION);
        assertThat(unit.getStatus()).isEqualTo(Job.Status.QUEUED);
    }

    @Test
    @DisplayName("Should reject leaving a terminal state")
    void testTerminalIsFinal() throws Exception {
        WorkUnit unit = new WorkUnit(4, "true", null, null, T0);
        unit.start(T0);
        unit.complete(0, JobOutput.EMPTY, T0);

        assertThatThrownBy(() -> unit.fail("late", JobOutput.EMPTY, T0))
                .isInstanceOf(HybridQueueException.class);
        assertThatThrownBy(() -> unit.start(T0))
                .isInstanceOf(HybridQueueException.class);
        assertThat(unit.getStatus()).isEqualTo(Job.Status.COMPLETED);
    }

    @Test
    @DisplayName("Should keep timestamps monotone when the clock steps back")
    void testMonotoneTimestamps() throws Exception {
        WorkUnit unit = new WorkUnit(5, "true", null, null, T0);

        unit.start(T0.minusSeconds(10));
        unit.complete(1, JobOutput.EMPTY, T0.minusSeconds(20));

        assertThat(unit.getStartedAt()).isEqualTo(T0);
        assertThat(unit.getFinishedAt()).isEqualTo(T0.plusNanos(1));
    }

    @Test
    @DisplayName("Should finish strictly after the start even within one clock tick")
    void testFinishAfterStart() throws Exception {
        // Given
        WorkUnit unit = new WorkUnit(7, "true", null, null, T0);
        unit.start(T0.plusMillis(3));

        // When
        unit.fail("Killed by signal 9", JobOutput.EMPTY, T0.plusMillis(3));

        // Then
        assertThat(unit.getFinishedAt()).isAfter(unit.getStartedAt());
        assertThat(unit.getFinishedAt()).isEqualTo(T0.plusMillis(3).plusNanos(1));
    }

    @Test
    @DisplayName("Should produce a detached view")
    void testView() throws Exception {
        WorkUnit unit = new WorkUnit(6, "sleep 1", 1L, "tee /tmp/x", T0);

        JobView before = unit.toView();
        unit.start(T0.plusSeconds(1));

        assertThat(before.getStatus()).isEqualTo(Job.Status.QUEUED);
        assertThat(before.getNotifyCmd()).isEqualTo("tee /tmp/x");
        assertThat(unit.toView().getStatus()).isEqualTo(Job.Status.RUNNING);
    }
}
