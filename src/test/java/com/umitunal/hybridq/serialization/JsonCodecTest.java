package com.umitunal.hybridq.serialization;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.Job;
import com.umitunal.hybridq.core.JobView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JsonCodecTest {

    private final JsonCodec<JobView> codec = new JsonCodec<>(JobView.class);

    @Test
    @DisplayName("Should write snake_case names and ISO timestamps")
    void testWireNames() {
        // Given
        Instant submitted = Instant.parse("2024-06-01T08:30:00.250Z");
        JobView job = new JobView(7, "sleep 5", 5L, null, Job.Status.QUEUED, null, null,
                submitted, null, null, null, null);

        // When
        String json = new String(codec.encode(job), StandardCharsets.UTF_8);

        // Then
        assertThat(json)
                .contains("\"expected_duration\":5")
                .contains("\"submitted_at\":\"2024-06-01T08:30:00.250Z\"")
                .contains("\"status\":\"QUEUED\"")
                .doesNotContain("expectedDuration");
    }

    @Test
    @DisplayName("Should read a job document produced by another client")
    void testDecode() throws Exception {
        byte[] json = ("{\"id\":3,\"cmdline\":\"true\",\"status\":\"COMPLETED\",\"exit_code\":0,"
                + "\"submitted_at\":\"2024-06-01T08:30:00Z\"}").getBytes(StandardCharsets.UTF_8);

        JobView job = codec.decode(json);

        assertThat(job.getId()).isEqualTo(3);
        assertThat(job.getStatus()).isEqualTo(Job.Status.COMPLETED);
        assertThat(job.getExitCode()).isZero();
        assertThat(job.getStdout()).isEmpty();
    }

    @Test
    @DisplayName("Should report undecodable bytes as a protocol error")
    void testMalformed() {
        assertThatThrownBy(() -> codec.decode("{\"id\":".getBytes(StandardCharsets.UTF_8)))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.PROTOCOL_ERROR);
        assertThatThrownBy(() -> codec.decode("{\"id\":1,\"status\":\"PAUSED\"}".getBytes(StandardCharsets.UTF_8)))
                .hasFieldOrPropertyWithValue("kind", ErrorKind.PROTOCOL_ERROR);
    }
}
