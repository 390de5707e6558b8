package com.umitunal.hybridq.config;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.transport.TlsSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DaemonConfigTest {
    private static final Path CA = Paths.get("ca.pem");
    private static final Path BUNDLE = Paths.get("server.p12");

    @Test
    @DisplayName("Should use documented defaults")
    void testDefaults() {
        DaemonConfig config = DaemonConfig.newBuilder().build();

        assertThat(config.getPort()).isEqualTo(1337);
        assertThat(config.getBindAddress()).isNull();
        assertThat(config.isInsecure()).isFalse();
        assertThat(config.isAllowNotify()).isFalse();
        assertThat(config.getRetainFinished()).isZero();
        assertThat(config.getMaxFrameBytes()).isEqualTo(16 * 1024 * 1024);
        assertThat(config.getMaxOutputBytes()).isEqualTo(64 * 1024);
        assertThat(config.getAppKeys()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse to start with --insecure and a CA certificate")
    void testInsecureWithCa() {
        // Given
        DaemonConfig config = DaemonConfig.newBuilder()
                .withInsecure(true)
                .withCaCertificates(List.of(CA))
                .build();

        // When / Then
        assertThatThrownBy(config::validate)
                .isInstanceOf(HybridQueueException.class)
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT)
                .hasMessageContaining("--insecure")
                .hasMessageContaining("--ca");
    }

    @Test
    @DisplayName("Should refuse --insecure together with a server certificate")
    void testInsecureWithCert() {
        DaemonConfig config = DaemonConfig.newBuilder()
                .withInsecure(true)
                .withServerCertificate(BUNDLE, "changeit")
                .build();

        assertThatThrownBy(config::validate)
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT);
    }

    @Test
    @DisplayName("Should require a certificate unless insecure")
    void testMissingCertificate() {
        assertThatThrownBy(() -> DaemonConfig.newBuilder().build().validate())
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT);
    }

    @Test
    @DisplayName("Should reject out of range values")
    void testRanges() {
        assertThatThrownBy(() -> DaemonConfig.newBuilder().withInsecure(true).withPort(70000).build().validate())
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT);
        assertThatThrownBy(() -> DaemonConfig.newBuilder().withInsecure(true).withRetainFinished(-1).build().validate())
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT);
        assertThatThrownBy(() -> DaemonConfig.newBuilder().withInsecure(true).withMaxFrameBytes(0).build().validate())
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT);
    }

    @Test
    @DisplayName("Should reject a poll interval that is not positive")
    void testPollInterval() {
        assertThatThrownBy(() -> DaemonConfig.newBuilder().withInsecure(true).withPollInterval(0).build().validate())
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT)
                .hasMessageContaining("Poll interval");
        assertThatThrownBy(() -> DaemonConfig.newBuilder().withInsecure(true).withPollInterval(-5).build().validate())
                .hasFieldOrPropertyWithValue("kind", ErrorKind.CONFIG_CONFLICT);
    }

    @Test
    @DisplayName("Should accept plain TCP and TLS setups")
    void testValidSetups() throws Exception {
        DaemonConfig.newBuilder().withInsecure(true).withPort(0).build().validate();
        DaemonConfig.newBuilder().withServerCertificate(BUNDLE, "changeit").build().validate();
        DaemonConfig.newBuilder()
                .withServerCertificate(BUNDLE, "changeit")
                .withCaCertificates(List.of(CA))
                .build()
                .validate();
    }

    @Test
    @DisplayName("Should require client certificates exactly when CA certificates are configured")
    void testClientAuth() {
        TlsSettings withoutCa = DaemonConfig.newBuilder()
                .withServerCertificate(BUNDLE, "changeit")
                .build()
                .toTlsSettings();
        TlsSettings withCa = DaemonConfig.newBuilder()
                .withServerCertificate(BUNDLE, "changeit")
                .withCaCertificates(List.of(CA))
                .build()
                .toTlsSettings();

        assertThat(withoutCa.isRequireClientAuth()).isFalse();
        assertThat(withCa.isRequireClientAuth()).isTrue();
        assertThat(withCa.getKeyStore()).isEqualTo(BUNDLE);
        assertThat(withCa.getCaCertificates()).containsExactly(CA);
    }
}
