package com.umitunal.hybridq.config;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.protocol.FrameCodec;
import com.umitunal.hybridq.transport.TlsSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a client connection to the daemon.
 */
public class ClientConfig {
    public static final String DEFAULT_HOST = "localhost";

    private final String host;
    private final int port;
    private final boolean insecure;
    private final List<Path> caCertificates;
    private final boolean useSystemTrustStore;
    private final Path clientCertificate;
    private final String certificatePassword;
    private final boolean verifyHostname;
    private final int timeoutMillis;
    private final int maxFrameBytes;
    private final boolean dumpProtocol;

    private ClientConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.insecure = builder.insecure;
        this.caCertificates = List.copyOf(builder.caCertificates);
        this.useSystemTrustStore = builder.useSystemTrustStore;
        this.clientCertificate = builder.clientCertificate;
        this.certificatePassword = builder.certificatePassword;
        this.verifyHostname = builder.verifyHostname;
        this.timeoutMillis = builder.timeoutMillis;
        this.maxFrameBytes = builder.maxFrameBytes;
        this.dumpProtocol = builder.dumpProtocol;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public boolean isInsecure() { return insecure; }
    public List<Path> getCaCertificates() { return caCertificates; }
    public boolean isUseSystemTrustStore() { return useSystemTrustStore; }
    public Path getClientCertificate() { return clientCertificate; }
    public String getCertificatePassword() { return certificatePassword; }
    public boolean isVerifyHostname() { return verifyHostname; }
    public int getTimeoutMillis() { return timeoutMillis; }
    public int getMaxFrameBytes() { return maxFrameBytes; }
    public boolean isDumpProtocol() { return dumpProtocol; }

    /**
     * @throws HybridQueueException CONFIG_CONFLICT
     */
    public void validate() throws HybridQueueException {
        if (insecure && !caCertificates.isEmpty()) {
            throw new HybridQueueException(ErrorKind.CONFIG_CONFLICT, "--insecure cannot be combined with --ca");
        }
        if (insecure && clientCertificate != null) {
            throw new HybridQueueException(ErrorKind.CONFIG_CONFLICT,
                    "--insecure cannot be combined with --client-cert");
        }
        if (port <= 0 || port > 65535) {
            throw new HybridQueueException(ErrorKind.CONFIG_CONFLICT, "Port out of range: " + port);
        }
        if (maxFrameBytes <= 0 || maxFrameBytes > FrameCodec.MAX_FRAME_BYTES) {
            throw new HybridQueueException(ErrorKind.CONFIG_CONFLICT, "Frame limit out of range: " + maxFrameBytes);
        }
    }

    public TlsSettings toTlsSettings() {
        return TlsSettings.newBuilder()
                .withKeyStore(clientCertificate, certificatePassword)
                .withCaCertificates(caCertificates)
                .withSystemTrustStore(useSystemTrustStore)
                .withHostnameVerification(verifyHostname)
                .build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DaemonConfig.DEFAULT_PORT;
        private boolean insecure = false;
        private final List<Path> caCertificates = new ArrayList<>();
        private boolean useSystemTrustStore = true;
        private Path clientCertificate;
        private String certificatePassword = "";
        private boolean verifyHostname = true;
        private int timeoutMillis = 30000;
        private int maxFrameBytes = FrameCodec.MAX_FRAME_BYTES;
        private boolean dumpProtocol = false;

        private Builder() {
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withInsecure(boolean insecure) {
            this.insecure = insecure;
            return this;
        }

        /**
         * CA certificates the daemon's certificate must chain to.
         */
        public Builder withCaCertificates(List<Path> certificates) {
            this.caCertificates.addAll(certificates);
            return this;
        }

        /**
         * Default: true
         */
        public Builder withSystemTrustStore(boolean enable) {
            this.useSystemTrustStore = enable;
            return this;
        }

        /**
         * PKCS#12 bundle presented to daemons that require client certificates.
         */
        public Builder withClientCertificate(Path bundle, String password) {
            this.clientCertificate = bundle;
            this.certificatePassword = password == null ? "" : password;
            return this;
        }

        /**
         * Default: true
         */
        public Builder withHostnameVerification(boolean enable) {
            this.verifyHostname = enable;
            return this;
        }

        /**
         * Connect and read timeout.
         * Default: 30 seconds
         */
        public Builder withTimeout(int millis) {
            this.timeoutMillis = millis;
            return this;
        }

        /**
         * Largest accepted response document.
         * Default: no limit beyond what a byte array holds
         */
        public Builder withMaxFrameBytes(int bytes) {
            this.maxFrameBytes = bytes;
            return this;
        }

        public Builder withDumpProtocol(boolean enable) {
            this.dumpProtocol = enable;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
