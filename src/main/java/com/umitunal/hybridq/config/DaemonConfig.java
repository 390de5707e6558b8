package com.umitunal.hybridq.config;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import com.umitunal.hybridq.protocol.FrameCodec;
import com.umitunal.hybridq.transport.TlsSettings;
import com.umitunal.hybridq.worker.ProcessJobRunner;

import java.net.InetAddress;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the daemon.
 */
public class DaemonConfig {
    public static final int DEFAULT_PORT = 1337;

    private final int port;
    private final InetAddress bindAddress;
    private final boolean insecure;
    private final Path serverCertificate;
    private final String certificatePassword;
    private final List<Path> caCertificates;
    private final boolean useSystemTrustStore;
    private final Path pidFile;
    private final boolean allowNotify;
    private final int retainFinished;
    private final int maxFrameBytes;
    private final int maxOutputBytes;
    private final Path workingDirectory;
    private final Map<String, Path> appKeys;
    private final boolean dumpProtocol;
    private final long pollInterval;

    private DaemonConfig(Builder builder) {
        this.port = builder.port;
        this.bindAddress = builder.bindAddress;
        this.insecure = builder.insecure;
        this.serverCertificate = builder.serverCertificate;
        this.certificatePassword = builder.certificatePassword;
        this.caCertificates = List.copyOf(builder.caCertificates);
        this.useSystemTrustStore = builder.useSystemTrustStore;
        this.pidFile = builder.pidFile;
        this.allowNotify = builder.allowNotify;
        this.retainFinished = builder.retainFinished;
        this.maxFrameBytes = builder.maxFrameBytes;
        this.maxOutputBytes = builder.maxOutputBytes;
        this.workingDirectory = builder.workingDirectory;
        this.appKeys = Map.copyOf(builder.appKeys);
        this.dumpProtocol = builder.dumpProtocol;
        this.pollInterval = builder.pollInterval;
    }

    public int getPort() { return port; }
    public InetAddress getBindAddress() { return bindAddress; }
    public boolean isInsecure() { return insecure; }
    public Path getServerCertificate() { return serverCertificate; }
    public String getCertificatePassword() { return certificatePassword; }
    public List<Path> getCaCertificates() { return caCertificates; }
    public boolean isUseSystemTrustStore() { return useSystemTrustStore; }
    public Path getPidFile() { return pidFile; }
    public boolean isAllowNotify() { return allowNotify; }
    public int getRetainFinished() { return retainFinished; }
    public int getMaxFrameBytes() { return maxFrameBytes; }
    public int getMaxOutputBytes() { return maxOutputBytes; }
    public Path getWorkingDirectory() { return workingDirectory; }
    public Map<String, Path> getAppKeys() { return appKeys; }
    public boolean isDumpProtocol() { return dumpProtocol; }
    public long getPollInterval() { return pollInterval; }

    /**
     * Reject option combinations that cannot work together. Runs before anything is bound.
     *
     * @throws HybridQueueException CONFIG_CONFLICT
     */
    public void validate() throws HybridQueueException {
        if (insecure) {
            if (!caCertificates.isEmpty()) {
                throw conflict("--insecure cannot be combined with --ca");
            }
            if (serverCertificate != null) {
                throw conflict("--insecure cannot be combined with --cert");
            }
        } else if (serverCertificate == null) {
            throw conflict("The daemon needs either --cert or --insecure");
        }
        if (port < 0 || port > 65535) {
            throw conflict("Port out of range: " + port);
        }
        if (retainFinished < 0) {
            throw conflict("Retention bound must not be negative: " + retainFinished);
        }
        if (maxFrameBytes <= 0 || maxFrameBytes > FrameCodec.MAX_FRAME_BYTES || maxOutputBytes < 0) {
            throw conflict("Frame and output limits must be positive");
        }
        if (pollInterval <= 0) {
            throw conflict("Poll interval must be positive: " + pollInterval);
        }
    }

    /**
     * TLS settings for the listening socket. Clients must present a certificate whenever
     * CA certificates are configured.
     */
    public TlsSettings toTlsSettings() {
        return TlsSettings.newBuilder()
                .withKeyStore(serverCertificate, certificatePassword)
                .withCaCertificates(caCertificates)
                .withSystemTrustStore(useSystemTrustStore)
                .withClientAuth(!caCertificates.isEmpty())
                .build();
    }

    private static HybridQueueException conflict(String message) {
        return new HybridQueueException(ErrorKind.CONFIG_CONFLICT, message);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int port = DEFAULT_PORT;
        private InetAddress bindAddress;
        private boolean insecure = false;
        private Path serverCertificate;
        private String certificatePassword = "";
        private final List<Path> caCertificates = new ArrayList<>();
        private boolean useSystemTrustStore = true;
        private Path pidFile;
        private boolean allowNotify = false;
        private int retainFinished = 0;
        private int maxFrameBytes = FrameCodec.DEFAULT_MAX_FRAME_BYTES;
        private int maxOutputBytes = ProcessJobRunner.DEFAULT_MAX_OUTPUT_BYTES;
        private Path workingDirectory;
        private final Map<String, Path> appKeys = new LinkedHashMap<>();
        private boolean dumpProtocol = false;
        private long pollInterval = 1000;

        private Builder() {
        }

        /**
         * TCP port to listen on, 0 for an ephemeral port.
         * Default: 1337
         */
        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        /**
         * Local address to listen on.
         * Default: all addresses
         */
        public Builder withBindAddress(InetAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        /**
         * Serve plain TCP instead of TLS.
         * Default: false
         */
        public Builder withInsecure(boolean insecure) {
            this.insecure = insecure;
            return this;
        }

        /**
         * PKCS#12 bundle with the server key and its full certificate chain.
         */
        public Builder withServerCertificate(Path bundle, String password) {
            this.serverCertificate = bundle;
            this.certificatePassword = password == null ? "" : password;
            return this;
        }

        /**
         * CA certificates that client certificates must chain to.
         */
        public Builder withCaCertificates(List<Path> certificates) {
            this.caCertificates.addAll(certificates);
            return this;
        }

        /**
         * Also accept clients trusted by the JVM's default trust store.
         * Default: true
         */
        public Builder withSystemTrustStore(boolean enable) {
            this.useSystemTrustStore = enable;
            return this;
        }

        public Builder withPidFile(Path pidFile) {
            this.pidFile = pidFile;
            return this;
        }

        /**
         * Allow clients to attach notify commands, which the daemon executes on its host.
         * Default: false
         */
        public Builder withNotifyCommands(boolean allow) {
            this.allowNotify = allow;
            return this;
        }

        /**
         * Number of terminated jobs kept for status queries, oldest evicted first. 0 keeps all.
         * Default: 0
         */
        public Builder withRetainFinished(int count) {
            this.retainFinished = count;
            return this;
        }

        /**
         * Largest accepted request document. Responses are not limited.
         * Default: 16 MiB
         */
        public Builder withMaxFrameBytes(int bytes) {
            this.maxFrameBytes = bytes;
            return this;
        }

        /**
         * Bytes of standard output and of standard error kept per job.
         * Default: 64 KiB
         */
        public Builder withMaxOutputBytes(int bytes) {
            this.maxOutputBytes = bytes;
            return this;
        }

        public Builder withWorkingDirectory(Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        /**
         * Restrict jobs to these executables, selected by the first token of the command line.
         */
        public Builder withAppKeys(Map<String, Path> appKeys) {
            this.appKeys.putAll(appKeys);
            return this;
        }

        /**
         * Log every request and response document at DEBUG.
         * Default: false
         */
        public Builder withDumpProtocol(boolean enable) {
            this.dumpProtocol = enable;
            return this;
        }

        /**
         * How long an idle executor sleeps before looking at the queue again.
         * Default: 1000 ms
         */
        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public DaemonConfig build() {
            return new DaemonConfig(this);
        }
    }
}
