package com.umitunal.hybridq.transport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Key and trust material for a TLS endpoint.
 */
public class TlsSettings {
    private final Path keyStore;
    private final String keyStorePassword;
    private final List<Path> caCertificates;
    private final boolean useSystemTrustStore;
    private final boolean requireClientAuth;
    private final boolean verifyHostname;

    private TlsSettings(Builder builder) {
        this.keyStore = builder.keyStore;
        this.keyStorePassword = builder.keyStorePassword;
        this.caCertificates = List.copyOf(builder.caCertificates);
        this.useSystemTrustStore = builder.useSystemTrustStore;
        this.requireClientAuth = builder.requireClientAuth;
        this.verifyHostname = builder.verifyHostname;
    }

    public Path getKeyStore() { return keyStore; }
    public String getKeyStorePassword() { return keyStorePassword; }
    public List<Path> getCaCertificates() { return caCertificates; }
    public boolean isUseSystemTrustStore() { return useSystemTrustStore; }
    public boolean isRequireClientAuth() { return requireClientAuth; }
    public boolean isVerifyHostname() { return verifyHostname; }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Path keyStore;
        private String keyStorePassword = "";
        private final List<Path> caCertificates = new ArrayList<>();
        private boolean useSystemTrustStore = true;
        private boolean requireClientAuth = false;
        private boolean verifyHostname = true;

        private Builder() {
        }

        /**
         * PKCS#12 bundle holding this endpoint's private key and its full certificate chain.
         */
        public Builder withKeyStore(Path keyStore, String password) {
            this.keyStore = keyStore;
            this.keyStorePassword = password == null ? "" : password;
            return this;
        }

        /**
         * Add PEM or DER files with CA certificates trusted for the peer.
         */
        public Builder withCaCertificates(List<Path> caCertificates) {
            this.caCertificates.addAll(caCertificates);
            return this;
        }

        /**
         * Also trust the JVM's default trust store.
         * Default: true
         */
        public Builder withSystemTrustStore(boolean enable) {
            this.useSystemTrustStore = enable;
            return this;
        }

        /**
         * Server side: refuse peers that present no trusted certificate.
         * Default: false
         */
        public Builder withClientAuth(boolean require) {
            this.requireClientAuth = require;
            return this;
        }

        /**
         * Client side: check the server certificate against the host name.
         * Default: true
         */
        public Builder withHostnameVerification(boolean enable) {
            this.verifyHostname = enable;
            return this;
        }

        public TlsSettings build() {
            return new TlsSettings(this);
        }
    }
}
