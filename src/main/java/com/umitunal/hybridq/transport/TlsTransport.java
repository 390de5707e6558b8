package com.umitunal.hybridq.transport;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * TCP wrapped in TLS. Peers are verified against the configured CA certificates
 * and, unless disabled, the JVM's default trust store.
 */
public class TlsTransport implements Transport {
    private static final Logger LOG = LogManager.getLogger(TlsTransport.class);

    private final SSLContext context;
    private final TlsSettings settings;

    private TlsTransport(SSLContext context, TlsSettings settings) {
        this.context = context;
        this.settings = settings;
    }

    /**
     * Load key and trust material and build the TLS context.
     *
     * @throws HybridQueueException TLS_ERROR if a key store or certificate cannot be loaded
     */
    public static TlsTransport create(TlsSettings settings) throws HybridQueueException {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagers(settings), new TrustManager[]{trustManager(settings)}, null);
            return new TlsTransport(context, settings);
        } catch (IOException | GeneralSecurityException e) {
            throw new HybridQueueException(ErrorKind.TLS_ERROR, "Cannot set up TLS: " + e.getMessage(), e);
        }
    }

    @Override
    public ServerSocket bind(InetAddress address, int port) throws IOException {
        SSLServerSocket serverSocket = (SSLServerSocket) context.getServerSocketFactory().createServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.setNeedClientAuth(settings.isRequireClientAuth());
        serverSocket.bind(new InetSocketAddress(address, port), PlainTransport.BACKLOG);
        return serverSocket;
    }

    @Override
    public void accept(Socket socket) throws HybridQueueException {
        try {
            ((SSLSocket) socket).startHandshake();
        } catch (IOException e) {
            throw new HybridQueueException(ErrorKind.TLS_ERROR,
                    "TLS handshake with " + socket.getRemoteSocketAddress() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Socket connect(String host, int port, int timeoutMillis) throws IOException, HybridQueueException {
        Socket plain = new Socket();
        plain.connect(new InetSocketAddress(host, port), timeoutMillis);
        plain.setSoTimeout(timeoutMillis);

        SSLSocket socket = (SSLSocket) context.getSocketFactory().createSocket(plain, host, port, true);
        socket.setUseClientMode(true);
        if (settings.isVerifyHostname()) {
            SSLParameters parameters = socket.getSSLParameters();
            parameters.setEndpointIdentificationAlgorithm("HTTPS");
            socket.setSSLParameters(parameters);
        }

        try {
            socket.startHandshake();
        } catch (IOException e) {
            socket.close();
            throw new HybridQueueException(ErrorKind.TLS_ERROR,
                    "TLS handshake with " + host + ":" + port + " failed: " + e.getMessage(), e);
        }
        return socket;
    }

    @Override
    public boolean isSecure() {
        return true;
    }

    @Override
    public String toString() {
        return "TLS (client auth " + (settings.isRequireClientAuth() ? "required" : "not required") + ")";
    }

    private static KeyManager[] keyManagers(TlsSettings settings) throws IOException, GeneralSecurityException {
        if (settings.getKeyStore() == null) {
            return null;
        }
        char[] password = settings.getKeyStorePassword().toCharArray();
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        try (InputStream in = Files.newInputStream(settings.getKeyStore())) {
            keyStore.load(in, password);
        }
        KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        factory.init(keyStore, password);
        return factory.getKeyManagers();
    }

    private static X509TrustManager trustManager(TlsSettings settings) throws IOException, GeneralSecurityException {
        List<X509TrustManager> delegates = new ArrayList<>();

        if (!settings.getCaCertificates().isEmpty()) {
            KeyStore anchors = KeyStore.getInstance(KeyStore.getDefaultType());
            anchors.load(null, null);
            CertificateFactory certificates = CertificateFactory.getInstance("X.509");
            int index = 0;
            for (Path path : settings.getCaCertificates()) {
                try (InputStream in = Files.newInputStream(path)) {
                    Collection<? extends Certificate> loaded = certificates.generateCertificates(in);
                    if (loaded.isEmpty()) {
                        throw new GeneralSecurityException("No certificate found in " + path);
                    }
                    for (Certificate certificate : loaded) {
                        anchors.setCertificateEntry("ca-" + index++, certificate);
                    }
                }
                LOG.debug("Loaded CA certificates from {}", path);
            }
            delegates.add(x509TrustManager(anchors));
        }

        if (settings.isUseSystemTrustStore()) {
            delegates.add(x509TrustManager(null));
        }

        if (delegates.isEmpty()) {
            throw new GeneralSecurityException("No trust anchors: give CA certificates or enable the system trust store");
        }
        return new CompositeTrustManager(delegates);
    }

    private static X509TrustManager x509TrustManager(KeyStore anchors) throws GeneralSecurityException {
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(anchors);
        for (TrustManager manager : factory.getTrustManagers()) {
            if (manager instanceof X509TrustManager) {
                return (X509TrustManager) manager;
            }
        }
        throw new GeneralSecurityException("No X509TrustManager available");
    }
}
