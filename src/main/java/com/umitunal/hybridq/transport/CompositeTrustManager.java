package com.umitunal.hybridq.transport;

import javax.net.ssl.X509TrustManager;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Trusts a chain if any delegate trusts it. Combines the configured CA set with the system store.
 */
public class CompositeTrustManager implements X509TrustManager {
    private final List<X509TrustManager> delegates;

    public CompositeTrustManager(List<X509TrustManager> delegates) {
        if (delegates.isEmpty()) {
            throw new IllegalArgumentException("At least one trust manager is required");
        }
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        CertificateException last = null;
        for (X509TrustManager delegate : delegates) {
            try {
                delegate.checkClientTrusted(chain, authType);
                return;
            } catch (CertificateException e) {
                last = e;
            }
        }
        throw last;
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
        CertificateException last = null;
        for (X509TrustManager delegate : delegates) {
            try {
                delegate.checkServerTrusted(chain, authType);
                return;
            } catch (CertificateException e) {
                last = e;
            }
        }
        throw last;
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return delegates.stream()
                .flatMap(delegate -> List.of(delegate.getAcceptedIssuers()).stream())
                .toArray(X509Certificate[]::new);
    }
}
