package org.paycron.nodes.lnd;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import java.util.HexFormat;

/**
 * TLS and macaroon material for talking to LND. LND serves a self-signed
 * certificate, so it is trusted explicitly instead of through the JDK trust store.
 */
public final class LndTls {
    private LndTls() {}

    /** SSL context that trusts exactly the certificate(s) in the given PEM file. */
    public static SSLContext sslContext(Path certPath) throws IOException, GeneralSecurityException {
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        Collection<? extends Certificate> certs;
        try (InputStream in = Files.newInputStream(certPath)) {
            certs = factory.generateCertificates(in);
        }
        if (certs.isEmpty()) {
            throw new GeneralSecurityException("No certificate found in " + certPath);
        }

        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        int i = 0;
        for (Certificate cert : certs) {
            trustStore.setCertificateEntry("lnd-" + i++, cert);
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);

        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, tmf.getTrustManagers(), null);
        return context;
    }

    /** Macaroon file bytes, hex encoded as LND's REST gateway expects them. */
    public static String macaroonHex(Path macaroonPath) throws IOException {
        return HexFormat.of().formatHex(Files.readAllBytes(macaroonPath));
    }
}
