package io.mhm.core.webhook;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies Discord's {@code X-Signature-Ed25519} header over {@code timestamp + body}.
 * Every failure mode answers {@code false}.
 */
public final class Ed25519SignatureVerifier implements SignatureVerifier {
    private static final Logger LOG = LoggerFactory.getLogger(Ed25519SignatureVerifier.class);
    private static final String ALGORITHM = "Ed25519";
    private static final int PUBLIC_KEY_LENGTH = 32;
    private static final int SIGNATURE_LENGTH = 64;
    // DER prefix of a SubjectPublicKeyInfo for an Ed25519 key (OID 1.3.101.112)
    private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final PublicKey publicKey;

    public Ed25519SignatureVerifier(String publicKeyHex) {
        this.publicKey = decodePublicKey(publicKeyHex);
    }

    @Override
    public boolean verify(String signatureHex, String timestamp, byte[] rawBody) {
        if (signatureHex == null || signatureHex.isBlank() || timestamp == null || timestamp.isBlank()) {
            return false;
        }
        try {
            byte[] signatureBytes = HexFormat.of().parseHex(signatureHex.trim());
            if (signatureBytes.length != SIGNATURE_LENGTH) {
                LOG.debug("Rejecting signature of {} bytes", signatureBytes.length);
                return false;
            }
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(timestamp.getBytes(StandardCharsets.UTF_8));
            signature.update(rawBody == null ? new byte[0] : rawBody);
            return signature.verify(signatureBytes);
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejecting malformed signature header: {}", e.getMessage());
            return false;
        } catch (SignatureException e) {
            LOG.debug("Rejecting undecodable signature: {}", e.getMessage());
            return false;
        } catch (GeneralSecurityException e) {
            LOG.error("Error verifying webhook signature", e);
            return false;
        }
    }

    private static PublicKey decodePublicKey(String publicKeyHex) {
        byte[] raw;
        try {
            raw = HexFormat.of().parseHex(publicKeyHex.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Discord public key must be hex encoded", e);
        }
        if (raw.length != PUBLIC_KEY_LENGTH) {
            throw new IllegalArgumentException("Discord public key must be " + PUBLIC_KEY_LENGTH + " bytes, got " + raw.length);
        }
        byte[] encoded = new byte[X509_PREFIX.length + raw.length];
        System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
        System.arraycopy(raw, 0, encoded, X509_PREFIX.length, raw.length);
        try {
            return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to load Discord public key", e);
        }
    }
}
