package io.mhm.core.webhook;

public interface SignatureVerifier {
    boolean verify(String signatureHex, String timestamp, byte[] rawBody);

    static SignatureVerifier create(String publicKeyHex, boolean allowUnsigned) {
        if (publicKeyHex != null && !publicKeyHex.isBlank()) {
            return new Ed25519SignatureVerifier(publicKeyHex);
        }
        if (allowUnsigned) {
            return new InsecurePassthroughVerifier();
        }
        throw new IllegalStateException(
            "No Discord public key configured. Set DISCORD_PUBLIC_KEY, or enable allowUnsignedRequests for local development only."
        );
    }
}
