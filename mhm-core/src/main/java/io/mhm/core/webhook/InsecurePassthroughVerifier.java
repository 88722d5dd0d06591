package io.mhm.core.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local-development verifier that accepts any request carrying both signature headers.
 * Only reachable when unsigned requests were explicitly allowed in configuration.
 */
public final class InsecurePassthroughVerifier implements SignatureVerifier {
    private static final Logger LOG = LoggerFactory.getLogger(InsecurePassthroughVerifier.class);

    public InsecurePassthroughVerifier() {
        LOG.warn("*** Webhook signature verification is DISABLED: no Discord public key configured. Do not run this in production. ***");
    }

    @Override
    public boolean verify(String signatureHex, String timestamp, byte[] rawBody) {
        if (signatureHex == null || signatureHex.isBlank() || timestamp == null || timestamp.isBlank()) {
            return false;
        }
        LOG.warn("Accepting webhook without signature verification (insecure development mode)");
        return true;
    }
}
