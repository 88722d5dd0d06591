package io.mhm.core.webhook;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Signs webhook bodies the way Discord does, for tests.
 */
public final class RequestSigner {
    private final KeyPair keyPair;

    private RequestSigner(KeyPair keyPair) {
        this.keyPair = keyPair;
    }

    public static RequestSigner generate() throws GeneralSecurityException {
        return new RequestSigner(KeyPairGenerator.getInstance("Ed25519").generateKeyPair());
    }

    public String publicKeyHex() {
        byte[] encoded = keyPair.getPublic().getEncoded();
        // raw key is the tail of the X.509 SubjectPublicKeyInfo
        return HexFormat.of().formatHex(Arrays.copyOfRange(encoded, encoded.length - 32, encoded.length));
    }

    public String sign(String timestamp, byte[] body) throws GeneralSecurityException {
        Signature signature = Signature.getInstance("Ed25519");
        signature.initSign(keyPair.getPrivate());
        signature.update(timestamp.getBytes(StandardCharsets.UTF_8));
        signature.update(body);
        return HexFormat.of().formatHex(signature.sign());
    }

    public String sign(String timestamp, String body) throws GeneralSecurityException {
        return sign(timestamp, body.getBytes(StandardCharsets.UTF_8));
    }
}
