package io.hermes.server.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 over a fixed key, with URL-safe base64 encoding of the result.
 */
final class HmacSha256 {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecretKeySpec key;

    HmacSha256(byte[] secret) {
        if (secret.length == 0) {
            throw new IllegalArgumentException("HMAC secret may not be empty");
        }
        this.key = new SecretKeySpec(secret.clone(), ALGORITHM);
    }

    /**
     * Uses the UTF-8 bytes of {@code secret}, or a random key when it is blank.
     */
    static HmacSha256 fromSecret(String secret) {
        if (secret.isBlank()) {
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            return new HmacSha256(random);
        }
        return new HmacSha256(secret.getBytes(StandardCharsets.UTF_8));
    }

    byte[] mac(byte[] data) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(data);
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every JDK
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    String sign(byte[] data) {
        return ENCODER.encodeToString(mac(data));
    }

    boolean verify(byte[] data, String signature) {
        byte[] expected = ENCODER.encode(mac(data));
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII));
    }
}
