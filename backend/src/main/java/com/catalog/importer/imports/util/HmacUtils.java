package com.catalog.importer.imports.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

public final class HmacUtils {
    private static final String ALGORITHM = "HmacSHA256";

    private HmacUtils() {
    }

    public static String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] hash = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("HmacSHA256 algorithm not available", e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException("Unusable webhook secret", e);
        }
    }

    /**
     * Header value for {@code X-Webhook-Signature}.
     */
    public static String signatureHeader(String secret, String payload) {
        return "sha256=" + hmacSha256Hex(secret, payload);
    }
}
