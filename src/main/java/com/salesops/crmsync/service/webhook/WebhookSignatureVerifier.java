package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.AuthenticationException;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies the HMAC-SHA256 signature the CRM sends with each webhook delivery. The signature is
 * the hex digest of the raw body keyed with the shared secret.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final CrmSyncProperties properties;

    public WebhookSignatureVerifier(CrmSyncProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws AuthenticationException if the signature is missing, no secret is configured or
     *                                 the signature does not match
     */
    public void verify(byte[] body, String signature) {
        if (signature == null || signature.isBlank()) {
            throw new AuthenticationException("Missing webhook signature");
        }
        String expected = sign(body);
        byte[] expectedBytes = expected.getBytes(StandardCharsets.US_ASCII);
        byte[] actualBytes = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expectedBytes, actualBytes)) {
            throw new AuthenticationException("Invalid webhook signature");
        }
    }

    public String sign(byte[] body) {
        String secret = properties.getWebhook().getSecret();
        if (secret == null || secret.isEmpty()) {
            throw new AuthenticationException("Webhook secret is not configured");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }
}
