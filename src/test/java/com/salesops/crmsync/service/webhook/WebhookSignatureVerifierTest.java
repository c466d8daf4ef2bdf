package com.salesops.crmsync.service.webhook;

import com.salesops.crmsync.config.CrmSyncProperties;
import com.salesops.crmsync.exception.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WebhookSignatureVerifier Tests")
class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"module\":\"Contacts\",\"operation\":\"update\",\"record_id\":\"42\"}"
            .getBytes(StandardCharsets.UTF_8);

    private CrmSyncProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new CrmSyncProperties();
        properties.getWebhook().setSecret("s3cret");
        verifier = new WebhookSignatureVerifier(properties);
    }

    @Test
    @DisplayName("Should produce lowercase hex HMAC-SHA256")
    void shouldSignAsLowercaseHex() {
        // Known answer for HMAC-SHA256 with key "key"
        properties.getWebhook().setSecret("key");

        String signature = verifier.sign("The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8));

        assertThat(signature).isEqualTo("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
    }

    @Test
    @DisplayName("Should accept a matching signature regardless of case")
    void shouldAcceptMatchingSignature() {
        String signature = verifier.sign(BODY);

        assertThatCode(() -> verifier.verify(BODY, signature)).doesNotThrowAnyException();
        assertThatCode(() -> verifier.verify(BODY, signature.toUpperCase())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject a signature over a different body")
    void shouldRejectTamperedBody() {
        String signature = verifier.sign(BODY);
        byte[] tampered = "{\"module\":\"Contacts\",\"operation\":\"delete\",\"record_id\":\"42\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> verifier.verify(tampered, signature))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("Invalid");
    }

    @Test
    @DisplayName("Should reject a missing signature")
    void shouldRejectMissingSignature() {
        assertThatThrownBy(() -> verifier.verify(BODY, null)).isInstanceOf(AuthenticationException.class);
        assertThatThrownBy(() -> verifier.verify(BODY, "  ")).isInstanceOf(AuthenticationException.class);
    }

    @Test
    @DisplayName("Should reject everything when no secret is configured")
    void shouldRejectWithoutSecret() {
        properties.getWebhook().setSecret("");

        assertThatThrownBy(() -> verifier.verify(BODY, "abcdef"))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("secret");
    }
}
