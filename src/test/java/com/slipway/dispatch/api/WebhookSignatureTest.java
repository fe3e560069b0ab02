package com.slipway.dispatch.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureTest {

    private static final byte[] BODY = "{\"ref\":\"refs/heads/main\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("matches GitHub's documented HMAC-SHA256 example")
    void knownVector() {
        // Example from GitHub's webhook validation docs
        String signature = WebhookSignature.sign("It's a Secret to Everybody",
                "Hello, World!".getBytes(StandardCharsets.UTF_8));

        assertEquals("sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17", signature);
    }

    @Test
    @DisplayName("accepts its own signature, case-insensitively")
    void verifiesOwnSignature() {
        String signature = WebhookSignature.sign("s3cret", BODY);

        assertTrue(WebhookSignature.verify("s3cret", BODY, signature));
        assertTrue(WebhookSignature.verify("s3cret", BODY, "sha256=" + signature.substring(7).toUpperCase()));
    }

    @Test
    @DisplayName("rejects wrong secrets, tampered bodies and malformed headers")
    void rejects() {
        String signature = WebhookSignature.sign("s3cret", BODY);

        assertFalse(WebhookSignature.verify("other", BODY, signature));
        assertFalse(WebhookSignature.verify("s3cret", "{}".getBytes(StandardCharsets.UTF_8), signature));
        assertFalse(WebhookSignature.verify("s3cret", BODY, null));
        assertFalse(WebhookSignature.verify("s3cret", BODY, signature.substring(7)));
    }
}
