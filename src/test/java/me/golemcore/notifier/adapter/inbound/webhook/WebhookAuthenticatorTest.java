package me.golemcore.notifier.adapter.inbound.webhook;

import me.golemcore.notifier.domain.model.AuthOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAuthenticatorTest {

    private static final String SECRET = "It's a Secret to Everybody";
    private static final byte[] BODY = "Hello, World!".getBytes(StandardCharsets.UTF_8);
    // HMAC-SHA1("It's a Secret to Everybody", "Hello, World!")
    private static final String KNOWN_SIGNATURE = "sha1=01dc10d0c83e72ed246219cdd91669667fe2ca59";

    private WebhookAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        authenticator = new WebhookAuthenticator();
    }

    @Test
    void shouldComputeKnownSignature() {
        assertEquals(KNOWN_SIGNATURE, WebhookAuthenticator.sign(SECRET, BODY));
    }

    @Test
    void shouldAcceptMatchingSignature() {
        assertEquals(AuthOutcome.ALLOWED_VERIFIED, authenticator.verify(BODY, KNOWN_SIGNATURE, SECRET));
    }

    @Test
    void shouldAllowUnsignedRequestWhenNoSecretConfigured() {
        AuthOutcome outcome = authenticator.verify(BODY, null, "");

        assertEquals(AuthOutcome.ALLOWED_UNVERIFIED, outcome);
    }

    @Test
    void shouldRejectUnsignedRequestWhenSecretConfigured() {
        assertEquals(AuthOutcome.FORBIDDEN, authenticator.verify(BODY, null, SECRET));
    }

    @Test
    void shouldReportInternalErrorWhenSignedButNoSecret() {
        AuthOutcome outcome = authenticator.verify(BODY, KNOWN_SIGNATURE, "");

        assertEquals(AuthOutcome.INTERNAL_ERROR, outcome);
    }

    @Test
    void shouldTreatBlankSecretAsUnset() {
        assertEquals(AuthOutcome.ALLOWED_UNVERIFIED, authenticator.verify(BODY, null, "   "));
        assertEquals(AuthOutcome.INTERNAL_ERROR, authenticator.verify(BODY, KNOWN_SIGNATURE, null));
    }

    @Test
    void shouldRejectWhenAnySingleBodyByteChanges() {
        for (int i = 0; i < BODY.length; i++) {
            byte[] tampered = BODY.clone();
            tampered[i] ^= 0x01;

            assertEquals(AuthOutcome.FORBIDDEN, authenticator.verify(tampered, KNOWN_SIGNATURE, SECRET),
                    "byte " + i);
        }
    }

    @Test
    void shouldRejectWhenAnySingleSignatureCharacterChanges() {
        for (int i = 0; i < KNOWN_SIGNATURE.length(); i++) {
            char[] chars = KNOWN_SIGNATURE.toCharArray();
            chars[i] = chars[i] == 'a' ? 'b' : 'a';
            String tampered = new String(chars);

            assertEquals(AuthOutcome.FORBIDDEN, authenticator.verify(BODY, tampered, SECRET), tampered);
        }
    }

    @Test
    void shouldRejectUppercaseHexSignature() {
        String upper = "sha1=" + KNOWN_SIGNATURE.substring(5).toUpperCase();

        assertEquals(AuthOutcome.FORBIDDEN, authenticator.verify(BODY, upper, SECRET));
    }

    @Test
    void shouldRejectSignatureWithoutPrefix() {
        assertEquals(AuthOutcome.FORBIDDEN, authenticator.verify(BODY, KNOWN_SIGNATURE.substring(5), SECRET));
    }

    @Test
    void shouldRejectSignatureMadeWithAnotherSecret() {
        String forged = WebhookAuthenticator.sign("another secret", BODY);

        assertEquals(AuthOutcome.FORBIDDEN, authenticator.verify(BODY, forged, SECRET));
    }

    @Test
    void shouldVerifyEmptyBody() {
        byte[] empty = new byte[0];
        String signature = WebhookAuthenticator.sign(SECRET, empty);

        assertEquals(AuthOutcome.ALLOWED_VERIFIED, authenticator.verify(empty, signature, SECRET));
    }

    @Test
    void shouldBeDeterministic() {
        assertEquals(authenticator.verify(BODY, KNOWN_SIGNATURE, SECRET),
                authenticator.verify(BODY, KNOWN_SIGNATURE, SECRET));
        assertEquals(WebhookAuthenticator.sign(SECRET, BODY), WebhookAuthenticator.sign(SECRET, BODY));
    }
}
