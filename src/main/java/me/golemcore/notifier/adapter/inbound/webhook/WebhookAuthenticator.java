/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.notifier.adapter.inbound.webhook;

import me.golemcore.notifier.domain.model.AuthOutcome;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Verifies the {@code X-Hub-Signature} header of inbound webhooks, an
 * HMAC-SHA1 of the raw request body in the form {@code sha1=<lowercase hex>}.
 *
 * <p>
 * The check has no side effects: logging and status mapping are left to the
 * caller. Comparison is constant-time.
 */
@Component
public class WebhookAuthenticator {

    static final String SIGNATURE_PREFIX = "sha1=";
    private static final String HMAC_ALGORITHM = "HmacSHA1";

    /**
     * @param rawBody
     *            request body exactly as received
     * @param signatureHeader
     *            value of the signature header, or {@code null} when absent
     * @param secret
     *            shared secret, blank when verification is disabled
     */
    public AuthOutcome verify(byte[] rawBody, String signatureHeader, String secret) {
        boolean hasSecret = secret != null && !secret.isBlank();
        if (signatureHeader == null) {
            return hasSecret ? AuthOutcome.FORBIDDEN : AuthOutcome.ALLOWED_UNVERIFIED;
        }
        if (!hasSecret) {
            return AuthOutcome.INTERNAL_ERROR;
        }

        String expected = sign(secret, rawBody);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signatureHeader.getBytes(StandardCharsets.UTF_8));
        return matches ? AuthOutcome.ALLOWED_VERIFIED : AuthOutcome.FORBIDDEN;
    }

    /**
     * Computes the header value a sender holding {@code secret} would attach to
     * {@code body}.
     */
    public static String sign(String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return SIGNATURE_PREFIX + HexFormat.of().formatHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA1 is not available", e);
        }
    }
}
