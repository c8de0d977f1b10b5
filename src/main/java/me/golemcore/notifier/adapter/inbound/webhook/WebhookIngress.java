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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.notifier.domain.model.AuthOutcome;
import me.golemcore.notifier.domain.model.DeliveryReport;
import me.golemcore.notifier.domain.model.EventType;
import me.golemcore.notifier.domain.model.InboundEvent;
import me.golemcore.notifier.domain.model.RenderResult;
import me.golemcore.notifier.domain.service.EventDispatcher;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import me.golemcore.notifier.port.outbound.NotificationPort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one raw webhook request into an HTTP status.
 *
 * <p>
 * Checks run in this order, the first failure deciding the status:
 * <ol>
 * <li>method is POST, otherwise 405</li>
 * <li>content type is JSON, otherwise 400</li>
 * <li>event header is present, otherwise 400</li>
 * <li>signature verifies, otherwise 403 (500 when a signature arrives but no
 * secret is configured)</li>
 * <li>body parses as a JSON object, otherwise 400</li>
 * <li>a renderer exists, otherwise 501</li>
 * </ol>
 * Rendered lines are delivered synchronously; 202 is returned once delivery
 * finished, even partially. Waiting past the configured timeouts yields 504.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookIngress {

    private final NotifierProperties properties;
    private final WebhookAuthenticator authenticator;
    private final EventDispatcher dispatcher;
    private final NotificationPort notificationPort;
    private final ObjectMapper objectMapper;

    public HttpStatus handle(HttpMethod method, HttpHeaders headers, byte[] rawBody) {
        try {
            return process(method, headers, rawBody != null ? rawBody : new byte[0]);
        } catch (TimeoutException e) {
            log.error("[Webhook] Timed out handling event: {}", e.getMessage());
            return HttpStatus.GATEWAY_TIMEOUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[Webhook] Interrupted while handling event");
            return HttpStatus.INTERNAL_SERVER_ERROR;
        } catch (Exception e) {
            log.error("[Webhook] Failed to handle event", e);
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private HttpStatus process(HttpMethod method, HttpHeaders headers, byte[] rawBody)
            throws ExecutionException, InterruptedException, TimeoutException {
        NotifierProperties.WebhookProperties config = properties.getWebhook();

        if (!HttpMethod.POST.equals(method)) {
            log.warn("[Webhook] Rejected {} request", method);
            return HttpStatus.METHOD_NOT_ALLOWED;
        }

        if (!isJson(headers)) {
            log.error("[Webhook] Invalid Content-Type '{}'", headers.getFirst(HttpHeaders.CONTENT_TYPE));
            return HttpStatus.BAD_REQUEST;
        }

        String rawType = headers.getFirst(config.getEventHeader());
        if (rawType == null || rawType.isBlank()) {
            log.error("[Webhook] Missing {} header", config.getEventHeader());
            return HttpStatus.BAD_REQUEST;
        }

        String signature = headers.getFirst(config.getSignatureHeader());
        AuthOutcome outcome = authenticator.verify(rawBody, signature, config.getSecret());
        switch (outcome) {
        case FORBIDDEN -> {
            log.error("[Webhook] Signature check failed for '{}' event", rawType);
            return HttpStatus.FORBIDDEN;
        }
        case INTERNAL_ERROR -> {
            log.error("[Webhook] Got {} but no secret is configured", config.getSignatureHeader());
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        case ALLOWED_UNVERIFIED -> log.warn("[Webhook] No secret configured, accepting unsigned '{}' event", rawType);
        case ALLOWED_VERIFIED -> log.debug("[Webhook] Signature verified for '{}' event", rawType);
        }

        JsonNode payload = parse(rawBody);
        if (payload == null) {
            return HttpStatus.BAD_REQUEST;
        }

        InboundEvent event = new InboundEvent(EventType.fromHeader(rawType), rawType, rawBody, signature, payload);
        RenderResult result = dispatcher.dispatch(event.type(), event.payload());
        return switch (result.getKind()) {
        case UNSUPPORTED -> {
            log.warn("[Webhook] Unhandled event '{}': {}", rawType, result.getReason());
            yield HttpStatus.NOT_IMPLEMENTED;
        }
        case SKIPPED -> {
            log.info("[Webhook] Ignoring '{}' event: {}", rawType, result.getReason());
            yield HttpStatus.ACCEPTED;
        }
        case LINES -> deliver(event, result);
        };
    }

    private HttpStatus deliver(InboundEvent event, RenderResult result)
            throws ExecutionException, InterruptedException, TimeoutException {
        Duration connectTimeout = properties.getIrc().getConnectTimeout();
        Duration handlingTimeout = properties.getWebhook().getHandlingTimeout();

        notificationPort.ensureConnected().get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        DeliveryReport report = notificationPort.deliver(result.getLines())
                .get(handlingTimeout.toMillis(), TimeUnit.MILLISECONDS);

        if (report.isEmpty()) {
            log.warn("[Webhook] '{}' event not relayed, no IRC channels configured", event.rawType());
        } else if (report.isComplete()) {
            log.info("[Webhook] Relayed '{}' event ({} line(s)) to {}", event.rawType(), result.getLines().size(),
                    report.delivered());
        } else {
            log.warn("[Webhook] '{}' event only partially relayed, failed: {}", event.rawType(), report.failed());
        }
        return HttpStatus.ACCEPTED;
    }

    private boolean isJson(HttpHeaders headers) {
        try {
            MediaType contentType = headers.getContentType();
            return contentType != null && (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                    || contentType.getSubtype().endsWith("+json"));
        } catch (InvalidMediaTypeException e) {
            log.debug("[Webhook] Unparseable Content-Type: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode parse(byte[] rawBody) {
        try {
            JsonNode node = objectMapper.readTree(rawBody);
            if (node == null || !node.isObject()) {
                log.error("[Webhook] Event body is not a JSON object");
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            log.error("[Webhook] Unable to parse event JSON: {}", e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.error("[Webhook] Unable to read event JSON: {}", e.getMessage());
            return null;
        }
    }
}
