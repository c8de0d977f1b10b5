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

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Inbound HTTP endpoint for repository webhooks (WebFlux).
 *
 * <p>
 * Mapped for every HTTP method so that {@link WebhookIngress} can answer 405
 * itself. Accepted requests get an empty body, rejected ones a filler phrase.
 * Handling blocks until the notification is delivered, so it runs on the
 * bounded elastic scheduler rather than the event loop.
 */
@RestController
@RequestMapping("${notifier.webhook.path:/api/hooks/github}")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookIngress ingress;

    @RequestMapping
    public Mono<ResponseEntity<String>> receive(
            HttpMethod method,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {

        return Mono.fromCallable(() -> ingress.handle(method, headers, body))
                .subscribeOn(Schedulers.boundedElastic())
                .map(WebhookController::toResponse);
    }

    static ResponseEntity<String> toResponse(HttpStatus status) {
        if (status.is2xxSuccessful()) {
            return ResponseEntity.status(status).build();
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(FillerText.random());
    }
}
