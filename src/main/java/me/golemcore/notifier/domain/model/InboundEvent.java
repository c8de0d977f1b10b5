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

package me.golemcore.notifier.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single webhook delivery as received over HTTP.
 *
 * <p>
 * {@code payload} must only be read after the raw body passed signature
 * verification, or verification was disabled by configuration.
 *
 * @param type
 *            resolved event kind
 * @param rawType
 *            event header value as sent by the provider
 * @param rawBody
 *            request body exactly as received, used for HMAC verification
 * @param signature
 *            signature header value, {@code null} when absent
 * @param payload
 *            parsed JSON body
 */
public record InboundEvent(EventType type, String rawType, byte[] rawBody, String signature, JsonNode payload) {
}
