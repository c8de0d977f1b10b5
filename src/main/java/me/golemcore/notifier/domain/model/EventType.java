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

import java.util.Arrays;

/**
 * Webhook event kinds that have a renderer, plus {@link #UNKNOWN} for
 * everything else.
 */
public enum EventType {

    ISSUES("issues"),

    PING("ping"),

    PULL_REQUEST("pull_request"),

    PUSH("push"),

    /**
     * Any event name without a renderer. Always dispatched as unsupported.
     */
    UNKNOWN("");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves the value of the event header. Matching is exact, as the provider
     * always sends lower-case names.
     */
    public static EventType fromHeader(String header) {
        if (header == null || header.isBlank()) {
            return UNKNOWN;
        }
        String name = header.trim();
        return Arrays.stream(values())
                .filter(type -> type != UNKNOWN && type.wireName.equals(name))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
