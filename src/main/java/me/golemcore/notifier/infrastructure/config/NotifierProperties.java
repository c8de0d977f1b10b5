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

package me.golemcore.notifier.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Centralized configuration properties for the notifier, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code notifier.*} prefix:
 * <ul>
 * <li>{@link WebhookProperties} - inbound HTTP endpoint and signature
 * verification</li>
 * <li>{@link IrcProperties} - IRC server, identity, channels and connection
 * timers</li>
 * <li>{@link RenderProperties} - limits applied while rendering events</li>
 * </ul>
 *
 * <p>
 * The bound values are treated as a read-only snapshot for the lifetime of the
 * process.
 */
@Component
@ConfigurationProperties(prefix = "notifier")
@Data
public class NotifierProperties {

    private WebhookProperties webhook = new WebhookProperties();
    private IrcProperties irc = new IrcProperties();
    private RenderProperties render = new RenderProperties();

    // ==================== WEBHOOK ====================

    @Data
    public static class WebhookProperties {
        private String path = "/api/hooks/github";
        private String eventHeader = "X-GitHub-Event";
        private String signatureHeader = "X-Hub-Signature";

        /**
         * Shared HMAC secret. When blank, unsigned requests are accepted with a
         * warning and signed requests are rejected.
         */
        private String secret = "";

        /** Name used when announcing pings, e.g. "GitHub has pinged acme". */
        private String providerName = "GitHub";

        /** Append a line describing this process to ping notifications. */
        private boolean announceRuntime = true;

        /** Upper bound for delivering one rendered event. */
        private Duration handlingTimeout = Duration.ofSeconds(5);
    }

    // ==================== IRC ====================

    @Data
    public static class IrcProperties {
        private String host = "localhost";
        private int port = 6667;
        private String nickname = "Golem";
        private String login = "golem";
        private String realName = "GolemCore IRC notifier";

        /** Whitespace-separated channel list. */
        private String channels = "#notifications";

        /** Send notifications as NOTICE instead of PRIVMSG. */
        private boolean useNotice = false;

        private boolean connectOnStartup = true;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration joinTimeout = Duration.ofSeconds(5);
        private Duration livenessTimeout = Duration.ofSeconds(5);
        private Duration reconnectDelay = Duration.ofSeconds(1);
        private Duration quitTimeout = Duration.ofSeconds(2);
        private String quitMessage = "Shutting down";

        /** Outgoing flood-protection delay between lines. */
        private Duration messageDelay = Duration.ofMillis(200);

        public List<String> getChannelList() {
            if (channels == null || channels.isBlank()) {
                return List.of();
            }
            return Arrays.stream(channels.trim().split("\\s+"))
                    .distinct()
                    .toList();
        }
    }

    // ==================== RENDER ====================

    @Data
    public static class RenderProperties {
        /**
         * Pushes with more commits than this only produce the summary line.
         */
        private int maxCommitsPerEvent = 3;

        /** Lines longer than this many UTF-8 bytes are cut. */
        private int maxLineLength = 400;
    }
}
