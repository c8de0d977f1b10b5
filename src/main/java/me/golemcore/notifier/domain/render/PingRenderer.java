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

package me.golemcore.notifier.domain.render;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.notifier.domain.model.EventType;
import me.golemcore.notifier.domain.model.RenderResult;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the {@code ping} event a provider sends when a hook is created.
 *
 * <p>
 * Optionally adds a second line identifying this process, which helps telling
 * several deployments apart when they share a channel.
 */
@Component
public class PingRenderer implements EventRenderer {

    static final String UNKNOWN_TARGET = "?UNKNOWN?";

    private final String providerName;
    private final String runtimeLine;

    public PingRenderer(NotifierProperties properties,
            @Value("${spring.application.name:golemcore-irc-notifier}") String applicationName) {
        NotifierProperties.WebhookProperties webhook = properties.getWebhook();
        this.providerName = webhook.getProviderName();
        this.runtimeLine = webhook.isAnnounceRuntime() ? describeRuntime(applicationName) : null;
    }

    @Override
    public EventType getEventType() {
        return EventType.PING;
    }

    @Override
    public RenderResult render(JsonNode payload) {
        String target = PayloadReader.optionalText(payload, "organization.login")
                .or(() -> PayloadReader.optionalText(payload, "repository.full_name"))
                .orElse(UNKNOWN_TARGET);

        List<String> lines = new ArrayList<>();
        lines.add(IrcFormatting.bold(providerName) + " has pinged " + target);
        if (runtimeLine != null) {
            lines.add(runtimeLine);
        }
        return RenderResult.lines(lines);
    }

    static String describeRuntime(String applicationName) {
        return "I'm " + applicationName + ", running on "
                + System.getProperty("os.name") + " " + System.getProperty("os.version")
                + " (" + System.getProperty("os.arch") + ")"
                + " Java/" + System.getProperty("java.version");
    }
}
