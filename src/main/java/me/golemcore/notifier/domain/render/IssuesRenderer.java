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
import org.springframework.stereotype.Component;

import java.util.Set;

import static me.golemcore.notifier.domain.render.PayloadReader.requireLong;
import static me.golemcore.notifier.domain.render.PayloadReader.requireText;

/**
 * Renders {@code issues} events. Only lifecycle actions are announced; label,
 * assignment and edit noise is skipped.
 */
@Component
public class IssuesRenderer implements EventRenderer {

    private static final Set<String> NOTABLE_ACTIONS = Set.of("opened", "deleted", "closed", "reopened");

    @Override
    public EventType getEventType() {
        return EventType.ISSUES;
    }

    @Override
    public RenderResult render(JsonNode payload) {
        String action = requireText(payload, "action");
        if (!NOTABLE_ACTIONS.contains(action)) {
            return RenderResult.skipped("issue action '" + action + "'");
        }

        String line = IrcFormatting.bold(requireText(payload, "sender.login"))
                + " has " + action
                + " issue #" + requireLong(payload, "issue.number")
                + " (" + requireText(payload, "issue.title") + ")"
                + " on " + requireText(payload, "repository.full_name")
                + ": " + requireText(payload, "issue.html_url");
        return RenderResult.lines(line);
    }
}
