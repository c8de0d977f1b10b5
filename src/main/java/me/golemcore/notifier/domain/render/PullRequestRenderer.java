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

import static me.golemcore.notifier.domain.render.PayloadReader.requireBoolean;
import static me.golemcore.notifier.domain.render.PayloadReader.requireLong;
import static me.golemcore.notifier.domain.render.PayloadReader.requireText;

/**
 * Renders {@code pull_request} events for open, close/merge, reopen and
 * ready-for-review.
 */
@Component
public class PullRequestRenderer implements EventRenderer {

    @Override
    public EventType getEventType() {
        return EventType.PULL_REQUEST;
    }

    @Override
    public RenderResult render(JsonNode payload) {
        String action = requireText(payload, "action");
        String phrase = switch (action) {
        case "opened" -> "opened " + describe(payload);
        case "closed" -> (requireBoolean(payload, "pull_request.merged") ? "merged " : "closed ")
                + describe(payload);
        case "ready_for_review" -> "marked " + describe(payload) + " ready for review";
        case "reopened" -> "reopened " + describe(payload);
        default -> null;
        };
        if (phrase == null) {
            return RenderResult.skipped("pull request action '" + action + "'");
        }

        String line = IrcFormatting.bold(requireText(payload, "sender.login"))
                + " has " + phrase
                + " on " + requireText(payload, "repository.full_name")
                + ": " + requireText(payload, "pull_request.html_url");
        return RenderResult.lines(line);
    }

    private String describe(JsonNode payload) {
        return "pull request #" + requireLong(payload, "number")
                + " (" + requireText(payload, "pull_request.title") + ")";
    }
}
