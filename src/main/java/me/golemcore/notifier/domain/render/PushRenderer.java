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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.notifier.domain.model.EventType;
import me.golemcore.notifier.domain.model.RenderResult;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static me.golemcore.notifier.domain.render.PayloadReader.requireArray;
import static me.golemcore.notifier.domain.render.PayloadReader.requireBoolean;
import static me.golemcore.notifier.domain.render.PayloadReader.requireText;

/**
 * Renders {@code push} events for branches and tags.
 *
 * <p>
 * Branch pushes produce a summary line followed by one line per commit, unless
 * the push carries more commits than
 * {@code notifier.render.max-commits-per-event}, in which case only the summary
 * is sent. Deletions and tag pushes produce a single line.
 */
@Component
@Slf4j
public class PushRenderer implements EventRenderer {

    /** Rolling tag moved by the nightly build on every successful run. */
    static final String NIGHTLY_TAG = "last-successful";

    private static final int SHORT_SHA_LENGTH = 7;

    private final int maxCommitsPerEvent;

    public PushRenderer(NotifierProperties properties) {
        this.maxCommitsPerEvent = Math.max(0, properties.getRender().getMaxCommitsPerEvent());
    }

    @Override
    public EventType getEventType() {
        return EventType.PUSH;
    }

    @Override
    public RenderResult render(JsonNode payload) {
        String rawRef = requireText(payload, "ref");
        PushRef ref = PushRef.parse(rawRef);
        if (!ref.isParsed()) {
            log.warn("[Render] Unexpected ref in push event: '{}'", rawRef);
        }

        if (ref.isTag() && NIGHTLY_TAG.equals(ref.name())) {
            return RenderResult.skipped("nightly tag");
        }

        String actor = IrcFormatting.bold(requireText(payload, "sender.login"));
        String repository = requireText(payload, "repository.full_name");
        boolean deleted = requireBoolean(payload, "deleted");
        String refPath = ref.isBranch() || ref.isTag() ? repository + "/" + ref.name() : repository;

        if (ref.isBranch() && !deleted) {
            return renderBranchPush(payload, actor, refPath);
        }
        if (deleted) {
            return RenderResult.lines(actor + " has deleted " + refPath);
        }
        if (ref.isTag()) {
            String url = requireText(payload, "repository.html_url") + "/releases/tag/" + ref.name();
            return RenderResult.lines(actor + " has " + pushVerb(payload) + " tag " + ref.name()
                    + " to " + repository + ": " + url);
        }

        log.warn("[Render] Unhandled push notification for ref '{}'", rawRef);
        return RenderResult.unsupported("push to ref '" + rawRef + "'");
    }

    private RenderResult renderBranchPush(JsonNode payload, String actor, String refPath) {
        JsonNode commits = requireArray(payload, "commits");
        int count = commits.size();
        String verb = pushVerb(payload);

        List<String> lines = new ArrayList<>();
        if (count > 0) {
            lines.add(actor + " has " + verb + " " + count + (count == 1 ? " commit" : " commits")
                    + " to " + refPath + ": " + requireText(payload, "compare"));
        } else {
            lines.add(actor + " has " + verb + " to " + refPath);
        }

        if (count <= maxCommitsPerEvent) {
            for (JsonNode commit : commits) {
                lines.add(requireText(commit, "author.name")
                        + " " + shortSha(requireText(commit, "id"))
                        + " " + firstLine(requireText(commit, "message")));
            }
        }
        return RenderResult.lines(lines);
    }

    private String pushVerb(JsonNode payload) {
        return requireBoolean(payload, "forced")
                ? IrcFormatting.emphasize(IrcFormatting.RED, "force-pushed")
                : "pushed";
    }

    static String shortSha(String sha) {
        return sha.length() > SHORT_SHA_LENGTH ? sha.substring(0, SHORT_SHA_LENGTH) : sha;
    }

    static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline == -1 ? message : message.substring(0, newline);
    }
}
