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

package me.golemcore.notifier.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.notifier.domain.model.EventType;
import me.golemcore.notifier.domain.model.RenderResult;
import me.golemcore.notifier.domain.render.EventRenderer;
import me.golemcore.notifier.domain.render.MalformedPayloadException;
import me.golemcore.notifier.domain.render.NotificationLines;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a webhook event to the renderer registered for its type. Renderers
 * are collected from every {@link EventRenderer} bean.
 *
 * <p>
 * Never throws for bad input: unknown event types and payloads that lack a
 * required field both come back as {@link RenderResult.Kind#UNSUPPORTED}.
 */
@Service
@Slf4j
public class EventDispatcher {

    private final Map<EventType, EventRenderer> renderers = new EnumMap<>(EventType.class);
    private final int maxLineLength;

    public EventDispatcher(List<EventRenderer> renderers, NotifierProperties properties) {
        for (EventRenderer renderer : renderers) {
            EventType type = renderer.getEventType();
            if (type == null || type == EventType.UNKNOWN) {
                throw new IllegalStateException("Renderer " + renderer.getClass().getSimpleName()
                        + " has no event type");
            }
            EventRenderer previous = this.renderers.put(type, renderer);
            if (previous != null) {
                throw new IllegalStateException("Two renderers for '" + type.getWireName() + "': "
                        + previous.getClass().getSimpleName() + " and " + renderer.getClass().getSimpleName());
            }
        }
        this.maxLineLength = properties.getRender().getMaxLineLength();
        log.debug("[Render] Registered renderers for {}", this.renderers.keySet());
    }

    public RenderResult dispatch(EventType type, JsonNode payload) {
        EventRenderer renderer = renderers.get(type);
        if (renderer == null) {
            return RenderResult.unsupported("no renderer");
        }

        RenderResult result;
        try {
            result = renderer.render(payload);
        } catch (MalformedPayloadException e) {
            log.warn("[Render] Dropping {} event: {}", type.getWireName(), e.getMessage());
            return RenderResult.unsupported(e.getMessage());
        }

        if (!result.hasLines()) {
            log.debug("[Render] {} event not rendered: {}", type.getWireName(), result);
            return result;
        }
        return RenderResult.lines(NotificationLines.sanitize(result.getLines(), maxLineLength));
    }
}
