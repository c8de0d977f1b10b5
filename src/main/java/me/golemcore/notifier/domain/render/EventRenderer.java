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

/**
 * Renders one kind of webhook event into chat lines.
 *
 * <p>
 * Implementations are pure: no I/O, no mutable state, and the same payload
 * always yields the same lines. Missing or mistyped fields are reported by
 * throwing {@link MalformedPayloadException}.
 */
public interface EventRenderer {

    EventType getEventType();

    RenderResult render(JsonNode payload);
}
