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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Outcome of rendering one webhook event: chat lines, a deliberate skip, or
 * "no renderer for this".
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RenderResult {

    public enum Kind {
        LINES,
        SKIPPED,
        UNSUPPORTED
    }

    private final Kind kind;
    private final List<String> lines;
    private final String reason;

    /**
     * Creates a result carrying the given lines, summary first.
     */
    public static RenderResult lines(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("At least one line is required");
        }
        return new RenderResult(Kind.LINES, List.copyOf(lines), null);
    }

    public static RenderResult lines(String line) {
        return lines(List.of(line));
    }

    /**
     * Recognized event whose action is not worth announcing.
     */
    public static RenderResult skipped(String reason) {
        return new RenderResult(Kind.SKIPPED, List.of(), reason);
    }

    /**
     * Event (or event variant) that cannot be rendered.
     */
    public static RenderResult unsupported(String reason) {
        return new RenderResult(Kind.UNSUPPORTED, List.of(), reason);
    }

    public boolean hasLines() {
        return kind == Kind.LINES;
    }

    @Override
    public String toString() {
        return kind == Kind.LINES ? "LINES" + lines : kind + "(" + reason + ")";
    }
}
