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

/**
 * A git ref of the form {@code refs/<type>/<name>} as sent in push events.
 *
 * @param type
 *            {@code heads}, {@code tags}, or {@link #UNKNOWN}
 * @param name
 *            branch or tag name, or {@link #UNKNOWN}
 */
public record PushRef(String type, String name) {

    public static final String UNKNOWN = "<unknown>";
    public static final String HEADS = "heads";
    public static final String TAGS = "tags";

    /**
     * Splits {@code ref} into exactly three {@code /}-separated parts. Anything
     * else yields a placeholder ref with {@link #isParsed()} false.
     */
    public static PushRef parse(String ref) {
        if (ref == null) {
            return unknown();
        }
        String[] parts = ref.split("/", -1);
        if (parts.length != 3) {
            return unknown();
        }
        return new PushRef(parts[1], parts[2]);
    }

    public static PushRef unknown() {
        return new PushRef(UNKNOWN, UNKNOWN);
    }

    public boolean isParsed() {
        return !UNKNOWN.equals(type);
    }

    public boolean isBranch() {
        return HEADS.equals(type);
    }

    public boolean isTag() {
        return TAGS.equals(type);
    }
}
