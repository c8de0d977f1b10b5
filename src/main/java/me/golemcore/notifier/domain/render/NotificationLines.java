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

import java.util.List;

/**
 * Final clean-up of rendered lines before they go on the wire: one IRC message
 * per line, so embedded line breaks are flattened and overly long lines are
 * cut.
 */
public final class NotificationLines {

    static final String ELLIPSIS = "...";

    private NotificationLines() {
    }

    public static List<String> sanitize(List<String> lines, int maxLength) {
        return lines.stream()
                .map(line -> sanitize(line, maxLength))
                .toList();
    }

    /**
     * Flattens {@code line} and cuts it to at most {@code maxLength} bytes of
     * UTF-8, never inside a code point.
     */
    public static String sanitize(String line, int maxLength) {
        String flat = line.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
        if (maxLength <= ELLIPSIS.length() || utf8Length(flat) <= maxLength) {
            return flat;
        }
        int budget = maxLength - ELLIPSIS.length();
        int bytes = 0;
        int end = 0;
        while (end < flat.length()) {
            int codePoint = flat.codePointAt(end);
            int size = utf8Length(codePoint);
            if (bytes + size > budget) {
                break;
            }
            bytes += size;
            end += Character.charCount(codePoint);
        }
        return flat.substring(0, end) + ELLIPSIS;
    }

    static int utf8Length(String text) {
        int bytes = 0;
        for (int i = 0; i < text.length();) {
            int codePoint = text.codePointAt(i);
            bytes += utf8Length(codePoint);
            i += Character.charCount(codePoint);
        }
        return bytes;
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
