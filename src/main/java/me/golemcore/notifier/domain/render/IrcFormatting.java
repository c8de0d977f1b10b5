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
 * mIRC-style inline formatting control characters.
 */
public final class IrcFormatting {

    public static final char BOLD = '\u0002';
    public static final char COLOR = '\u0003';
    public static final char RESET = '\u000F';

    public static final String RED = "04";

    private IrcFormatting() {
    }

    public static String bold(String text) {
        return BOLD + text + BOLD;
    }

    /**
     * Colored and bold text, closed with {@link #RESET} so nothing leaks into the
     * rest of the line.
     */
    public static String emphasize(String color, String text) {
        return COLOR + color + BOLD + text + RESET;
    }
}
