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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the ordered list of nicknames tried when the primary one is taken.
 *
 * <p>
 * The ladder depends on nothing but the primary nickname, so every restart of
 * the process walks the same names in the same order:
 * <ol>
 * <li>the primary and its reversed spelling;</li>
 * <li>both spellings with one to four trailing underscores, interleaved;</li>
 * <li>ROT13 of both spellings with zero to three trailing underscores.</li>
 * </ol>
 * Duplicates (palindromes, names without letters) are dropped, keeping the first
 * occurrence.
 */
public final class NicknameLadder {

    private static final int MAX_UNDERSCORES = 4;
    private static final int MAX_ROT13_UNDERSCORES = 3;

    private NicknameLadder() {
    }

    public static List<String> build(String primary) {
        if (primary == null || primary.isBlank()) {
            throw new IllegalArgumentException("Primary nickname must not be blank");
        }
        String nick = primary.trim();
        String reversed = new StringBuilder(nick).reverse().toString();

        Set<String> ladder = new LinkedHashSet<>();
        for (int i = 0; i <= MAX_UNDERSCORES; i++) {
            String suffix = "_".repeat(i);
            ladder.add(nick + suffix);
            ladder.add(reversed + suffix);
        }
        for (int i = 0; i <= MAX_ROT13_UNDERSCORES; i++) {
            String suffix = "_".repeat(i);
            ladder.add(rot13(nick + suffix));
            ladder.add(rot13(reversed + suffix));
        }
        return List.copyOf(ladder);
    }

    static String rot13(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c >= 'a' && c <= 'z') {
                sb.append((char) ('a' + (c - 'a' + 13) % 26));
            } else if (c >= 'A' && c <= 'Z') {
                sb.append((char) ('A' + (c - 'A' + 13) % 26));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
