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

import java.util.List;

/**
 * Nickname state of the IRC connection.
 *
 * <p>
 * Not thread-safe: owned and mutated by the notification sink's single worker
 * thread only.
 */
public final class ChatIdentity {

    private final String primary;
    private final List<String> ladder;
    private int index;
    private String current;

    public ChatIdentity(String primary) {
        this.ladder = NicknameLadder.build(primary);
        this.primary = ladder.get(0);
        this.index = 0;
        this.current = this.primary;
    }

    public String getPrimary() {
        return primary;
    }

    public List<String> getLadder() {
        return ladder;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Nickname currently held (or being registered) on the server.
     */
    public String getCurrent() {
        return current;
    }

    public boolean isPrimary() {
        return primary.equalsIgnoreCase(current);
    }

    /**
     * Moves to the next ladder entry after the server refused the current one.
     *
     * @return {@code false} if the ladder is exhausted; the identity is left
     *         unchanged in that case
     */
    public boolean advance() {
        if (index + 1 >= ladder.size()) {
            return false;
        }
        index++;
        current = ladder.get(index);
        return true;
    }

    /**
     * Records a nickname assigned or confirmed by the server. Names outside the
     * ladder are kept as-is with the ladder position unchanged.
     */
    public void record(String nickname) {
        if (nickname == null || nickname.isBlank()) {
            return;
        }
        current = nickname;
        for (int i = 0; i < ladder.size(); i++) {
            if (ladder.get(i).equalsIgnoreCase(nickname)) {
                index = i;
                return;
            }
        }
    }

    public boolean isCurrent(String nickname) {
        return nickname != null && nickname.equalsIgnoreCase(current);
    }

    /**
     * Starts over from the primary nickname, e.g. before a fresh connect.
     */
    public void reset() {
        index = 0;
        current = primary;
    }

    @Override
    public String toString() {
        return "ChatIdentity{current=" + current + ", index=" + index + "/" + ladder.size() + "}";
    }
}
