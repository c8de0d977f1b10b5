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

package me.golemcore.notifier.port.outbound;

/**
 * Callbacks raised by an {@link IrcProtocolPort} connection, on the protocol
 * client's own thread.
 */
public interface IrcSessionListener {

    /**
     * Registration with the server completed (RPL_WELCOME).
     */
    void onRegistered();

    /**
     * Someone, possibly us, joined a channel.
     */
    void onJoined(String channel, String nickname);

    /**
     * {@code recipient} was kicked from {@code channel}.
     */
    void onKicked(String channel, String recipient, String kicker, String reason);

    /**
     * The connection is gone, whatever the cause. Raised at most once per
     * connection.
     */
    void onDisconnected(String reason);

    /**
     * The server rejected {@code nickname} because it is in use.
     */
    void onNicknameInUse(String nickname);

    void onNicknameChanged(String oldNickname, String newNickname);

    /**
     * The server answered a PING with {@code token}.
     */
    void onPong(String token);
}
