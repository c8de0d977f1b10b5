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
 * Minimal IRC client capability consumed by the notification sink.
 *
 * <p>
 * Send methods are fire-and-forget. Failures surface as unchecked exceptions
 * from the call or as a later {@link IrcSessionListener#onDisconnected(String)}.
 */
public interface IrcProtocolPort {

    /**
     * Registers the receiver of session callbacks. Applies to the current
     * connection, if any, and to every later one.
     */
    void setSessionListener(IrcSessionListener listener);

    /**
     * Opens a connection in the background and starts registration with
     * {@code nickname}. Returns immediately; progress is reported to the
     * session listener.
     */
    void connect(String host, int port, String nickname);

    void join(String channel);

    /**
     * Sends one line of text to a channel as PRIVMSG, or NOTICE when
     * {@code notice} is set.
     */
    void sendLine(String channel, String text, boolean notice);

    void changeNickname(String nickname);

    /**
     * Sends a protocol-level PING carrying {@code token}.
     */
    void ping(String token);

    boolean isConnected();

    /**
     * Nickname as last tracked by the protocol client. May lag behind the
     * server during registration.
     */
    String currentNickname();

    /**
     * Asks the server to close the connection. The disconnect is reported
     * through the session listener.
     */
    void quit(String message);

    /**
     * Closes the socket locally without waiting for the server. No further
     * callbacks are raised for the closed connection.
     */
    void forceClose();
}
