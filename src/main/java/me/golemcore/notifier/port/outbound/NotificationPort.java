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

import me.golemcore.notifier.domain.model.ConnectionState;
import me.golemcore.notifier.domain.model.DeliveryReport;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for delivering rendered notifications to chat channels.
 *
 * <p>
 * Implementations own their connection and state; callers only submit work and
 * wait on the returned futures with their own timeouts.
 */
public interface NotificationPort {

    /**
     * Starts the background connection, if it is not running yet.
     */
    void start();

    /**
     * Disconnects gracefully, forcing the connection closed if the server does
     * not acknowledge in time.
     */
    void stop();

    /**
     * Completes once the connection is registered and all channels are joined.
     * Concurrent callers share the same pending connect.
     */
    CompletableFuture<Void> ensureConnected();

    /**
     * Sends every line, in order, to every joined channel.
     */
    CompletableFuture<DeliveryReport> deliver(List<String> lines);

    ConnectionState getState();

    String getCurrentNickname();
}
