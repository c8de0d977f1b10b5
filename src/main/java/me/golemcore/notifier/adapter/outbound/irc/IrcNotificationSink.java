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

package me.golemcore.notifier.adapter.outbound.irc;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.notifier.domain.model.ChatIdentity;
import me.golemcore.notifier.domain.model.ConnectionState;
import me.golemcore.notifier.domain.model.DeliveryReport;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import me.golemcore.notifier.port.outbound.IrcProtocolPort;
import me.golemcore.notifier.port.outbound.IrcSessionListener;
import me.golemcore.notifier.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * IRC implementation of {@link NotificationPort}.
 *
 * <p>
 * A single worker thread ({@code irc-sink}) owns the connection state, the
 * nickname ladder and the set of joined channels. Public methods only enqueue
 * work on it and hand back futures. Protocol callbacks are re-submitted to the
 * same thread, as are the timers, so nothing here needs a lock.
 *
 * <p>
 * Lifecycle:
 * <ul>
 * <li>DISCONNECTED → CONNECTING on the first {@link #start()} or
 * {@link #ensureConnected()}</li>
 * <li>CONNECTING → CONNECTED on registration, walking the nickname ladder on
 * every "nickname in use" refusal</li>
 * <li>CONNECTED → JOINING → READY once every channel acknowledged the JOIN, or
 * the join timeout expired</li>
 * <li>any state → CONNECTING on disconnect, with a fixed reconnect delay</li>
 * </ul>
 */
@Component
@Slf4j
public class IrcNotificationSink implements NotificationPort {

    private static final String PROBE_TOKEN_PREFIX = "golemcore-";

    private final IrcProtocolPort protocol;
    private final NotifierProperties.IrcProperties config;
    private final List<String> channels;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    // Owned by the irc-sink thread.
    private final ChatIdentity identity;
    private final Set<String> joined = new LinkedHashSet<>();
    private boolean started;
    private boolean stopping;
    private long attempt;
    private long probeCounter;
    private CompletableFuture<Void> readyFuture;
    private CompletableFuture<Void> probeFuture;
    private String probeToken;
    private CompletableFuture<Void> disconnectFuture;
    private ScheduledFuture<?> reconnectTimer;
    private ScheduledFuture<?> joinTimer;

    // Published for readers on other threads.
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile String currentNickname;

    public IrcNotificationSink(NotifierProperties properties, IrcProtocolPort protocol) {
        this.protocol = protocol;
        this.config = properties.getIrc();
        this.channels = config.getChannelList();
        this.identity = new ChatIdentity(config.getNickname());
        this.currentNickname = identity.getCurrent();
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "irc-sink");
            t.setDaemon(true);
            return t;
        });
        protocol.setSessionListener(new SinkCallbacks());
    }

    // ==================== PUBLIC API ====================

    @Override
    public void start() {
        runOnSink(this::startOnSink);
    }

    @Override
    public CompletableFuture<Void> ensureConnected() {
        return callOnSink(this::ensureConnectedOnSink);
    }

    @Override
    public CompletableFuture<DeliveryReport> deliver(List<String> lines) {
        List<String> snapshot = List.copyOf(lines);
        return callOnSink(() -> CompletableFuture.completedFuture(deliverOnSink(snapshot)));
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public String getCurrentNickname() {
        return currentNickname;
    }

    /**
     * Sends QUIT, waits up to {@code notifier.irc.quit-timeout} for the server to
     * close the connection, then closes it locally and stops the worker.
     */
    @Override
    @PreDestroy
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        log.info("[IRC] Stopping notification sink");
        CompletableFuture<Void> closed = callOnSink(this::stopOnSink);
        Duration quitTimeout = config.getQuitTimeout();
        try {
            closed.get(quitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[IRC] Server did not close the connection within {}, closing locally", quitTimeout);
        } catch (ExecutionException e) {
            log.warn("[IRC] Graceful disconnect failed: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        runOnSink(this::finishStopOnSink);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(quitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[IRC] Notification sink stopped");
    }

    // ==================== LIFECYCLE (irc-sink thread) ====================

    private void startOnSink() {
        if (started || stopping) {
            return;
        }
        started = true;
        if (protocol.isConnected()) {
            reattach();
        } else if (state == ConnectionState.DISCONNECTED) {
            beginConnect();
        }
    }

    private CompletableFuture<Void> ensureConnectedOnSink() {
        if (stopping) {
            return CompletableFuture.failedFuture(new IllegalStateException("Notification sink is stopped"));
        }
        started = true;
        if (state == ConnectionState.READY) {
            return probeLiveness();
        }
        if (readyFuture != null && !readyFuture.isDone()) {
            return readyFuture;
        }
        if (protocol.isConnected()) {
            reattach();
            return probeLiveness();
        }
        return beginConnect();
    }

    /**
     * Adopts a connection that is already registered, treating every configured
     * channel as joined.
     */
    private void reattach() {
        identity.record(protocol.currentNickname());
        currentNickname = identity.getCurrent();
        joined.addAll(channels);
        if (readyFuture == null || readyFuture.isDone()) {
            readyFuture = new CompletableFuture<>();
        }
        log.info("[IRC] Reattached to existing connection as {}", identity.getCurrent());
        markReady();
    }

    private CompletableFuture<Void> beginConnect() {
        if (readyFuture == null || readyFuture.isDone()) {
            readyFuture = new CompletableFuture<>();
        }
        connectNow();
        return readyFuture;
    }

    private void connectNow() {
        if (stopping) {
            return;
        }
        long current = ++attempt;
        identity.reset();
        currentNickname = identity.getCurrent();
        joined.clear();
        state = ConnectionState.CONNECTING;
        log.info("[IRC] Connecting to {}:{} as {}", config.getHost(), config.getPort(), identity.getCurrent());
        try {
            protocol.connect(config.getHost(), config.getPort(), identity.getCurrent());
        } catch (RuntimeException e) {
            log.warn("[IRC] Connect to {}:{} failed: {}", config.getHost(), config.getPort(), e.getMessage());
            connectionLost("connect failed");
            return;
        }
        schedule(() -> onRegistrationTimeout(current), config.getConnectTimeout());
    }

    private void onRegistrationTimeout(long forAttempt) {
        if (forAttempt != attempt || stopping) {
            return;
        }
        if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED) {
            log.warn("[IRC] Registration did not complete within {}", config.getConnectTimeout());
            closeLocally();
            connectionLost("registration timed out");
        }
    }

    private void joinChannels() {
        state = ConnectionState.JOINING;
        if (channels.isEmpty()) {
            log.warn("[IRC] No channels configured, notifications will not be delivered");
            markReady();
            return;
        }
        for (String channel : channels) {
            try {
                protocol.join(channel);
            } catch (RuntimeException e) {
                log.warn("[IRC] Failed to send JOIN {}: {}", channel, e.getMessage());
            }
        }
        cancel(joinTimer);
        long forAttempt = attempt;
        joinTimer = schedule(() -> onJoinTimeout(forAttempt), config.getJoinTimeout());
    }

    private void onJoinTimeout(long forAttempt) {
        if (forAttempt != attempt || state != ConnectionState.JOINING) {
            return;
        }
        List<String> missing = new ArrayList<>(channels);
        missing.removeAll(joined);
        log.warn("[IRC] Join not acknowledged within {} for {}", config.getJoinTimeout(), missing);
        markReady();
    }

    private void markReady() {
        cancel(joinTimer);
        state = ConnectionState.READY;
        log.info("[IRC] Ready as {} in {}", identity.getCurrent(), joined);
        if (readyFuture != null) {
            readyFuture.complete(null);
        }
    }

    /**
     * Forgets the current connection and schedules a reconnect. Callers waiting
     * on {@link #ensureConnected()} keep waiting for the next READY.
     */
    private void connectionLost(String reason) {
        attempt++;
        joined.clear();
        cancel(joinTimer);
        if (stopping) {
            state = ConnectionState.DISCONNECTED;
            if (disconnectFuture != null) {
                disconnectFuture.complete(null);
            }
            return;
        }
        state = ConnectionState.CONNECTING;
        if (readyFuture == null || readyFuture.isDone()) {
            readyFuture = new CompletableFuture<>();
        }
        if (reconnectTimer != null && !reconnectTimer.isDone()) {
            return;
        }
        log.warn("[IRC] Connection lost ({}), reconnecting in {}", reason, config.getReconnectDelay());
        reconnectTimer = schedule(this::connectNow, config.getReconnectDelay());
    }

    private void closeLocally() {
        try {
            protocol.forceClose();
        } catch (RuntimeException e) {
            log.debug("[IRC] Force-close failed: {}", e.getMessage());
        }
    }

    private CompletableFuture<Void> stopOnSink() {
        stopping = true;
        cancel(reconnectTimer);
        cancel(joinTimer);
        if (readyFuture != null) {
            readyFuture.completeExceptionally(new IllegalStateException("Notification sink is stopping"));
        }
        if (probeFuture != null) {
            probeFuture.completeExceptionally(new IllegalStateException("Notification sink is stopping"));
        }
        if (!protocol.isConnected()) {
            if (state != ConnectionState.DISCONNECTED) {
                // A connect may still be in flight; nothing will QUIT it.
                closeLocally();
            }
            state = ConnectionState.DISCONNECTED;
            return CompletableFuture.completedFuture(null);
        }
        disconnectFuture = new CompletableFuture<>();
        try {
            protocol.quit(config.getQuitMessage());
        } catch (RuntimeException e) {
            log.warn("[IRC] Failed to send QUIT: {}", e.getMessage());
            disconnectFuture.complete(null);
        }
        return disconnectFuture;
    }

    private void finishStopOnSink() {
        if (state != ConnectionState.DISCONNECTED || protocol.isConnected()) {
            closeLocally();
        }
        state = ConnectionState.DISCONNECTED;
        joined.clear();
    }

    // ==================== LIVENESS & IDENTITY ====================

    /**
     * Sends a PING and completes once the PONG carrying the same token arrives.
     * Without it within {@code notifier.irc.liveness-timeout} the link is
     * dropped and the returned future follows the reconnect instead.
     */
    private CompletableFuture<Void> probeLiveness() {
        if (probeFuture != null && !probeFuture.isDone()) {
            return probeFuture;
        }
        CompletableFuture<Void> probe = new CompletableFuture<>();
        probeFuture = probe;
        String token = PROBE_TOKEN_PREFIX + (++probeCounter);
        probeToken = token;
        try {
            protocol.ping(token);
        } catch (RuntimeException e) {
            log.warn("[IRC] Liveness PING failed: {}", e.getMessage());
            failLiveness(probe);
            return probe;
        }
        ScheduledFuture<?> timer = schedule(() -> onProbeTimeout(probe), config.getLivenessTimeout());
        probe.whenComplete((ignored, error) -> timer.cancel(false));
        return probe;
    }

    private void onProbeTimeout(CompletableFuture<Void> probe) {
        if (probe.isDone()) {
            return;
        }
        log.warn("[IRC] No reply to PING within {}", config.getLivenessTimeout());
        failLiveness(probe);
    }

    private void failLiveness(CompletableFuture<Void> probe) {
        closeLocally();
        connectionLost("liveness probe failed");
        readyFuture.whenComplete((ignored, error) -> {
            if (error != null) {
                probe.completeExceptionally(error);
            } else {
                probe.complete(null);
            }
        });
    }

    private void reclaimPrimaryNickname() {
        if (identity.isPrimary()) {
            return;
        }
        log.debug("[IRC] Reclaiming primary nickname {} (holding {})", identity.getPrimary(), identity.getCurrent());
        try {
            protocol.changeNickname(identity.getPrimary());
        } catch (RuntimeException e) {
            log.debug("[IRC] Nickname reclaim failed: {}", e.getMessage());
        }
    }

    // ==================== DELIVERY ====================

    private DeliveryReport deliverOnSink(List<String> lines) {
        List<String> delivered = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        if (state != ConnectionState.READY) {
            for (String channel : channels) {
                failed.put(channel, "not connected");
            }
            log.warn("[IRC] Dropping {} line(s), connection is {}", lines.size(), state);
            return new DeliveryReport(delivered, failed);
        }

        reclaimPrimaryNickname();
        for (String channel : channels) {
            if (!joined.contains(channel)) {
                failed.put(channel, "not joined");
                continue;
            }
            try {
                for (String line : lines) {
                    protocol.sendLine(channel, line, config.isUseNotice());
                }
                delivered.add(channel);
            } catch (RuntimeException e) {
                log.warn("[IRC] Delivery to {} failed: {}", channel, e.getMessage());
                failed.put(channel, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        DeliveryReport report = new DeliveryReport(delivered, failed);
        if (!failed.isEmpty()) {
            log.warn("[IRC] Delivered {} line(s) to {}, failed for {}", lines.size(), delivered, failed);
        } else {
            log.debug("[IRC] Delivered {} line(s) to {}", lines.size(), delivered);
        }
        return report;
    }

    // ==================== CALLBACKS (irc-sink thread) ====================

    private void handleRegistered() {
        if (stopping) {
            return;
        }
        identity.record(protocol.currentNickname());
        currentNickname = identity.getCurrent();
        state = ConnectionState.CONNECTED;
        log.info("[IRC] Registered as {}", identity.getCurrent());
        joinChannels();
    }

    private void handleJoined(String channel, String nickname) {
        if (!identity.isCurrent(nickname)) {
            return;
        }
        String configured = findConfiguredChannel(channel);
        if (configured == null) {
            log.debug("[IRC] Joined unconfigured channel {}", channel);
            return;
        }
        joined.add(configured);
        log.debug("[IRC] Joined {}", configured);
        if (state == ConnectionState.JOINING && joined.containsAll(channels)) {
            markReady();
        }
    }

    private void handleKicked(String channel, String recipient, String kicker, String reason) {
        if (!identity.isCurrent(recipient)) {
            return;
        }
        String configured = findConfiguredChannel(channel);
        if (configured == null) {
            return;
        }
        joined.remove(configured);
        log.warn("[IRC] Kicked from {} by {} ({}), rejoining", configured, kicker, reason);
        try {
            protocol.join(configured);
        } catch (RuntimeException e) {
            log.warn("[IRC] Rejoin of {} failed: {}", configured, e.getMessage());
        }
    }

    private void handleNicknameInUse(String nickname) {
        if (state != ConnectionState.CONNECTING) {
            log.debug("[IRC] Nickname {} is in use, keeping {}", nickname, identity.getCurrent());
            return;
        }
        if (identity.advance()) {
            log.info("[IRC] Nickname {} is in use, trying {}", nickname, identity.getCurrent());
            currentNickname = identity.getCurrent();
            try {
                protocol.changeNickname(identity.getCurrent());
            } catch (RuntimeException e) {
                log.warn("[IRC] Failed to send NICK {}: {}", identity.getCurrent(), e.getMessage());
            }
            return;
        }
        log.error("[IRC] All {} nicknames are in use", identity.getLadder().size());
        closeLocally();
        connectionLost("nickname ladder exhausted");
    }

    private void handleNicknameChanged(String oldNickname, String newNickname) {
        if (!identity.isCurrent(oldNickname)) {
            return;
        }
        identity.record(newNickname);
        currentNickname = identity.getCurrent();
        log.info("[IRC] Nickname changed from {} to {}", oldNickname, newNickname);
    }

    private void handlePong(String token) {
        if (probeFuture == null || probeFuture.isDone()) {
            return;
        }
        if (!token.equals(probeToken)) {
            log.debug("[IRC] Ignoring PONG {} while waiting for {}", token, probeToken);
            return;
        }
        probeFuture.complete(null);
    }

    private void handleDisconnected(String reason) {
        if (state == ConnectionState.DISCONNECTED && !stopping) {
            return;
        }
        connectionLost(reason);
    }

    private String findConfiguredChannel(String channel) {
        for (String configured : channels) {
            if (configured.equalsIgnoreCase(channel)) {
                return configured;
            }
        }
        return null;
    }

    // ==================== EXECUTOR PLUMBING ====================

    private void runOnSink(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("[IRC] Sink is shut down, dropping task");
        }
    }

    private <T> CompletableFuture<T> callOnSink(Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    task.get().whenComplete((value, error) -> {
                        if (error != null) {
                            result.completeExceptionally(error);
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (RuntimeException e) {
                    log.error("[IRC] Sink task failed", e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Notification sink is stopped", e));
        }
        return result;
    }

    private ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("[IRC] Sink task failed", e);
            }
        };
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    /**
     * Moves protocol callbacks onto the sink thread.
     */
    private final class SinkCallbacks implements IrcSessionListener {

        @Override
        public void onRegistered() {
            runOnSink(IrcNotificationSink.this::handleRegistered);
        }

        @Override
        public void onJoined(String channel, String nickname) {
            runOnSink(() -> handleJoined(channel, nickname));
        }

        @Override
        public void onKicked(String channel, String recipient, String kicker, String reason) {
            runOnSink(() -> handleKicked(channel, recipient, kicker, reason));
        }

        @Override
        public void onDisconnected(String reason) {
            runOnSink(() -> handleDisconnected(reason));
        }

        @Override
        public void onNicknameInUse(String nickname) {
            runOnSink(() -> handleNicknameInUse(nickname));
        }

        @Override
        public void onNicknameChanged(String oldNickname, String newNickname) {
            runOnSink(() -> handleNicknameChanged(oldNickname, newNickname));
        }

        @Override
        public void onPong(String token) {
            runOnSink(() -> handlePong(token));
        }
    }
}
