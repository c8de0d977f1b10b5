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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import me.golemcore.notifier.port.outbound.IrcProtocolPort;
import me.golemcore.notifier.port.outbound.IrcSessionListener;
import org.pircbotx.PircBotX;
import org.pircbotx.exception.IrcException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link IrcProtocolPort} backed by PircBotX.
 *
 * <p>
 * Each {@link #connect} builds a fresh bot whose blocking
 * {@link PircBotX#startBot()} runs on a dedicated {@code irc-connection} daemon
 * thread. Only the latest connection is tracked; a force-closed one is detached
 * before its socket is closed.
 */
@Component
@Slf4j
public class PircbotxIrcClient implements IrcProtocolPort {

    private final PircbotxBotFactory botFactory;
    private final int connectTimeoutMs;
    private final AtomicReference<Session> session = new AtomicReference<>();
    private volatile IrcSessionListener listener;

    public PircbotxIrcClient(PircbotxBotFactory botFactory, NotifierProperties properties) {
        this.botFactory = botFactory;
        this.connectTimeoutMs = (int) Math.min(Integer.MAX_VALUE, properties.getIrc().getConnectTimeout().toMillis());
    }

    private record Session(PircBotX bot, PircbotxSessionListener events, TrackingSocketFactory sockets) {
    }

    @Override
    public void setSessionListener(IrcSessionListener listener) {
        this.listener = listener;
        Session current = session.get();
        if (current != null) {
            current.events().setDelegate(listener);
        }
    }

    @Override
    public void connect(String host, int port, String nickname) {
        IrcSessionListener target = listener;
        if (target == null) {
            throw new IllegalStateException("Session listener is not set");
        }
        TrackingSocketFactory sockets = new TrackingSocketFactory(connectTimeoutMs);
        PircbotxSessionListener events = new PircbotxSessionListener(target);
        PircBotX bot = botFactory.create(host, port, nickname, sockets, events);
        Session next = new Session(bot, events, sockets);

        Session previous = session.getAndSet(next);
        if (previous != null) {
            log.debug("[IRC] Abandoning previous connection");
            previous.events().detach();
            previous.sockets().closeAll();
        }

        Thread thread = new Thread(() -> run(next, host, port), "irc-connection");
        thread.setDaemon(true);
        thread.start();
    }

    private void run(Session current, String host, int port) {
        String reason = "connection closed";
        try {
            current.bot().startBot();
        } catch (IOException | IrcException e) {
            log.warn("[IRC] Connection to {}:{} failed: {}", host, port, e.getMessage());
            reason = "connection failed: " + e.getMessage();
        } catch (RuntimeException e) {
            log.error("[IRC] Connection thread crashed", e);
            reason = "connection crashed: " + e.getMessage();
        } finally {
            session.compareAndSet(current, null);
            current.events().closed(reason);
        }
    }

    @Override
    public void join(String channel) {
        requireBot().sendIRC().joinChannel(channel);
    }

    @Override
    public void sendLine(String channel, String text, boolean notice) {
        if (notice) {
            requireBot().sendIRC().notice(channel, text);
        } else {
            requireBot().sendIRC().message(channel, text);
        }
    }

    @Override
    public void changeNickname(String nickname) {
        requireBot().sendIRC().changeNick(nickname);
    }

    @Override
    public void ping(String token) {
        requireBot().sendRaw().rawLineNow("PING :" + token);
    }

    @Override
    public boolean isConnected() {
        Session current = session.get();
        return current != null && current.bot().isConnected();
    }

    @Override
    public String currentNickname() {
        Session current = session.get();
        return current != null ? current.bot().getNick() : null;
    }

    @Override
    public void quit(String message) {
        PircBotX bot = requireBot();
        bot.stopBotReconnect();
        bot.sendIRC().quitServer(message);
    }

    @Override
    public void forceClose() {
        Session current = session.getAndSet(null);
        if (current == null) {
            return;
        }
        log.debug("[IRC] Closing connection locally");
        current.events().detach();
        current.bot().stopBotReconnect();
        current.sockets().closeAll();
    }

    private PircBotX requireBot() {
        Session current = session.get();
        if (current == null) {
            throw new IllegalStateException("Not connected");
        }
        return current.bot();
    }
}
