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

import me.golemcore.notifier.port.outbound.IrcSessionListener;
import org.pircbotx.User;
import org.pircbotx.hooks.ListenerAdapter;
import org.pircbotx.hooks.events.ConnectEvent;
import org.pircbotx.hooks.events.DisconnectEvent;
import org.pircbotx.hooks.events.JoinEvent;
import org.pircbotx.hooks.events.KickEvent;
import org.pircbotx.hooks.events.NickAlreadyInUseEvent;
import org.pircbotx.hooks.events.NickChangeEvent;
import org.pircbotx.hooks.events.UnknownEvent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Translates PircBotX events of one connection into {@link IrcSessionListener}
 * callbacks.
 *
 * <p>
 * Once the connection is closed or detached, no further callbacks are raised,
 * so a late event from an abandoned connection cannot disturb its successor.
 */
class PircbotxSessionListener extends ListenerAdapter {

    private final AtomicBoolean active = new AtomicBoolean(true);
    private volatile IrcSessionListener delegate;

    PircbotxSessionListener(IrcSessionListener delegate) {
        this.delegate = delegate;
    }

    void setDelegate(IrcSessionListener delegate) {
        this.delegate = delegate;
    }

    boolean isActive() {
        return active.get();
    }

    /**
     * Stops forwarding without reporting a disconnect.
     */
    void detach() {
        active.set(false);
    }

    /**
     * Reports the end of this connection exactly once.
     */
    void closed(String reason) {
        if (active.compareAndSet(true, false)) {
            delegate.onDisconnected(reason);
        }
    }

    @Override
    public void onConnect(ConnectEvent event) {
        if (active.get()) {
            delegate.onRegistered();
        }
    }

    @Override
    public void onJoin(JoinEvent event) {
        if (active.get()) {
            delegate.onJoined(event.getChannel().getName(), nickOf(event.getUser()));
        }
    }

    @Override
    public void onKick(KickEvent event) {
        if (active.get()) {
            delegate.onKicked(event.getChannel().getName(), nickOf(event.getRecipient()),
                    nickOf(event.getUser()), event.getReason());
        }
    }

    @Override
    public void onNickAlreadyInUse(NickAlreadyInUseEvent event) {
        if (active.get()) {
            delegate.onNicknameInUse(event.getUsedNick());
        }
    }

    @Override
    public void onNickChange(NickChangeEvent event) {
        if (active.get()) {
            delegate.onNicknameChanged(event.getOldNick(), event.getNewNick());
        }
    }

    /**
     * PircBotX has no dedicated event for PONG, it arrives as an unknown line.
     */
    @Override
    public void onUnknown(UnknownEvent event) {
        if (!active.get()) {
            return;
        }
        String token = pongToken(event.getLine());
        if (token != null) {
            delegate.onPong(token);
        }
    }

    @Override
    public void onDisconnect(DisconnectEvent event) {
        closed("server closed the connection");
    }

    /**
     * Extracts the token from {@code [:server] PONG <server> :<token>}, or
     * returns null when the line is not a PONG.
     */
    static String pongToken(String line) {
        if (line == null) {
            return null;
        }
        String rest = line.trim();
        if (rest.startsWith(":")) {
            int space = rest.indexOf(' ');
            if (space == -1) {
                return null;
            }
            rest = rest.substring(space + 1).trim();
        }
        String[] parts = rest.split("\\s+", 2);
        if (parts.length < 2 || !"PONG".equalsIgnoreCase(parts[0])) {
            return null;
        }
        String params = parts[1];
        if (params.startsWith(":")) {
            return params.substring(1);
        }
        int trailing = params.indexOf(" :");
        if (trailing != -1) {
            return params.substring(trailing + 2);
        }
        String[] words = params.split("\\s+");
        return words[words.length - 1];
    }

    private static String nickOf(User user) {
        return user != null ? user.getNick() : null;
    }
}
