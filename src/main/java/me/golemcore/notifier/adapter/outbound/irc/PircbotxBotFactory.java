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

import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import org.pircbotx.Configuration;
import org.pircbotx.PircBotX;
import org.pircbotx.hooks.Listener;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.net.SocketFactory;

/**
 * Builds one {@link PircBotX} per connection attempt.
 *
 * <p>
 * Nickname fallback and reconnects are driven by {@link IrcNotificationSink},
 * so PircBotX's own automatic nick change and reconnect are turned off.
 */
@Component
public class PircbotxBotFactory {

    private final NotifierProperties.IrcProperties config;
    private final String version;

    public PircbotxBotFactory(NotifierProperties properties,
            @Value("${spring.application.name:golemcore-irc-notifier}") String applicationName) {
        this.config = properties.getIrc();
        this.version = versionString(applicationName);
    }

    PircBotX create(String host, int port, String nickname, SocketFactory socketFactory, Listener listener) {
        Configuration configuration = new Configuration.Builder()
                .setName(nickname)
                .setLogin(config.getLogin())
                .setRealName(config.getRealName())
                .setVersion(version)
                .addServer(host, port)
                .setSocketFactory(socketFactory)
                .setAutoNickChange(false)
                .setAutoReconnect(false)
                .setMessageDelay(config.getMessageDelay().toMillis())
                .addListener(listener)
                .buildConfiguration();
        return new PircBotX(configuration);
    }

    String getVersion() {
        return version;
    }

    /**
     * CTCP VERSION reply, e.g. {@code golemcore-irc-notifier - Linux - Java 17.0.9}.
     */
    static String versionString(String applicationName) {
        return applicationName + " - " + System.getProperty("os.name") + " - Java "
                + System.getProperty("java.version");
    }
}
