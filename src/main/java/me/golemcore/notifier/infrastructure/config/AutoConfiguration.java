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

package me.golemcore.notifier.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.notifier.port.outbound.NotificationPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that logs the effective setup and brings up the IRC
 * connection on application startup.
 *
 * <p>
 * The connection is started in the background; the first webhook waits for it
 * if it is not ready yet. With {@code notifier.irc.connect-on-startup=false}
 * the connection is opened lazily by the first notification instead.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final NotifierProperties properties;
    private final NotificationPort notificationPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        NotifierProperties.IrcProperties irc = properties.getIrc();
        NotifierProperties.WebhookProperties webhook = properties.getWebhook();

        log.info("GolemCore IRC notifier v{} starting...", version);
        log.info("Webhook path: {}", webhook.getPath());
        log.info("IRC server: {}:{} as {}", irc.getHost(), irc.getPort(), irc.getNickname());
        log.info("IRC channels: {}", irc.getChannelList());
        if (webhook.getSecret() == null || webhook.getSecret().isBlank()) {
            log.warn("No webhook secret configured, signatures will not be verified");
        }

        if (irc.isConnectOnStartup()) {
            notificationPort.start();
        } else {
            log.info("IRC connection deferred until the first notification");
        }
    }
}
