package me.golemcore.notifier.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.notifier.port.outbound.NotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AutoConfigurationTest {

    private NotifierProperties properties;
    private NotificationPort notificationPort;
    private ObjectProvider<BuildProperties> buildPropertiesProvider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new NotifierProperties();
        notificationPort = mock(NotificationPort.class);
        buildPropertiesProvider = mock(ObjectProvider.class);
    }

    @Test
    void shouldStartSinkWhenConnectOnStartup() {
        properties.getIrc().setConnectOnStartup(true);

        new AutoConfiguration(properties, notificationPort, buildPropertiesProvider).init();

        verify(notificationPort).start();
    }

    @Test
    void shouldDeferConnectionWhenDisabled() {
        properties.getIrc().setConnectOnStartup(false);

        new AutoConfiguration(properties, notificationPort, buildPropertiesProvider).init();

        verify(notificationPort, never()).start();
    }

    @Test
    void shouldIgnoreUnknownJsonProperties() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        JsonNode node = mapper.readTree("{\"a\": 1}");

        assertEquals(1, node.get("a").intValue());
        assertFalse(mapper.getDeserializationConfig()
                .isEnabled(com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }
}
