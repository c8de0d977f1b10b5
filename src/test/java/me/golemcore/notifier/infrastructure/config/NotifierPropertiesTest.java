package me.golemcore.notifier.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotifierPropertiesTest {

    @Test
    void shouldProvideDefaults() {
        NotifierProperties properties = new NotifierProperties();

        assertEquals("/api/hooks/github", properties.getWebhook().getPath());
        assertEquals("X-GitHub-Event", properties.getWebhook().getEventHeader());
        assertEquals("X-Hub-Signature", properties.getWebhook().getSignatureHeader());
        assertEquals(Duration.ofSeconds(5), properties.getWebhook().getHandlingTimeout());
        assertEquals(6667, properties.getIrc().getPort());
        assertEquals(Duration.ofSeconds(10), properties.getIrc().getConnectTimeout());
        assertEquals(Duration.ofSeconds(1), properties.getIrc().getReconnectDelay());
        assertEquals(Duration.ofSeconds(2), properties.getIrc().getQuitTimeout());
        assertEquals(3, properties.getRender().getMaxCommitsPerEvent());
        assertEquals(400, properties.getRender().getMaxLineLength());
    }

    @Test
    void shouldSplitChannelsOnWhitespace() {
        NotifierProperties.IrcProperties irc = new NotifierProperties.IrcProperties();
        irc.setChannels("  #alpha\t#beta \n #gamma ");

        assertEquals(List.of("#alpha", "#beta", "#gamma"), irc.getChannelList());
    }

    @Test
    void shouldDropDuplicateChannels() {
        NotifierProperties.IrcProperties irc = new NotifierProperties.IrcProperties();
        irc.setChannels("#alpha #beta #alpha");

        assertEquals(List.of("#alpha", "#beta"), irc.getChannelList());
    }

    @Test
    void shouldReturnNoChannelsWhenBlank() {
        NotifierProperties.IrcProperties irc = new NotifierProperties.IrcProperties();
        irc.setChannels(" ");

        assertTrue(irc.getChannelList().isEmpty());

        irc.setChannels(null);

        assertTrue(irc.getChannelList().isEmpty());
    }
}
