package me.golemcore.notifier.domain.render;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotificationLinesTest {

    @Test
    void shouldFlattenLineBreaks() {
        assertEquals("one two three four", NotificationLines.sanitize("one\r\ntwo\nthree\rfour", 400));
    }

    @Test
    void shouldKeepShortLinesUnchanged() {
        assertEquals("short", NotificationLines.sanitize("short", 5));
    }

    @Test
    void shouldCutLongLinesWithEllipsis() {
        String cut = NotificationLines.sanitize("abcdefghij", 8);

        assertEquals("abcde...", cut);
        assertEquals(8, cut.length());
    }

    @Test
    void shouldMeasureLengthInUtf8Bytes() {
        String cyrillic = "привет мир";

        String cut = NotificationLines.sanitize(cyrillic, 12);

        assertEquals("прив...", cut);
        assertTrue(NotificationLines.utf8Length(cut) <= 12);
    }

    @Test
    void shouldNotSplitSurrogatePairs() {
        String emoji = "ab\uD83D\uDE00\uD83D\uDE00cd";

        String cut = NotificationLines.sanitize(emoji, 9);

        assertEquals("ab\uD83D\uDE00...", cut);
        assertEquals(9, NotificationLines.utf8Length(cut));
    }

    @Test
    void shouldSanitizeEveryLineInOrder() {
        assertEquals(List.of("a b", "c"), NotificationLines.sanitize(List.of("a\nb", "c"), 400));
    }
}
