package me.golemcore.notifier.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NicknameLadderTest {

    @Test
    void shouldBuildFullLadderInOrder() {
        List<String> ladder = NicknameLadder.build("Golem");

        assertEquals(List.of(
                "Golem", "meloG",
                "Golem_", "meloG_",
                "Golem__", "meloG__",
                "Golem___", "meloG___",
                "Golem____", "meloG____",
                "Tbyrz", "zrybT",
                "Tbyrz_", "zrybT_",
                "Tbyrz__", "zrybT__",
                "Tbyrz___", "zrybT___"), ladder);
    }

    @Test
    void shouldStartWithPrimary() {
        assertEquals("Golem", NicknameLadder.build("Golem").get(0));
    }

    @Test
    void shouldBeDeterministic() {
        assertEquals(NicknameLadder.build("notifier"), NicknameLadder.build("notifier"));
    }

    @Test
    void shouldDropDuplicatesForPalindromes() {
        List<String> ladder = NicknameLadder.build("bob");

        assertEquals(List.of("bob", "bob_", "bob__", "bob___", "bob____", "obo", "obo_", "obo__", "obo___"),
                ladder);
        assertEquals(ladder.size(), new HashSet<>(ladder).size());
    }

    @Test
    void shouldNeverContainDuplicates() {
        for (String primary : List.of("Golem", "a", "x1", "12321", "[]", "Nick_")) {
            List<String> ladder = NicknameLadder.build(primary);

            assertEquals(ladder.size(), new HashSet<>(ladder).size(), primary);
        }
    }

    @Test
    void shouldRejectBlankPrimary() {
        assertThrows(IllegalArgumentException.class, () -> NicknameLadder.build(" "));
        assertThrows(IllegalArgumentException.class, () -> NicknameLadder.build(null));
    }

    @Test
    void shouldRotateLettersOnly() {
        assertEquals("Uryyb-123_", NicknameLadder.rot13("Hello-123_"));
        assertEquals("Hello-123_", NicknameLadder.rot13(NicknameLadder.rot13("Hello-123_")));
    }
}
