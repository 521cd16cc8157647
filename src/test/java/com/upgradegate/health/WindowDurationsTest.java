package com.upgradegate.health;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WindowDurationsTest {

    @Test
    void parsesEveryUnit() {
        assertEquals(Duration.ofSeconds(45), WindowDurations.parse("45s"));
        assertEquals(Duration.ofMinutes(30), WindowDurations.parse("30m"));
        assertEquals(Duration.ofHours(2), WindowDurations.parse("2h"));
        assertEquals(Duration.ofDays(1), WindowDurations.parse("1d"));
        assertEquals(Duration.ofDays(14), WindowDurations.parse("2w"));
        assertEquals(Duration.ofHours(6), WindowDurations.parse(" 6H "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2", "h", "2y", "-1h", "1.5h", "0m"})
    void rejectsMalformedWindows(String window) {
        assertThrows(IllegalArgumentException.class, () -> WindowDurations.parse(window));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> WindowDurations.parse(null));
    }
}
