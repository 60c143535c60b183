package work.isu.core.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSingleUnits() {
        assertEquals(Optional.of(Duration.ofSeconds(30)), DurationParser.parse("30s"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse("1h"));
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
    }

    @Test
    void parsesCompoundDurations() {
        assertEquals(Optional.of(Duration.ofSeconds(90)), DurationParser.parse("1m30s"));
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1s 500ms"));
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
        assertEquals(Optional.of(Duration.ZERO), DurationParser.parse("0"));
    }

    @Test
    void blankMeansNoDuration() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("5d"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("1s!"));
    }
}
