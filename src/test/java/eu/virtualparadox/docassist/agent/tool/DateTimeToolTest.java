package eu.virtualparadox.docassist.agent.tool;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DateTimeToolTest {

    private final DateTimeTool tool = new DateTimeTool(
            Clock.fixed(Instant.parse("2024-03-15T09:30:05Z"), ZoneOffset.UTC));

    @Test
    void currentDateTime() {
        assertThat(tool.run("current")).isEqualTo("Current date and time: 2024-03-15 09:30:05");
        assertThat(tool.run("  NOW ")).isEqualTo("Current date and time: 2024-03-15 09:30:05");
    }

    @Test
    void daysBetween() {
        assertThat(tool.run("days between 2024-01-01 and 2024-12-31"))
                .isEqualTo("Days between 2024-01-01 and 2024-12-31: 365 days");
        assertThat(tool.run("How many days are there between 2024-12-31 and 2024-01-01?"))
                .isEqualTo("Days between 2024-12-31 and 2024-01-01: 365 days");
    }

    @Test
    void missingDates() {
        assertThat(tool.run("days between yesterday and tomorrow")).isEqualTo(DateTimeTool.DATE_FORMAT_HINT);
    }

    @Test
    void unrecognizedInputGetsUsage() {
        assertThat(tool.run("what's the weather")).isEqualTo(DateTimeTool.USAGE);
    }

    @Test
    void invalidDatesAreReported() {
        assertThat(tool.run("days between 2024-13-01 and 2024-01-01"))
                .startsWith("Error with date/time operation: ");
    }
}
