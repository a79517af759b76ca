package works.nuka.soclebot.scheduler;

import org.junit.jupiter.api.Test;
import works.nuka.soclebot.utils.JsonUtils;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTriggerTest {

    private static final Instant T0 = Instant.parse("2024-01-15T08:00:00Z");

    @Test
    void cronTrigger_daily_firesAtNextMatchingMinute() {
        // Arrange
        CronTrigger trigger = CronTrigger.daily(9, 30);

        // Act & Assert
        assertEquals(Instant.parse("2024-01-15T09:30:00Z"), trigger.firstFireTime(T0));
        assertEquals(Instant.parse("2024-01-16T09:30:00Z"),
                trigger.nextFireTime(Instant.parse("2024-01-15T09:30:00Z"), Instant.parse("2024-01-15T09:30:00Z")));
    }

    @Test
    void cronTrigger_timezone_isAppliedToFields() {
        // Arrange : 9h à Paris en hiver = 8h UTC
        CronTrigger trigger = new CronTrigger("0", "9", null, null, null, "Europe/Paris");

        // Act & Assert
        assertEquals(Instant.parse("2024-01-16T08:00:00Z"), trigger.firstFireTime(T0));
    }

    @Test
    void cronTrigger_weekdays_skipsWeekend() {
        // Arrange : le 19/01/2024 est un vendredi
        CronTrigger trigger = new CronTrigger("0", "12", null, null, "MON-FRI", null);
        Instant fridayAfternoon = Instant.parse("2024-01-19T13:00:00Z");

        // Act & Assert
        assertEquals(Instant.parse("2024-01-22T12:00:00Z"), trigger.firstFireTime(fridayAfternoon));
    }

    @Test
    void cronTrigger_invalidField_throwsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new CronTrigger("61", null, null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new CronTrigger("0", "8", null, null, null, "Mars/Olympus"));
    }

    @Test
    void intervalTrigger_firstFireIsOnePeriodAfterRegistration() {
        IntervalTrigger trigger = new IntervalTrigger(0, 0, 1, 30, 0);

        assertEquals(Duration.ofMinutes(90), trigger.period());
        assertEquals(T0.plus(Duration.ofMinutes(90)), trigger.firstFireTime(T0));
    }

    @Test
    void intervalTrigger_missedPeriods_areSkippedToNextFutureSlot() {
        // Arrange
        IntervalTrigger trigger = IntervalTrigger.ofSeconds(60);

        // Act
        Instant next = trigger.nextFireTime(T0, T0.plusSeconds(250));

        // Assert
        assertEquals(T0.plusSeconds(300), next);
    }

    @Test
    void intervalTrigger_zeroOrNegative_throwsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalTrigger(0, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new IntervalTrigger(0, -1, 0, 0, 0));
    }

    @Test
    void intervalTrigger_overflowingPeriod_throwsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalTrigger(Long.MAX_VALUE, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new IntervalTrigger(0, Long.MAX_VALUE, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new IntervalTrigger(0, 0, Long.MAX_VALUE, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new IntervalTrigger(0, 1, 0, 0, Long.MAX_VALUE));
    }

    @Test
    void dateTrigger_firesOnce() {
        DateTrigger trigger = new DateTrigger(T0);

        assertEquals(T0, trigger.firstFireTime(T0.minusSeconds(10)));
        assertNull(trigger.nextFireTime(T0, T0));
        assertFalse(trigger.recurring());
    }

    @Test
    void triggers_storedAsJson_keepTheirType() {
        // Arrange
        TaskTrigger cron = new CronTrigger("*/5", null, null, null, null, "UTC");
        TaskTrigger interval = new IntervalTrigger(1, 2, 0, 0, 0);
        TaskTrigger date = new DateTrigger(T0);

        // Act & Assert
        assertEquals(cron, JsonUtils.fromJson(JsonUtils.toJson(cron), TaskTrigger.class));
        assertEquals(interval, JsonUtils.fromJson(JsonUtils.toJson(interval), TaskTrigger.class));
        assertEquals(date, JsonUtils.fromJson(JsonUtils.toJson(date), TaskTrigger.class));
        assertTrue(JsonUtils.toJson(date).contains("\"type\":\"date\""));
    }
}
