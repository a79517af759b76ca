package works.nuka.soclebot.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Déclencheur de type cron, à la minute près.
 * Les champs absents valent {@code *}. Le jour de la semaine suit la convention
 * cron (0 ou 7 = dimanche, noms MON à SUN acceptés).
 */
public final class CronTrigger implements TaskTrigger {
    public static final String TYPE = "cron";
    public static final String DEFAULT_TIMEZONE = "UTC";

    private final String minute;
    private final String hour;
    private final String dayOfMonth;
    private final String month;
    private final String dayOfWeek;
    private final String timezone;

    private final transient CronExpression expression;
    private final transient ZoneId zone;

    /**
     * @throws IllegalArgumentException si un champ ou le fuseau est invalide
     */
    @JsonCreator
    public CronTrigger(@JsonProperty("minute") String minute,
                       @JsonProperty("hour") String hour,
                       @JsonProperty("dayOfMonth") String dayOfMonth,
                       @JsonProperty("month") String month,
                       @JsonProperty("dayOfWeek") String dayOfWeek,
                       @JsonProperty("timezone") String timezone) {
        this.minute = orWildcard(minute);
        this.hour = orWildcard(hour);
        this.dayOfMonth = orWildcard(dayOfMonth);
        this.month = orWildcard(month);
        this.dayOfWeek = orWildcard(dayOfWeek);
        this.timezone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone.trim();

        this.expression = CronExpression.parse(String.join(" ",
                "0", this.minute, this.hour, this.dayOfMonth, this.month, this.dayOfWeek));
        try {
            this.zone = ZoneId.of(this.timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Fuseau horaire invalide : " + this.timezone, e);
        }
    }

    /**
     * Déclencheur quotidien à heure fixe, en UTC
     */
    public static CronTrigger daily(int hour, int minute) {
        return new CronTrigger(String.valueOf(minute), String.valueOf(hour), null, null, null, null);
    }

    @Override
    public Instant firstFireTime(Instant now) {
        return next(now);
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        return next(now);
    }

    private Instant next(Instant after) {
        ZonedDateTime next = expression.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    public String getMinute() {
        return minute;
    }

    public String getHour() {
        return hour;
    }

    public String getDayOfMonth() {
        return dayOfMonth;
    }

    public String getMonth() {
        return month;
    }

    public String getDayOfWeek() {
        return dayOfWeek;
    }

    public String getTimezone() {
        return timezone;
    }

    private static String orWildcard(String field) {
        return field == null || field.isBlank() ? "*" : field.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronTrigger)) return false;
        CronTrigger that = (CronTrigger) o;
        return minute.equals(that.minute) && hour.equals(that.hour) && dayOfMonth.equals(that.dayOfMonth)
                && month.equals(that.month) && dayOfWeek.equals(that.dayOfWeek) && timezone.equals(that.timezone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, hour, dayOfMonth, month, dayOfWeek, timezone);
    }

    @Override
    public String toString() {
        return "cron[" + minute + " " + hour + " " + dayOfMonth + " " + month + " " + dayOfWeek + " " + timezone + "]";
    }
}
