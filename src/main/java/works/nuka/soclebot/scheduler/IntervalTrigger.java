package works.nuka.soclebot.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Déclencheur périodique. Le premier déclenchement a lieu une période après l'enregistrement.
 */
public final class IntervalTrigger implements TaskTrigger {
    public static final String TYPE = "interval";

    private final long weeks;
    private final long days;
    private final long hours;
    private final long minutes;
    private final long seconds;

    private final transient Duration period;

    /**
     * @throws IllegalArgumentException si une valeur est négative, si la période est nulle ou trop grande
     */
    @JsonCreator
    public IntervalTrigger(@JsonProperty("weeks") long weeks,
                           @JsonProperty("days") long days,
                           @JsonProperty("hours") long hours,
                           @JsonProperty("minutes") long minutes,
                           @JsonProperty("seconds") long seconds) {
        if (weeks < 0 || days < 0 || hours < 0 || minutes < 0 || seconds < 0) {
            throw new IllegalArgumentException("Les composantes d'un intervalle ne peuvent pas être négatives");
        }
        this.weeks = weeks;
        this.days = days;
        this.hours = hours;
        this.minutes = minutes;
        this.seconds = seconds;
        try {
            this.period = Duration.ofDays(Math.addExact(Math.multiplyExact(weeks, 7), days))
                    .plusHours(hours)
                    .plusMinutes(minutes)
                    .plusSeconds(seconds);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Intervalle trop grand", e);
        }
        if (period.isZero()) {
            throw new IllegalArgumentException("L'intervalle doit être strictement positif");
        }
    }

    public static IntervalTrigger ofMinutes(long minutes) {
        return new IntervalTrigger(0, 0, 0, minutes, 0);
    }

    public static IntervalTrigger ofSeconds(long seconds) {
        return new IntervalTrigger(0, 0, 0, 0, seconds);
    }

    @Override
    public Instant firstFireTime(Instant now) {
        return now.plus(period);
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        Instant next = previousFireTime.plus(period);
        if (next.isAfter(now)) {
            return next;
        }
        // Rattrape les périodes manquées sans les rejouer
        long elapsed = Duration.between(previousFireTime, now).toMillis();
        long periods = elapsed / period.toMillis() + 1;
        return previousFireTime.plus(period.multipliedBy(periods));
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    public Duration period() {
        return period;
    }

    public long getWeeks() {
        return weeks;
    }

    public long getDays() {
        return days;
    }

    public long getHours() {
        return hours;
    }

    public long getMinutes() {
        return minutes;
    }

    public long getSeconds() {
        return seconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalTrigger)) return false;
        return period.equals(((IntervalTrigger) o).period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period);
    }

    @Override
    public String toString() {
        return "interval[" + period + "]";
    }
}
