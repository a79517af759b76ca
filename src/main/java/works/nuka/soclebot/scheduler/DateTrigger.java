package works.nuka.soclebot.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Déclencheur unique à une date donnée
 */
public final class DateTrigger implements TaskTrigger {
    public static final String TYPE = "date";

    private final Instant runAt;

    @JsonCreator
    public DateTrigger(@JsonProperty("runAt") Instant runAt) {
        this.runAt = Objects.requireNonNull(runAt, "runAt");
    }

    @Override
    public Instant firstFireTime(Instant now) {
        return runAt;
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        return null;
    }

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public boolean recurring() {
        return false;
    }

    public Instant getRunAt() {
        return runAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateTrigger)) return false;
        return runAt.equals(((DateTrigger) o).runAt);
    }

    @Override
    public int hashCode() {
        return runAt.hashCode();
    }

    @Override
    public String toString() {
        return "date[" + runAt + "]";
    }
}
