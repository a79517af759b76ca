package works.nuka.soclebot.scheduler;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vue en lecture seule d'une tâche persistée
 */
public final class TaskDefinition {
    private final String id;
    private final String jobName;
    private final TaskTrigger trigger;
    private final Map<String, String> args;
    private final Instant nextFireTime;
    private final int misfireGraceSeconds;

    public TaskDefinition(String id, String jobName, TaskTrigger trigger, Map<String, String> args,
                          Instant nextFireTime, int misfireGraceSeconds) {
        this.id = id;
        this.jobName = jobName;
        this.trigger = trigger;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.nextFireTime = nextFireTime;
        this.misfireGraceSeconds = misfireGraceSeconds;
    }

    public String getId() {
        return id;
    }

    public String getJobName() {
        return jobName;
    }

    /**
     * @return le déclencheur, ou null si sa définition stockée est illisible
     */
    public TaskTrigger getTrigger() {
        return trigger;
    }

    public Map<String, String> getArgs() {
        return args;
    }

    /**
     * @return la prochaine date de déclenchement, null si la tâche est suspendue
     */
    public Instant getNextFireTime() {
        return nextFireTime;
    }

    public int getMisfireGraceSeconds() {
        return misfireGraceSeconds;
    }

    @Override
    public String toString() {
        return "TaskDefinition{id='" + id + "', job='" + jobName + "', trigger=" + trigger
                + ", nextFireTime=" + nextFireTime + "}";
    }
}
