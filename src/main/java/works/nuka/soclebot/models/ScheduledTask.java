package works.nuka.soclebot.models;

import jakarta.persistence.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Entité représentant la définition persistée d'une tâche planifiée.
 * Le déclencheur et les arguments sont stockés en JSON.
 */
@Entity
@Table(name = "scheduled_tasks",
        indexes = @Index(name = "idx_scheduled_tasks_next_fire", columnList = "next_fire_time"))
public class ScheduledTask {
    @Id
    @Column(name = "task_id", length = 191)
    private String id;

    @Column(name = "job_name", nullable = false, length = 191)
    private String jobName;

    @Column(name = "trigger_type", nullable = false, length = 20)
    private String triggerType;

    @Column(name = "trigger_data", nullable = false, length = 4000)
    private String triggerData;

    @Column(name = "args_data", length = 4000)
    private String argsData;

    @Column(name = "next_fire_time")
    private Instant nextFireTime;

    @Column(name = "misfire_grace_seconds", nullable = false)
    private int misfireGraceSeconds;

    // Incrémentée à chaque remplacement de la définition
    @Version
    @ColumnDefault("0")
    @Column(name = "version", nullable = false)
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // Constructeurs
    public ScheduledTask() {
    }

    public ScheduledTask(String id, String jobName) {
        this.id = id;
        this.jobName = jobName;
    }

    // Getters et setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public String getTriggerType() {
        return triggerType;
    }

    public void setTriggerType(String triggerType) {
        this.triggerType = triggerType;
    }

    public String getTriggerData() {
        return triggerData;
    }

    public void setTriggerData(String triggerData) {
        this.triggerData = triggerData;
    }

    public String getArgsData() {
        return argsData;
    }

    public void setArgsData(String argsData) {
        this.argsData = argsData;
    }

    public Instant getNextFireTime() {
        return nextFireTime;
    }

    public void setNextFireTime(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    public int getMisfireGraceSeconds() {
        return misfireGraceSeconds;
    }

    public void setMisfireGraceSeconds(int misfireGraceSeconds) {
        this.misfireGraceSeconds = misfireGraceSeconds;
    }

    public long getVersion() {
        return version;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "ScheduledTask{id='" + id + "', job='" + jobName + "', trigger=" + triggerType
                + ", nextFireTime=" + nextFireTime + "}";
    }
}
