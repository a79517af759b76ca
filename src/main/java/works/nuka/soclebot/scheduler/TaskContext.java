package works.nuka.soclebot.scheduler;

import net.dv8tion.jda.api.JDA;
import org.slf4j.Logger;
import works.nuka.soclebot.services.GuildSettingService;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Données et services mis à disposition d'un traitement planifié
 */
public class TaskContext {
    private final String taskId;
    private final String jobName;
    private final Map<String, String> args;
    private final Instant scheduledFireTime;
    private final GuildSettingService settings;
    private final Logger logger;
    private final JDA jda;

    public TaskContext(String taskId, String jobName, Map<String, String> args, Instant scheduledFireTime,
                       GuildSettingService settings, Logger logger, JDA jda) {
        this.taskId = taskId;
        this.jobName = jobName;
        this.args = args != null ? Collections.unmodifiableMap(args) : Collections.emptyMap();
        this.scheduledFireTime = scheduledFireTime;
        this.settings = settings;
        this.logger = logger;
        this.jda = jda;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getJobName() {
        return jobName;
    }

    public Map<String, String> getArgs() {
        return args;
    }

    public Optional<String> getArg(String name) {
        return Optional.ofNullable(args.get(name));
    }

    public Instant getScheduledFireTime() {
        return scheduledFireTime;
    }

    public GuildSettingService getSettings() {
        return settings;
    }

    public Logger getLogger() {
        return logger;
    }

    /**
     * @return la connexion Discord, vide tant que le bot n'est pas connecté
     */
    public Optional<JDA> getJda() {
        return Optional.ofNullable(jda);
    }
}
