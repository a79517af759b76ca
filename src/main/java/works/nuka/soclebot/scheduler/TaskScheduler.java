package works.nuka.soclebot.scheduler;

import net.dv8tion.jda.api.JDA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.config.SchedulerConfig;
import works.nuka.soclebot.models.ScheduledTask;
import works.nuka.soclebot.repositories.ScheduledTaskRepository;
import works.nuka.soclebot.services.GuildSettingService;
import works.nuka.soclebot.utils.DatabaseManager;
import works.nuka.soclebot.utils.JsonUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Planificateur de tâches persistées en base.
 * <p>
 * Un thread unique évalue les déclencheurs à intervalle régulier ; les tâches dues
 * sont exécutées sur un pool séparé. La prochaine date de déclenchement est
 * enregistrée avant l'exécution, une même tâche ne tourne donc jamais deux fois
 * en parallèle.
 */
public class TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ScheduledTaskRepository repository;
    private final DatabaseManager databaseManager;
    private final GuildSettingService settings;
    private final SchedulerConfig config;
    private final Clock clock;
    private final ScheduledExecutorService pollExecutor;
    private final ExecutorService taskExecutor;

    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Set<String> firing = ConcurrentHashMap.newKeySet();
    private final Set<String> reportedUnknownJobs = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile JDA jda;

    /**
     * Crée un planificateur avec l'horloge système et des pools par défaut
     */
    public TaskScheduler(ScheduledTaskRepository repository, DatabaseManager databaseManager,
                         GuildSettingService settings, SchedulerConfig config) {
        this(repository, databaseManager, settings, config, Clock.systemUTC(),
                Executors.newSingleThreadScheduledExecutor(daemonThreads("scheduler-poll")),
                Executors.newCachedThreadPool(daemonThreads("scheduler-task")));
    }

    /**
     * Crée un planificateur avec l'horloge et les executors spécifiés
     *
     * @param clock horloge utilisée pour évaluer les déclencheurs
     * @param pollExecutor l'executor pour l'évaluation périodique
     * @param taskExecutor l'executor pour l'exécution des tâches
     */
    public TaskScheduler(ScheduledTaskRepository repository, DatabaseManager databaseManager,
                         GuildSettingService settings, SchedulerConfig config, Clock clock,
                         ScheduledExecutorService pollExecutor, ExecutorService taskExecutor) {
        this.repository = repository;
        this.databaseManager = databaseManager;
        this.settings = settings;
        this.config = config;
        this.clock = clock;
        this.pollExecutor = pollExecutor;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Enregistre un traitement sous un nom. Remplace un traitement de même nom.
     *
     * @param name nom référencé par les tâches persistées
     * @param job le traitement
     */
    public void registerJob(String name, ScheduledJob job) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Le nom du traitement est obligatoire");
        }
        if (jobs.put(name, job) != null) {
            logger.warn("Traitement '{}' remplacé", name);
        } else {
            logger.debug("Traitement '{}' enregistré", name);
        }
        reportedUnknownJobs.clear();
    }

    public boolean isJobRegistered(String name) {
        return jobs.containsKey(name);
    }

    /**
     * Fournit la connexion Discord transmise aux traitements
     */
    public void attachJda(JDA jda) {
        this.jda = jda;
    }

    /**
     * Démarre l'évaluation des déclencheurs. Un second appel est sans effet.
     *
     * @throws works.nuka.soclebot.errors.StoreUnavailableException si la base n'est pas joignable
     */
    public void start() {
        if (stopped.get()) {
            logger.warn("Le planificateur a été arrêté, démarrage impossible");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            logger.warn("Le planificateur est déjà démarré");
            return;
        }

        try {
            databaseManager.checkAvailable();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        pollExecutor.scheduleWithFixedDelay(this::checkTasks, 0, config.getPollIntervalMillis(), TimeUnit.MILLISECONDS);
        logger.info("Planificateur démarré - {} tâche(s) persistée(s), vérification toutes les {} ms",
                repository.findAll().size(), config.getPollIntervalMillis());
    }

    /**
     * Arrête l'évaluation des déclencheurs
     *
     * @param waitForRunning true pour attendre (avec une limite) la fin des tâches en cours
     */
    public void shutdown(boolean waitForRunning) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Arrêt du planificateur");

        pollExecutor.shutdownNow();
        taskExecutor.shutdown();
        if (waitForRunning) {
            try {
                if (!taskExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Des tâches sont toujours en cours après {} s", SHUTDOWN_TIMEOUT_SECONDS);
                    taskExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                taskExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        logger.info("Planificateur arrêté");
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    /**
     * Ajoute une tâche avec le délai de grâce par défaut
     *
     * @see #addTask(String, TaskTrigger, String, Map, int)
     */
    public TaskDefinition addTask(String id, TaskTrigger trigger, String jobName, Map<String, String> args) {
        return addTask(id, trigger, jobName, args, config.getMisfireGraceSeconds());
    }

    /**
     * Crée ou remplace la tâche portant cet ID. La prochaine date de déclenchement
     * est calculée à partir de maintenant. Une exécution en cours se termine avec
     * ses anciens arguments.
     *
     * @param id identifiant stable de la tâche
     * @param trigger règle de déclenchement
     * @param jobName nom d'un traitement enregistré
     * @param args arguments transmis au traitement
     * @param misfireGraceSeconds retard toléré avant qu'un déclenchement soit ignoré
     * @return la tâche enregistrée
     * @throws IllegalArgumentException si un paramètre est invalide ou si le déclencheur ne se déclenchera jamais
     */
    public TaskDefinition addTask(String id, TaskTrigger trigger, String jobName, Map<String, String> args,
                                  int misfireGraceSeconds) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("L'ID de la tâche est obligatoire");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("Le déclencheur est obligatoire");
        }
        if (!jobs.containsKey(jobName)) {
            throw new IllegalArgumentException("Traitement inconnu : " + jobName);
        }
        if (misfireGraceSeconds < 0) {
            throw new IllegalArgumentException("Le délai de grâce ne peut pas être négatif");
        }

        Instant now = clock.instant();
        Instant first = trigger.firstFireTime(now);
        if (first == null) {
            throw new IllegalArgumentException("Le déclencheur " + trigger + " ne se déclenchera jamais");
        }

        Map<String, String> safeArgs = args != null ? args : Collections.emptyMap();
        String triggerData = JsonUtils.toJson(trigger);
        if (triggerData == null) {
            throw new IllegalArgumentException("Le déclencheur " + trigger + " ne peut pas être enregistré");
        }
        String argsData = JsonUtils.toJson(safeArgs);
        if (argsData == null) {
            throw new IllegalArgumentException("Les arguments de la tâche '" + id + "' ne peuvent pas être enregistrés");
        }

        ScheduledTask task = new ScheduledTask(id, jobName);
        task.setTriggerType(trigger.typeName());
        task.setTriggerData(triggerData);
        task.setArgsData(argsData);
        task.setNextFireTime(first);
        task.setMisfireGraceSeconds(misfireGraceSeconds);
        repository.save(task);

        logger.info("Tâche '{}' planifiée ({}, traitement '{}'), prochain déclenchement : {}",
                id, trigger, jobName, first);
        return new TaskDefinition(id, jobName, trigger, safeArgs, first, misfireGraceSeconds);
    }

    /**
     * Supprime une tâche. Un ID inconnu est signalé dans le journal.
     *
     * @param id identifiant de la tâche
     * @return true si la tâche existait
     */
    public boolean removeTask(String id) {
        boolean removed = repository.deleteById(id);
        if (removed) {
            logger.info("Tâche '{}' supprimée", id);
        } else {
            logger.warn("Suppression impossible : aucune tâche '{}'", id);
        }
        return removed;
    }

    public Optional<TaskDefinition> getTask(String id) {
        return repository.findById(id).map(TaskScheduler::toDefinition);
    }

    /**
     * @return toutes les tâches persistées, par date de déclenchement
     */
    public List<TaskDefinition> listTasks() {
        List<TaskDefinition> result = new ArrayList<>();
        for (ScheduledTask task : repository.findAll()) {
            result.add(toDefinition(task));
        }
        return result;
    }

    public TaskState getState(String id) {
        if (firing.contains(id)) {
            return TaskState.FIRING;
        }
        return repository.findById(id).isPresent() ? TaskState.PENDING : TaskState.REMOVED;
    }

    /**
     * Vérifie les tâches dues et les déclenche
     */
    void checkTasks() {
        if (stopped.get()) {
            return;
        }
        Instant now = clock.instant();
        try {
            List<ScheduledTask> due = repository.findDueBefore(now);
            if (!due.isEmpty()) {
                logger.debug("{} tâche(s) à traiter", due.size());
            }
            for (ScheduledTask task : due) {
                processTask(task, now);
            }
        } catch (Exception e) {
            logger.error("Erreur lors de la vérification des tâches", e);
        }
    }

    private void processTask(ScheduledTask task, Instant now) {
        String id = task.getId();
        if (firing.contains(id)) {
            return;
        }

        TaskTrigger trigger = JsonUtils.fromJson(task.getTriggerData(), TaskTrigger.class);
        if (trigger == null) {
            logger.error("Déclencheur illisible pour la tâche '{}', tâche suspendue", id);
            repository.updateNextFireTimeIfUnchanged(id, task.getVersion(), null);
            return;
        }

        ScheduledJob job = jobs.get(task.getJobName());
        if (job == null) {
            if (reportedUnknownJobs.add(id)) {
                logger.warn("Tâche '{}' : traitement '{}' non enregistré, tâche laissée en attente",
                        id, task.getJobName());
            }
            return;
        }

        Instant scheduled = task.getNextFireTime();
        Instant next = trigger.nextFireTime(scheduled, now);
        Duration lateness = Duration.between(scheduled, now);

        if (lateness.compareTo(Duration.ofSeconds(task.getMisfireGraceSeconds())) > 0) {
            logger.warn("Exécution de la tâche '{}' prévue à {} manquée de {} s, ignorée",
                    id, scheduled, lateness.getSeconds());
            reschedule(task, next);
            return;
        }

        Map<String, String> args = JsonUtils.toStringMap(task.getArgsData());
        firing.add(id);
        try {
            if (!reschedule(task, next)) {
                firing.remove(id);
                return;
            }
            taskExecutor.submit(() -> runJob(id, task.getJobName(), job, args, scheduled));
        } catch (RuntimeException e) {
            firing.remove(id);
            throw e;
        }
    }

    /**
     * Enregistre la prochaine échéance, ou supprime la tâche terminée, sauf si la
     * définition a été remplacée depuis sa lecture
     *
     * @return false si la tâche a été remplacée ou supprimée entre-temps
     */
    private boolean reschedule(ScheduledTask task, Instant next) {
        String id = task.getId();
        boolean applied = next == null
                ? repository.deleteIfUnchanged(id, task.getVersion())
                : repository.updateNextFireTimeIfUnchanged(id, task.getVersion(), next);
        if (!applied) {
            logger.info("Tâche '{}' remplacée ou supprimée pendant son traitement, ancienne échéance abandonnée", id);
        } else if (next == null) {
            logger.debug("Tâche '{}' terminée, retirée du planificateur", id);
        }
        return applied;
    }

    private void runJob(String id, String jobName, ScheduledJob job, Map<String, String> args, Instant scheduled) {
        Logger jobLogger = LoggerFactory.getLogger(TaskScheduler.class.getPackageName() + ".job." + jobName);
        TaskContext context = new TaskContext(id, jobName, args, scheduled, settings, jobLogger, jda);
        try {
            logger.debug("Exécution de la tâche '{}' ({})", id, jobName);
            job.run(context);
        } catch (Exception e) {
            logger.error("Erreur lors de l'exécution de la tâche '{}' ({})", id, jobName, e);
        } finally {
            firing.remove(id);
        }
    }

    private static TaskDefinition toDefinition(ScheduledTask task) {
        return new TaskDefinition(
                task.getId(),
                task.getJobName(),
                JsonUtils.fromJson(task.getTriggerData(), TaskTrigger.class),
                JsonUtils.toStringMap(task.getArgsData()),
                task.getNextFireTime(),
                task.getMisfireGraceSeconds());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
