package works.nuka.soclebot.scheduler;

/**
 * Traitement exécuté lors du déclenchement d'une tâche.
 * Les tâches persistées référencent un traitement par son nom d'enregistrement.
 */
@FunctionalInterface
public interface ScheduledJob {

    /**
     * @param context contexte du déclenchement
     * @throws Exception toute erreur est journalisée par le planificateur
     */
    void run(TaskContext context) throws Exception;
}
