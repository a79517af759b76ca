package works.nuka.soclebot.scheduler;

/**
 * État d'une tâche planifiée vu du planificateur
 */
public enum TaskState {
    /** En attente de son prochain déclenchement */
    PENDING,
    /** En cours d'exécution */
    FIRING,
    /** Supprimée, ou tâche unique terminée */
    REMOVED
}
