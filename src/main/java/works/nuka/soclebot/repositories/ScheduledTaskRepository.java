package works.nuka.soclebot.repositories;

import org.hibernate.LockMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.models.ScheduledTask;
import works.nuka.soclebot.utils.DatabaseManager;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository pour gérer les tâches planifiées dans la base de données
 */
public class ScheduledTaskRepository {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledTaskRepository.class);

    private final DatabaseManager databaseManager;

    public ScheduledTaskRepository(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    /**
     * Trouve une tâche par son ID
     *
     * @param id ID de la tâche
     * @return Tâche optionnelle
     */
    public Optional<ScheduledTask> findById(String id) {
        return databaseManager.inTransaction(session -> Optional.ofNullable(session.get(ScheduledTask.class, id)));
    }

    /**
     * Crée ou remplace une tâche portant le même ID. Tout remplacement incrémente
     * la version de la tâche.
     *
     * @param task Tâche à sauvegarder
     * @return Tâche sauvegardée
     */
    public ScheduledTask save(ScheduledTask task) {
        return databaseManager.inTransaction(session -> {
            ScheduledTask existing = session.get(ScheduledTask.class, task.getId());
            if (existing == null) {
                session.persist(task);
                return task;
            }
            existing.setJobName(task.getJobName());
            existing.setTriggerType(task.getTriggerType());
            existing.setTriggerData(task.getTriggerData());
            existing.setArgsData(task.getArgsData());
            existing.setNextFireTime(task.getNextFireTime());
            existing.setMisfireGraceSeconds(task.getMisfireGraceSeconds());
            // Même une définition identique invalide les lectures en cours
            session.lock(existing, LockMode.OPTIMISTIC_FORCE_INCREMENT);
            return existing;
        });
    }

    /**
     * Met à jour la prochaine date de déclenchement si la tâche n'a pas été remplacée
     * depuis sa lecture
     *
     * @param id ID de la tâche
     * @param expectedVersion version lue
     * @param nextFireTime nouvelle date de déclenchement
     * @return true si la mise à jour a eu lieu, false si la tâche a été remplacée ou supprimée
     */
    public boolean updateNextFireTimeIfUnchanged(String id, long expectedVersion, Instant nextFireTime) {
        return databaseManager.inTransaction(session -> session.createMutationQuery(
                        "UPDATE ScheduledTask t SET t.nextFireTime = :next, t.version = t.version + 1, "
                                + "t.updatedAt = :now WHERE t.id = :id AND t.version = :version")
                .setParameter("next", nextFireTime)
                .setParameter("now", LocalDateTime.now())
                .setParameter("id", id)
                .setParameter("version", expectedVersion)
                .executeUpdate() == 1);
    }

    /**
     * Supprime une tâche si elle n'a pas été remplacée depuis sa lecture
     *
     * @param id ID de la tâche
     * @param expectedVersion version lue
     * @return true si la tâche a été supprimée
     */
    public boolean deleteIfUnchanged(String id, long expectedVersion) {
        return databaseManager.inTransaction(session -> session.createMutationQuery(
                        "DELETE FROM ScheduledTask t WHERE t.id = :id AND t.version = :version")
                .setParameter("id", id)
                .setParameter("version", expectedVersion)
                .executeUpdate() == 1);
    }

    /**
     * Supprime une tâche
     *
     * @param id ID de la tâche
     * @return true si la tâche a été supprimée, false si elle n'existait pas
     */
    public boolean deleteById(String id) {
        return databaseManager.inTransaction(session -> {
            ScheduledTask task = session.get(ScheduledTask.class, id);
            if (task == null) {
                return false;
            }
            session.remove(task);
            logger.debug("Tâche {} supprimée de la base", id);
            return true;
        });
    }

    /**
     * Trouve toutes les tâches
     *
     * @return Liste de toutes les tâches, par date de déclenchement
     */
    public List<ScheduledTask> findAll() {
        return databaseManager.inTransaction(session ->
                session.createQuery("FROM ScheduledTask t ORDER BY t.nextFireTime", ScheduledTask.class).list());
    }

    /**
     * Trouve les tâches dont le déclenchement est prévu au plus tard à un instant donné
     *
     * @param before Instant limite (inclus)
     * @return Liste des tâches dues, de la plus ancienne à la plus récente
     */
    public List<ScheduledTask> findDueBefore(Instant before) {
        return databaseManager.inTransaction(session -> session.createQuery(
                        "FROM ScheduledTask t WHERE t.nextFireTime IS NOT NULL AND t.nextFireTime <= :before "
                                + "ORDER BY t.nextFireTime", ScheduledTask.class)
                .setParameter("before", before)
                .list());
    }
}
