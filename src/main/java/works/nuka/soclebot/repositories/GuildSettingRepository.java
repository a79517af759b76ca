package works.nuka.soclebot.repositories;

import org.hibernate.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.models.GuildSetting;
import works.nuka.soclebot.utils.DatabaseManager;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository pour accéder aux paramètres des guildes dans la base de données.
 * Chaque opération s'exécute dans sa propre transaction.
 */
public class GuildSettingRepository {
    private static final Logger logger = LoggerFactory.getLogger(GuildSettingRepository.class);

    private static final String FIND_ONE =
            "FROM GuildSetting s WHERE s.guildId = :guildId AND s.settingKey = :settingKey";

    private final DatabaseManager databaseManager;

    public GuildSettingRepository(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    /**
     * Crée ou met à jour un paramètre
     *
     * @param guildId L'ID de la guilde Discord
     * @param key La clé du paramètre
     * @param value La nouvelle valeur
     */
    public void setSetting(long guildId, String key, String value) {
        databaseManager.inTransactionVoid(session -> {
            GuildSetting setting = findOne(session, guildId, key);
            if (setting != null) {
                setting.setSettingValue(value);
                session.merge(setting);
            } else {
                session.persist(new GuildSetting(guildId, key, value));
            }
        });
        logger.debug("Paramètre enregistré : {} - {} = {}", guildId, key, value);
    }

    /**
     * Récupère la valeur d'un paramètre
     *
     * @param guildId L'ID de la guilde Discord
     * @param key La clé du paramètre
     * @return La valeur, ou empty si le paramètre n'existe pas
     */
    public Optional<String> getSetting(long guildId, String key) {
        return databaseManager.inTransaction(session ->
                Optional.ofNullable(findOne(session, guildId, key)).map(GuildSetting::getSettingValue));
    }

    /**
     * Supprime un paramètre
     *
     * @param guildId L'ID de la guilde Discord
     * @param key La clé du paramètre
     * @return true si un paramètre a été supprimé, false s'il n'existait pas
     */
    public boolean deleteSetting(long guildId, String key) {
        return databaseManager.inTransaction(session -> {
            GuildSetting setting = findOne(session, guildId, key);
            if (setting == null) {
                return false;
            }
            session.remove(setting);
            return true;
        });
    }

    /**
     * Récupère tous les paramètres d'une guilde, triés par clé
     *
     * @param guildId L'ID de la guilde Discord
     * @return Les paramètres (clé vers valeur)
     */
    public Map<String, String> findByGuild(long guildId) {
        return databaseManager.inTransaction(session -> {
            List<GuildSetting> settings = session.createQuery(
                            "FROM GuildSetting s WHERE s.guildId = :guildId ORDER BY s.settingKey", GuildSetting.class)
                    .setParameter("guildId", guildId)
                    .list();
            Map<String, String> result = new LinkedHashMap<>();
            for (GuildSetting setting : settings) {
                result.put(setting.getSettingKey(), setting.getSettingValue());
            }
            return result;
        });
    }

    private GuildSetting findOne(Session session, long guildId, String key) {
        return session.createQuery(FIND_ONE, GuildSetting.class)
                .setParameter("guildId", guildId)
                .setParameter("settingKey", key)
                .uniqueResult();
    }
}
