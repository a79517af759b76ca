package works.nuka.soclebot.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.config.BotConfig;
import works.nuka.soclebot.errors.UsageException;
import works.nuka.soclebot.models.GuildSetting;
import works.nuka.soclebot.repositories.GuildSettingRepository;

import java.util.Map;
import java.util.Optional;

/**
 * Service pour gérer les paramètres clé/valeur des guildes Discord
 */
public class GuildSettingService {
    private static final Logger logger = LoggerFactory.getLogger(GuildSettingService.class);

    private final GuildSettingRepository repository;
    private final BotConfig config;

    /**
     * Constructeur du service de paramètres de guilde
     *
     * @param repository accès à la table des paramètres
     * @param config configuration fournissant les valeurs par défaut (peut être null)
     */
    public GuildSettingService(GuildSettingRepository repository, BotConfig config) {
        this.repository = repository;
        this.config = config;
    }

    /**
     * Crée ou met à jour un paramètre de guilde
     *
     * @param guildId L'ID de la guilde Discord
     * @param key La clé du paramètre
     * @param value La nouvelle valeur
     * @throws UsageException si la clé ou la valeur est invalide
     */
    public void setSetting(long guildId, String key, String value) {
        validateKey(key);
        if (value != null && value.length() > GuildSetting.MAX_VALUE_LENGTH) {
            throw new UsageException("La valeur ne peut pas dépasser " + GuildSetting.MAX_VALUE_LENGTH + " caractères.");
        }
        repository.setSetting(guildId, key, value);
        logger.info("Paramètre '{}' mis à jour pour la guilde {}", key, guildId);
    }

    /**
     * Récupère un paramètre enregistré
     *
     * @param guildId L'ID de la guilde Discord
     * @param key La clé du paramètre
     * @return La valeur, ou empty si absente
     */
    public Optional<String> getSetting(long guildId, String key) {
        return repository.getSetting(guildId, key);
    }

    /**
     * Récupère un paramètre en retombant sur la valeur du fichier de configuration
     *
     * @param guildId L'ID de la guilde Discord
     * @param key La clé du paramètre
     * @return La valeur enregistrée, sinon la valeur par défaut configurée, sinon empty
     */
    public Optional<String> getEffectiveSetting(long guildId, String key) {
        Optional<String> stored = repository.getSetting(guildId, key);
        if (stored.isPresent() || config == null) {
            return stored;
        }
        return config.getGuildDefault(guildId, key);
    }

    /**
     * Supprime un paramètre de guilde
     *
     * @param guildId L'ID de la guilde Discord
     * @param key La clé du paramètre
     * @return true si le paramètre existait
     */
    public boolean deleteSetting(long guildId, String key) {
        boolean deleted = repository.deleteSetting(guildId, key);
        if (deleted) {
            logger.info("Paramètre '{}' supprimé pour la guilde {}", key, guildId);
        }
        return deleted;
    }

    /**
     * Liste les paramètres enregistrés d'une guilde
     *
     * @param guildId L'ID de la guilde Discord
     * @return Les paramètres triés par clé
     */
    public Map<String, String> listSettings(long guildId) {
        return repository.findByGuild(guildId);
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new UsageException("La clé du paramètre est obligatoire.");
        }
        if (key.length() > GuildSetting.MAX_KEY_LENGTH) {
            throw new UsageException("La clé ne peut pas dépasser " + GuildSetting.MAX_KEY_LENGTH + " caractères.");
        }
    }
}
