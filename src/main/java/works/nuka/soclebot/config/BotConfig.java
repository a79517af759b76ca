package works.nuka.soclebot.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration complète du bot, immuable après chargement
 */
public final class BotConfig {
    private final String token;
    private final String commandPrefix;
    private final String botName;
    private final PermissionConfig permissions;
    private final LoggingConfig logging;
    private final DatabaseConfig database;
    private final SchedulerConfig scheduler;
    private final Map<String, String> guildDefaults;

    public BotConfig(String token, String commandPrefix, String botName, PermissionConfig permissions,
                     LoggingConfig logging, DatabaseConfig database, SchedulerConfig scheduler,
                     Map<String, String> guildDefaults) {
        this.token = token;
        this.commandPrefix = commandPrefix;
        this.botName = botName;
        this.permissions = permissions;
        this.logging = logging;
        this.database = database;
        this.scheduler = scheduler;
        this.guildDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(guildDefaults));
    }

    public String getToken() {
        return token;
    }

    public String getCommandPrefix() {
        return commandPrefix;
    }

    public String getBotName() {
        return botName;
    }

    public PermissionConfig getPermissions() {
        return permissions;
    }

    public LoggingConfig getLogging() {
        return logging;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public SchedulerConfig getScheduler() {
        return scheduler;
    }

    /**
     * Obtient la valeur par défaut d'un paramètre de serveur définie dans le fichier de configuration.
     * La clé propre au serveur ({@code guild.<id>.<clé>}) est prioritaire sur la valeur
     * commune ({@code settings.<clé>}).
     *
     * @param guildId ID du serveur
     * @param key clé du paramètre
     * @return la valeur configurée, ou empty si aucune
     */
    public Optional<String> getGuildDefault(long guildId, String key) {
        String specific = guildDefaults.get("guild." + guildId + "." + key);
        if (specific != null) {
            return Optional.of(specific);
        }
        return Optional.ofNullable(guildDefaults.get("settings." + key));
    }
}
