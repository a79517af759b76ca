package works.nuka.soclebot.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chargeur de configuration pour le bot.
 * <p>
 * Les paramètres généraux sont lus dans un fichier de propriétés, les secrets
 * (le token Discord) dans un fichier {@code .env}. Toute valeur obligatoire
 * absente ou mal formée lève une {@link ConfigException}.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "config.properties";
    public static final String DEFAULT_ENV_FILE = ".env";
    public static final String TOKEN_KEY = "DISCORD_BOT_TOKEN";

    private static final String COMMAND_PREFIX = "command.";
    private static final String FEATURE_PREFIX = "feature.";
    private static final String ALLOWED_ROLES = "allowedRoles";
    private static final String ALLOWED_USERS = "allowedUsers";
    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

    private final Path configPath;
    private final Path envPath;

    /**
     * Crée un chargeur utilisant les fichiers par défaut du répertoire courant
     */
    public ConfigLoader() {
        this(Paths.get(DEFAULT_CONFIG_FILE), Paths.get(DEFAULT_ENV_FILE));
    }

    /**
     * Crée un chargeur pour des fichiers explicites
     * @param configPath chemin du fichier de propriétés
     * @param envPath chemin du fichier .env
     */
    public ConfigLoader(Path configPath, Path envPath) {
        this.configPath = configPath;
        this.envPath = envPath;
    }

    /**
     * Charge et valide la configuration
     * @return la configuration immuable
     * @throws ConfigException si un fichier ou une valeur obligatoire est absent ou invalide
     */
    public BotConfig load() {
        String token = loadToken();
        Properties properties = loadProperties();

        BotConfig config = new BotConfig(
                token,
                properties.getProperty("bot.prefix", "!").trim(),
                properties.getProperty("bot.name", "SocleBot").trim(),
                parsePermissions(properties),
                parseLogging(properties),
                parseDatabase(properties),
                parseScheduler(properties),
                collectGuildDefaults(properties)
        );
        logger.info("Configuration chargée depuis {}", configPath);
        return config;
    }

    private String loadToken() {
        Dotenv dotenv;
        try {
            Path directory = envPath.toAbsolutePath().getParent();
            dotenv = Dotenv.configure()
                    .directory(directory == null ? "." : directory.toString())
                    .filename(envPath.getFileName().toString())
                    .ignoreIfMissing()
                    .load();
        } catch (DotenvException e) {
            throw new ConfigException("Fichier de secrets illisible : " + envPath, e);
        }

        String token = dotenv.get(TOKEN_KEY);
        if (token == null || token.isBlank()) {
            throw new ConfigException(TOKEN_KEY + " introuvable dans '" + envPath + "' ni dans l'environnement");
        }
        return token.trim();
    }

    private Properties loadProperties() {
        if (!Files.exists(configPath)) {
            throw new ConfigException("Fichier de configuration introuvable : " + configPath);
        }

        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("Lecture du fichier de configuration impossible : " + configPath, e);
        }
        return properties;
    }

    private PermissionConfig parsePermissions(Properties properties) {
        Set<String> adminRoles = new LinkedHashSet<>(parseList(properties.getProperty("permissions.adminRoles")));
        Set<Long> adminUsers = parseIds("permissions.adminUsers", properties.getProperty("permissions.adminUsers"));

        // Les sections command.* sont prioritaires sur feature.* pour un même nom
        Map<String, FeatureGrant> grants = new LinkedHashMap<>();
        Map<String, FeatureGrant> featureGrants = parseGrants(properties, FEATURE_PREFIX);
        grants.putAll(featureGrants);
        parseGrants(properties, COMMAND_PREFIX).forEach((name, grant) -> {
            if (featureGrants.containsKey(name)) {
                logger.debug("Permission '{}' : la section command.* masque feature.*", name);
            }
            grants.put(name, grant);
        });

        logger.info("Rôles administrateurs : {}", adminRoles);
        logger.info("Utilisateurs administrateurs : {}", adminUsers);
        logger.info("Fonctionnalités à permissions dédiées : {}", grants.keySet());
        return new PermissionConfig(adminRoles, adminUsers, grants);
    }

    private Map<String, FeatureGrant> parseGrants(Properties properties, String prefix) {
        Map<String, Set<String>> roles = new HashMap<>();
        Map<String, Set<Long>> users = new HashMap<>();

        List<String> keys = properties.stringPropertyNames().stream()
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .collect(Collectors.toList());

        for (String key : keys) {
            int separator = key.lastIndexOf('.');
            if (separator <= prefix.length()) {
                throw new ConfigException("Clé de permission invalide : " + key);
            }
            String feature = key.substring(prefix.length(), separator);
            String attribute = key.substring(separator + 1);
            String value = properties.getProperty(key);

            if (ALLOWED_ROLES.equals(attribute)) {
                roles.computeIfAbsent(feature, f -> new LinkedHashSet<>()).addAll(parseList(value));
                users.computeIfAbsent(feature, f -> new LinkedHashSet<>());
            } else if (ALLOWED_USERS.equals(attribute)) {
                users.computeIfAbsent(feature, f -> new LinkedHashSet<>()).addAll(parseIds(key, value));
                roles.computeIfAbsent(feature, f -> new LinkedHashSet<>());
            } else {
                logger.warn("Attribut de permission ignoré : {}", key);
            }
        }

        Map<String, FeatureGrant> grants = new LinkedHashMap<>();
        roles.keySet().stream().sorted().forEach(feature ->
                grants.put(feature, new FeatureGrant(feature, roles.get(feature), users.get(feature))));
        return grants;
    }

    private LoggingConfig parseLogging(Properties properties) {
        String level = properties.getProperty("logging.level", LoggingConfig.DEFAULT_LEVEL).trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(level)) {
            level = "WARN";
        } else if ("CRITICAL".equals(level)) {
            level = "ERROR";
        }
        if (!LOG_LEVELS.contains(level)) {
            throw new ConfigException("Niveau de journalisation inconnu : " + level);
        }

        return new LoggingConfig(
                level,
                properties.getProperty("logging.file", LoggingConfig.DEFAULT_FILE).trim(),
                parseLong(properties, "logging.maxBytes", LoggingConfig.DEFAULT_MAX_BYTES),
                (int) parseLong(properties, "logging.backupCount", LoggingConfig.DEFAULT_BACKUP_COUNT),
                parseBoolean(properties, "logging.notifyUserOnError", false)
        );
    }

    private DatabaseConfig parseDatabase(Properties properties) {
        String typeName = properties.getProperty("database.type", "sqlite");
        DatabaseConfig.Type type = DatabaseConfig.Type.fromName(typeName);
        if (type == null) {
            logger.warn("Type de base de données inconnu : {}. Utilisation de SQLite.", typeName);
            type = DatabaseConfig.Type.SQLITE;
        }

        String dsn = properties.getProperty("database.dsn", "db/bot.db").trim();
        if (dsn.isEmpty()) {
            throw new ConfigException("database.dsn ne peut pas être vide");
        }
        return new DatabaseConfig(type, dsn);
    }

    private SchedulerConfig parseScheduler(Properties properties) {
        long grace = parseLong(properties, "scheduler.misfireGraceSeconds", SchedulerConfig.DEFAULT_MISFIRE_GRACE_SECONDS);
        long poll = parseLong(properties, "scheduler.pollIntervalMillis", SchedulerConfig.DEFAULT_POLL_INTERVAL_MILLIS);
        if (poll <= 0) {
            throw new ConfigException("scheduler.pollIntervalMillis doit être positif");
        }
        return new SchedulerConfig((int) grace, poll);
    }

    private Map<String, String> collectGuildDefaults(Properties properties) {
        Map<String, String> defaults = new LinkedHashMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith("guild.") || key.startsWith("settings.")) {
                defaults.put(key, properties.getProperty(key).trim());
            }
        }
        return defaults;
    }

    /**
     * Convertit une liste séparée par des virgules
     * @param value valeur brute (peut être null)
     * @return les éléments non vides, sans espaces superflus
     */
    static List<String> parseList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
    }

    private static Set<Long> parseIds(String key, String value) {
        Set<Long> ids = new LinkedHashSet<>();
        for (String item : parseList(value)) {
            try {
                ids.add(Long.parseUnsignedLong(item));
            } catch (NumberFormatException e) {
                throw new ConfigException("ID utilisateur invalide '" + item + "' pour " + key, e);
            }
        }
        return ids;
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                throw new ConfigException(key + " ne peut pas être négatif : " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigException("Nombre invalide pour " + key + " : " + value, e);
        }
    }

    private static boolean parseBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> throw new ConfigException("Booléen invalide pour " + key + " : " + value);
        };
    }
}
