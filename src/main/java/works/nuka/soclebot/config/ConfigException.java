package works.nuka.soclebot.config;

/**
 * Erreur fatale de configuration : le démarrage du bot doit être interrompu
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
