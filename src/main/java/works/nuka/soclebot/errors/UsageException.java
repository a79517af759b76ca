package works.nuka.soclebot.errors;

/**
 * Argument de commande manquant ou mal formé.
 * Le message est renvoyé tel quel à l'utilisateur.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
