package works.nuka.soclebot.errors;

/**
 * Le stockage persistant n'est pas joignable.
 * Fatale lorsqu'elle survient pendant le démarrage.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
