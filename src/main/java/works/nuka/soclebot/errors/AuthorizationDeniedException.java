package works.nuka.soclebot.errors;

/**
 * L'appelant n'a pas la permission requise par la commande
 */
public class AuthorizationDeniedException extends RuntimeException {

    public AuthorizationDeniedException(String message) {
        super(message);
    }
}
