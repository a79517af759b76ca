package works.nuka.soclebot.auth;

/**
 * Résultat d'une vérification de permission
 */
public final class AuthorizationResult {
    private static final AuthorizationResult GRANTED = new AuthorizationResult(true, null);

    private final boolean granted;
    private final String denialReason;

    private AuthorizationResult(boolean granted, String denialReason) {
        this.granted = granted;
        this.denialReason = denialReason;
    }

    public static AuthorizationResult granted() {
        return GRANTED;
    }

    public static AuthorizationResult denied(String reason) {
        return new AuthorizationResult(false, reason);
    }

    public boolean isGranted() {
        return granted;
    }

    /**
     * @return la raison du refus, ou null si accordé
     */
    public String getDenialReason() {
        return denialReason;
    }
}
