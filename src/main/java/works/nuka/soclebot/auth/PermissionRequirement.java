package works.nuka.soclebot.auth;

/**
 * Permission exigée par une commande avant l'exécution de son traitement
 */
public final class PermissionRequirement {

    /**
     * Niveau d'exigence
     */
    public enum Kind {
        NONE,
        BOT_ADMIN,
        FEATURE
    }

    private static final PermissionRequirement NONE = new PermissionRequirement(Kind.NONE, null);
    private static final PermissionRequirement ADMIN_ONLY = new PermissionRequirement(Kind.BOT_ADMIN, null);

    private final Kind kind;
    private final String featureName;

    private PermissionRequirement(Kind kind, String featureName) {
        this.kind = kind;
        this.featureName = featureName;
    }

    /**
     * @return une exigence toujours satisfaite
     */
    public static PermissionRequirement none() {
        return NONE;
    }

    /**
     * @return une exigence réservée aux administrateurs du bot
     */
    public static PermissionRequirement adminOnly() {
        return ADMIN_ONLY;
    }

    /**
     * @param featureName nom de la fonctionnalité configurée
     * @return une exigence de permission dédiée (les administrateurs passent toujours)
     */
    public static PermissionRequirement feature(String featureName) {
        if (featureName == null || featureName.isBlank()) {
            throw new IllegalArgumentException("Le nom de la fonctionnalité est obligatoire");
        }
        return new PermissionRequirement(Kind.FEATURE, featureName);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return le nom de la fonctionnalité, ou null si l'exigence n'en vise aucune
     */
    public String getFeatureName() {
        return featureName;
    }

    @Override
    public String toString() {
        return kind == Kind.FEATURE ? "feature:" + featureName : kind.name().toLowerCase();
    }
}
