package works.nuka.soclebot.errors;

/**
 * Échec d'un service externe appelé par une fonctionnalité du bot (API météo, etc.)
 */
public class ExternalDependencyException extends RuntimeException {
    private final String dependency;

    public ExternalDependencyException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public ExternalDependencyException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    /**
     * Obtient le nom du service en échec
     * @return le nom du service
     */
    public String getDependency() {
        return dependency;
    }
}
