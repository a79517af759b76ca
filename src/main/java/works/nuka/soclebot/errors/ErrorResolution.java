package works.nuka.soclebot.errors;

/**
 * Politique de traitement d'une erreur : ce qu'il faut journaliser et ce qu'il faut répondre
 */
public final class ErrorResolution {

    /**
     * Catégorie d'erreur retenue par le classificateur
     */
    public enum Category {
        COMMAND_NOT_FOUND,
        AUTHORIZATION_DENIED,
        USAGE_ERROR,
        RATE_LIMITED,
        PLATFORM_FORBIDDEN,
        EXTERNAL_DEPENDENCY,
        UNCLASSIFIED
    }

    /**
     * Niveau de l'unique enregistrement de journal produit
     */
    public enum LogLevel {
        NONE,
        WARN,
        ERROR
    }

    private final Category category;
    private final LogLevel logLevel;
    private final String logMessage;
    private final boolean includeStack;
    private final String userNotice;
    private final boolean exposeDetails;

    private ErrorResolution(Builder builder) {
        this.category = builder.category;
        this.logLevel = builder.logLevel;
        this.logMessage = builder.logMessage;
        this.includeStack = builder.includeStack;
        this.userNotice = builder.userNotice;
        this.exposeDetails = builder.exposeDetails;
    }

    public Category getCategory() {
        return category;
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }

    public String getLogMessage() {
        return logMessage;
    }

    public boolean isIncludeStack() {
        return includeStack;
    }

    /**
     * @return le message destiné à l'utilisateur, ou null si aucune réponse
     */
    public String getUserNotice() {
        return userNotice;
    }

    public boolean hasUserNotice() {
        return userNotice != null;
    }

    /**
     * @return true si la réponse reprend le détail de l'erreur
     */
    public boolean isExposeDetails() {
        return exposeDetails;
    }

    /**
     * @return true si l'erreur ne produit ni journal ni réponse
     */
    public boolean isSilent() {
        return logLevel == LogLevel.NONE && userNotice == null;
    }

    /**
     * Les réponses d'erreur ne sont visibles que par l'appelant
     * @return toujours true
     */
    public boolean isEphemeral() {
        return true;
    }

    @Override
    public String toString() {
        return "ErrorResolution{" + category + ", log=" + logLevel + ", notice=" + (userNotice != null) + "}";
    }

    static Builder builder(Category category) {
        return new Builder(category);
    }

    static final class Builder {
        private final Category category;
        private LogLevel logLevel = LogLevel.NONE;
        private String logMessage;
        private boolean includeStack;
        private String userNotice;
        private boolean exposeDetails;

        private Builder(Category category) {
            this.category = category;
        }

        Builder warn(String message) {
            this.logLevel = LogLevel.WARN;
            this.logMessage = message;
            return this;
        }

        Builder error(String message, boolean includeStack) {
            this.logLevel = LogLevel.ERROR;
            this.logMessage = message;
            this.includeStack = includeStack;
            return this;
        }

        Builder notice(String message, boolean exposeDetails) {
            this.userNotice = message;
            this.exposeDetails = exposeDetails;
            return this;
        }

        ErrorResolution build() {
            return new ErrorResolution(this);
        }
    }
}
