package works.nuka.soclebot.errors;

import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.PermissionException;
import net.dv8tion.jda.api.exceptions.RateLimitedException;
import net.dv8tion.jda.api.requests.ErrorResponse;

import java.lang.reflect.InvocationTargetException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Associe une erreur levée pendant une commande à sa politique de journalisation
 * et de réponse. Les règles sont évaluées dans l'ordre, la première qui
 * correspond l'emporte.
 */
public class ErrorClassifier {
    static final String MSG_NO_PERMISSION = "❌ Vous n'avez pas la permission d'utiliser cette commande.";
    static final String MSG_USAGE = "❌ Utilisation incorrecte de la commande.";
    static final String MSG_BOT_FORBIDDEN = "❌ Le bot n'a pas les permissions nécessaires. Contactez un administrateur du serveur.";
    static final String MSG_EXTERNAL = "❌ Échec de l'appel au service externe : ";
    static final String MSG_UNEXPECTED = "❌ Une erreur inattendue s'est produite. Les administrateurs ont été prévenus.";

    private final boolean notifyUserOnError;

    /**
     * @param notifyUserOnError true pour prévenir l'utilisateur des erreurs inattendues
     */
    public ErrorClassifier(boolean notifyUserOnError) {
        this.notifyUserOnError = notifyUserOnError;
    }

    /**
     * Détermine la politique applicable à une erreur
     *
     * @param error l'erreur levée (éventuellement enveloppée)
     * @return la politique de journalisation et de réponse
     */
    public ErrorResolution classify(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof CommandNotFoundException) {
            return ErrorResolution.builder(ErrorResolution.Category.COMMAND_NOT_FOUND).build();
        }

        if (cause instanceof AuthorizationDeniedException) {
            return ErrorResolution.builder(ErrorResolution.Category.AUTHORIZATION_DENIED)
                    .notice(MSG_NO_PERMISSION, false)
                    .build();
        }

        if (cause instanceof UsageException) {
            return ErrorResolution.builder(ErrorResolution.Category.USAGE_ERROR)
                    .warn("[Usage Error] " + cause.getMessage())
                    .notice(MSG_USAGE + "\n```\n" + cause.getMessage() + "\n```", true)
                    .build();
        }

        if (cause instanceof RateLimitedException) {
            long retryAfter = ((RateLimitedException) cause).getRetryAfter();
            return ErrorResolution.builder(ErrorResolution.Category.RATE_LIMITED)
                    .warn(String.format(Locale.ROOT, "Limite de débit Discord atteinte. Nouvel essai dans %.2f s.", retryAfter / 1000.0))
                    .build();
        }

        if (isPlatformForbidden(cause)) {
            return ErrorResolution.builder(ErrorResolution.Category.PLATFORM_FORBIDDEN)
                    .error("Erreur Discord (403 Forbidden) : permissions du bot insuffisantes. " + describeMissing(cause), false)
                    .notice(MSG_BOT_FORBIDDEN, false)
                    .build();
        }

        if (cause instanceof ExternalDependencyException) {
            ExternalDependencyException external = (ExternalDependencyException) cause;
            return ErrorResolution.builder(ErrorResolution.Category.EXTERNAL_DEPENDENCY)
                    .warn("[External API Error] " + external.getDependency() + " : " + external.getMessage())
                    .notice(MSG_EXTERNAL + external.getMessage(), true)
                    .build();
        }

        ErrorResolution.Builder unclassified = ErrorResolution.builder(ErrorResolution.Category.UNCLASSIFIED)
                .error("Erreur inattendue pendant l'exécution de la commande.", true);
        if (notifyUserOnError) {
            unclassified.notice(MSG_UNEXPECTED, false);
        }
        return unclassified.build();
    }

    public boolean isNotifyUserOnError() {
        return notifyUserOnError;
    }

    /**
     * Retire les enveloppes techniques (exécution asynchrone, réflexion)
     *
     * @param error l'erreur reçue
     * @return la cause d'origine
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof InvocationTargetException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isPlatformForbidden(Throwable cause) {
        if (cause instanceof PermissionException) {
            return true;
        }
        if (cause instanceof ErrorResponseException) {
            ErrorResponse response = ((ErrorResponseException) cause).getErrorResponse();
            return response == ErrorResponse.MISSING_PERMISSIONS || response == ErrorResponse.MISSING_ACCESS;
        }
        return false;
    }

    private static String describeMissing(Throwable cause) {
        if (cause instanceof PermissionException) {
            return "Permission manquante : " + ((PermissionException) cause).getPermission().getName();
        }
        return "Détail : " + cause.getMessage();
    }
}
