package works.nuka.soclebot.utils;

import org.slf4j.Logger;

/**
 * Formats de journal communs du bot (commandes, événements, erreurs)
 */
public final class BotLogs {

    private BotLogs() {
    }

    /**
     * Enregistre les détails d'une commande exécutée
     *
     * @param logger journal de destination
     * @param guildName nom du serveur (ou null si message privé)
     * @param channelName nom du canal
     * @param userName nom de l'utilisateur
     * @param userId ID de l'utilisateur
     * @param content contenu de la commande
     */
    public static void logCommand(Logger logger, String guildName, String channelName,
                                  String userName, long userId, String content) {
        String location = guildName != null ? guildName : "DM";
        logger.info("[Cmd] {} > #{} | {} (ID: {}) | {}", location, channelName, userName, userId, content);
    }

    /**
     * Enregistre un événement du bot
     *
     * @param logger journal de destination
     * @param message description de l'événement
     * @param guildName serveur concerné (peut être null)
     */
    public static void logEvent(Logger logger, String message, String guildName) {
        if (guildName != null) {
            logger.info("[Evt] [{}] {}", guildName, message);
        } else {
            logger.info("[Evt] {}", message);
        }
    }

    /**
     * Enregistre une erreur avec son type et son détail
     *
     * @param logger journal de destination
     * @param error exception (peut être null)
     * @param message résumé de l'erreur
     * @param includeStack true pour joindre la pile d'appels
     */
    public static void logError(Logger logger, Throwable error, String message, boolean includeStack) {
        if (error == null) {
            logger.error("[Err] {}", message);
            return;
        }
        String formatted = String.format("[Err] %s - Type: %s - Details: %s",
                message, error.getClass().getSimpleName(), error.getMessage());
        if (includeStack) {
            logger.error(formatted, error);
        } else {
            logger.error(formatted);
        }
    }
}
