package works.nuka.soclebot.errors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.commands.ReplyChannel;
import works.nuka.soclebot.utils.BotLogs;

/**
 * Point de passage unique des erreurs de commande : un enregistrement de journal
 * au plus et une réponse éphémère au plus.
 */
public class ErrorHandler {
    private static final Logger logger = LoggerFactory.getLogger(ErrorHandler.class);

    private final ErrorClassifier classifier;

    public ErrorHandler(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Traite une erreur levée pendant une commande. Ne lève jamais d'exception.
     *
     * @param channel le canal de réponse de la commande (peut être null)
     * @param error l'erreur
     * @return la politique appliquée
     */
    public ErrorResolution handle(ReplyChannel channel, Throwable error) {
        ErrorResolution resolution = classifier.classify(error);
        Throwable cause = ErrorClassifier.unwrap(error);

        switch (resolution.getLogLevel()) {
            case WARN:
                logger.warn(resolution.getLogMessage());
                break;
            case ERROR:
                BotLogs.logError(logger, cause, resolution.getLogMessage(), resolution.isIncludeStack());
                break;
            case NONE:
            default:
                break;
        }

        if (resolution.hasUserNotice() && channel != null) {
            notifyUser(channel, resolution);
        }
        return resolution;
    }

    private void notifyUser(ReplyChannel channel, ErrorResolution resolution) {
        try {
            if (channel.hasResponseAlreadyBeenSent()) {
                channel.sendFollowup(resolution.getUserNotice(), resolution.isEphemeral());
            } else {
                channel.sendReply(resolution.getUserNotice(), resolution.isEphemeral());
            }
        } catch (RuntimeException e) {
            logger.error("Impossible d'envoyer le message d'erreur à l'utilisateur : {}", e.getMessage());
        }
    }

    public ErrorClassifier getClassifier() {
        return classifier;
    }
}
