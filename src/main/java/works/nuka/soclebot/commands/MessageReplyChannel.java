package works.nuka.soclebot.commands;

import net.dv8tion.jda.api.entities.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Réponses aux commandes préfixées, envoyées dans le canal du message.
 * Discord ne permet pas de message éphémère ici : l'option est ignorée.
 */
public class MessageReplyChannel implements ReplyChannel {
    private static final Logger logger = LoggerFactory.getLogger(MessageReplyChannel.class);

    private final Message message;
    private final AtomicBoolean responded = new AtomicBoolean(false);

    public MessageReplyChannel(Message message) {
        this.message = message;
    }

    @Override
    public void sendReply(String text, boolean ephemeral) {
        responded.set(true);
        message.reply(text).queue(null, this::onFailure);
    }

    @Override
    public void sendFollowup(String text, boolean ephemeral) {
        responded.set(true);
        message.getChannel().sendMessage(text).queue(null, this::onFailure);
    }

    @Override
    public boolean hasResponseAlreadyBeenSent() {
        return responded.get();
    }

    private void onFailure(Throwable failure) {
        logger.error("Échec de l'envoi de la réponse dans le canal {} : {}",
                message.getChannel().getId(), failure.getMessage());
    }
}
