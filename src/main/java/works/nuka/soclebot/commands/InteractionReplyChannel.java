package works.nuka.soclebot.commands;

import net.dv8tion.jda.api.interactions.callbacks.IReplyCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Réponses aux commandes slash. La première réponse acquitte l'interaction,
 * les suivantes passent par le webhook de suivi.
 */
public class InteractionReplyChannel implements ReplyChannel {
    private static final Logger logger = LoggerFactory.getLogger(InteractionReplyChannel.class);

    private final IReplyCallback interaction;

    public InteractionReplyChannel(IReplyCallback interaction) {
        this.interaction = interaction;
    }

    @Override
    public void sendReply(String text, boolean ephemeral) {
        if (interaction.isAcknowledged()) {
            sendFollowup(text, ephemeral);
            return;
        }
        interaction.reply(text).setEphemeral(ephemeral).queue(null, this::onFailure);
    }

    @Override
    public void sendFollowup(String text, boolean ephemeral) {
        interaction.getHook().sendMessage(text).setEphemeral(ephemeral).queue(null, this::onFailure);
    }

    @Override
    public boolean hasResponseAlreadyBeenSent() {
        return interaction.isAcknowledged();
    }

    private void onFailure(Throwable failure) {
        logger.error("Échec de la réponse à l'interaction {} : {}", interaction.getId(), failure.getMessage());
    }
}
