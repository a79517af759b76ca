package works.nuka.soclebot.commands;

import net.dv8tion.jda.api.JDA;
import works.nuka.soclebot.auth.Caller;
import works.nuka.soclebot.errors.UsageException;

/**
 * Contexte d'exécution d'une commande, indépendant de sa source (message ou commande slash)
 */
public class CommandContext {
    private final Caller caller;
    private final ReplyChannel replyChannel;
    private final Long guildId;
    private final long channelId;
    private final JDA jda;
    private final BotServices services;

    /**
     * @param guildId ID du serveur, null pour un message privé
     * @param jda connexion Discord (peut être null hors connexion)
     */
    public CommandContext(Caller caller, ReplyChannel replyChannel, Long guildId, long channelId,
                          JDA jda, BotServices services) {
        this.caller = caller;
        this.replyChannel = replyChannel;
        this.guildId = guildId;
        this.channelId = channelId;
        this.jda = jda;
        this.services = services;
    }

    public Caller getCaller() {
        return caller;
    }

    public ReplyChannel getReplyChannel() {
        return replyChannel;
    }

    public boolean isFromGuild() {
        return guildId != null;
    }

    public Long getGuildId() {
        return guildId;
    }

    /**
     * @return l'ID du serveur
     * @throws UsageException si la commande est utilisée en message privé
     */
    public long requireGuildId() {
        if (guildId == null) {
            throw new UsageException("Cette commande ne peut être utilisée que sur un serveur.");
        }
        return guildId;
    }

    public long getChannelId() {
        return channelId;
    }

    public JDA getJda() {
        return jda;
    }

    public BotServices getServices() {
        return services;
    }

    /**
     * Raccourci pour répondre publiquement
     * @param text le message
     */
    public void reply(String text) {
        replyChannel.sendReply(text, false);
    }
}
