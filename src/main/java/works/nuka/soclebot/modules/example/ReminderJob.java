package works.nuka.soclebot.modules.example;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import works.nuka.soclebot.scheduler.ScheduledJob;
import works.nuka.soclebot.scheduler.TaskContext;

/**
 * Envoie le texte d'un rappel dans le canal où il a été demandé
 */
public class ReminderJob implements ScheduledJob {
    public static final String NAME = "reminder";
    static final String ARG_CHANNEL_ID = "channelId";
    static final String ARG_USER_ID = "userId";
    static final String ARG_TEXT = "text";

    @Override
    public void run(TaskContext context) {
        JDA jda = context.getJda()
                .orElseThrow(() -> new IllegalStateException("Connexion Discord indisponible"));
        long channelId = Long.parseLong(context.getArg(ARG_CHANNEL_ID)
                .orElseThrow(() -> new IllegalArgumentException("Argument manquant : " + ARG_CHANNEL_ID)));

        MessageChannel channel = jda.getChannelById(MessageChannel.class, channelId);
        if (channel == null) {
            context.getLogger().warn("Rappel {} : canal {} introuvable", context.getTaskId(), channelId);
            return;
        }

        String mention = context.getArg(ARG_USER_ID).map(id -> "<@" + id + "> ").orElse("");
        channel.sendMessage("⏰ " + mention + context.getArg(ARG_TEXT).orElse("")).complete();
        context.getLogger().info("Rappel {} envoyé dans le canal {}", context.getTaskId(), channelId);
    }
}
