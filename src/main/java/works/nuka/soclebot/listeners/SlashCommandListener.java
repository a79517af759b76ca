package works.nuka.soclebot.listeners;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.auth.JdaCaller;
import works.nuka.soclebot.commands.BotServices;
import works.nuka.soclebot.commands.CommandContext;
import works.nuka.soclebot.commands.CommandManager;
import works.nuka.soclebot.commands.InteractionReplyChannel;
import works.nuka.soclebot.utils.BotLogs;
import works.nuka.soclebot.utils.CommandUtils;

/**
 * Écouteur pour les commandes slash. Les arguments arrivent dans une option texte unique.
 */
public class SlashCommandListener extends ListenerAdapter {
    private static final Logger logger = LoggerFactory.getLogger(SlashCommandListener.class);

    public static final String ARGUMENTS_OPTION = "arguments";

    private final CommandManager commandManager;
    private final BotServices services;

    public SlashCommandListener(CommandManager commandManager, BotServices services) {
        this.commandManager = commandManager;
        this.services = services;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        OptionMapping option = event.getOption(ARGUMENTS_OPTION);
        String rawArgs = option != null ? option.getAsString() : "";

        BotLogs.logCommand(logger,
                event.isFromGuild() ? event.getGuild().getName() : null,
                event.getChannel().getName(),
                event.getUser().getName(),
                event.getUser().getIdLong(),
                "/" + event.getName() + (rawArgs.isEmpty() ? "" : " " + rawArgs));

        CommandContext context = new CommandContext(
                new JdaCaller(event.getUser(), event.getMember()),
                new InteractionReplyChannel(event),
                event.isFromGuild() ? event.getGuild().getIdLong() : null,
                event.getChannel().getIdLong(),
                event.getJDA(),
                services);
        commandManager.dispatch(event.getName(), context, CommandUtils.splitArgs(rawArgs));
    }
}
