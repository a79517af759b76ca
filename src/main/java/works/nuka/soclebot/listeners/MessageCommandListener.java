package works.nuka.soclebot.listeners;

import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.auth.JdaCaller;
import works.nuka.soclebot.commands.BotServices;
import works.nuka.soclebot.commands.CommandContext;
import works.nuka.soclebot.commands.CommandManager;
import works.nuka.soclebot.commands.MessageReplyChannel;
import works.nuka.soclebot.utils.BotLogs;
import works.nuka.soclebot.utils.CommandUtils;
import works.nuka.soclebot.utils.RateLimiter;

/**
 * Écouteur pour les commandes préfixées
 */
public class MessageCommandListener extends ListenerAdapter {
    private static final Logger logger = LoggerFactory.getLogger(MessageCommandListener.class);

    private final CommandManager commandManager;
    private final BotServices services;
    private final RateLimiter rateLimiter;
    private final String prefix;

    public MessageCommandListener(CommandManager commandManager, BotServices services, RateLimiter rateLimiter) {
        this.commandManager = commandManager;
        this.services = services;
        this.rateLimiter = rateLimiter;
        this.prefix = services.getConfig().getCommandPrefix();
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        // Ignorer les messages des bots, y compris le nôtre
        if (event.getAuthor().isBot()) return;

        Message message = event.getMessage();
        String content = message.getContentRaw();
        if (!content.startsWith(prefix)) {
            return;
        }

        String commandName = CommandUtils.extractCommandName(content, prefix);
        if (commandName.isEmpty()) {
            return;
        }

        // Seules les commandes existantes sont décomptées
        boolean known = commandManager.findCommand(commandName).isPresent();
        if (known && !rateLimiter.check(event.getAuthor().getIdLong())) {
            message.reply("⚠️ Vous envoyez des commandes trop rapidement. Veuillez attendre un peu.").queue();
            return;
        }

        String[] args = CommandUtils.parseArgs(content, prefix, commandName);
        BotLogs.logCommand(logger,
                event.isFromGuild() ? event.getGuild().getName() : null,
                event.getChannel().getName(),
                event.getAuthor().getName(),
                event.getAuthor().getIdLong(),
                content);

        CommandContext context = new CommandContext(
                new JdaCaller(event.getAuthor(), event.getMember()),
                new MessageReplyChannel(message),
                event.isFromGuild() ? event.getGuild().getIdLong() : null,
                event.getChannel().getIdLong(),
                event.getJDA(),
                services);
        commandManager.dispatch(commandName, context, args);
    }
}
