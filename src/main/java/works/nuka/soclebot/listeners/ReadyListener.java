package works.nuka.soclebot.listeners;

import net.dv8tion.jda.api.events.guild.GuildJoinEvent;
import net.dv8tion.jda.api.events.guild.GuildLeaveEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandManager;
import works.nuka.soclebot.utils.BotLogs;

import java.util.ArrayList;
import java.util.List;

/**
 * Synchronise les commandes slash à la connexion et journalise les arrivées et départs de serveurs
 */
public class ReadyListener extends ListenerAdapter {
    private static final Logger logger = LoggerFactory.getLogger(ReadyListener.class);
    private static final int MAX_DESCRIPTION_LENGTH = 100;

    private final CommandManager commandManager;

    public ReadyListener(CommandManager commandManager) {
        this.commandManager = commandManager;
    }

    @Override
    public void onReady(ReadyEvent event) {
        logger.info("Connecté en tant que {} (ID: {}) sur {} serveur(s)",
                event.getJDA().getSelfUser().getName(),
                event.getJDA().getSelfUser().getId(),
                event.getGuildTotalCount());

        List<CommandData> slashCommands = buildSlashCommands(commandManager);
        event.getJDA().updateCommands().addCommands(slashCommands).queue(
                synced -> logger.info("{} commande(s) slash synchronisée(s)", synced.size()),
                failure -> logger.error("Échec de la synchronisation des commandes slash : {}", failure.getMessage()));
    }

    @Override
    public void onGuildJoin(GuildJoinEvent event) {
        BotLogs.logEvent(logger, "Bot ajouté au serveur (ID: " + event.getGuild().getId() + ")",
                event.getGuild().getName());
    }

    @Override
    public void onGuildLeave(GuildLeaveEvent event) {
        BotLogs.logEvent(logger, "Bot retiré du serveur (ID: " + event.getGuild().getId() + ")",
                event.getGuild().getName());
    }

    /**
     * Construit la déclaration slash de chaque commande, avec une option texte facultative
     *
     * @param commandManager les commandes enregistrées
     * @return les déclarations
     */
    static List<CommandData> buildSlashCommands(CommandManager commandManager) {
        List<CommandData> result = new ArrayList<>();
        for (Command command : commandManager.getCommands()) {
            result.add(Commands.slash(command.getName(), truncate(command.getDescription()))
                    .addOption(OptionType.STRING, SlashCommandListener.ARGUMENTS_OPTION,
                            truncate("Arguments : " + command.getUsage()), false));
        }
        return result;
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_DESCRIPTION_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_DESCRIPTION_LENGTH - 1) + "…";
    }
}
