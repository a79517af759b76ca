package works.nuka.soclebot.modules.example;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.modules.BotModule;
import works.nuka.soclebot.scheduler.ScheduledJob;

import java.util.List;
import java.util.Map;

/**
 * Module d'exemple : salutation, latence, commandes à permission, paramètres et rappels
 */
public class ExampleModule implements BotModule {
    private static final Logger logger = LoggerFactory.getLogger(ExampleModule.class);

    private final List<Command> commands = List.of(
            new GreetCommand(),
            new PingCommand(),
            new AdminTestCommand(),
            new HrCommand(),
            new SettingCommand(),
            new RemindCommand());

    private final Map<String, ScheduledJob> jobs = Map.of(ReminderJob.NAME, new ReminderJob());

    @Override
    public String getId() {
        return "example";
    }

    @Override
    public String getName() {
        return "Module d'exemple";
    }

    @Override
    public String getDescription() {
        return "Commandes de démonstration du socle";
    }

    @Override
    public List<Command> getCommands() {
        return commands;
    }

    @Override
    public Map<String, ScheduledJob> getJobs() {
        return jobs;
    }

    @Override
    public void onEnable() {
        logger.info("Activation du module d'exemple");
    }

    @Override
    public void onDisable() {
        logger.info("Désactivation du module d'exemple");
    }
}
