package works.nuka.soclebot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.entities.Activity;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.auth.PermissionResolver;
import works.nuka.soclebot.commands.BotServices;
import works.nuka.soclebot.commands.CommandManager;
import works.nuka.soclebot.config.BotConfig;
import works.nuka.soclebot.config.ConfigException;
import works.nuka.soclebot.config.ConfigLoader;
import works.nuka.soclebot.errors.ErrorClassifier;
import works.nuka.soclebot.errors.ErrorHandler;
import works.nuka.soclebot.listeners.MessageCommandListener;
import works.nuka.soclebot.listeners.ReadyListener;
import works.nuka.soclebot.listeners.SlashCommandListener;
import works.nuka.soclebot.modules.BotModule;
import works.nuka.soclebot.modules.ModuleLoader;
import works.nuka.soclebot.modules.example.ExampleModule;
import works.nuka.soclebot.repositories.GuildSettingRepository;
import works.nuka.soclebot.repositories.ScheduledTaskRepository;
import works.nuka.soclebot.scheduler.TaskScheduler;
import works.nuka.soclebot.services.GuildSettingService;
import works.nuka.soclebot.utils.DatabaseManager;
import works.nuka.soclebot.utils.LoggingConfigurer;
import works.nuka.soclebot.utils.RateLimiter;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Classe principale du bot : assemble les composants, se connecte à Discord
 * et les arrête dans l'ordre inverse.
 */
public class SocleBot {
    private static final Logger logger = LoggerFactory.getLogger(SocleBot.class);

    // 5 commandes par 10 secondes et par utilisateur
    private static final int RATE_LIMIT_REQUESTS = 5;
    private static final long RATE_LIMIT_WINDOW_MILLIS = 10_000;

    private final BotConfig config;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private DatabaseManager databaseManager;
    private TaskScheduler scheduler;
    private ModuleLoader moduleLoader;
    private JDA jda;

    public SocleBot(BotConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        BotConfig config;
        try {
            config = new ConfigLoader().load();
        } catch (ConfigException e) {
            System.err.println("Erreur de configuration : " + e.getMessage());
            System.exit(1);
            return;
        }

        LoggingConfigurer.configure(config.getLogging());

        SocleBot bot = new SocleBot(config);
        Runtime.getRuntime().addShutdownHook(new Thread(bot::shutdown, "soclebot-shutdown"));
        try {
            bot.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Démarrage du bot interrompu");
            bot.shutdown();
            System.exit(1);
        } catch (Exception e) {
            logger.error("Erreur lors du démarrage du bot", e);
            bot.shutdown();
            System.exit(1);
        }
    }

    /**
     * Initialise la base, les services et les modules, puis se connecte à Discord.
     * Le planificateur démarre une fois la connexion établie.
     *
     * @throws InterruptedException si l'attente de la connexion est interrompue
     */
    public void start() throws InterruptedException {
        databaseManager = new DatabaseManager(config.getDatabase());
        databaseManager.initSchema();
        logger.info("Connexion à la base de données établie");

        GuildSettingService settings = new GuildSettingService(new GuildSettingRepository(databaseManager), config);
        PermissionResolver permissionResolver = new PermissionResolver(config.getPermissions());
        ErrorHandler errorHandler = new ErrorHandler(
                new ErrorClassifier(config.getLogging().isNotifyUserOnError()));
        scheduler = new TaskScheduler(new ScheduledTaskRepository(databaseManager), databaseManager,
                settings, config.getScheduler());

        CommandManager commandManager = new CommandManager(permissionResolver, errorHandler);
        moduleLoader = new ModuleLoader(commandManager, scheduler);
        moduleLoader.loadModules(modules());

        BotServices services = new BotServices(config, permissionResolver, settings, scheduler);

        EnumSet<GatewayIntent> intents = EnumSet.of(
                GatewayIntent.GUILD_MESSAGES,
                GatewayIntent.DIRECT_MESSAGES,
                GatewayIntent.MESSAGE_CONTENT,
                GatewayIntent.GUILD_MEMBERS
        );

        jda = JDABuilder.createDefault(config.getToken())
                .setActivity(Activity.playing(config.getBotName()))
                .enableIntents(intents)
                .addEventListeners(
                        new ReadyListener(commandManager),
                        new MessageCommandListener(commandManager, services,
                                new RateLimiter(RATE_LIMIT_REQUESTS, RATE_LIMIT_WINDOW_MILLIS)),
                        new SlashCommandListener(commandManager, services))
                .build();

        jda.awaitReady();
        logger.info("Bot {} connecté et prêt!", jda.getSelfUser().getName());

        scheduler.attachJda(jda);
        scheduler.start();
    }

    /**
     * Arrête le planificateur, les modules, la connexion Discord puis la base.
     * Chaque étape est tentée même si la précédente échoue ; les appels suivants sont sans effet.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Arrêt du bot");

        if (scheduler != null) {
            try {
                scheduler.shutdown(false);
            } catch (RuntimeException e) {
                logger.error("Erreur lors de l'arrêt du planificateur", e);
            }
        }
        if (moduleLoader != null) {
            moduleLoader.unloadAll();
        }
        if (jda != null) {
            try {
                jda.shutdown();
            } catch (RuntimeException e) {
                logger.error("Erreur lors de la déconnexion de Discord", e);
            }
        }
        if (databaseManager != null) {
            try {
                databaseManager.close();
            } catch (RuntimeException e) {
                logger.error("Erreur lors de la fermeture de la base de données", e);
            }
        }
        logger.info("Bot arrêté");
    }

    private static List<BotModule> modules() {
        return List.of(new ExampleModule());
    }
}
