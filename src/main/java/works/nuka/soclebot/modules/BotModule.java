package works.nuka.soclebot.modules;

import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.scheduler.ScheduledJob;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ensemble de commandes et de traitements planifiés chargé au démarrage du bot
 */
public interface BotModule {

    String getId();

    String getName();

    String getDescription();

    default String getVersion() {
        return "1.0.0";
    }

    /**
     * @return les commandes fournies par le module
     */
    List<Command> getCommands();

    /**
     * @return les traitements planifiés fournis par le module, par nom d'enregistrement
     */
    default Map<String, ScheduledJob> getJobs() {
        return Collections.emptyMap();
    }

    /**
     * Appelé après l'enregistrement des commandes et des traitements
     */
    default void onEnable() {
    }

    /**
     * Appelé après le retrait des commandes du module
     */
    default void onDisable() {
    }
}
