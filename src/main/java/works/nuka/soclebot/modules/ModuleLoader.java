package works.nuka.soclebot.modules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandManager;
import works.nuka.soclebot.scheduler.ScheduledJob;
import works.nuka.soclebot.scheduler.TaskScheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chargeur de modules pour le bot
 */
public class ModuleLoader {
    private static final Logger logger = LoggerFactory.getLogger(ModuleLoader.class);

    private final CommandManager commandManager;
    private final TaskScheduler scheduler;
    private final Map<String, BotModule> loadedModules = new LinkedHashMap<>();

    public ModuleLoader(CommandManager commandManager, TaskScheduler scheduler) {
        this.commandManager = commandManager;
        this.scheduler = scheduler;
    }

    /**
     * Charge une liste de modules. L'échec d'un module n'empêche pas le chargement des autres.
     *
     * @param modules les modules à charger
     * @return le nombre de modules chargés
     */
    public int loadModules(List<BotModule> modules) {
        int loaded = 0;
        for (BotModule module : modules) {
            try {
                loadModule(module);
                loaded++;
            } catch (RuntimeException e) {
                logger.error("Erreur lors du chargement du module {}", module.getId(), e);
            }
        }
        logger.info("Modules chargés: {}/{}", loaded, modules.size());
        return loaded;
    }

    /**
     * Enregistre les commandes et traitements d'un module puis l'active.
     * En cas d'échec, les commandes déjà enregistrées sont retirées.
     *
     * @param module le module
     * @throws IllegalStateException si un module de même ID est déjà chargé
     */
    public synchronized void loadModule(BotModule module) {
        if (loadedModules.containsKey(module.getId())) {
            throw new IllegalStateException("Module déjà chargé : " + module.getId());
        }

        List<Command> registered = new ArrayList<>();
        try {
            for (Command command : module.getCommands()) {
                commandManager.registerCommand(command);
                registered.add(command);
            }
            for (Map.Entry<String, ScheduledJob> job : module.getJobs().entrySet()) {
                scheduler.registerJob(job.getKey(), job.getValue());
            }
            module.onEnable();
        } catch (RuntimeException e) {
            for (Command command : registered) {
                commandManager.unregisterCommand(command.getName());
            }
            throw e;
        }

        loadedModules.put(module.getId(), module);
        logger.info("Module '{}' v{} chargé ({} commande(s), {} traitement(s))",
                module.getName(), module.getVersion(), registered.size(), module.getJobs().size());
    }

    /**
     * Désactive un module et retire ses commandes. Ses traitements restent enregistrés
     * pour que les tâches déjà persistées ne soient pas orphelines.
     *
     * @param moduleId l'ID du module
     * @return true si le module était chargé
     */
    public synchronized boolean unloadModule(String moduleId) {
        BotModule module = loadedModules.remove(moduleId);
        if (module == null) {
            return false;
        }
        for (Command command : module.getCommands()) {
            commandManager.unregisterCommand(command.getName());
        }
        try {
            module.onDisable();
        } catch (RuntimeException e) {
            logger.error("Erreur lors de la désactivation du module {}", moduleId, e);
        }
        logger.info("Module '{}' déchargé", module.getName());
        return true;
    }

    /**
     * Désactive tous les modules, dans l'ordre inverse du chargement
     */
    public synchronized void unloadAll() {
        List<String> ids = new ArrayList<>(loadedModules.keySet());
        Collections.reverse(ids);
        for (String id : ids) {
            unloadModule(id);
        }
    }

    public synchronized Collection<BotModule> getLoadedModules() {
        return Collections.unmodifiableCollection(new ArrayList<>(loadedModules.values()));
    }
}
