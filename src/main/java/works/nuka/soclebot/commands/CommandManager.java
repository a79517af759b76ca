package works.nuka.soclebot.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.auth.PermissionRequirement;
import works.nuka.soclebot.auth.PermissionResolver;
import works.nuka.soclebot.errors.CommandNotFoundException;
import works.nuka.soclebot.errors.ErrorHandler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Gestionnaire des commandes du bot : enregistrement, gardes et routage des erreurs
 */
public class CommandManager {
    private static final Logger logger = LoggerFactory.getLogger(CommandManager.class);

    private final Map<String, Command> lookup = new ConcurrentHashMap<>();
    private final Map<String, Command> commands = new ConcurrentSkipListMap<>();
    private final List<CommandGuard> guards = new CopyOnWriteArrayList<>();
    private final PermissionResolver permissionResolver;
    private final ErrorHandler errorHandler;

    /**
     * Initialise le gestionnaire ; la garde de permissions est toujours évaluée en premier
     *
     * @param permissionResolver résolution des permissions
     * @param errorHandler destination de toutes les erreurs de commande
     */
    public CommandManager(PermissionResolver permissionResolver, ErrorHandler errorHandler) {
        this.permissionResolver = permissionResolver;
        this.errorHandler = errorHandler;
        this.guards.add(new PermissionGuard(permissionResolver));
    }

    /**
     * Ajoute une garde évaluée après les gardes existantes
     * @param guard la garde
     */
    public void addGuard(CommandGuard guard) {
        guards.add(guard);
    }

    /**
     * Enregistre une commande et ses alias
     * @param command la commande à enregistrer
     * @throws IllegalArgumentException si le nom ou un alias est déjà utilisé
     */
    public void registerCommand(Command command) {
        String name = command.getName().toLowerCase(Locale.ROOT);
        List<String> keys = new ArrayList<>();
        keys.add(name);
        for (String alias : command.getAliases()) {
            keys.add(alias.toLowerCase(Locale.ROOT));
        }
        for (String key : keys) {
            if (lookup.containsKey(key)) {
                throw new IllegalArgumentException("Nom de commande déjà utilisé : " + key);
            }
        }

        for (String key : keys) {
            lookup.put(key, command);
        }
        commands.put(name, command);

        PermissionRequirement requirement = command.getRequirement();
        if (requirement.getKind() == PermissionRequirement.Kind.FEATURE) {
            List<String> unknown = permissionResolver.getConfig()
                    .unknownFeatures(Collections.singleton(requirement.getFeatureName()));
            if (!unknown.isEmpty()) {
                logger.warn("La commande '{}' requiert la permission '{}' absente de la configuration : "
                        + "seuls les administrateurs pourront l'utiliser", name, requirement.getFeatureName());
            }
        }
        logger.debug("Commande enregistrée : {} ({})", name, requirement);
    }

    /**
     * Retire une commande et ses alias
     * @param name nom de la commande
     * @return true si la commande existait
     */
    public boolean unregisterCommand(String name) {
        Command command = commands.remove(name.toLowerCase(Locale.ROOT));
        if (command == null) {
            return false;
        }
        lookup.values().removeIf(registered -> registered == command);
        return true;
    }

    /**
     * Exécute une commande par son nom. N'émet jamais d'exception : toute erreur
     * (commande inconnue, refus, échec de la commande) passe par le gestionnaire d'erreurs.
     *
     * @param name nom ou alias de la commande
     * @param context contexte de l'appel
     * @param args arguments de la commande
     * @return true si la commande s'est exécutée sans erreur
     */
    public boolean dispatch(String name, CommandContext context, String[] args) {
        try {
            Command command = findCommand(name)
                    .orElseThrow(() -> new CommandNotFoundException(name));
            for (CommandGuard guard : guards) {
                guard.check(command, context);
            }
            command.execute(context, args);
            return true;
        } catch (Exception e) {
            errorHandler.handle(context.getReplyChannel(), e);
            return false;
        }
    }

    /**
     * Cherche une commande par son nom ou un alias, sans tenir compte de la casse
     * @param name nom ou alias
     * @return la commande
     */
    public Optional<Command> findCommand(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(lookup.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Obtient toutes les commandes enregistrées, par nom
     * @return les commandes
     */
    public Collection<Command> getCommands() {
        return Collections.unmodifiableCollection(commands.values());
    }

    /**
     * @return les permissions requises par les commandes mais absentes de la configuration
     */
    public List<String> findUnknownFeatures() {
        List<String> features = new ArrayList<>();
        for (Command command : commands.values()) {
            if (command.getRequirement().getKind() == PermissionRequirement.Kind.FEATURE) {
                features.add(command.getRequirement().getFeatureName());
            }
        }
        return permissionResolver.getConfig().unknownFeatures(features);
    }
}
