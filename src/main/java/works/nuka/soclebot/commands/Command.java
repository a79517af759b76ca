package works.nuka.soclebot.commands;

import works.nuka.soclebot.auth.PermissionRequirement;

/**
 * Interface pour les commandes du bot
 */
public interface Command {
    /**
     * Obtient le nom de la commande
     * @return le nom
     */
    String getName();

    /**
     * Obtient la description de la commande
     * @return la description
     */
    String getDescription();

    /**
     * Obtient les exemples d'utilisation de la commande
     * @return les exemples d'utilisation
     */
    String getUsage();

    /**
     * Obtient les alias de la commande
     * @return les alias
     */
    default String[] getAliases() {
        return new String[0];
    }

    /**
     * Obtient l'exigence de permission vérifiée avant l'exécution
     * @return l'exigence, aucune par défaut
     */
    default PermissionRequirement getRequirement() {
        return PermissionRequirement.none();
    }

    /**
     * Exécute la commande. Toute exception est transmise au gestionnaire d'erreurs.
     * @param context contexte de l'appel
     * @param args arguments de la commande
     * @throws Exception en cas d'échec
     */
    void execute(CommandContext context, String[] args) throws Exception;
}
