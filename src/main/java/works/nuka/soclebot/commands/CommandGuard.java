package works.nuka.soclebot.commands;

/**
 * Vérification exécutée avant le corps d'une commande.
 * Un refus se traduit par une exception, les gardes suivantes ne sont alors pas évaluées.
 */
@FunctionalInterface
public interface CommandGuard {

    /**
     * @param command la commande demandée
     * @param context le contexte de l'appel
     */
    void check(Command command, CommandContext context);
}
