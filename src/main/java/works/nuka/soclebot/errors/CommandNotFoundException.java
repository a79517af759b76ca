package works.nuka.soclebot.errors;

/**
 * Aucune commande enregistrée ne correspond au nom reçu
 */
public class CommandNotFoundException extends RuntimeException {
    private final String commandName;

    public CommandNotFoundException(String commandName) {
        super("Commande inconnue : " + commandName);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }
}
