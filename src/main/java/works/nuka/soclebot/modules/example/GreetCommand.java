package works.nuka.soclebot.modules.example;

import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandContext;

/**
 * Commande de salutation
 */
public class GreetCommand implements Command {
    @Override
    public String getName() {
        return "greet";
    }

    @Override
    public String getDescription() {
        return "Salue l'utilisateur";
    }

    @Override
    public String getUsage() {
        return "greet";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"hello"};
    }

    @Override
    public void execute(CommandContext context, String[] args) {
        context.reply("Bonjour, <@" + context.getCaller().getId() + "> !");
    }
}
