package works.nuka.soclebot.modules.example;

import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandContext;

public class PingCommand implements Command {
    @Override
    public String getName() {
        return "ping";
    }

    @Override
    public String getDescription() {
        return "Affiche la latence du bot";
    }

    @Override
    public String getUsage() {
        return "ping";
    }

    @Override
    public void execute(CommandContext context, String[] args) {
        if (context.getJda() == null) {
            context.reply("Pong!");
            return;
        }
        context.reply("Pong! (" + context.getJda().getGatewayPing() + "ms)");
    }
}
