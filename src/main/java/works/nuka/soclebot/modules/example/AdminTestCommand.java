package works.nuka.soclebot.modules.example;

import works.nuka.soclebot.auth.PermissionRequirement;
import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandContext;

/**
 * Commande réservée aux administrateurs du bot
 */
public class AdminTestCommand implements Command {
    @Override
    public String getName() {
        return "admin_test";
    }

    @Override
    public String getDescription() {
        return "Vérifie que vous êtes administrateur du bot";
    }

    @Override
    public String getUsage() {
        return "admin_test";
    }

    @Override
    public String[] getAliases() {
        return new String[]{"admin_only"};
    }

    @Override
    public PermissionRequirement getRequirement() {
        return PermissionRequirement.adminOnly();
    }

    @Override
    public void execute(CommandContext context, String[] args) {
        context.getReplyChannel().sendReply("Vous êtes administrateur du bot.", true);
    }
}
