package works.nuka.soclebot.modules.example;

import works.nuka.soclebot.auth.PermissionRequirement;
import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandContext;

/**
 * Commande réservée aux détenteurs de la permission {@value #FEATURE}
 */
public class HrCommand implements Command {
    public static final String FEATURE = "hr_tool";

    @Override
    public String getName() {
        return "hr_command";
    }

    @Override
    public String getDescription() {
        return "Commande réservée aux ressources humaines";
    }

    @Override
    public String getUsage() {
        return "hr_command";
    }

    @Override
    public PermissionRequirement getRequirement() {
        return PermissionRequirement.feature(FEATURE);
    }

    @Override
    public void execute(CommandContext context, String[] args) {
        context.getReplyChannel().sendReply("Vous disposez de la permission ressources humaines.", true);
    }
}
