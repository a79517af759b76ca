package works.nuka.soclebot.modules.example;

import works.nuka.soclebot.auth.PermissionRequirement;
import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandContext;
import works.nuka.soclebot.errors.UsageException;
import works.nuka.soclebot.services.GuildSettingService;
import works.nuka.soclebot.utils.CommandUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Consultation et modification des paramètres du serveur
 */
public class SettingCommand implements Command {
    @Override
    public String getName() {
        return "setting";
    }

    @Override
    public String getDescription() {
        return "Gère les paramètres du serveur";
    }

    @Override
    public String getUsage() {
        return "setting get <clé> | set <clé> <valeur> | delete <clé> | list";
    }

    @Override
    public PermissionRequirement getRequirement() {
        return PermissionRequirement.adminOnly();
    }

    @Override
    public void execute(CommandContext context, String[] args) {
        long guildId = context.requireGuildId();
        if (args.length == 0) {
            throw new UsageException(getUsage());
        }

        GuildSettingService settings = context.getServices().getSettings();
        String action = args[0].toLowerCase(Locale.ROOT);
        switch (action) {
            case "get": {
                String key = requireKey(args);
                Optional<String> value = settings.getEffectiveSetting(guildId, key);
                context.reply(value.map(v -> "`" + key + "` = " + v)
                        .orElse("Aucune valeur pour `" + key + "`."));
                break;
            }
            case "set": {
                String key = requireKey(args);
                if (args.length < 3) {
                    throw new UsageException("setting set <clé> <valeur>");
                }
                String value = CommandUtils.joinFrom(args, 2);
                settings.setSetting(guildId, key, value);
                context.reply("✅ `" + key + "` = " + value);
                break;
            }
            case "delete": {
                String key = requireKey(args);
                boolean deleted = settings.deleteSetting(guildId, key);
                context.reply(deleted ? "✅ `" + key + "` supprimé." : "Aucune valeur pour `" + key + "`.");
                break;
            }
            case "list": {
                Map<String, String> all = settings.listSettings(guildId);
                if (all.isEmpty()) {
                    context.reply("Aucun paramètre enregistré pour ce serveur.");
                    break;
                }
                StringBuilder sb = new StringBuilder("Paramètres du serveur :");
                all.forEach((key, value) -> sb.append("\n• `").append(key).append("` = ").append(value));
                context.reply(sb.toString());
                break;
            }
            default:
                throw new UsageException("Action inconnue : " + args[0] + "\n" + getUsage());
        }
    }

    private static String requireKey(String[] args) {
        if (args.length < 2) {
            throw new UsageException("Une clé de paramètre est attendue.");
        }
        return args[1];
    }
}
