package works.nuka.soclebot.commands;

import works.nuka.soclebot.auth.PermissionResolver;
import works.nuka.soclebot.config.BotConfig;
import works.nuka.soclebot.scheduler.TaskScheduler;
import works.nuka.soclebot.services.GuildSettingService;

/**
 * Services partagés mis à disposition des commandes
 */
public class BotServices {
    private final BotConfig config;
    private final PermissionResolver permissionResolver;
    private final GuildSettingService settings;
    private final TaskScheduler scheduler;

    public BotServices(BotConfig config, PermissionResolver permissionResolver,
                       GuildSettingService settings, TaskScheduler scheduler) {
        this.config = config;
        this.permissionResolver = permissionResolver;
        this.settings = settings;
        this.scheduler = scheduler;
    }

    public BotConfig getConfig() {
        return config;
    }

    public PermissionResolver getPermissionResolver() {
        return permissionResolver;
    }

    public GuildSettingService getSettings() {
        return settings;
    }

    public TaskScheduler getScheduler() {
        return scheduler;
    }
}
