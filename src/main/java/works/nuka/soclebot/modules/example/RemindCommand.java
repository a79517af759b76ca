package works.nuka.soclebot.modules.example;

import works.nuka.soclebot.commands.Command;
import works.nuka.soclebot.commands.CommandContext;
import works.nuka.soclebot.errors.UsageException;
import works.nuka.soclebot.scheduler.DateTrigger;
import works.nuka.soclebot.utils.CommandUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Programme un rappel unique dans le canal courant
 */
public class RemindCommand implements Command {
    static final long MAX_DELAY_MILLIS = Duration.ofDays(30).toMillis();
    static final int MAX_TEXT_LENGTH = 1000;

    private final Clock clock;

    public RemindCommand() {
        this(Clock.systemUTC());
    }

    RemindCommand(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "remind";
    }

    @Override
    public String getDescription() {
        return "Programme un rappel dans ce canal";
    }

    @Override
    public String getUsage() {
        return "remind <minutes|30s|10m|2h|1d> <texte>";
    }

    @Override
    public void execute(CommandContext context, String[] args) {
        if (args.length < 2) {
            throw new UsageException(getUsage());
        }

        long delayMillis = parseDelay(args[0]);
        String text = CommandUtils.joinFrom(args, 1);
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new UsageException("Le texte du rappel ne peut pas dépasser " + MAX_TEXT_LENGTH + " caractères.");
        }

        Instant runAt = clock.instant().plusMillis(delayMillis);
        long userId = context.getCaller().getId();
        String taskId = "reminder:" + userId + ":" + runAt.toEpochMilli();

        Map<String, String> taskArgs = new HashMap<>();
        taskArgs.put(ReminderJob.ARG_CHANNEL_ID, String.valueOf(context.getChannelId()));
        taskArgs.put(ReminderJob.ARG_USER_ID, String.valueOf(userId));
        taskArgs.put(ReminderJob.ARG_TEXT, text);

        context.getServices().getScheduler().addTask(taskId, new DateTrigger(runAt), ReminderJob.NAME, taskArgs);
        context.getReplyChannel().sendReply("⏰ Rappel programmé pour <t:" + runAt.getEpochSecond() + ":R>.", true);
    }

    /**
     * Un nombre seul est exprimé en minutes
     */
    static long parseDelay(String raw) {
        long millis;
        if (raw.matches("\\d+")) {
            try {
                millis = Duration.ofMinutes(Long.parseLong(raw)).toMillis();
            } catch (ArithmeticException | NumberFormatException e) {
                millis = -1;
            }
        } else {
            millis = CommandUtils.parseDuration(raw);
        }
        if (millis <= 0 || millis > MAX_DELAY_MILLIS) {
            throw new UsageException("Délai invalide : " + raw + " (entre 1 seconde et 30 jours).");
        }
        return millis;
    }
}
