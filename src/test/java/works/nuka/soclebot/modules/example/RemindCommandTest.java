package works.nuka.soclebot.modules.example;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import works.nuka.soclebot.auth.CallerIdentity;
import works.nuka.soclebot.commands.BotServices;
import works.nuka.soclebot.commands.CommandContext;
import works.nuka.soclebot.commands.ReplyChannel;
import works.nuka.soclebot.errors.UsageException;
import works.nuka.soclebot.scheduler.DateTrigger;
import works.nuka.soclebot.scheduler.TaskScheduler;
import works.nuka.soclebot.scheduler.TaskTrigger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RemindCommandTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private TaskScheduler scheduler;

    @Mock
    private ReplyChannel replyChannel;

    private AutoCloseable mocks;
    private RemindCommand command;
    private CommandContext context;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        command = new RemindCommand(Clock.fixed(NOW, ZoneOffset.UTC));
        context = new CommandContext(CallerIdentity.member(5L, Set.of(), false), replyChannel, 42L, 7L, null,
                new BotServices(null, null, null, scheduler));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void parseDelay_bareNumber_isMinutes() {
        assertEquals(10 * 60_000L, RemindCommand.parseDelay("10"));
        assertEquals(30_000L, RemindCommand.parseDelay("30s"));
        assertEquals(2 * 3_600_000L, RemindCommand.parseDelay("2h"));
    }

    @Test
    void parseDelay_outOfRangeOrInvalid_throws() {
        assertThrows(UsageException.class, () -> RemindCommand.parseDelay("0"));
        assertThrows(UsageException.class, () -> RemindCommand.parseDelay("31d"));
        assertThrows(UsageException.class, () -> RemindCommand.parseDelay("demain"));
        assertThrows(UsageException.class, () -> RemindCommand.parseDelay("99999999999999999999"));
    }

    @Test
    void execute_schedulesOneShotReminder() {
        // Act
        command.execute(context, new String[]{"10m", "Réunion", "d'équipe"});

        // Assert
        Instant runAt = NOW.plusSeconds(600);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> args = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<TaskTrigger> trigger = ArgumentCaptor.forClass(TaskTrigger.class);
        verify(scheduler).addTask(eq("reminder:5:" + runAt.toEpochMilli()), trigger.capture(),
                eq(ReminderJob.NAME), args.capture());

        assertEquals(new DateTrigger(runAt), trigger.getValue());
        assertEquals("7", args.getValue().get(ReminderJob.ARG_CHANNEL_ID));
        assertEquals("5", args.getValue().get(ReminderJob.ARG_USER_ID));
        assertEquals("Réunion d'équipe", args.getValue().get(ReminderJob.ARG_TEXT));
        verify(replyChannel).sendReply("⏰ Rappel programmé pour <t:" + runAt.getEpochSecond() + ":R>.", true);
    }

    @Test
    void execute_missingText_throwsUsageException() {
        assertThrows(UsageException.class, () -> command.execute(context, new String[]{"10m"}));
        verify(scheduler, never()).addTask(anyString(), any(), anyString(), anyMap());
    }

    @Test
    void execute_textTooLong_throwsUsageException() {
        String longText = "x".repeat(RemindCommand.MAX_TEXT_LENGTH + 1);

        assertThrows(UsageException.class, () -> command.execute(context, new String[]{"10m", longText}));
        verify(scheduler, never()).addTask(anyString(), any(), anyString(), anyMap());
    }
}
