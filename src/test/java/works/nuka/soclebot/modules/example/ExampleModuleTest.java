package works.nuka.soclebot.modules.example;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import works.nuka.soclebot.auth.Caller;
import works.nuka.soclebot.auth.CallerIdentity;
import works.nuka.soclebot.auth.PermissionResolver;
import works.nuka.soclebot.commands.CommandContext;
import works.nuka.soclebot.commands.CommandManager;
import works.nuka.soclebot.commands.ReplyChannel;
import works.nuka.soclebot.config.FeatureGrant;
import works.nuka.soclebot.config.PermissionConfig;
import works.nuka.soclebot.errors.ErrorClassifier;
import works.nuka.soclebot.errors.ErrorHandler;
import works.nuka.soclebot.modules.ModuleLoader;
import works.nuka.soclebot.scheduler.TaskScheduler;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ExampleModuleTest {

    private static final long ADMIN_ID = 100001L;

    @Mock
    private TaskScheduler scheduler;

    @Mock
    private ReplyChannel replyChannel;

    private AutoCloseable mocks;
    private CommandManager commandManager;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        PermissionConfig permissions = new PermissionConfig(
                Set.of("Admin"),
                Set.of(ADMIN_ID),
                Map.of(HrCommand.FEATURE, new FeatureGrant(HrCommand.FEATURE, Set.of("HR"), Set.of())));
        commandManager = new CommandManager(new PermissionResolver(permissions),
                new ErrorHandler(new ErrorClassifier(true)));
        new ModuleLoader(commandManager, scheduler).loadModule(new ExampleModule());
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private CommandContext contextFor(Caller caller) {
        return new CommandContext(caller, replyChannel, 42L, 7L, null, null);
    }

    @Test
    void load_registersCommandsAndReminderJob() {
        assertTrue(commandManager.findCommand("hello").isPresent());
        assertTrue(commandManager.findCommand("admin_only").isPresent());
        assertTrue(commandManager.findCommand("remind").isPresent());
        assertTrue(commandManager.findUnknownFeatures().isEmpty());
        verify(scheduler).registerJob(eq(ReminderJob.NAME), any(ReminderJob.class));
    }

    @Test
    void greet_mentionsCaller() {
        commandManager.dispatch("greet", contextFor(CallerIdentity.member(55L, Set.of(), false)), new String[0]);

        verify(replyChannel).sendReply("Bonjour, <@55> !", false);
    }

    @Test
    void ping_withoutConnection_repliesPong() {
        commandManager.dispatch("ping", contextFor(CallerIdentity.user(55L)), new String[0]);

        verify(replyChannel).sendReply("Pong!", false);
    }

    @Test
    void adminTest_byMember_repliesPermissionNotice() {
        // Act
        boolean result = commandManager.dispatch("admin_test",
                contextFor(CallerIdentity.member(55L, Set.of("Member"), false)), new String[0]);

        // Assert
        assertFalse(result);
        verify(replyChannel, never()).sendReply("Vous êtes administrateur du bot.", true);
        verify(replyChannel).sendReply(anyString(), eq(true));
    }

    @Test
    void adminTest_byConfiguredAdmin_repliesEphemeral() {
        commandManager.dispatch("admin_only", contextFor(CallerIdentity.user(ADMIN_ID)), new String[0]);

        verify(replyChannel).sendReply("Vous êtes administrateur du bot.", true);
    }

    @Test
    void hrCommand_grantedRoleOrAdmin_isAllowed() {
        commandManager.dispatch("hr_command", contextFor(CallerIdentity.member(55L, Set.of("HR"), false)), new String[0]);
        commandManager.dispatch("hr_command", contextFor(CallerIdentity.user(ADMIN_ID)), new String[0]);

        verify(replyChannel, times(2))
                .sendReply("Vous disposez de la permission ressources humaines.", true);
    }

    @Test
    void hrCommand_otherMember_isDenied() {
        boolean result = commandManager.dispatch("hr_command",
                contextFor(CallerIdentity.member(56L, Set.of("Member"), false)), new String[0]);

        assertFalse(result);
        verify(replyChannel, never()).sendReply("Vous disposez de la permission ressources humaines.", true);
    }

    @Test
    void unknownCommand_isSilent() {
        commandManager.dispatch("inexistante", contextFor(CallerIdentity.user(55L)), new String[0]);

        verify(replyChannel, never()).sendReply(anyString(), anyBoolean());
        verify(replyChannel, never()).sendFollowup(anyString(), anyBoolean());
    }
}
