package works.nuka.soclebot.commands;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import works.nuka.soclebot.auth.CallerIdentity;
import works.nuka.soclebot.auth.PermissionRequirement;
import works.nuka.soclebot.auth.PermissionResolver;
import works.nuka.soclebot.config.FeatureGrant;
import works.nuka.soclebot.config.PermissionConfig;
import works.nuka.soclebot.errors.AuthorizationDeniedException;
import works.nuka.soclebot.errors.CommandNotFoundException;
import works.nuka.soclebot.errors.ErrorHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class CommandManagerTest {

    private static final long ADMIN_ID = 100001L;

    @Mock
    private ErrorHandler errorHandler;

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
                Map.of("hr_tool", new FeatureGrant("hr_tool", Set.of("HR"), Set.of())));
        commandManager = new CommandManager(new PermissionResolver(permissions), errorHandler);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private CommandContext contextFor(long userId) {
        return new CommandContext(CallerIdentity.member(userId, Set.of(), false), replyChannel, 42L, 7L, null, null);
    }

    @Test
    void dispatch_knownCommand_executesWithArgs() {
        // Arrange
        RecordingCommand command = new RecordingCommand("greet", PermissionRequirement.none());
        commandManager.registerCommand(command);

        // Act
        boolean result = commandManager.dispatch("greet", contextFor(1L), new String[]{"a", "b"});

        // Assert
        assertTrue(result);
        assertEquals(1, command.calls.size());
        assertArrayEquals(new String[]{"a", "b"}, command.calls.get(0));
        verify(errorHandler, never()).handle(any(), any());
    }

    @Test
    void dispatch_aliasAndCase_resolveSameCommand() {
        // Arrange
        RecordingCommand command = new RecordingCommand("greet", PermissionRequirement.none(), "hello");
        commandManager.registerCommand(command);

        // Act
        commandManager.dispatch("HELLO", contextFor(1L), new String[0]);
        commandManager.dispatch("Greet", contextFor(1L), new String[0]);

        // Assert
        assertEquals(2, command.calls.size());
    }

    @Test
    void dispatch_unknownCommand_isRoutedAsNotFound() {
        // Act
        boolean result = commandManager.dispatch("nope", contextFor(1L), new String[0]);

        // Assert
        assertFalse(result);
        ArgumentCaptor<Throwable> captor = ArgumentCaptor.forClass(Throwable.class);
        verify(errorHandler).handle(eq(replyChannel), captor.capture());
        assertInstanceOf(CommandNotFoundException.class, captor.getValue());
    }

    @Test
    void dispatch_adminOnlyByNonAdmin_isDeniedBeforeExecution() {
        // Arrange
        RecordingCommand command = new RecordingCommand("admin_test", PermissionRequirement.adminOnly());
        commandManager.registerCommand(command);

        // Act
        boolean result = commandManager.dispatch("admin_test", contextFor(555L), new String[0]);

        // Assert
        assertFalse(result);
        assertTrue(command.calls.isEmpty());
        verify(errorHandler).handle(eq(replyChannel), any(AuthorizationDeniedException.class));
    }

    @Test
    void dispatch_adminOnlyByAdmin_executes() {
        // Arrange
        RecordingCommand command = new RecordingCommand("admin_test", PermissionRequirement.adminOnly());
        commandManager.registerCommand(command);

        // Act
        boolean result = commandManager.dispatch("admin_test", contextFor(ADMIN_ID), new String[0]);

        // Assert
        assertTrue(result);
        assertEquals(1, command.calls.size());
    }

    @Test
    void dispatch_commandFailure_isRoutedToErrorHandler() {
        // Arrange
        IllegalStateException failure = new IllegalStateException("boom");
        commandManager.registerCommand(new RecordingCommand("broken", PermissionRequirement.none()) {
            @Override
            public void execute(CommandContext context, String[] args) {
                throw failure;
            }
        });

        // Act
        boolean result = commandManager.dispatch("broken", contextFor(1L), new String[0]);

        // Assert
        assertFalse(result);
        verify(errorHandler).handle(replyChannel, failure);
    }

    @Test
    void dispatch_additionalGuard_runsAfterPermissions() {
        // Arrange
        List<String> guarded = new ArrayList<>();
        commandManager.addGuard((command, context) -> guarded.add(command.getName()));
        commandManager.registerCommand(new RecordingCommand("greet", PermissionRequirement.none()));
        commandManager.registerCommand(new RecordingCommand("admin_test", PermissionRequirement.adminOnly()));

        // Act
        commandManager.dispatch("greet", contextFor(1L), new String[0]);
        commandManager.dispatch("admin_test", contextFor(1L), new String[0]);

        // Assert
        assertEquals(List.of("greet"), guarded);
    }

    @Test
    void registerCommand_duplicateNameOrAlias_throws() {
        // Arrange
        commandManager.registerCommand(new RecordingCommand("greet", PermissionRequirement.none(), "hello"));

        // Act & Assert
        assertThrows(IllegalArgumentException.class,
                () -> commandManager.registerCommand(new RecordingCommand("GREET", PermissionRequirement.none())));
        assertThrows(IllegalArgumentException.class,
                () -> commandManager.registerCommand(new RecordingCommand("other", PermissionRequirement.none(), "hello")));
        assertFalse(commandManager.findCommand("other").isPresent());
    }

    @Test
    void unregisterCommand_removesNameAndAliases() {
        // Arrange
        commandManager.registerCommand(new RecordingCommand("greet", PermissionRequirement.none(), "hello"));

        // Act
        boolean removed = commandManager.unregisterCommand("greet");

        // Assert
        assertTrue(removed);
        assertFalse(commandManager.findCommand("hello").isPresent());
        assertTrue(commandManager.getCommands().isEmpty());
        assertFalse(commandManager.unregisterCommand("greet"));
    }

    @Test
    void findUnknownFeatures_reportsUnconfiguredFeatures() {
        // Arrange
        commandManager.registerCommand(new RecordingCommand("hr_command", PermissionRequirement.feature("hr_tool")));
        commandManager.registerCommand(new RecordingCommand("audit", PermissionRequirement.feature("audit_tool")));

        // Act
        List<String> unknown = commandManager.findUnknownFeatures();

        // Assert
        assertEquals(List.of("audit_tool"), unknown);
    }

    @Test
    void getCommands_isSortedByName() {
        commandManager.registerCommand(new RecordingCommand("ping", PermissionRequirement.none()));
        commandManager.registerCommand(new RecordingCommand("greet", PermissionRequirement.none()));

        List<String> names = new ArrayList<>();
        commandManager.getCommands().forEach(command -> names.add(command.getName()));

        assertEquals(List.of("greet", "ping"), names);
    }

    private static class RecordingCommand implements Command {
        private final String name;
        private final PermissionRequirement requirement;
        private final String[] aliases;
        final List<String[]> calls = new ArrayList<>();

        RecordingCommand(String name, PermissionRequirement requirement, String... aliases) {
            this.name = name;
            this.requirement = requirement;
            this.aliases = aliases;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return "Commande de test " + name;
        }

        @Override
        public String getUsage() {
            return name;
        }

        @Override
        public String[] getAliases() {
            return aliases;
        }

        @Override
        public PermissionRequirement getRequirement() {
            return requirement;
        }

        @Override
        public void execute(CommandContext context, String[] args) throws Exception {
            calls.add(args);
        }
    }
}
