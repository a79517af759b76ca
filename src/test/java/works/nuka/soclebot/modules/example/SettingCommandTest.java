package works.nuka.soclebot.modules.example;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import works.nuka.soclebot.auth.CallerIdentity;
import works.nuka.soclebot.auth.PermissionRequirement;
import works.nuka.soclebot.commands.BotServices;
import works.nuka.soclebot.commands.CommandContext;
import works.nuka.soclebot.commands.ReplyChannel;
import works.nuka.soclebot.errors.UsageException;
import works.nuka.soclebot.services.GuildSettingService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SettingCommandTest {

    private static final long GUILD_ID = 42L;

    @Mock
    private GuildSettingService settings;

    @Mock
    private ReplyChannel replyChannel;

    private AutoCloseable mocks;
    private SettingCommand command;
    private CommandContext guildContext;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        command = new SettingCommand();
        BotServices services = new BotServices(null, null, settings, null);
        guildContext = new CommandContext(CallerIdentity.member(1L, Set.of(), true), replyChannel,
                GUILD_ID, 7L, null, services);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void requirement_isAdminOnly() {
        assertEquals(PermissionRequirement.Kind.BOT_ADMIN, command.getRequirement().getKind());
    }

    @Test
    void execute_set_storesJoinedValue() {
        // Act
        command.execute(guildContext, new String[]{"set", "welcome", "Bienvenue", "à", "tous"});

        // Assert
        verify(settings).setSetting(GUILD_ID, "welcome", "Bienvenue à tous");
        verify(replyChannel).sendReply("✅ `welcome` = Bienvenue à tous", false);
    }

    @Test
    void execute_get_repliesEffectiveValue() {
        // Arrange
        when(settings.getEffectiveSetting(GUILD_ID, "lang")).thenReturn(Optional.of("fr"));

        // Act
        command.execute(guildContext, new String[]{"get", "lang"});

        // Assert
        verify(replyChannel).sendReply("`lang` = fr", false);
    }

    @Test
    void execute_getMissing_repliesNoValue() {
        // Arrange
        when(settings.getEffectiveSetting(GUILD_ID, "lang")).thenReturn(Optional.empty());

        // Act
        command.execute(guildContext, new String[]{"GET", "lang"});

        // Assert
        verify(replyChannel).sendReply("Aucune valeur pour `lang`.", false);
    }

    @Test
    void execute_delete_reportsOutcome() {
        // Arrange
        when(settings.deleteSetting(GUILD_ID, "lang")).thenReturn(true);

        // Act
        command.execute(guildContext, new String[]{"delete", "lang"});

        // Assert
        verify(replyChannel).sendReply("✅ `lang` supprimé.", false);
    }

    @Test
    void execute_list_formatsEverySetting() {
        // Arrange
        Map<String, String> all = new LinkedHashMap<>();
        all.put("lang", "fr");
        all.put("welcome", "Salut");
        when(settings.listSettings(GUILD_ID)).thenReturn(all);

        // Act
        command.execute(guildContext, new String[]{"list"});

        // Assert
        verify(replyChannel).sendReply("Paramètres du serveur :\n• `lang` = fr\n• `welcome` = Salut", false);
    }

    @Test
    void execute_listEmpty_repliesNothingStored() {
        // Arrange
        when(settings.listSettings(GUILD_ID)).thenReturn(Map.of());

        // Act
        command.execute(guildContext, new String[]{"list"});

        // Assert
        verify(replyChannel).sendReply("Aucun paramètre enregistré pour ce serveur.", false);
    }

    @Test
    void execute_invalidUsage_throwsUsageException() {
        assertThrows(UsageException.class, () -> command.execute(guildContext, new String[0]));
        assertThrows(UsageException.class, () -> command.execute(guildContext, new String[]{"get"}));
        assertThrows(UsageException.class, () -> command.execute(guildContext, new String[]{"set", "lang"}));
        assertThrows(UsageException.class, () -> command.execute(guildContext, new String[]{"purge"}));
        verifyNoInteractions(settings);
    }

    @Test
    void execute_inDirectMessage_throwsUsageException() {
        // Arrange
        CommandContext dmContext = new CommandContext(CallerIdentity.user(1L), replyChannel, null, 7L, null,
                new BotServices(null, null, settings, null));

        // Act & Assert
        assertThrows(UsageException.class, () -> command.execute(dmContext, new String[]{"list"}));
        verifyNoInteractions(settings);
    }
}
