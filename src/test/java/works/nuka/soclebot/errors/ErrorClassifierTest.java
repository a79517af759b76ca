package works.nuka.soclebot.errors;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.InsufficientPermissionException;
import net.dv8tion.jda.api.exceptions.RateLimitedException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier(false);

    @Test
    void classify_commandNotFound_isSilent() {
        ErrorResolution resolution = classifier.classify(new CommandNotFoundException("nope"));

        assertEquals(ErrorResolution.Category.COMMAND_NOT_FOUND, resolution.getCategory());
        assertTrue(resolution.isSilent());
    }

    @Test
    void classify_authorizationDenied_noticeWithoutLog() {
        ErrorResolution resolution = classifier.classify(new AuthorizationDeniedException("refusé"));

        assertEquals(ErrorResolution.LogLevel.NONE, resolution.getLogLevel());
        assertEquals(ErrorClassifier.MSG_NO_PERMISSION, resolution.getUserNotice());
        assertTrue(resolution.isEphemeral());
    }

    @Test
    void classify_usageError_warnsAndEchoesDetail() {
        ErrorResolution resolution = classifier.classify(new UsageException("argument manquant"));

        assertEquals(ErrorResolution.LogLevel.WARN, resolution.getLogLevel());
        assertTrue(resolution.getUserNotice().contains("argument manquant"));
        assertTrue(resolution.isExposeDetails());
    }

    @Test
    void classify_rateLimited_warnsWithoutNotice() {
        ErrorResolution resolution = classifier.classify(new RateLimitedException("route", 1500));

        assertEquals(ErrorResolution.Category.RATE_LIMITED, resolution.getCategory());
        assertEquals(ErrorResolution.LogLevel.WARN, resolution.getLogLevel());
        assertTrue(resolution.getLogMessage().contains("1.50") || resolution.getLogMessage().contains("1,50"));
        assertFalse(resolution.hasUserNotice());
    }

    @Test
    void classify_missingBotPermission_errorWithoutStackAndNotice() {
        ErrorResolution resolution = classifier.classify(
                new InsufficientPermissionException(mockGuild(), Permission.MESSAGE_SEND));

        assertEquals(ErrorResolution.Category.PLATFORM_FORBIDDEN, resolution.getCategory());
        assertEquals(ErrorResolution.LogLevel.ERROR, resolution.getLogLevel());
        assertFalse(resolution.isIncludeStack());
        assertEquals(ErrorClassifier.MSG_BOT_FORBIDDEN, resolution.getUserNotice());
    }

    @Test
    void classify_forbiddenErrorResponse_isPlatformForbidden() {
        ErrorResponseException forbidden = mock(ErrorResponseException.class);
        when(forbidden.getErrorResponse()).thenReturn(ErrorResponse.MISSING_PERMISSIONS);

        assertEquals(ErrorResolution.Category.PLATFORM_FORBIDDEN, classifier.classify(forbidden).getCategory());
    }

    @Test
    void classify_otherErrorResponse_isUnclassified() {
        ErrorResponseException unknown = mock(ErrorResponseException.class);
        when(unknown.getErrorResponse()).thenReturn(ErrorResponse.UNKNOWN_MESSAGE);

        assertEquals(ErrorResolution.Category.UNCLASSIFIED, classifier.classify(unknown).getCategory());
    }

    @Test
    void classify_externalDependency_warnsWithMessage() {
        ErrorResolution resolution = classifier.classify(
                new ExternalDependencyException("météo", "service indisponible"));

        assertEquals(ErrorResolution.LogLevel.WARN, resolution.getLogLevel());
        assertTrue(resolution.getLogMessage().contains("météo"));
        assertTrue(resolution.getUserNotice().contains("service indisponible"));
    }

    @Test
    void classify_unexpectedError_logsStackWithoutNoticeByDefault() {
        ErrorResolution resolution = classifier.classify(new IllegalStateException("boom"));

        assertEquals(ErrorResolution.LogLevel.ERROR, resolution.getLogLevel());
        assertTrue(resolution.isIncludeStack());
        assertFalse(resolution.hasUserNotice());
    }

    @Test
    void classify_unexpectedErrorWithNotification_sendsGenericNotice() {
        ErrorResolution resolution = new ErrorClassifier(true).classify(new IllegalStateException("boom"));

        assertEquals(ErrorClassifier.MSG_UNEXPECTED, resolution.getUserNotice());
        assertFalse(resolution.getUserNotice().contains("boom"));
    }

    @Test
    void classify_wrappedError_usesOriginalCause() {
        Throwable wrapped = new CompletionException(new ExecutionException(new UsageException("détail")));

        assertEquals(ErrorResolution.Category.USAGE_ERROR, classifier.classify(wrapped).getCategory());
    }

    private static Guild mockGuild() {
        Guild guild = mock(Guild.class);
        when(guild.getIdLong()).thenReturn(2L);
        return guild;
    }
}
