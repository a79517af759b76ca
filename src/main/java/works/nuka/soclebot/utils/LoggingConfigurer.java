package works.nuka.soclebot.utils;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.config.LoggingConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configure Logback à partir des paramètres de journalisation :
 * sortie console et fichier avec rotation par taille.
 */
public final class LoggingConfigurer {
    static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss} - [%-5level] - %msg%n";
    static final String CONSOLE_APPENDER = "CONSOLE";
    static final String FILE_APPENDER = "FILE";

    private LoggingConfigurer() {
    }

    /**
     * Remplace la configuration Logback courante
     * @param config paramètres de journalisation
     */
    public static void configure(LoggingConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(config.getLevel(), Level.INFO));
        root.addAppender(createConsoleAppender(context));

        RollingFileAppender<ILoggingEvent> fileAppender = createFileAppender(context, config);
        if (fileAppender != null) {
            root.addAppender(fileAppender);
        }

        // Les bibliothèques restent discrètes sauf en mode DEBUG
        context.getLogger("org.hibernate").setLevel(Level.WARN);
        context.getLogger("net.dv8tion").setLevel(Level.INFO);

        root.info("Journalisation configurée (niveau {}, fichier {})", config.getLevel(), config.getFile());
    }

    private static ConsoleAppender<ILoggingEvent> createConsoleAppender(LoggerContext context) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(CONSOLE_APPENDER);
        appender.setEncoder(createEncoder(context));
        appender.start();
        return appender;
    }

    private static RollingFileAppender<ILoggingEvent> createFileAppender(LoggerContext context, LoggingConfig config) {
        Path logFile = Paths.get(config.getFile());
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            System.err.println("[ERREUR] Impossible de créer le répertoire des journaux pour " + logFile + " : " + e.getMessage());
            return null;
        }

        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName(FILE_APPENDER);
        appender.setFile(logFile.toString());
        appender.setEncoder(createEncoder(context));

        FixedWindowRollingPolicy rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(appender);
        rollingPolicy.setFileNamePattern(logFile + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(Math.max(1, config.getBackupCount()));
        rollingPolicy.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(new FileSize(config.getMaxBytes()));
        triggeringPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setTriggeringPolicy(triggeringPolicy);
        appender.start();

        if (!appender.isStarted()) {
            System.err.println("[ERREUR] Écriture impossible dans le fichier de journal " + logFile);
            return null;
        }
        return appender;
    }

    private static PatternLayoutEncoder createEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();
        return encoder;
    }
}
