package works.nuka.soclebot.config;

/**
 * Paramètres de journalisation
 */
public final class LoggingConfig {
    public static final String DEFAULT_LEVEL = "INFO";
    public static final String DEFAULT_FILE = "logs/bot.log";
    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_BACKUP_COUNT = 5;

    private final String level;
    private final String file;
    private final long maxBytes;
    private final int backupCount;
    private final boolean notifyUserOnError;

    public LoggingConfig(String level, String file, long maxBytes, int backupCount, boolean notifyUserOnError) {
        this.level = level;
        this.file = file;
        this.maxBytes = maxBytes;
        this.backupCount = backupCount;
        this.notifyUserOnError = notifyUserOnError;
    }

    public static LoggingConfig defaults() {
        return new LoggingConfig(DEFAULT_LEVEL, DEFAULT_FILE, DEFAULT_MAX_BYTES, DEFAULT_BACKUP_COUNT, false);
    }

    public String getLevel() {
        return level;
    }

    public String getFile() {
        return file;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public int getBackupCount() {
        return backupCount;
    }

    /**
     * Indique si l'utilisateur doit être prévenu en cas d'erreur inattendue
     * @return true si la notification est activée
     */
    public boolean isNotifyUserOnError() {
        return notifyUserOnError;
    }
}
