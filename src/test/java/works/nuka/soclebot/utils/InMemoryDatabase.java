package works.nuka.soclebot.utils;

import works.nuka.soclebot.config.DatabaseConfig;

import java.util.UUID;

/**
 * Base H2 en mémoire, distincte pour chaque appel
 */
public final class InMemoryDatabase {

    private InMemoryDatabase() {
    }

    public static DatabaseManager create() {
        DatabaseConfig config = new DatabaseConfig(DatabaseConfig.Type.H2,
                "jdbc:h2:mem:soclebot-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        DatabaseManager manager = new DatabaseManager(config);
        manager.initSchema();
        return manager;
    }
}
