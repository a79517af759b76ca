package works.nuka.soclebot.config;

import java.util.Locale;

/**
 * Paramètres de connexion à la base de données
 */
public final class DatabaseConfig {

    /**
     * Types de base de données pris en charge
     */
    public enum Type {
        SQLITE,
        H2,
        POSTGRESQL;

        /**
         * Convertit le nom configuré en type
         * @param name nom (insensible à la casse)
         * @return le type, ou null si inconnu
         */
        public static Type fromName(String name) {
            if (name == null) {
                return null;
            }
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }

    private final Type type;
    private final String dsn;

    public DatabaseConfig(Type type, String dsn) {
        this.type = type;
        this.dsn = dsn;
    }

    public Type getType() {
        return type;
    }

    public String getDsn() {
        return dsn;
    }

    /**
     * Construit l'URL JDBC à partir du type et du DSN
     * @return l'URL JDBC
     */
    public String getJdbcUrl() {
        if (dsn.startsWith("jdbc:")) {
            return dsn;
        }
        return switch (type) {
            case SQLITE -> "jdbc:sqlite:" + dsn;
            case H2 -> "jdbc:h2:" + dsn;
            case POSTGRESQL -> "jdbc:postgresql://" + dsn;
        };
    }

    /**
     * Obtient la classe de dialecte Hibernate correspondant au type
     * @return nom complet de la classe de dialecte
     */
    public String getDialect() {
        return switch (type) {
            case SQLITE -> "org.hibernate.community.dialect.SQLiteDialect";
            case H2 -> "org.hibernate.dialect.H2Dialect";
            case POSTGRESQL -> "org.hibernate.dialect.PostgreSQLDialect";
        };
    }

    /**
     * Obtient la classe du pilote JDBC
     * @return nom complet du pilote
     */
    public String getDriverClass() {
        return switch (type) {
            case SQLITE -> "org.sqlite.JDBC";
            case H2 -> "org.h2.Driver";
            case POSTGRESQL -> "org.postgresql.Driver";
        };
    }

    @Override
    public String toString() {
        return type.name().toLowerCase(Locale.ROOT) + ":" + dsn;
    }
}
