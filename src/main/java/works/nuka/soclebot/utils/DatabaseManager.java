package works.nuka.soclebot.utils;

import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;
import org.hibernate.cfg.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.config.DatabaseConfig;
import works.nuka.soclebot.errors.StoreUnavailableException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Gère la fabrique de sessions Hibernate partagée par le stockage des paramètres
 * et le planificateur de tâches.
 * <p>
 * La construction ne se connecte pas à la base ; la connexion et la création du
 * schéma ont lieu dans {@link #initSchema()}. Le cycle de vie appartient à
 * l'orchestrateur principal.
 */
public class DatabaseManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private final DatabaseConfig config;
    private final Configuration configuration;
    private volatile SessionFactory sessionFactory;

    public DatabaseManager(DatabaseConfig config) {
        this.config = config;
        this.configuration = new Configuration().configure()
                .setProperty("hibernate.connection.url", config.getJdbcUrl())
                .setProperty("hibernate.connection.driver_class", config.getDriverClass())
                .setProperty("hibernate.dialect", config.getDialect());

        if (config.getType() == DatabaseConfig.Type.SQLITE) {
            createSqliteDirectory(config.getDsn());
        }
        logger.info("Base de données {} prête à être initialisée", config.getType());
    }

    /**
     * Crée la fabrique de sessions et les tables manquantes.
     * Sans effet si le schéma est déjà initialisé.
     *
     * @throws StoreUnavailableException si la base n'est pas joignable
     */
    public synchronized void initSchema() {
        if (sessionFactory != null) {
            return;
        }
        try {
            sessionFactory = configuration.buildSessionFactory();
            logger.info("Initialisation du schéma de la base de données terminée ({})", config);
        } catch (RuntimeException e) {
            logger.error("Échec de création de la SessionFactory pour {}", config, e);
            throw new StoreUnavailableException("Base de données inaccessible : " + config, e);
        }
    }

    /**
     * Vérifie que la base répond
     * @throws StoreUnavailableException si la base n'est pas initialisée ou ne répond pas
     */
    public void checkAvailable() {
        SessionFactory factory = sessionFactory;
        if (factory == null || !factory.isOpen()) {
            throw new StoreUnavailableException("La base de données n'est pas initialisée");
        }
        try (Session session = factory.openSession()) {
            Boolean valid = session.doReturningWork(connection -> connection.isValid(5));
            if (!Boolean.TRUE.equals(valid)) {
                throw new StoreUnavailableException("La connexion à la base de données n'est pas valide");
            }
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Base de données inaccessible : " + config, e);
        }
    }

    /**
     * Exécute un traitement dans une transaction : validation si tout se passe bien,
     * annulation puis propagation de l'exception sinon.
     *
     * @param work traitement à exécuter
     * @return le résultat du traitement
     */
    public <T> T inTransaction(Function<Session, T> work) {
        try (Session session = getSessionFactory().openSession()) {
            Transaction transaction = session.beginTransaction();
            try {
                T result = work.apply(session);
                transaction.commit();
                return result;
            } catch (RuntimeException e) {
                if (transaction.isActive()) {
                    transaction.rollback();
                }
                logger.error("Erreur pendant la transaction, annulation", e);
                throw e;
            }
        }
    }

    /**
     * Variante de {@link #inTransaction(Function)} sans résultat
     * @param work traitement à exécuter
     */
    public void inTransactionVoid(Consumer<Session> work) {
        inTransaction(session -> {
            work.accept(session);
            return null;
        });
    }

    /**
     * Obtient la fabrique de sessions
     * @return la fabrique de session
     * @throws IllegalStateException si {@link #initSchema()} n'a pas été appelé
     */
    public SessionFactory getSessionFactory() {
        SessionFactory factory = sessionFactory;
        if (factory == null) {
            throw new IllegalStateException("initSchema() doit être appelé avant tout accès à la base");
        }
        return factory;
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    /**
     * Ferme la fabrique de sessions
     */
    @Override
    public synchronized void close() {
        if (sessionFactory != null && sessionFactory.isOpen()) {
            sessionFactory.close();
            logger.info("Connexion à la base de données fermée");
        }
    }

    private static void createSqliteDirectory(String dsn) {
        if (dsn.startsWith("jdbc:") || dsn.startsWith(":memory:")) {
            return;
        }
        Path parent = Paths.get(dsn).toAbsolutePath().getParent();
        if (parent == null || Files.exists(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            logger.info("Répertoire de base de données créé : {}", parent);
        } catch (IOException e) {
            throw new StoreUnavailableException("Création du répertoire " + parent + " impossible", e);
        }
    }
}
