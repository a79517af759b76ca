package works.nuka.soclebot.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Limite le nombre de commandes par utilisateur sur une fenêtre glissante
 */
public class RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<Long, UserLimit> userLimits = new ConcurrentHashMap<>();
    private final long windowMillis;
    private final int maxRequests;
    private final Clock clock;
    private volatile long lastSweep;

    /**
     * Crée un nouveau limiteur de taux
     *
     * @param maxRequests Nombre maximum de requêtes dans la fenêtre
     * @param windowMillis Fenêtre de temps en millisecondes
     */
    public RateLimiter(int maxRequests, long windowMillis) {
        this(maxRequests, windowMillis, Clock.systemUTC());
    }

    public RateLimiter(int maxRequests, long windowMillis, Clock clock) {
        if (maxRequests <= 0 || windowMillis <= 0) {
            throw new IllegalArgumentException("La limite et la fenêtre doivent être positives");
        }
        this.maxRequests = maxRequests;
        this.windowMillis = windowMillis;
        this.clock = clock;
        this.lastSweep = clock.millis();
    }

    /**
     * Vérifie si l'utilisateur peut effectuer une nouvelle requête, et la comptabilise si oui
     *
     * @param userId ID de l'utilisateur
     * @return true si la requête est autorisée, false sinon
     */
    public boolean check(long userId) {
        long now = clock.millis();
        evictExpired(now);
        boolean allowed = userLimits.computeIfAbsent(userId, id -> new UserLimit()).check(now);
        if (!allowed) {
            logger.debug("Limite de commandes atteinte pour l'utilisateur {}", userId);
        }
        return allowed;
    }

    /**
     * Indique combien de temps l'utilisateur doit attendre avant de pouvoir faire une nouvelle requête
     *
     * @param userId ID de l'utilisateur
     * @return Temps d'attente en millisecondes, 0 si aucune attente n'est nécessaire
     */
    public long getWaitTime(long userId) {
        UserLimit userLimit = userLimits.get(userId);
        return userLimit == null ? 0 : userLimit.getWaitTimeMillis(clock.millis());
    }

    /**
     * Réinitialise la limite pour un utilisateur
     *
     * @param userId ID de l'utilisateur
     */
    public void reset(long userId) {
        userLimits.remove(userId);
    }

    /**
     * Retire les utilisateurs sans requête dans la fenêtre, au plus une fois par fenêtre
     */
    private void evictExpired(long now) {
        if (now - lastSweep < windowMillis) {
            return;
        }
        lastSweep = now;
        int before = userLimits.size();
        userLimits.values().removeIf(limit -> limit.isExpired(now));
        logger.trace("Limiteur : {} utilisateur(s) expiré(s) retiré(s)", before - userLimits.size());
    }

    int trackedUsers() {
        return userLimits.size();
    }

    /**
     * Horodatages des dernières requêtes d'un utilisateur, en tampon circulaire
     */
    private class UserLimit {
        private final long[] requestTimestamps = new long[maxRequests];
        private int oldest = 0;
        private int count = 0;

        synchronized boolean check(long now) {
            // Nettoyer les requêtes expirées
            while (count > 0 && now - requestTimestamps[oldest] >= windowMillis) {
                oldest = (oldest + 1) % maxRequests;
                count--;
            }

            if (count >= maxRequests) {
                return false;
            }

            requestTimestamps[(oldest + count) % maxRequests] = now;
            count++;
            return true;
        }

        synchronized boolean isExpired(long now) {
            return count == 0 || now - requestTimestamps[(oldest + count - 1) % maxRequests] >= windowMillis;
        }

        synchronized long getWaitTimeMillis(long now) {
            if (count < maxRequests) {
                return 0;
            }
            return Math.max(0, requestTimestamps[oldest] + windowMillis - now);
        }
    }
}
