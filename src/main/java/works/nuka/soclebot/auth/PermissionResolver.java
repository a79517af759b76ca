package works.nuka.soclebot.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.config.FeatureGrant;
import works.nuka.soclebot.config.PermissionConfig;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * Détermine si un appelant peut utiliser une commande ou une fonctionnalité,
 * à partir des rôles et IDs définis dans la configuration.
 * <p>
 * Ne lève jamais d'exception : un refus est un résultat, c'est à l'appelant
 * de le transformer en erreur.
 */
public class PermissionResolver {
    private static final Logger logger = LoggerFactory.getLogger(PermissionResolver.class);

    private final PermissionConfig config;

    public PermissionResolver(PermissionConfig config) {
        this.config = config;
    }

    /**
     * Vérifie si l'appelant est administrateur du bot : ID listé, propriétaire
     * du serveur, ou porteur d'un rôle administrateur.
     *
     * @param caller l'appelant
     * @return true si administrateur
     */
    public boolean isBotAdmin(Caller caller) {
        if (caller == null) {
            return false;
        }

        if (config.getAdminUserIds().contains(caller.getId())) {
            return true;
        }

        // Hors serveur, les rôles ne peuvent pas être vérifiés
        if (!caller.isGuildMember()) {
            return false;
        }

        if (caller.isGuildOwner()) {
            return true;
        }

        try {
            return intersects(caller.getRoleNames(), config.getAdminRoleNames());
        } catch (RuntimeException e) {
            logger.warn("Comparaison des rôles administrateurs impossible pour {} : {}", caller.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Vérifie si l'appelant peut utiliser une fonctionnalité.
     * Les administrateurs du bot y ont toujours accès.
     *
     * @param caller l'appelant
     * @param featureName nom de la fonctionnalité
     * @return true si autorisé
     */
    public boolean hasFeaturePermission(Caller caller, String featureName) {
        if (isBotAdmin(caller)) {
            return true;
        }
        return hasSpecificPermission(caller, featureName);
    }

    /**
     * Vérifie uniquement la liste d'autorisation propre à la fonctionnalité,
     * sans tenir compte du statut d'administrateur. Une fonctionnalité sans
     * section de configuration est refusée.
     *
     * @param caller l'appelant
     * @param featureName nom de la fonctionnalité
     * @return true si l'appelant figure dans la liste d'autorisation
     */
    public boolean hasSpecificPermission(Caller caller, String featureName) {
        if (caller == null) {
            return false;
        }

        Optional<FeatureGrant> grant = config.getFeatureGrant(featureName);
        if (grant.isEmpty()) {
            logger.debug("Permission '{}' : aucune section dédiée dans la configuration", featureName);
            return false;
        }

        if (grant.get().getAllowedUserIds().contains(caller.getId())) {
            return true;
        }

        return caller.isGuildMember() && intersects(caller.getRoleNames(), grant.get().getAllowedRoleNames());
    }

    /**
     * Évalue une exigence de permission
     *
     * @param caller l'appelant
     * @param requirement l'exigence de la commande
     * @return le résultat, avec la raison en cas de refus
     */
    public AuthorizationResult authorize(Caller caller, PermissionRequirement requirement) {
        switch (requirement.getKind()) {
            case NONE:
                return AuthorizationResult.granted();
            case BOT_ADMIN:
                return isBotAdmin(caller)
                        ? AuthorizationResult.granted()
                        : AuthorizationResult.denied("Cette commande est réservée aux administrateurs du bot.");
            case FEATURE:
            default:
                return hasFeaturePermission(caller, requirement.getFeatureName())
                        ? AuthorizationResult.granted()
                        : AuthorizationResult.denied("Cette commande nécessite la permission '"
                                + requirement.getFeatureName() + "'.");
        }
    }

    public PermissionConfig getConfig() {
        return config;
    }

    private static boolean intersects(Set<String> roles, Set<String> allowed) {
        return !Collections.disjoint(roles, allowed);
    }
}
