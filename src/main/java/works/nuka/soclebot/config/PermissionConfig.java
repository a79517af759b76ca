package works.nuka.soclebot.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration des permissions du bot, chargée une seule fois au démarrage
 */
public final class PermissionConfig {
    private final Set<String> adminRoleNames;
    private final Set<Long> adminUserIds;
    private final Map<String, FeatureGrant> featureGrants;

    public PermissionConfig(Set<String> adminRoleNames, Set<Long> adminUserIds, Map<String, FeatureGrant> featureGrants) {
        this.adminRoleNames = Collections.unmodifiableSet(new LinkedHashSet<>(adminRoleNames));
        this.adminUserIds = Collections.unmodifiableSet(new LinkedHashSet<>(adminUserIds));
        this.featureGrants = Collections.unmodifiableMap(new LinkedHashMap<>(featureGrants));
    }

    /**
     * Configuration sans administrateur ni fonctionnalité
     * @return une configuration vide
     */
    public static PermissionConfig empty() {
        return new PermissionConfig(Set.of(), Set.of(), Map.of());
    }

    public Set<String> getAdminRoleNames() {
        return adminRoleNames;
    }

    public Set<Long> getAdminUserIds() {
        return adminUserIds;
    }

    public Map<String, FeatureGrant> getFeatureGrants() {
        return featureGrants;
    }

    /**
     * Obtient l'autorisation d'une fonctionnalité
     * @param featureName nom de la fonctionnalité
     * @return l'autorisation, ou empty si aucune section n'est configurée
     */
    public Optional<FeatureGrant> getFeatureGrant(String featureName) {
        return Optional.ofNullable(featureGrants.get(featureName));
    }

    /**
     * Filtre les fonctionnalités qui n'ont aucune section de configuration
     * @param featureNames noms référencés par le code
     * @return les noms inconnus, dans l'ordre d'origine
     */
    public List<String> unknownFeatures(Collection<String> featureNames) {
        return featureNames.stream()
                .filter(name -> !featureGrants.containsKey(name))
                .distinct()
                .collect(Collectors.toList());
    }
}
