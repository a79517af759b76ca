package works.nuka.soclebot.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Liste d'autorisation (rôles et utilisateurs) propre à une fonctionnalité
 */
public final class FeatureGrant {
    private final String featureName;
    private final Set<String> allowedRoleNames;
    private final Set<Long> allowedUserIds;

    public FeatureGrant(String featureName, Set<String> allowedRoleNames, Set<Long> allowedUserIds) {
        this.featureName = featureName;
        this.allowedRoleNames = Collections.unmodifiableSet(new LinkedHashSet<>(allowedRoleNames));
        this.allowedUserIds = Collections.unmodifiableSet(new LinkedHashSet<>(allowedUserIds));
    }

    public String getFeatureName() {
        return featureName;
    }

    public Set<String> getAllowedRoleNames() {
        return allowedRoleNames;
    }

    public Set<Long> getAllowedUserIds() {
        return allowedUserIds;
    }

    @Override
    public String toString() {
        return "FeatureGrant{" + featureName + ", roles=" + allowedRoleNames + ", users=" + allowedUserIds + "}";
    }
}
