package works.nuka.soclebot.auth;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Implémentation simple et immuable de {@link Caller}
 */
public final class CallerIdentity implements Caller {
    private final long id;
    private final String name;
    private final boolean guildMember;
    private final Set<String> roleNames;
    private final boolean guildOwner;

    private CallerIdentity(long id, String name, boolean guildMember, Set<String> roleNames, boolean guildOwner) {
        this.id = id;
        this.name = name;
        this.guildMember = guildMember;
        this.roleNames = Collections.unmodifiableSet(new LinkedHashSet<>(roleNames));
        this.guildOwner = guildOwner;
    }

    /**
     * Crée un utilisateur hors serveur (message privé)
     * @param id ID de l'utilisateur
     * @return l'identité
     */
    public static CallerIdentity user(long id) {
        return new CallerIdentity(id, String.valueOf(id), false, Set.of(), false);
    }

    /**
     * Crée un membre de serveur
     * @param id ID du membre
     * @param roleNames noms de ses rôles
     * @param guildOwner true s'il possède le serveur
     * @return l'identité
     */
    public static CallerIdentity member(long id, Set<String> roleNames, boolean guildOwner) {
        return new CallerIdentity(id, String.valueOf(id), true, roleNames, guildOwner);
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isGuildMember() {
        return guildMember;
    }

    @Override
    public Set<String> getRoleNames() {
        return roleNames;
    }

    @Override
    public boolean isGuildOwner() {
        return guildOwner;
    }

    @Override
    public String toString() {
        return "Caller{id=" + id + ", member=" + guildMember + ", roles=" + roleNames + ", owner=" + guildOwner + "}";
    }
}
