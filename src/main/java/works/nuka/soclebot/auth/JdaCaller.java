package works.nuka.soclebot.auth;

import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.User;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Adapte un utilisateur ou un membre JDA en {@link Caller}
 */
public final class JdaCaller implements Caller {
    private final User user;
    private final Member member;

    /**
     * @param user l'utilisateur à l'origine de l'événement
     * @param member le membre correspondant, ou null hors serveur
     */
    public JdaCaller(User user, Member member) {
        this.user = user;
        this.member = member;
    }

    @Override
    public long getId() {
        return user.getIdLong();
    }

    @Override
    public String getName() {
        return user.getName();
    }

    @Override
    public boolean isGuildMember() {
        return member != null;
    }

    @Override
    public Set<String> getRoleNames() {
        if (member == null) {
            return Set.of();
        }
        return member.getRoles().stream()
                .map(Role::getName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public boolean isGuildOwner() {
        return member != null && member.isOwner();
    }
}
