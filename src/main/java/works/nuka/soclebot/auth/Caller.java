package works.nuka.soclebot.auth;

import java.util.Set;

/**
 * Identité de l'utilisateur qui invoque une commande.
 * Hors d'un serveur (message privé), l'appelant n'a ni rôles ni statut de propriétaire.
 */
public interface Caller {

    /**
     * @return l'ID Discord de l'utilisateur
     */
    long getId();

    /**
     * @return le nom affichable de l'utilisateur
     */
    String getName();

    /**
     * @return true si l'appel provient d'un membre de serveur
     */
    boolean isGuildMember();

    /**
     * @return les noms des rôles du membre (vide hors serveur)
     */
    Set<String> getRoleNames();

    /**
     * @return true si le membre est propriétaire du serveur
     */
    boolean isGuildOwner();
}
