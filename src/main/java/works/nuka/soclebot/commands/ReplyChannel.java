package works.nuka.soclebot.commands;

/**
 * Canal de réponse à l'utilisateur ayant déclenché une commande.
 * Les envois sont asynchrones ; un échec d'envoi est journalisé par l'implémentation.
 */
public interface ReplyChannel {

    /**
     * Envoie la réponse principale à la commande
     *
     * @param text le message
     * @param ephemeral true pour que seul l'appelant le voie (ignoré si non supporté)
     */
    void sendReply(String text, boolean ephemeral);

    /**
     * Envoie un message de suivi, après une première réponse
     *
     * @param text le message
     * @param ephemeral true pour que seul l'appelant le voie (ignoré si non supporté)
     */
    void sendFollowup(String text, boolean ephemeral);

    /**
     * @return true si une réponse (ou un accusé de réception) a déjà été envoyée
     */
    boolean hasResponseAlreadyBeenSent();
}
