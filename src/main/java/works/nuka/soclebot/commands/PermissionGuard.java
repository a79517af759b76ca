package works.nuka.soclebot.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.nuka.soclebot.auth.AuthorizationResult;
import works.nuka.soclebot.auth.PermissionResolver;
import works.nuka.soclebot.errors.AuthorizationDeniedException;

/**
 * Garde vérifiant l'exigence de permission déclarée par la commande
 */
public class PermissionGuard implements CommandGuard {
    private static final Logger logger = LoggerFactory.getLogger(PermissionGuard.class);

    private final PermissionResolver resolver;

    public PermissionGuard(PermissionResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void check(Command command, CommandContext context) {
        AuthorizationResult result = resolver.authorize(context.getCaller(), command.getRequirement());
        if (!result.isGranted()) {
            logger.debug("Accès refusé à '{}' pour {} : {}",
                    command.getName(), context.getCaller().getId(), result.getDenialReason());
            throw new AuthorizationDeniedException(result.getDenialReason());
        }
    }
}
