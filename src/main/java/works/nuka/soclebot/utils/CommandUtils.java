package works.nuka.soclebot.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Utilitaires pour faciliter le traitement des commandes
 */
public final class CommandUtils {

    private CommandUtils() {
    }

    /**
     * Analyse les arguments d'une commande préfixée
     *
     * @param content Le contenu du message
     * @param prefix Le préfixe de commande
     * @param commandName Le nom de la commande
     * @return Un tableau d'arguments
     */
    public static String[] parseArgs(String content, String prefix, String commandName) {
        // Retirer le préfixe et le nom de la commande
        return splitArgs(content.substring(prefix.length() + commandName.length()));
    }

    /**
     * Découpe une chaîne d'arguments. Les guillemets regroupent un argument contenant des espaces.
     *
     * @param argsString La chaîne d'arguments (peut être null)
     * @return Un tableau d'arguments
     */
    public static String[] splitArgs(String argsString) {
        if (argsString == null || argsString.isBlank()) {
            return new String[0];
        }

        List<String> args = new ArrayList<>();
        StringBuilder currentArg = new StringBuilder();
        boolean inQuotes = false;

        for (char c : argsString.trim().toCharArray()) {
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (Character.isWhitespace(c) && !inQuotes) {
                // Espace hors guillemets = séparateur d'argument
                if (currentArg.length() > 0) {
                    args.add(currentArg.toString());
                    currentArg = new StringBuilder();
                }
            } else {
                currentArg.append(c);
            }
        }

        if (currentArg.length() > 0) {
            args.add(currentArg.toString());
        }

        return args.toArray(new String[0]);
    }

    /**
     * Extrait le nom de commande d'un message préfixé
     *
     * @param content Le contenu du message
     * @param prefix Le préfixe de commande
     * @return Le nom, vide si le message ne contient que le préfixe
     */
    public static String extractCommandName(String content, String prefix) {
        String withoutPrefix = content.substring(prefix.length());
        if (withoutPrefix.isEmpty() || Character.isWhitespace(withoutPrefix.charAt(0))) {
            return "";
        }
        return withoutPrefix.split("\\s+", 2)[0];
    }

    /**
     * Joint les arguments restants en une phrase
     *
     * @param args Les arguments de la commande
     * @param startIndex L'index du premier argument à joindre
     * @return La phrase, vide s'il n'y a pas d'arguments
     */
    public static String joinFrom(String[] args, int startIndex) {
        if (args.length <= startIndex) {
            return "";
        }
        return String.join(" ", Arrays.copyOfRange(args, startIndex, args.length));
    }

    /**
     * Convertit une durée textuelle en millisecondes
     *
     * @param durationString La durée textuelle (ex: "1h", "30m", "1d")
     * @return La durée en millisecondes ou -1 si invalide
     */
    public static long parseDuration(String durationString) {
        if (durationString == null || !durationString.matches("\\d+[smhd]")) {
            return -1;
        }

        try {
            long number = Long.parseLong(durationString.substring(0, durationString.length() - 1));
            char unit = durationString.charAt(durationString.length() - 1);

            switch (unit) {
                case 's':
                    return number * 1000;
                case 'm':
                    return number * 60 * 1000;
                case 'h':
                    return number * 60 * 60 * 1000;
                case 'd':
                    return number * 24 * 60 * 60 * 1000;
                default:
                    return -1;
            }
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
