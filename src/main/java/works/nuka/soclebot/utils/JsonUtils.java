package works.nuka.soclebot.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * Utilitaire pour sérialiser en JSON les données stockées en base
 * (déclencheurs et arguments des tâches planifiées)
 */
public final class JsonUtils {
    private static final Logger logger = LoggerFactory.getLogger(JsonUtils.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private JsonUtils() {
    }

    /**
     * Convertit un objet en chaîne JSON
     *
     * @param object L'objet à convertir
     * @return La chaîne JSON ou null en cas d'erreur
     */
    public static String toJson(Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (Exception e) {
            logger.error("Erreur lors de la sérialisation en JSON", e);
            return null;
        }
    }

    /**
     * Convertit une chaîne JSON en objet du type spécifié
     *
     * @param json La chaîne JSON
     * @param valueType Le type de l'objet résultant
     * @return L'objet converti ou null en cas d'erreur
     */
    public static <T> T fromJson(String json, Class<T> valueType) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, valueType);
        } catch (Exception e) {
            logger.error("Erreur lors de la désérialisation du JSON en {}", valueType.getSimpleName(), e);
            return null;
        }
    }

    /**
     * Lit un dictionnaire de chaînes. Un JSON absent ou invalide donne un dictionnaire vide.
     *
     * @param json La chaîne JSON
     * @return Le dictionnaire
     */
    public static Map<String, String> toStringMap(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, STRING_MAP);
        } catch (Exception e) {
            logger.error("Erreur lors de la lecture des arguments JSON", e);
            return Collections.emptyMap();
        }
    }
}
