package works.nuka.soclebot.scheduler;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Règle de déclenchement d'une tâche planifiée, persistée en JSON
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronTrigger.class, name = CronTrigger.TYPE),
        @JsonSubTypes.Type(value = IntervalTrigger.class, name = IntervalTrigger.TYPE),
        @JsonSubTypes.Type(value = DateTrigger.class, name = DateTrigger.TYPE)
})
public interface TaskTrigger {

    /**
     * Calcule le premier déclenchement d'une tâche enregistrée à un instant donné
     *
     * @param now instant d'enregistrement
     * @return la date du premier déclenchement
     */
    Instant firstFireTime(Instant now);

    /**
     * Calcule le déclenchement suivant, strictement postérieur à {@code now}
     *
     * @param previousFireTime date du déclenchement précédent
     * @param now instant courant
     * @return la date suivante, ou null si le déclencheur est épuisé
     */
    Instant nextFireTime(Instant previousFireTime, Instant now);

    /**
     * @return le nom du type, identique à celui de la sérialisation JSON
     */
    String typeName();

    /**
     * @return true si le déclencheur peut se déclencher plusieurs fois
     */
    default boolean recurring() {
        return true;
    }
}
