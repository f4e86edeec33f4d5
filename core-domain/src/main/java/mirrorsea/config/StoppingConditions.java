package mirrorsea.config;

import lombok.Builder;
import lombok.With;

/**
 * Condiciones de parada de la búsqueda de imágenes. Cada umbral puede dejarse sin límite
 * ({@code Double.POSITIVE_INFINITY}), pero al menos uno debe acotar la recursión.
 *
 * @param attenuationThresholdDb Pérdida máxima (dB) respecto a la llegada directa. Un valor no finito
 *                               desactiva el criterio.
 * @param bounceCountThreshold   Número máximo de rebotes de un rayo.
 * @param timeLagThreshold       Retardo máximo (s) de un rayo multitrayecto.
 */
@Builder
@With
public record StoppingConditions(
        double attenuationThresholdDb,
        double bounceCountThreshold,
        double timeLagThreshold
) {

    public static StoppingConditions standard() {
        return StoppingConditions.builder()
                .attenuationThresholdDb(100)
                .bounceCountThreshold(Double.POSITIVE_INFINITY)
                .timeLagThreshold(Double.POSITIVE_INFINITY)
                .build();
    }

    /**
     * Valida que al menos un criterio acota la búsqueda: atenuación finita, o número de rebotes
     * finito y no negativo, o retardo finito y no negativo.
     *
     * @throws IllegalStateException si ningún criterio es válido.
     */
    public void validate() {
        if (!(hasAttenuationLimit() || hasBounceLimit() || hasTimeLagLimit())) {
            throw new IllegalStateException("Condiciones de parada inválidas: la recursión no estaría acotada.");
        }
    }

    public boolean hasAttenuationLimit() {
        return Double.isFinite(attenuationThresholdDb);
    }

    public boolean hasBounceLimit() {
        return finiteNonNegative(bounceCountThreshold);
    }

    public boolean hasTimeLagLimit() {
        return finiteNonNegative(timeLagThreshold);
    }

    /**
     * Indica si la búsqueda solo queda acotada por la atenuación. La pérdida por reflexión puede
     * estancarse por debajo del umbral (reflexión total), así que es una configuración arriesgada.
     */
    public boolean boundedOnlyByAttenuation() {
        return hasAttenuationLimit() && !hasBounceLimit() && !hasTimeLagLimit();
    }

    private static boolean finiteNonNegative(double value) {
        return Double.isFinite(value) && value >= 0;
    }
}
