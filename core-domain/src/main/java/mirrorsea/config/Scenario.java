package mirrorsea.config;

import lombok.Builder;
import lombok.With;
import mirrorsea.domain.geometry.SourceReceiverGeometry;

import java.util.Objects;

/**
 * Contenedor principal de una simulación completa: entorno, condiciones de parada y posiciones
 * de fuentes y receptores. Es la forma serializable (JSON) de una ejecución.
 *
 * @param environment        Propiedades acústicas del entorno.
 * @param stoppingConditions Criterios de parada de la búsqueda de imágenes.
 * @param sources            Coordenadas de las fuentes, una fila {x, y, z} por fuente.
 * @param receivers          Coordenadas de los receptores, una fila {x, y, z} por receptor.
 */
@Builder
@With
public record Scenario(
        Environment environment,
        StoppingConditions stoppingConditions,
        double[][] sources,
        double[][] receivers
) {

    public Scenario {
        Objects.requireNonNull(environment, "El entorno no puede ser nulo.");
        if (stoppingConditions == null) {
            stoppingConditions = StoppingConditions.standard();
        }
    }

    /**
     * Convierte las coordenadas en una geometría inmutable.
     */
    public SourceReceiverGeometry toGeometry() {
        return SourceReceiverGeometry.of(sources, receivers);
    }
}
