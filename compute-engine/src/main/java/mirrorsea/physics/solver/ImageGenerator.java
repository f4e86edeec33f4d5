package mirrorsea.physics.solver;

import mirrorsea.config.Environment;
import mirrorsea.config.StoppingConditions;
import mirrorsea.domain.geometry.SourceReceiverGeometry;
import mirrorsea.domain.image.ImageCollection;

/**
 * Define el contrato para los algoritmos que encuentran las imágenes (eigenrays) de una
 * configuración de entorno y geometría.
 */
public interface ImageGenerator {

    /**
     * Busca todas las imágenes que sobreviven a las condiciones de parada.
     * <p>
     * Cada llamada devuelve una colección NUEVA: no hay estado compartido entre ejecuciones.
     * La primera imagen es siempre el camino directo.
     *
     * @throws IllegalStateException si las condiciones de parada no acotan la búsqueda o el
     *                               entorno está incompleto. Se valida antes de empezar.
     */
    ImageCollection generate(Environment environment, StoppingConditions stoppingConditions,
                             SourceReceiverGeometry geometry);

    /**
     * Identificador del generador para logs y benchmarks.
     */
    String getGeneratorName();
}
