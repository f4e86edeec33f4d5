package mirrorsea.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import mirrorsea.config.Environment;
import mirrorsea.config.StoppingConditions;
import mirrorsea.domain.geometry.SourceReceiverGeometry;
import mirrorsea.domain.image.Boundary;
import mirrorsea.domain.image.Breadcrumb;
import mirrorsea.domain.image.Image;
import mirrorsea.domain.image.ImageCollection;
import mirrorsea.physics.model.FluidFluidReflectionModel;
import mirrorsea.physics.model.ReflectionModel;
import mirrorsea.physics.solver.ImageGenerator;
import org.apache.commons.math3.complex.Complex;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Arrays;

/**
 * Generador de imágenes por el método de las imágenes en un medio isoveloz con una sola capa
 * de fondo.
 * <p>
 * Tras insertar el camino directo se lanzan dos ramas, una que empieza reflejando en la
 * superficie y otra en el fondo. Cada rama alterna la frontera en cada paso:
 * <ol>
 * <li>Refleja las imágenes del paso anterior sobre el plano de la frontera actual.</li>
 * <li>Si todos los receptores están sobre ese plano la imagen es degenerada: no se guarda,
 * pero la rama continúa a partir de ella.</li>
 * <li>Calcula distancia, vector, ángulo rasante y coeficiente de reflexión acumulado.</li>
 * <li>Evalúa las condiciones de parada (rebotes, retardo, atenuación). Cualquiera de ellas
 * termina la rama completa.</li>
 * </ol>
 * El coeficiente acumulado es {@code R_sup(θ)^n_sup · R_fondo(θ)^n_fondo} evaluado en el ángulo
 * rasante del paso actual.
 */
@Slf4j
public class ImageMethodGenerator implements ImageGenerator {

    @Override
    public ImageCollection generate(Environment environment, StoppingConditions stoppingConditions,
                                    SourceReceiverGeometry geometry) {
        // 1. Validación previa: nada se calcula si la búsqueda no está acotada
        stoppingConditions.validate();
        environment.validate();
        if (stoppingConditions.boundedOnlyByAttenuation()) {
            log.warn("La búsqueda solo está acotada por la atenuación ({} dB). Con reflexión total la pérdida puede "
                    + "no alcanzar nunca el umbral; se recomienda fijar también rebotes o retardo.",
                    stoppingConditions.attenuationThresholdDb());
        }

        ImageCollection collection = new ImageCollection(geometry.receiverCount(), geometry.sourceCount());

        // 2. Camino directo: coeficiente 1 y ángulo rasante sin sentido (NaN)
        collection.append(directPath(geometry));

        // 3. Una rama por frontera, salvo que todas las fuentes estén sobre ella
        for (Boundary start : Boundary.values()) {
            double planeZ = start.planeZ(environment);
            if (geometry.allSourcesOnPlane(planeZ)) {
                log.debug("Rama {} omitida: todas las fuentes están sobre el plano z={}", start, planeZ);
                continue;
            }
            int found = generateBranch(start, environment, stoppingConditions, geometry, collection);
            log.debug("Rama {}: {} imágenes", start, found);
        }

        log.info("Generación completada [{}]: {} imágenes para {} fuentes y {} receptores",
                getGeneratorName(), collection.count(), geometry.sourceCount(), geometry.receiverCount());
        return collection;
    }

    @Override
    public String getGeneratorName() {
        return "CPU_ImageMethod_Seq";
    }

    private Image directPath(SourceReceiverGeometry geometry) {
        int receivers = geometry.receiverCount();
        int sources = geometry.sourceCount();

        Vector3d[][] vectors = geometry.vectorToReceivers(geometry.sources());
        double[][] angles = new double[receivers][sources];
        Complex[][] coefficients = new Complex[receivers][sources];
        for (int r = 0; r < receivers; r++) {
            Arrays.fill(angles[r], Double.NaN);
            Arrays.fill(coefficients[r], Complex.ONE);
        }

        return Image.builder()
                .positions(geometry.sources())
                .distances(SourceReceiverGeometry.lengths(vectors))
                .vectors(vectors)
                .grazingAngles(angles)
                .reflectionCoefficients(coefficients)
                .breadcrumb(Breadcrumb.direct())
                .build();
    }

    /**
     * Recorre una rama hasta que se cumple una condición de parada.
     *
     * @return Número de imágenes añadidas a la colección.
     */
    private int generateBranch(Boundary start, Environment env, StoppingConditions stop,
                               SourceReceiverGeometry geometry, ImageCollection collection) {
        ReflectionModel surfaceModel = FluidFluidReflectionModel.surface(env);
        ReflectionModel seabedModel = FluidFluidReflectionModel.seabed(env);

        // Estado previo
        Point3d[] lastPoints = geometry.sources();
        Breadcrumb lastBreadcrumb = Breadcrumb.direct();
        Boundary current = start;
        int surfaceBounces = 0;
        int bottomBounces = 0;
        int added = 0;

        // Cálculos que no dependen del paso
        double[][] directSpreadingLossDb = spreadingLossDb(geometry.distanceToReceivers(geometry.sources()));

        while (true) {
            if (surfaceBounces + bottomBounces >= stop.bounceCountThreshold()) {
                log.debug("Rama {} detenida por número de rebotes en '{}'", start, lastBreadcrumb.toCode());
                break;
            }

            // A. Siguiente imagen y transición de frontera
            Breadcrumb breadcrumb = lastBreadcrumb.append(current);
            double planeZ = current.planeZ(env);
            if (current == Boundary.SURFACE) {
                surfaceBounces++;
            } else {
                bottomBounces++;
            }
            current = current.opposite();
            Point3d[] points = SourceReceiverGeometry.mirror(lastPoints, planeZ);

            // B. Un receptor sobre una frontera no puede tenerla como última reflexión
            if (geometry.allReceiversOnPlane(planeZ)) {
                lastPoints = points;
                lastBreadcrumb = breadcrumb;
                continue;
            }

            Vector3d[][] vectors = geometry.vectorToReceivers(points);
            double[][] distances = SourceReceiverGeometry.lengths(vectors);

            // C. Retardo
            if (Double.isFinite(stop.timeLagThreshold())
                    && allExceed(divide(distances, env.waterC()), stop.timeLagThreshold())) {
                log.debug("Rama {} detenida por retardo en '{}'", start, breadcrumb.toCode());
                break;
            }

            // D. Coeficiente acumulado en el ángulo rasante actual
            double[][] angles = SourceReceiverGeometry.grazingAngles(vectors);
            Complex[][] coefficients = cumulativeCoefficients(angles, surfaceModel, surfaceBounces,
                    seabedModel, bottomBounces);

            // E. Atenuación relativa a la llegada directa
            if (Double.isFinite(stop.attenuationThresholdDb())) {
                double[][] relativeLossDb = relativeLossDb(distances, directSpreadingLossDb, coefficients);
                if (allExceed(relativeLossDb, stop.attenuationThresholdDb())) {
                    log.debug("Rama {} detenida por atenuación en '{}'", start, breadcrumb.toCode());
                    break;
                }
            }

            collection.append(Image.builder()
                    .positions(points)
                    .distances(distances)
                    .vectors(vectors)
                    .grazingAngles(angles)
                    .reflectionCoefficients(coefficients)
                    .breadcrumb(breadcrumb)
                    .build());
            added++;

            lastPoints = points;
            lastBreadcrumb = breadcrumb;
        }
        return added;
    }

    private static Complex[][] cumulativeCoefficients(double[][] angles,
                                                      ReflectionModel surfaceModel, int surfaceBounces,
                                                      ReflectionModel seabedModel, int bottomBounces) {
        Complex[][] result = new Complex[angles.length][];
        for (int r = 0; r < angles.length; r++) {
            result[r] = new Complex[angles[r].length];
            for (int s = 0; s < angles[r].length; s++) {
                Complex coefficient = Complex.ONE;
                if (surfaceBounces > 0) {
                    coefficient = coefficient.multiply(power(surfaceModel.coefficient(angles[r][s]), surfaceBounces));
                }
                if (bottomBounces > 0) {
                    coefficient = coefficient.multiply(power(seabedModel.coefficient(angles[r][s]), bottomBounces));
                }
                result[r][s] = coefficient;
            }
        }
        return result;
    }

    /**
     * Potencia entera por multiplicación repetida. {@link Complex#pow(double)} pasa por el
     * logaritmo complejo y no está definida para base 0.
     */
    private static Complex power(Complex base, int exponent) {
        Complex result = Complex.ONE;
        for (int i = 0; i < exponent; i++) {
            result = result.multiply(base);
        }
        return result;
    }

    private static double[][] spreadingLossDb(double[][] distances) {
        double[][] loss = new double[distances.length][];
        for (int r = 0; r < distances.length; r++) {
            loss[r] = new double[distances[r].length];
            for (int s = 0; s < distances[r].length; s++) {
                loss[r][s] = 20.0 * Math.log10(distances[r][s]);
            }
        }
        return loss;
    }

    private static double[][] relativeLossDb(double[][] distances, double[][] directSpreadingLossDb,
                                             Complex[][] coefficients) {
        double[][] spreading = spreadingLossDb(distances);
        double[][] loss = new double[distances.length][];
        for (int r = 0; r < distances.length; r++) {
            loss[r] = new double[distances[r].length];
            for (int s = 0; s < distances[r].length; s++) {
                double reflectionLossDb = -20.0 * Math.log10(coefficients[r][s].abs());
                loss[r][s] = spreading[r][s] - directSpreadingLossDb[r][s] + reflectionLossDb;
            }
        }
        return loss;
    }

    private static double[][] divide(double[][] values, double divisor) {
        double[][] result = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            result[r] = new double[values[r].length];
            for (int s = 0; s < values[r].length; s++) {
                result[r][s] = values[r][s] / divisor;
            }
        }
        return result;
    }

    /**
     * {@code true} si TODOS los elementos superan el umbral.
     */
    private static boolean allExceed(double[][] values, double threshold) {
        return Arrays.stream(values).flatMapToDouble(Arrays::stream).allMatch(v -> v > threshold);
    }
}
