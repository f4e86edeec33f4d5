package mirrorsea.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import mirrorsea.config.Environment;
import mirrorsea.config.Scenario;
import mirrorsea.config.StoppingConditions;
import mirrorsea.domain.geometry.SourceReceiverGeometry;
import mirrorsea.domain.image.ImageCollection;
import mirrorsea.domain.spectrum.CrossSpectralDensity;
import mirrorsea.domain.spectrum.TransferFunction;
import mirrorsea.physics.solver.CsdmBuilder;
import mirrorsea.physics.solver.ImageGenerator;
import mirrorsea.physics.solver.TransferFunctionSynthesizer;
import mirrorsea.physics.solver.impl.ImageMethodGenerator;

import java.util.Objects;

/**
 * Orquesta el flujo completo del modelo: búsqueda de imágenes, filtrado de eigenrays y
 * renderizado (función de transferencia y CSDM).
 * <p>
 * La configuración es inmutable; lo único que cambia es la colección de imágenes, que se
 * sustituye por una nueva en cada {@link #generate()}. Una instancia no debe usarse desde varios
 * hilos a la vez.
 */
@Slf4j
public class ImageMethodSimulator {

    @Getter
    private final Environment environment;
    @Getter
    private final StoppingConditions stoppingConditions;
    @Getter
    private final SourceReceiverGeometry geometry;

    private final ImageGenerator generator;
    private final TransferFunctionSynthesizer synthesizer;
    private final CsdmBuilder csdmBuilder;

    private ImageCollection images;

    public ImageMethodSimulator(Scenario scenario) {
        this(scenario.environment(), scenario.stoppingConditions(), scenario.toGeometry());
    }

    public ImageMethodSimulator(Environment environment, StoppingConditions stoppingConditions,
                                SourceReceiverGeometry geometry) {
        this(environment, stoppingConditions, geometry, new ImageMethodGenerator());
    }

    public ImageMethodSimulator(Environment environment, StoppingConditions stoppingConditions,
                                SourceReceiverGeometry geometry, ImageGenerator generator) {
        this.environment = Objects.requireNonNull(environment, "El entorno no puede ser nulo.");
        this.stoppingConditions = Objects.requireNonNull(stoppingConditions, "Las condiciones de parada no pueden ser nulas.");
        this.geometry = Objects.requireNonNull(geometry, "La geometría no puede ser nula.");
        this.generator = Objects.requireNonNull(generator, "El generador no puede ser nulo.");
        this.synthesizer = new TransferFunctionSynthesizer(environment.waterC());
        this.csdmBuilder = new CsdmBuilder(synthesizer);
        this.images = new ImageCollection(geometry.receiverCount(), geometry.sourceCount());

        log.info("ImageMethodSimulator inicializado. Generador={}, fuentes={}, receptores={}",
                generator.getGeneratorName(), geometry.sourceCount(), geometry.receiverCount());
    }

    /**
     * Busca las imágenes y reemplaza la colección actual por la nueva.
     *
     * @return La colección recién generada.
     */
    public ImageCollection generate() {
        this.images = generator.generate(environment, stoppingConditions, geometry);
        return images;
    }

    /**
     * Vacía la colección actual para poder volver a generar.
     */
    public void reset() {
        images.clear();
    }

    public ImageCollection getImages() {
        return images;
    }

    public int getImageCount() {
        return images.count();
    }

    public int getReceiverCount() {
        return geometry.receiverCount();
    }

    public int getSourceCount() {
        return geometry.sourceCount();
    }

    /**
     * Índices de los eigenrays identificados por su código ({@code "", "bs", ...}). Los que no
     * existen se descartan.
     */
    public int[] breadcrumbToImageIndices(String... breadcrumbs) {
        return images.indicesOf(breadcrumbs);
    }

    public void retainImageIndices(int... imageIndices) {
        images.retain(imageIndices);
        log.debug("Retenidas {} imágenes", images.count());
    }

    /**
     * Atajo para retener solo los eigenrays indicados por su código.
     */
    public void retainBreadcrumbs(String... breadcrumbs) {
        retainImageIndices(breadcrumbToImageIndices(breadcrumbs));
    }

    /**
     * Mayor distancia de propagación entre las imágenes retenidas. Útil para dimensionar el eje de
     * tiempos de una síntesis posterior.
     */
    public double getMaxImageDistance() {
        return images.maxDistance();
    }

    public TransferFunction getTransferFunction(double[] frequencies) {
        return synthesizer.synthesize(images, frequencies);
    }

    public TransferFunction getTransferFunction(double[] frequencies, int[] imageIndices) {
        return synthesizer.synthesize(images, frequencies, imageIndices);
    }

    public CrossSpectralDensity getClairvoyantCsdm(double[] frequencies) {
        return csdmBuilder.clairvoyant(images, frequencies);
    }

    public CrossSpectralDensity getClairvoyantCsdm(double[] frequencies, int[] imageIndices) {
        return csdmBuilder.clairvoyant(images, frequencies, imageIndices);
    }

    public CrossSpectralDensity getClairvoyantCsdmWithDecoherence(double[] frequencies,
                                                                  double surfaceCoherence, double seabedCoherence) {
        return csdmBuilder.clairvoyantWithDecoherence(images, frequencies, surfaceCoherence, seabedCoherence);
    }

    public CrossSpectralDensity getClairvoyantCsdmWithDecoherence(double[] frequencies,
                                                                  double surfaceCoherence, double seabedCoherence,
                                                                  int[] imageIndices) {
        return csdmBuilder.clairvoyantWithDecoherence(images, frequencies, surfaceCoherence, seabedCoherence, imageIndices);
    }
}
