package mirrorsea.physics.solver;

import mirrorsea.domain.image.Image;
import mirrorsea.domain.image.ImageCollection;
import mirrorsea.domain.spectrum.TransferFunction;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Sintetiza la función de transferencia como superposición de ondas esféricas, una por imagen:
 * <pre>
 *   T(f, r, s) = Σ_n  R_n(r,s) / d_n(r,s) · exp(−i·2πf/c · d_n(r,s))
 * </pre>
 * Sin normalización ni ventanas. Con cero imágenes el resultado es cero.
 */
public class TransferFunctionSynthesizer {

    private final double soundSpeed;

    /**
     * @param soundSpeed Velocidad del sonido en el agua (m/s).
     */
    public TransferFunctionSynthesizer(double soundSpeed) {
        if (!(soundSpeed > 0)) {
            throw new IllegalArgumentException("La velocidad del sonido debe ser positiva: " + soundSpeed);
        }
        this.soundSpeed = soundSpeed;
    }

    /**
     * Función de transferencia con todas las imágenes retenidas en la colección.
     */
    public TransferFunction synthesize(ImageCollection images, double[] frequencies) {
        return synthesize(images, frequencies, images.allIndices());
    }

    /**
     * Función de transferencia con un subconjunto de imágenes.
     *
     * @param images       Colección de imágenes.
     * @param frequencies  Frecuencias (Hz).
     * @param imageIndices Índices (base 0) de las imágenes que contribuyen.
     * @return Valores F×R×S.
     * @throws IndexOutOfBoundsException si algún índice no existe en la colección.
     */
    public TransferFunction synthesize(ImageCollection images, double[] frequencies, int[] imageIndices) {
        Objects.requireNonNull(images, "La colección de imágenes no puede ser nula.");
        Objects.requireNonNull(frequencies, "El array de frecuencias no puede ser nulo.");
        Objects.requireNonNull(imageIndices, "El array de índices no puede ser nulo.");

        final int receivers = images.getReceiverCount();
        final int sources = images.getSourceCount();
        final int nFreq = frequencies.length;

        // Acumuladores planos [f][r][s] para no crear un Complex por sumando
        double[][][] re = new double[nFreq][receivers][sources];
        double[][][] im = new double[nFreq][receivers][sources];

        for (int index : imageIndices) {
            Image image = images.get(index);
            for (int r = 0; r < receivers; r++) {
                for (int s = 0; s < sources; s++) {
                    double distance = image.getDistanceAt(r, s);
                    Complex amplitude = image.getReflectionCoefficientAt(r, s).divide(distance);
                    double ar = amplitude.getReal();
                    double ai = amplitude.getImaginary();
                    for (int f = 0; f < nFreq; f++) {
                        double phase = -2.0 * Math.PI * frequencies[f] / soundSpeed * distance;
                        double cos = Math.cos(phase);
                        double sin = Math.sin(phase);
                        re[f][r][s] += ar * cos - ai * sin;
                        im[f][r][s] += ar * sin + ai * cos;
                    }
                }
            }
        }

        Complex[][][] values = new Complex[nFreq][receivers][sources];
        for (int f = 0; f < nFreq; f++) {
            for (int r = 0; r < receivers; r++) {
                for (int s = 0; s < sources; s++) {
                    values[f][r][s] = new Complex(re[f][r][s], im[f][r][s]);
                }
            }
        }
        return new TransferFunction(frequencies, values);
    }
}
