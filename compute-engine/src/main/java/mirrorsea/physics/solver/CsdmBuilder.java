package mirrorsea.physics.solver;

import lombok.extern.slf4j.Slf4j;
import mirrorsea.domain.image.Image;
import mirrorsea.domain.image.ImageCollection;
import mirrorsea.domain.spectrum.CrossSpectralDensity;
import mirrorsea.domain.spectrum.TransferFunction;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.complex.ComplexField;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.FieldVector;
import org.apache.commons.math3.linear.MatrixUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Construye matrices de densidad espectral cruzada (CSDM) a partir de la función de transferencia.
 * <p>
 * La CSDM clarividente es el producto exterior {@code T·Tᴴ} por frecuencia y fuente: un campo
 * perfectamente coherente y sin ruido. La variante con decoherencia suma los productos exteriores
 * de todos los pares de imágenes, cada uno amortiguado según su orden de reflexión.
 */
@Slf4j
public class CsdmBuilder {

    private final TransferFunctionSynthesizer synthesizer;

    public CsdmBuilder(TransferFunctionSynthesizer synthesizer) {
        this.synthesizer = Objects.requireNonNull(synthesizer, "El sintetizador no puede ser nulo.");
    }

    public CrossSpectralDensity clairvoyant(ImageCollection images, double[] frequencies) {
        return clairvoyant(images, frequencies, images.allIndices());
    }

    /**
     * CSDM clarividente (sin ruido, SNR perfecta, sin decorrelación entre rayos).
     *
     * @return Una matriz R×R por frecuencia y fuente.
     */
    public CrossSpectralDensity clairvoyant(ImageCollection images, double[] frequencies, int[] imageIndices) {
        TransferFunction transfer = synthesizer.synthesize(images, frequencies, imageIndices);
        int sources = images.getSourceCount();

        List<List<FieldMatrix<Complex>>> matrices = new ArrayList<>(frequencies.length);
        for (int f = 0; f < frequencies.length; f++) {
            List<FieldMatrix<Complex>> perSource = new ArrayList<>(sources);
            for (int s = 0; s < sources; s++) {
                FieldVector<Complex> t = transfer.receiverVector(f, s);
                perSource.add(t.outerProduct(conjugate(t)));
            }
            matrices.add(perSource);
        }
        return new CrossSpectralDensity(frequencies, matrices);
    }

    public CrossSpectralDensity clairvoyantWithDecoherence(ImageCollection images, double[] frequencies,
                                                           double surfaceCoherence, double seabedCoherence) {
        return clairvoyantWithDecoherence(images, frequencies, surfaceCoherence, seabedCoherence, images.allIndices());
    }

    /**
     * CSDM con pérdida de coherencia ad hoc entre eigenrays. La contribución del par (n1, n2) se
     * escala por {@code seabedCoherence^(b1+b2) · surfaceCoherence^(s1+s2)}, con b y s los rebotes en
     * fondo y superficie de cada imagen. Con ambos factores a 1 coincide con la clarividente.
     *
     * @param surfaceCoherence Coherencia retenida por rebote en superficie, normalmente en [0, 1].
     * @param seabedCoherence  Coherencia retenida por rebote en el fondo, normalmente en [0, 1].
     */
    public CrossSpectralDensity clairvoyantWithDecoherence(ImageCollection images, double[] frequencies,
                                                           double surfaceCoherence, double seabedCoherence,
                                                           int[] imageIndices) {
        int receivers = images.getReceiverCount();
        int sources = images.getSourceCount();
        int nImages = imageIndices.length;

        // Función de transferencia y rebotes de cada imagen por separado
        TransferFunction[] partial = new TransferFunction[nImages];
        int[] bottomBounces = new int[nImages];
        int[] surfaceBounces = new int[nImages];
        for (int n = 0; n < nImages; n++) {
            Image image = images.get(imageIndices[n]);
            partial[n] = synthesizer.synthesize(images, frequencies, new int[]{imageIndices[n]});
            bottomBounces[n] = image.bottomBounces();
            surfaceBounces[n] = image.surfaceBounces();
        }

        List<List<FieldMatrix<Complex>>> matrices = new ArrayList<>(frequencies.length);
        for (int f = 0; f < frequencies.length; f++) {
            List<FieldMatrix<Complex>> perSource = new ArrayList<>(sources);
            for (int s = 0; s < sources; s++) {
                perSource.add(MatrixUtils.createFieldMatrix(ComplexField.getInstance(), receivers, receivers));
            }
            matrices.add(perSource);
        }

        for (int n1 = 0; n1 < nImages; n1++) {
            for (int n2 = 0; n2 < nImages; n2++) {
                double coherence = Math.pow(seabedCoherence, bottomBounces[n1] + bottomBounces[n2])
                        * Math.pow(surfaceCoherence, surfaceBounces[n1] + surfaceBounces[n2]);
                Complex factor = new Complex(coherence);
                for (int f = 0; f < frequencies.length; f++) {
                    for (int s = 0; s < sources; s++) {
                        FieldVector<Complex> t1 = partial[n1].receiverVector(f, s);
                        FieldVector<Complex> t2 = partial[n2].receiverVector(f, s);
                        FieldMatrix<Complex> cross = t1.outerProduct(conjugate(t2)).scalarMultiply(factor);
                        List<FieldMatrix<Complex>> perSource = matrices.get(f);
                        perSource.set(s, perSource.get(s).add(cross));
                    }
                }
            }
        }
        log.debug("CSDM con decoherencia: {} imágenes, {} frecuencias, {} fuentes", nImages, frequencies.length, sources);
        return new CrossSpectralDensity(frequencies, matrices);
    }

    private static FieldVector<Complex> conjugate(FieldVector<Complex> vector) {
        FieldVector<Complex> conj = vector.copy();
        for (int i = 0; i < conj.getDimension(); i++) {
            conj.setEntry(i, vector.getEntry(i).conjugate());
        }
        return conj;
    }
}
