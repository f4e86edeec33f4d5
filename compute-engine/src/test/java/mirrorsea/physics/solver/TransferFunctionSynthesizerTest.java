package mirrorsea.physics.solver;

import mirrorsea.config.Environment;
import mirrorsea.config.StoppingConditions;
import mirrorsea.domain.geometry.SourceReceiverGeometry;
import mirrorsea.domain.image.ImageCollection;
import mirrorsea.domain.spectrum.TransferFunction;
import mirrorsea.physics.solver.impl.ImageMethodGenerator;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransferFunctionSynthesizerTest {

    private static final double C = 1500.0;
    private static final double[] FREQUENCIES = {100.0, 250.0, 1000.0};

    private TransferFunctionSynthesizer synthesizer;
    private ImageCollection images;

    @BeforeEach
    void setUp() {
        synthesizer = new TransferFunctionSynthesizer(C);
        Environment env = Environment.standard().withSeabedZ(-20).withWaterC(C);
        SourceReceiverGeometry geometry = SourceReceiverGeometry.of(
                new double[][]{{0, 0, -5}, {10, 0, -15}},
                new double[][]{{100, 0, -10}, {100, 3, -12}, {120, 0, -8}});
        images = new ImageMethodGenerator().generate(env,
                new StoppingConditions(Double.POSITIVE_INFINITY, 4, Double.POSITIVE_INFINITY), geometry);
    }

    @Test
    @DisplayName("Camino directo: T = exp(-i·2πf·d/c) / d")
    void synthesize_directOnly_shouldMatchSphericalWave() {
        TransferFunction transfer = synthesizer.synthesize(images, FREQUENCIES, new int[]{0});

        assertEquals(3, transfer.frequencyCount());
        assertEquals(3, transfer.receiverCount());
        assertEquals(2, transfer.sourceCount());
        for (int f = 0; f < FREQUENCIES.length; f++) {
            for (int r = 0; r < 3; r++) {
                for (int s = 0; s < 2; s++) {
                    double d = images.get(0).getDistanceAt(r, s);
                    Complex expected = new Complex(0, -2 * Math.PI * FREQUENCIES[f] * d / C).exp().divide(d);
                    Complex actual = transfer.get(f, r, s);
                    assertEquals(expected.getReal(), actual.getReal(), 1e-12);
                    assertEquals(expected.getImaginary(), actual.getImaginary(), 1e-12);
                }
            }
        }
    }

    @Test
    @DisplayName("Superposición: la suma de las contribuciones por separado es el total")
    void synthesize_shouldBeLinearInImages() {
        TransferFunction total = synthesizer.synthesize(images, FREQUENCIES);
        Complex[][][] sum = new Complex[FREQUENCIES.length][3][2];
        for (int n = 0; n < images.count(); n++) {
            TransferFunction single = synthesizer.synthesize(images, FREQUENCIES, new int[]{n});
            for (int f = 0; f < FREQUENCIES.length; f++) {
                for (int r = 0; r < 3; r++) {
                    for (int s = 0; s < 2; s++) {
                        Complex prev = sum[f][r][s] == null ? Complex.ZERO : sum[f][r][s];
                        sum[f][r][s] = prev.add(single.get(f, r, s));
                    }
                }
            }
        }

        for (int f = 0; f < FREQUENCIES.length; f++) {
            for (int r = 0; r < 3; r++) {
                for (int s = 0; s < 2; s++) {
                    assertEquals(sum[f][r][s].getReal(), total.get(f, r, s).getReal(), 1e-12);
                    assertEquals(sum[f][r][s].getImaginary(), total.get(f, r, s).getImaginary(), 1e-12);
                }
            }
        }
    }

    @Test
    @DisplayName("Colección vacía: la función de transferencia es cero")
    void synthesize_emptyCollection_shouldBeZero() {
        images.clear();

        TransferFunction transfer = synthesizer.synthesize(images, FREQUENCIES);

        assertEquals(Complex.ZERO, transfer.get(2, 1, 1));
        assertEquals(3, transfer.receiverCount());
    }

    @Test
    @DisplayName("Índice fuera de rango: se propaga el error")
    void synthesize_invalidIndex_shouldThrow() {
        assertThrows(IndexOutOfBoundsException.class,
                () -> synthesizer.synthesize(images, FREQUENCIES, new int[]{images.count()}));
    }

    @Test
    @DisplayName("Velocidad del sonido no positiva: se rechaza")
    void constructor_nonPositiveSpeed_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new TransferFunctionSynthesizer(0));
    }
}
