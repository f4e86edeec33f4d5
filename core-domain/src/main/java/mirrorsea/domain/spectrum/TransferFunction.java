package mirrorsea.domain.spectrum;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.complex.ComplexField;
import org.apache.commons.math3.linear.ArrayFieldVector;
import org.apache.commons.math3.linear.FieldVector;

import java.util.Arrays;
import java.util.Objects;

/**
 * Función de transferencia compleja F×R×S: respuesta en frecuencia de cada fuente en cada receptor.
 *
 * @param frequencies Frecuencias (Hz).
 * @param values      Valores complejos indexados como {@code [frecuencia][receptor][fuente]}.
 */
public record TransferFunction(double[] frequencies, Complex[][][] values) {

    public TransferFunction {
        Objects.requireNonNull(frequencies, "El array de frecuencias no puede ser nulo.");
        Objects.requireNonNull(values, "El array de valores no puede ser nulo.");
        if (values.length != frequencies.length) {
            throw new IllegalArgumentException("Debe haber un bloque de valores por frecuencia.");
        }
        frequencies = frequencies.clone();
        values = copyOf(values);
    }

    @Override
    public double[] frequencies() {
        return frequencies.clone();
    }

    @Override
    public Complex[][][] values() {
        return copyOf(values);
    }

    public int frequencyCount() {
        return frequencies.length;
    }

    public int receiverCount() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public int sourceCount() {
        return receiverCount() == 0 ? 0 : values[0][0].length;
    }

    public Complex get(int frequencyIndex, int receiverIndex, int sourceIndex) {
        return values[frequencyIndex][receiverIndex][sourceIndex];
    }

    /**
     * Vector de respuestas de todos los receptores para una frecuencia y una fuente.
     */
    public FieldVector<Complex> receiverVector(int frequencyIndex, int sourceIndex) {
        Complex[][] atFrequency = values[frequencyIndex];
        ArrayFieldVector<Complex> vector = new ArrayFieldVector<>(ComplexField.getInstance(), atFrequency.length);
        for (int r = 0; r < atFrequency.length; r++) {
            vector.setEntry(r, atFrequency[r][sourceIndex]);
        }
        return vector;
    }

    // Complex es inmutable: basta con copiar los arrays
    private static Complex[][][] copyOf(Complex[][][] values) {
        Complex[][][] copy = new Complex[values.length][][];
        for (int f = 0; f < values.length; f++) {
            copy[f] = new Complex[values[f].length][];
            for (int r = 0; r < values[f].length; r++) {
                copy[f][r] = values[f][r].clone();
            }
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransferFunction that = (TransferFunction) o;
        return Arrays.equals(frequencies, that.frequencies) && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(frequencies) + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "TransferFunction{F=" + frequencyCount() + ", R=" + receiverCount() + ", S=" + sourceCount() + "}";
    }
}
