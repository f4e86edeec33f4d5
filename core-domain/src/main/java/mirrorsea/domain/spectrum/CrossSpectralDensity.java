package mirrorsea.domain.spectrum;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Matriz de densidad espectral cruzada (CSDM): una matriz R×R por frecuencia y fuente.
 * <p>
 * Equivale al array R×R×F×S del modelo, pero guardado como una lista por frecuencia de listas
 * por fuente de matrices de Commons Math para poder operar con ellas directamente.
 */
public final class CrossSpectralDensity {

    private final double[] frequencies;
    private final List<List<FieldMatrix<Complex>>> matrices;

    /**
     * @param frequencies Frecuencias (Hz).
     * @param matrices    Una lista por frecuencia con una matriz R×R por fuente.
     */
    public CrossSpectralDensity(double[] frequencies, List<List<FieldMatrix<Complex>>> matrices) {
        Objects.requireNonNull(frequencies, "El array de frecuencias no puede ser nulo.");
        Objects.requireNonNull(matrices, "La lista de matrices no puede ser nula.");
        if (matrices.size() != frequencies.length) {
            throw new IllegalArgumentException("Debe haber un bloque de matrices por frecuencia.");
        }
        this.frequencies = frequencies.clone();
        this.matrices = matrices.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    public double[] getFrequencies() {
        return frequencies.clone();
    }

    public int frequencyCount() {
        return frequencies.length;
    }

    public int sourceCount() {
        return matrices.isEmpty() ? 0 : matrices.get(0).size();
    }

    public int receiverCount() {
        return sourceCount() == 0 ? 0 : matrices.get(0).get(0).getRowDimension();
    }

    /**
     * Matriz R×R para una frecuencia y una fuente. Devuelve una copia.
     */
    public FieldMatrix<Complex> getMatrix(int frequencyIndex, int sourceIndex) {
        return matrices.get(frequencyIndex).get(sourceIndex).copy();
    }

    public Complex get(int receiverRow, int receiverColumn, int frequencyIndex, int sourceIndex) {
        return matrices.get(frequencyIndex).get(sourceIndex).getEntry(receiverRow, receiverColumn);
    }

    @Override
    public String toString() {
        return "CrossSpectralDensity{R=" + receiverCount() + ", F=" + frequencyCount() + ", S=" + sourceCount() + "}";
    }
}
