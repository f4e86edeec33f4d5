package mirrorsea.domain.image;

import lombok.Builder;
import org.apache.commons.math3.complex.Complex;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.Objects;

/**
 * Una imagen (fuente virtual) junto con toda su información derivada por receptor.
 * <p>
 * Agrupa en un único registro lo que de otro modo serían arrays paralelos indexados por imagen.
 * Los arrays se copian en profundidad al construir y al leerlos, así que el registro es inmutable.
 *
 * @param positions              Coordenadas de la imagen de cada una de las S fuentes.
 * @param distances              Distancia imagen-receptor, R×S (m).
 * @param vectors                Vector receptor menos imagen, R×S.
 * @param grazingAngles          Ángulo rasante, R×S (rad). {@code NaN} en el camino directo.
 * @param reflectionCoefficients Coeficiente de reflexión acumulado, R×S.
 * @param breadcrumb             Historial de reflexiones que produce esta imagen.
 */
@Builder
public record Image(
        Point3d[] positions,
        double[][] distances,
        Vector3d[][] vectors,
        double[][] grazingAngles,
        Complex[][] reflectionCoefficients,
        Breadcrumb breadcrumb
) {

    public Image {
        Objects.requireNonNull(positions, "Las posiciones de la imagen no pueden ser nulas.");
        Objects.requireNonNull(distances, "El array de distancias no puede ser nulo.");
        Objects.requireNonNull(vectors, "El array de vectores no puede ser nulo.");
        Objects.requireNonNull(grazingAngles, "El array de ángulos rasantes no puede ser nulo.");
        Objects.requireNonNull(reflectionCoefficients, "El array de coeficientes no puede ser nulo.");
        Objects.requireNonNull(breadcrumb, "El breadcrumb no puede ser nulo.");

        // Todas las matrices por receptor deben ser R×S
        int receiverCount = distances.length;
        int sourceCount = positions.length;
        if (vectors.length != receiverCount || grazingAngles.length != receiverCount
                || reflectionCoefficients.length != receiverCount) {
            throw new IllegalArgumentException("Todos los arrays por receptor deben tener " + receiverCount + " filas.");
        }
        for (int r = 0; r < receiverCount; r++) {
            if (distances[r].length != sourceCount || vectors[r].length != sourceCount
                    || grazingAngles[r].length != sourceCount || reflectionCoefficients[r].length != sourceCount) {
                throw new IllegalArgumentException("La fila " + r + " no tiene " + sourceCount + " fuentes.");
            }
        }

        positions = copyPositions(positions);
        distances = copyRows(distances);
        vectors = copyVectors(vectors);
        grazingAngles = copyRows(grazingAngles);
        reflectionCoefficients = copyCoefficients(reflectionCoefficients);
    }

    // Los accesores del registro devuelven copias: una imagen guardada en una colección no se
    // puede modificar desde fuera.

    @Override
    public Point3d[] positions() {
        return copyPositions(positions);
    }

    @Override
    public double[][] distances() {
        return copyRows(distances);
    }

    @Override
    public Vector3d[][] vectors() {
        return copyVectors(vectors);
    }

    @Override
    public double[][] grazingAngles() {
        return copyRows(grazingAngles);
    }

    @Override
    public Complex[][] reflectionCoefficients() {
        return copyCoefficients(reflectionCoefficients);
    }

    public int receiverCount() {
        return distances.length;
    }

    public int sourceCount() {
        return positions.length;
    }

    public boolean isDirectPath() {
        return breadcrumb.isDirect();
    }

    public int surfaceBounces() {
        return breadcrumb.count(Boundary.SURFACE);
    }

    public int bottomBounces() {
        return breadcrumb.count(Boundary.BOTTOM);
    }

    public int bounceCount() {
        return breadcrumb.length();
    }

    public Point3d getPositionOf(int sourceIndex) {
        return new Point3d(positions[sourceIndex]);
    }

    public double getDistanceAt(int receiverIndex, int sourceIndex) {
        return distances[receiverIndex][sourceIndex];
    }

    public Vector3d getVectorAt(int receiverIndex, int sourceIndex) {
        return new Vector3d(vectors[receiverIndex][sourceIndex]);
    }

    public double getGrazingAngleAt(int receiverIndex, int sourceIndex) {
        return grazingAngles[receiverIndex][sourceIndex];
    }

    public Complex getReflectionCoefficientAt(int receiverIndex, int sourceIndex) {
        return reflectionCoefficients[receiverIndex][sourceIndex];
    }

    /**
     * Tiempo de propagación (s) de esta llegada para un par receptor-fuente.
     */
    public double getTravelTimeAt(int receiverIndex, int sourceIndex, double soundSpeed) {
        return distances[receiverIndex][sourceIndex] / soundSpeed;
    }

    /**
     * Mayor distancia imagen-receptor de este registro.
     */
    public double maxDistance() {
        return Arrays.stream(distances).flatMapToDouble(Arrays::stream).max().orElse(0.0);
    }

    private static Point3d[] copyPositions(Point3d[] points) {
        return Arrays.stream(points).map(Point3d::new).toArray(Point3d[]::new);
    }

    private static double[][] copyRows(double[][] values) {
        return Arrays.stream(values).map(double[]::clone).toArray(double[][]::new);
    }

    private static Vector3d[][] copyVectors(Vector3d[][] vectors) {
        return Arrays.stream(vectors)
                .map(row -> Arrays.stream(row).map(Vector3d::new).toArray(Vector3d[]::new))
                .toArray(Vector3d[][]::new);
    }

    // Complex es inmutable: basta con copiar las filas
    private static Complex[][] copyCoefficients(Complex[][] coefficients) {
        return Arrays.stream(coefficients).map(Complex[]::clone).toArray(Complex[][]::new);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Image that = (Image) o;
        return Arrays.equals(positions, that.positions)
                && Arrays.deepEquals(distances, that.distances)
                && Arrays.deepEquals(vectors, that.vectors)
                && Arrays.deepEquals(grazingAngles, that.grazingAngles)
                && Arrays.deepEquals(reflectionCoefficients, that.reflectionCoefficients)
                && breadcrumb.equals(that.breadcrumb);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(positions);
        result = 31 * result + Arrays.deepHashCode(distances);
        result = 31 * result + Arrays.deepHashCode(grazingAngles);
        result = 31 * result + breadcrumb.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Image{" + breadcrumb + ", sources=" + sourceCount() + ", receivers=" + receiverCount() + "}";
    }
}
