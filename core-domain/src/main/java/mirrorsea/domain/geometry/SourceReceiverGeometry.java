package mirrorsea.domain.geometry;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.Objects;

/**
 * Geometría fija de fuentes y receptores. Calcula vectores y distancias desde un conjunto de
 * puntos (fuentes o sus imágenes) hasta cada receptor, y la imagen especular de un punto respecto
 * a un plano horizontal.
 * <p>
 * Los arrays se copian en profundidad al construir y en cada accesor, así que la instancia es inmutable.
 *
 * @param sources   Posiciones de las S fuentes reales.
 * @param receivers Posiciones de los R receptores.
 */
public record SourceReceiverGeometry(Point3d[] sources, Point3d[] receivers) {

    public SourceReceiverGeometry {
        Objects.requireNonNull(sources, "El array de fuentes no puede ser nulo.");
        Objects.requireNonNull(receivers, "El array de receptores no puede ser nulo.");
        if (sources.length == 0 || receivers.length == 0) {
            throw new IllegalArgumentException("Se necesita al menos una fuente y un receptor.");
        }
        sources = copyOf(sources);
        receivers = copyOf(receivers);
    }

    /**
     * Construye la geometría a partir de matrices N×3 de coordenadas cartesianas.
     */
    public static SourceReceiverGeometry of(double[][] sourcesXyz, double[][] receiversXyz) {
        return new SourceReceiverGeometry(toPoints(sourcesXyz), toPoints(receiversXyz));
    }

    @Override
    public Point3d[] sources() {
        return copyOf(sources);
    }

    @Override
    public Point3d[] receivers() {
        return copyOf(receivers);
    }

    public int sourceCount() {
        return sources.length;
    }

    public int receiverCount() {
        return receivers.length;
    }

    public Point3d getSource(int index) {
        return new Point3d(sources[index]);
    }

    public Point3d getReceiver(int index) {
        return new Point3d(receivers[index]);
    }

    /**
     * Vector con la cabeza en cada receptor y la cola en cada punto (receptor menos punto).
     *
     * @param points P puntos.
     * @return Array R×P de vectores.
     */
    public Vector3d[][] vectorToReceivers(Point3d[] points) {
        Vector3d[][] vectors = new Vector3d[receivers.length][points.length];
        for (int r = 0; r < receivers.length; r++) {
            for (int p = 0; p < points.length; p++) {
                Vector3d v = new Vector3d();
                v.sub(receivers[r], points[p]);
                vectors[r][p] = v;
            }
        }
        return vectors;
    }

    /**
     * Distancia euclídea entre cada receptor y cada punto.
     *
     * @return Array R×P de distancias en metros.
     */
    public double[][] distanceToReceivers(Point3d[] points) {
        return lengths(vectorToReceivers(points));
    }

    /**
     * Norma de cada vector de un array R×P.
     */
    public static double[][] lengths(Vector3d[][] vectors) {
        double[][] lengths = new double[vectors.length][];
        for (int r = 0; r < vectors.length; r++) {
            lengths[r] = new double[vectors[r].length];
            for (int p = 0; p < vectors[r].length; p++) {
                lengths[r][p] = vectors[r][p].length();
            }
        }
        return lengths;
    }

    /**
     * Ángulo rasante (medido desde la horizontal) de cada vector: {@code |atan2(Δz, √(Δx²+Δy²))|}.
     * Es puramente geométrico, igual para cualquier frontera.
     */
    public static double[][] grazingAngles(Vector3d[][] vectors) {
        double[][] angles = new double[vectors.length][];
        for (int r = 0; r < vectors.length; r++) {
            angles[r] = new double[vectors[r].length];
            for (int p = 0; p < vectors[r].length; p++) {
                Vector3d v = vectors[r][p];
                angles[r][p] = Math.abs(Math.atan2(v.z, Math.hypot(v.x, v.y)));
            }
        }
        return angles;
    }

    /**
     * Refleja la coordenada z de cada punto respecto al plano {@code boundaryZ}:
     * {@code z' = boundaryZ - (z - boundaryZ)}. Las coordenadas x e y no cambian.
     *
     * @return Array nuevo con las P imágenes.
     */
    public static Point3d[] mirror(Point3d[] points, double boundaryZ) {
        Point3d[] images = new Point3d[points.length];
        for (int p = 0; p < points.length; p++) {
            Point3d source = points[p];
            images[p] = new Point3d(source.x, source.y, boundaryZ - (source.z - boundaryZ));
        }
        return images;
    }

    /**
     * {@code true} si todos los receptores están exactamente sobre el plano z dado.
     */
    public boolean allReceiversOnPlane(double planeZ) {
        return Arrays.stream(receivers).allMatch(p -> p.z == planeZ);
    }

    /**
     * {@code true} si todas las fuentes están exactamente sobre el plano z dado.
     */
    public boolean allSourcesOnPlane(double planeZ) {
        return Arrays.stream(sources).allMatch(p -> p.z == planeZ);
    }

    private static Point3d[] toPoints(double[][] xyz) {
        Objects.requireNonNull(xyz, "La matriz de coordenadas no puede ser nula.");
        Point3d[] points = new Point3d[xyz.length];
        for (int i = 0; i < xyz.length; i++) {
            if (xyz[i] == null || xyz[i].length != 3) {
                throw new IllegalArgumentException("Cada punto debe tener exactamente 3 coordenadas (fila " + i + ").");
            }
            points[i] = new Point3d(xyz[i][0], xyz[i][1], xyz[i][2]);
        }
        return points;
    }

    private static Point3d[] copyOf(Point3d[] points) {
        Point3d[] copy = new Point3d[points.length];
        for (int i = 0; i < points.length; i++) {
            copy[i] = new Point3d(Objects.requireNonNull(points[i], "Punto nulo en la posición " + i));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceReceiverGeometry that = (SourceReceiverGeometry) o;
        return Arrays.equals(sources, that.sources) && Arrays.equals(receivers, that.receivers);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(sources) + Arrays.hashCode(receivers);
    }

    @Override
    public String toString() {
        return "SourceReceiverGeometry{sources=" + sources.length + ", receivers=" + receivers.length + "}";
    }
}
