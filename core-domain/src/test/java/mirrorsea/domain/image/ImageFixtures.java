package mirrorsea.domain.image;

import org.apache.commons.math3.complex.Complex;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Imágenes sintéticas para tests: R receptores y S fuentes con valores predecibles.
 */
final class ImageFixtures {

    private ImageFixtures() {
    }

    static Image image(String code, int receivers, int sources, double distance) {
        Point3d[] positions = new Point3d[sources];
        double[][] distances = new double[receivers][sources];
        Vector3d[][] vectors = new Vector3d[receivers][sources];
        double[][] angles = new double[receivers][sources];
        Complex[][] coefficients = new Complex[receivers][sources];
        for (int s = 0; s < sources; s++) {
            positions[s] = new Point3d(s, 0, -distance);
            for (int r = 0; r < receivers; r++) {
                distances[r][s] = distance + r;
                vectors[r][s] = new Vector3d(0, 0, distance + r);
                angles[r][s] = Math.PI / 2;
                coefficients[r][s] = new Complex(-0.5, 0.1 * r);
            }
        }
        return Image.builder()
                .positions(positions)
                .distances(distances)
                .vectors(vectors)
                .grazingAngles(angles)
                .reflectionCoefficients(coefficients)
                .breadcrumb(Breadcrumb.parse(code))
                .build();
    }
}
