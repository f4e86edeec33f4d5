package mirrorsea.physics.model;

import org.apache.commons.math3.complex.Complex;

/**
 * Define el contrato para modelos que calculan el coeficiente de reflexión de onda plana de una
 * frontera en función del ángulo rasante.
 * <p>
 * Los modelos son funciones puras: no guardan estado entre llamadas.
 */
@FunctionalInterface
public interface ReflectionModel {

    /**
     * @param grazingAngle Ángulo rasante en el medio incidente, medido desde la horizontal (rad).
     * @return Coeficiente de reflexión complejo.
     */
    Complex coefficient(double grazingAngle);

    /**
     * Versión vectorizada sobre una matriz de ángulos.
     */
    default Complex[][] coefficients(double[][] grazingAngles) {
        Complex[][] result = new Complex[grazingAngles.length][];
        for (int i = 0; i < grazingAngles.length; i++) {
            result[i] = new Complex[grazingAngles[i].length];
            for (int j = 0; j < grazingAngles[i].length; j++) {
                result[i][j] = coefficient(grazingAngles[i][j]);
            }
        }
        return result;
    }
}
