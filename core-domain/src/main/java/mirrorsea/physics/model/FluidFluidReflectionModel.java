package mirrorsea.physics.model;

import lombok.Getter;
import mirrorsea.config.Environment;
import mirrorsea.domain.image.Boundary;
import org.apache.commons.math3.complex.Complex;

/**
 * Coeficiente de reflexión de onda plana en la interfaz entre dos semiespacios fluidos.
 * <p>
 * Basado en la ecuación (2.127) de Jensen, Kuperman, Porter y Schmidt,
 * <i>Computational Ocean Acoustics</i> (Springer, 2000):
 * <pre>
 *   k1 = 1/c1,  k2 = 1/c2
 *   kz1 = k1·sin(θ),  kz2 = √(k2² − (k1·cos θ)²)
 *   R = (ρ2·kz1 − ρ1·kz2) / (ρ2·kz1 + ρ1·kz2)
 * </pre>
 * Se usa la raíz cuadrada compleja principal: por debajo del ángulo crítico {@code kz2} es
 * imaginario y {@code |R| = 1} (reflexión total).
 * <p>
 * El medio 1 es siempre el agua. En la superficie el medio 2 es el aire; en el fondo, el sedimento.
 */
@Getter
public class FluidFluidReflectionModel implements ReflectionModel {

    private final double c1;
    private final double rho1;
    private final double c2;
    private final double rho2;

    public FluidFluidReflectionModel(double c1, double rho1, double c2, double rho2) {
        this.c1 = c1;
        this.rho1 = rho1;
        this.c2 = c2;
        this.rho2 = rho2;
    }

    public static FluidFluidReflectionModel surface(Environment env) {
        return new FluidFluidReflectionModel(env.waterC(), env.waterRho(), env.airC(), env.airRho());
    }

    public static FluidFluidReflectionModel seabed(Environment env) {
        return new FluidFluidReflectionModel(env.waterC(), env.waterRho(), env.seabedC(), env.seabedRho());
    }

    public static FluidFluidReflectionModel forBoundary(Boundary boundary, Environment env) {
        return boundary == Boundary.SURFACE ? surface(env) : seabed(env);
    }

    @Override
    public Complex coefficient(double grazingAngle) {
        return reflectionCoefficient(grazingAngle, c1, rho1, c2, rho2);
    }

    /**
     * Ángulo crítico (rad, desde la horizontal): {@code acos(c1/c2)}. Es 0 cuando el medio 2 es más
     * lento que el agua y no existe reflexión total.
     */
    public double criticalAngle() {
        return criticalAngle(c1, c2);
    }

    public static double criticalAngle(double c1, double c2) {
        double ratio = c1 / c2;
        // Parte real de acos: para ratio > 1 el resultado es imaginario puro
        return ratio >= 1.0 ? 0.0 : Math.acos(ratio);
    }

    public static Complex reflectionCoefficient(double grazingAngle, double c1, double rho1, double c2, double rho2) {
        double k1 = 1.0 / c1;
        double k2 = 1.0 / c2;
        double kr1 = Math.cos(grazingAngle) * k1;
        double kz1 = Math.sin(grazingAngle) * k1;

        // El número de onda horizontal se conserva a través de la interfaz
        Complex kz2 = new Complex(k2 * k2 - kr1 * kr1).sqrt();

        Complex t1 = new Complex(rho2 * kz1);
        Complex t2 = kz2.multiply(rho1);
        return t1.subtract(t2).divide(t1.add(t2));
    }
}
