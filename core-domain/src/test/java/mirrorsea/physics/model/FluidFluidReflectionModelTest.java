package mirrorsea.physics.model;

import lombok.extern.slf4j.Slf4j;
import mirrorsea.config.Environment;
import mirrorsea.domain.image.Boundary;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class FluidFluidReflectionModelTest {

    private static final double EPS = 1e-9;

    private final Environment env = Environment.standard().withSeabedZ(-12);
    private final FluidFluidReflectionModel seabed = FluidFluidReflectionModel.seabed(env);
    private final FluidFluidReflectionModel surface = FluidFluidReflectionModel.surface(env);

    @Test
    @DisplayName("Ángulo crítico del fondo: acos(1500/1550)")
    void criticalAngle_shouldMatchSnellLaw() {
        assertEquals(Math.acos(1500.0 / 1550.0), seabed.criticalAngle(), EPS);
        // El aire es más lento que el agua: no hay ángulo crítico
        assertEquals(0.0, surface.criticalAngle(), EPS);
    }

    @Test
    @DisplayName("Reflexión total: |R| = 1 por debajo del ángulo crítico")
    void coefficient_belowCriticalAngle_shouldHaveUnitMagnitude() {
        double critical = seabed.criticalAngle();

        for (int i = 0; i < 20; i++) {
            double angle = critical * i / 20.0;
            Complex r = seabed.coefficient(angle);
            assertEquals(1.0, r.abs(), 1e-9, "Ángulo " + angle);
        }
        // Justo en el ángulo crítico el radicando es ~0 y solo queda error de redondeo
        assertEquals(1.0, seabed.coefficient(critical).abs(), 1e-6);
    }

    @Test
    @DisplayName("Por encima del ángulo crítico hay transmisión: |R| < 1 y nunca mayor que 1")
    void coefficient_aboveCriticalAngle_shouldLoseEnergy() {
        double critical = seabed.criticalAngle();

        for (int i = 1; i <= 20; i++) {
            double angle = critical + (Math.PI / 2 - critical) * i / 20.0;
            Complex r = seabed.coefficient(angle);
            assertTrue(r.abs() < 1.0, "Ángulo " + angle + " -> |R| = " + r.abs());
        }
    }

    @Test
    @DisplayName("Incidencia normal: R = (ρ2c2 − ρ1c1) / (ρ2c2 + ρ1c1)")
    void coefficient_normalIncidence_shouldMatchImpedanceContrast() {
        double z1 = env.waterRho() * env.waterC();
        double z2 = env.seabedRho() * env.seabedC();

        Complex r = seabed.coefficient(Math.PI / 2);

        log.info("R(90°) fondo = {}", r);
        assertEquals((z2 - z1) / (z2 + z1), r.getReal(), EPS);
        assertEquals(0.0, r.getImaginary(), EPS);
    }

    @Test
    @DisplayName("Superficie libre: el aire produce R ≈ −1")
    void coefficient_surface_shouldBeNearlyPressureRelease() {
        Complex r = surface.coefficient(0.3);

        assertEquals(-1.0, r.getReal(), 1e-2);
        assertEquals(0.0, r.getImaginary(), EPS);
    }

    @Test
    @DisplayName("Versión vectorizada coincide elemento a elemento y los factores eligen el medio")
    void coefficients_shouldMatchScalarVersion() {
        double[][] angles = {{0.1, 0.5}, {1.0, 1.5}};

        Complex[][] result = FluidFluidReflectionModel.forBoundary(Boundary.BOTTOM, env).coefficients(angles);

        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertEquals(FluidFluidReflectionModel.reflectionCoefficient(
                        angles[i][j], env.waterC(), env.waterRho(), env.seabedC(), env.seabedRho()), result[i][j]);
            }
        }
        assertEquals(env.airC(), FluidFluidReflectionModel.forBoundary(Boundary.SURFACE, env).getC2());
    }
}
