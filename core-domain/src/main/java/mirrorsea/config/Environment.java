package mirrorsea.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con las propiedades acústicas del entorno: aire, columna de agua
 * isoveloz y una única capa de fondo marino.
 * <p>
 * El eje z apunta hacia arriba y la superficie del aire se define en {@code z = 0}, por lo que el
 * fondo marino tiene {@code seabedZ} negativo.
 *
 * @param airZ        Cota del aire (m). Por convenio 0.
 * @param airC        Velocidad del sonido en el aire (m/s).
 * @param airRho      Densidad del aire (g/cm³).
 * @param waterZ      Cota de la superficie del agua (m). Es el plano de reflexión de superficie.
 * @param waterC      Velocidad del sonido en el agua (m/s).
 * @param waterRho    Densidad del agua (g/cm³).
 * @param waterAlpha  Atenuación del agua (dB/λ). Solo metadato, no interviene en el cálculo.
 * @param seabedZ     Cota del fondo marino (m). {@code NaN} indica que aún no se ha definido.
 * @param seabedC     Velocidad del sonido en el fondo (m/s).
 * @param seabedRho   Densidad del fondo (g/cm³).
 * @param seabedAlpha Atenuación del fondo (dB/λ). Solo metadato, no interviene en el cálculo.
 */
@Builder
@With
public record Environment(
        // --- Aire ---
        double airZ,
        double airC,
        double airRho,

        // --- Agua ---
        double waterZ,
        double waterC,
        double waterRho,
        double waterAlpha,

        // --- Fondo marino ---
        double seabedZ,
        double seabedC,
        double seabedRho,
        double seabedAlpha
) {

    /**
     * Entorno de referencia. La cota del fondo queda sin definir y debe fijarse con
     * {@link #withSeabedZ(double)} antes de generar imágenes.
     */
    public static Environment standard() {
        return Environment.builder()
                .airZ(0)
                .airC(343.21)
                .airRho(1.2041e-3)
                .waterZ(0)
                .waterC(1500)
                .waterRho(1)
                .waterAlpha(1.001438340469e-4)
                .seabedZ(Double.NaN)
                .seabedC(1550)
                .seabedRho(1.8)
                .seabedAlpha(0.2)
                .build();
    }

    /**
     * Comprueba que el entorno puede usarse para generar imágenes.
     *
     * @throws IllegalStateException si la cota del fondo no está definida o la velocidad del
     *                               sonido en el agua no es positiva.
     */
    public void validate() {
        if (Double.isNaN(seabedZ)) {
            throw new IllegalStateException("La cota del fondo marino (seabedZ) no está definida.");
        }
        if (!(waterC > 0)) {
            throw new IllegalStateException("La velocidad del sonido en el agua debe ser positiva: " + waterC);
        }
    }
}
