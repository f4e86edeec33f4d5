package mirrorsea.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentTest {

    @Test
    @DisplayName("El entorno estándar deja el fondo sin definir y no es válido hasta fijarlo")
    void standard_withoutSeabedDepth_shouldFailValidation() {
        Environment env = Environment.standard();

        assertThat(env.seabedZ()).isNaN();
        assertThat(env.waterC()).isEqualTo(1500.0);
        assertThat(env.airC()).isEqualTo(343.21);
        assertThatThrownBy(env::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("seabedZ");
    }

    @Test
    @DisplayName("Con la cota del fondo fijada el entorno es válido y el resto de valores se conserva")
    void withSeabedZ_shouldProduceValidEnvironment() {
        Environment env = Environment.standard().withSeabedZ(-12);

        env.validate();
        assertThat(env.seabedZ()).isEqualTo(-12.0);
        assertThat(env.seabedRho()).isEqualTo(1.8);
        assertThat(env.seabedC()).isEqualTo(1550.0);
    }

    @Test
    @DisplayName("Una velocidad del sonido en el agua no positiva es inválida")
    void validate_nonPositiveWaterSpeed_shouldThrow() {
        Environment env = Environment.standard().withSeabedZ(-20).withWaterC(0);

        assertThatThrownBy(env::validate).isInstanceOf(IllegalStateException.class);
    }
}
