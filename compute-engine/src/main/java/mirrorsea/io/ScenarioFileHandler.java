package mirrorsea.io;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import mirrorsea.config.Scenario;
import mirrorsea.domain.geometry.SourceReceiverGeometry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Lee y escribe escenarios ({@link Scenario}) en JSON.
 * <p>
 * Un escenario leído ya está listo para simular: el entorno y las condiciones de parada se
 * validan al cargar, y la geometría debe poder construirse. Todos los campos son obligatorios;
 * solo {@code "stoppingConditions": null} se admite, y equivale a las condiciones por defecto.
 * <p>
 * Los umbrales sin límite se escriben como {@code "Infinity"}; al leer se aceptan también
 * {@code NaN} e {@code Infinity} sin comillas.
 */
@Slf4j
public class ScenarioFileHandler {

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS.mappedFeature());
        // Un campo ausente no debe convertirse en 0.0 en silencio
        mapper.enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES);
        mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Guarda el escenario, creando los directorios intermedios. Si el archivo existe se sobrescribe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public void write(Scenario scenario, Path path) throws IOException {
        Objects.requireNonNull(scenario, "El escenario no puede ser nulo.");
        Path target = path.toAbsolutePath();
        log.info("Guardando escenario ({} fuentes, {} receptores) en {}",
                rowCount(scenario.sources()), rowCount(scenario.receivers()), target);

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), scenario);
        } catch (IOException e) {
            log.error("No se pudo escribir el escenario en {}", target, e);
            throw e;
        }
    }

    /**
     * Carga y valida un escenario.
     *
     * @throws IOException           Si el archivo no existe, no se puede leer o el JSON no es válido
     *                               (sintaxis, campos ausentes o desconocidos).
     * @throws IllegalStateException Si el entorno o las condiciones de parada no permiten simular.
     * @throws IllegalArgumentException Si las coordenadas de fuentes o receptores están mal formadas.
     */
    public Scenario read(Path path) throws IOException {
        Path source = path.toAbsolutePath();
        if (!Files.exists(source)) {
            throw new IOException("El archivo especificado no existe: " + source);
        }

        Scenario scenario;
        try {
            scenario = objectMapper.readValue(source.toFile(), Scenario.class);
        } catch (IOException e) {
            log.error("Error al leer o parsear el escenario desde {}", source, e);
            throw e;
        }

        try {
            scenario.environment().validate();
            scenario.stoppingConditions().validate();
            SourceReceiverGeometry geometry = scenario.toGeometry();
            log.info("Escenario cargado desde {}: {} fuentes, {} receptores",
                    source, geometry.sourceCount(), geometry.receiverCount());
        } catch (IllegalStateException | IllegalArgumentException | NullPointerException e) {
            log.error("Escenario inválido en {}: {}", source, e.getMessage());
            throw e;
        }
        return scenario;
    }

    private static int rowCount(double[][] rows) {
        return rows == null ? 0 : rows.length;
    }
}
