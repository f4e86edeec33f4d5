package mirrorsea.domain.image;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Historial ordenado de reflexiones que convierte la fuente real en una imagen.
 * <p>
 * La secuencia vacía identifica el camino directo. Dos breadcrumbs son iguales si contienen
 * las mismas fronteras en el mismo orden.
 *
 * @param reflections Fronteras reflejadas, de la primera a la última.
 */
public record Breadcrumb(List<Boundary> reflections) {

    private static final Breadcrumb DIRECT = new Breadcrumb(List.of());

    public Breadcrumb {
        Objects.requireNonNull(reflections, "La lista de reflexiones no puede ser nula.");
        reflections = List.copyOf(reflections);
    }

    /** Breadcrumb del camino directo. */
    public static Breadcrumb direct() {
        return DIRECT;
    }

    public static Breadcrumb of(Boundary... reflections) {
        return new Breadcrumb(List.of(reflections));
    }

    /**
     * Construye un breadcrumb a partir de su código textual, p.ej. {@code "bsbs"}.
     *
     * @throws IllegalArgumentException si aparece un carácter que no es {@code 's'} ni {@code 'b'}.
     */
    public static Breadcrumb parse(String code) {
        Objects.requireNonNull(code, "El código del breadcrumb no puede ser nulo.");
        List<Boundary> parsed = new ArrayList<>(code.length());
        for (char c : code.toCharArray()) {
            parsed.add(Boundary.fromCode(c));
        }
        return new Breadcrumb(parsed);
    }

    /**
     * Como {@link #parse(String)}, pero un código nulo o con caracteres desconocidos devuelve vacío.
     */
    public static Optional<Breadcrumb> tryParse(String code) {
        if (code == null) {
            return Optional.empty();
        }
        List<Boundary> parsed = new ArrayList<>(code.length());
        for (char c : code.toCharArray()) {
            Optional<Boundary> boundary = Arrays.stream(Boundary.values()).filter(b -> b.code() == c).findFirst();
            if (boundary.isEmpty()) {
                return Optional.empty();
            }
            parsed.add(boundary.get());
        }
        return Optional.of(new Breadcrumb(parsed));
    }

    /**
     * Devuelve un breadcrumb nuevo con una reflexión más al final.
     */
    public Breadcrumb append(Boundary boundary) {
        Objects.requireNonNull(boundary, "La frontera no puede ser nula.");
        List<Boundary> extended = new ArrayList<>(reflections.size() + 1);
        extended.addAll(reflections);
        extended.add(boundary);
        return new Breadcrumb(extended);
    }

    public int length() {
        return reflections.size();
    }

    public boolean isDirect() {
        return reflections.isEmpty();
    }

    public int count(Boundary boundary) {
        return (int) reflections.stream().filter(b -> b == boundary).count();
    }

    /**
     * Comprueba que no hay dos reflexiones consecutivas sobre la misma frontera.
     */
    public boolean isAlternating() {
        for (int i = 1; i < reflections.size(); i++) {
            if (reflections.get(i) == reflections.get(i - 1)) {
                return false;
            }
        }
        return true;
    }

    public String toCode() {
        StringBuilder sb = new StringBuilder(reflections.size());
        reflections.forEach(b -> sb.append(b.code()));
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Breadcrumb['" + toCode() + "']";
    }
}
