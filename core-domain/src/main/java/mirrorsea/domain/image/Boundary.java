package mirrorsea.domain.image;

import mirrorsea.config.Environment;

/**
 * Fronteras reflectantes del modelo. Cada reflexión sobre una frontera debe ir seguida de una
 * reflexión candidata sobre la otra, por lo que la única transición es {@link #opposite()}.
 */
public enum Boundary {

    /** Superficie del mar (interfaz agua-aire). */
    SURFACE('s'),

    /** Fondo marino (interfaz agua-sedimento). */
    BOTTOM('b');

    private final char code;

    Boundary(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public Boundary opposite() {
        return this == SURFACE ? BOTTOM : SURFACE;
    }

    /**
     * Cota z del plano de la frontera en el entorno dado.
     */
    public double planeZ(Environment environment) {
        return this == SURFACE ? environment.waterZ() : environment.seabedZ();
    }

    /**
     * @throws IllegalArgumentException si el carácter no corresponde a ninguna frontera.
     */
    public static Boundary fromCode(char code) {
        for (Boundary boundary : values()) {
            if (boundary.code == code) {
                return boundary;
            }
        }
        throw new IllegalArgumentException("Código de frontera desconocido: '" + code + "'");
    }
}
