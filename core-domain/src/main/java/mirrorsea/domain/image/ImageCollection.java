package mirrorsea.domain.image;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Almacén ordenado de las imágenes encontradas para una configuración de entorno y geometría.
 * <p>
 * El orden de inserción es el orden de descubrimiento de la búsqueda. Los índices son base 0.
 * La colección no es thread-safe: cada simulación independiente debe usar su propia instancia.
 */
public class ImageCollection {

    @Getter
    private final int receiverCount;

    @Getter
    private final int sourceCount;

    private final List<Image> images = new ArrayList<>();

    public ImageCollection(int receiverCount, int sourceCount) {
        if (receiverCount <= 0 || sourceCount <= 0) {
            throw new IllegalArgumentException("Se necesita al menos un receptor y una fuente.");
        }
        this.receiverCount = receiverCount;
        this.sourceCount = sourceCount;
    }

    /**
     * Añade una imagen al final de la colección. Solo lo usa el proceso de generación.
     *
     * @throws IllegalArgumentException si las dimensiones no coinciden o el breadcrumb repite frontera.
     */
    public void append(Image image) {
        Objects.requireNonNull(image, "La imagen no puede ser nula.");
        if (image.receiverCount() != receiverCount || image.sourceCount() != sourceCount) {
            throw new IllegalArgumentException("La imagen " + image + " no es " + receiverCount + "×" + sourceCount + ".");
        }
        if (!image.breadcrumb().isAlternating()) {
            throw new IllegalArgumentException("Las reflexiones deben alternar de frontera: " + image.breadcrumb());
        }
        images.add(image);
    }

    public int count() {
        return images.size();
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }

    /**
     * @throws IndexOutOfBoundsException si el índice no existe.
     */
    public Image get(int index) {
        return images.get(index);
    }

    /**
     * Vista de solo lectura de las imágenes, en orden de descubrimiento.
     */
    public List<Image> images() {
        return Collections.unmodifiableList(images);
    }

    public int[] allIndices() {
        return IntStream.range(0, images.size()).toArray();
    }

    /**
     * Busca linealmente la primera imagen con el breadcrumb dado.
     *
     * @return El índice, o vacío si no existe (no es un error).
     */
    public OptionalInt indexOf(Breadcrumb breadcrumb) {
        for (int i = 0; i < images.size(); i++) {
            if (images.get(i).breadcrumb().equals(breadcrumb)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Búsqueda por lotes. Los breadcrumbs que no existen se descartan en silencio, por lo que el
     * resultado puede tener menos elementos que la entrada.
     */
    public int[] indicesOf(Breadcrumb... breadcrumbs) {
        return Arrays.stream(breadcrumbs)
                .map(this::indexOf)
                .filter(OptionalInt::isPresent)
                .mapToInt(OptionalInt::getAsInt)
                .toArray();
    }

    /**
     * Igual que {@link #indicesOf(Breadcrumb...)} pero con códigos textuales ({@code "", "bs", ...}).
     * Un código con caracteres distintos de {@code 's'} y {@code 'b'} no puede existir en la
     * colección y se descarta igual que uno ausente.
     */
    public int[] indicesOf(String... codes) {
        return indicesOf(Arrays.stream(codes)
                .map(Breadcrumb::tryParse)
                .flatMap(Optional::stream)
                .toArray(Breadcrumb[]::new));
    }

    /**
     * Reescribe la colección para que contenga exactamente las imágenes indicadas, en el orden
     * dado. Las imágenes supervivientes se renumeran desde 0. Se validan todos los índices antes
     * de modificar nada.
     *
     * @throws IndexOutOfBoundsException si algún índice está fuera de rango.
     */
    public void retain(int... indices) {
        Objects.requireNonNull(indices, "La lista de índices no puede ser nula.");
        for (int index : indices) {
            Objects.checkIndex(index, images.size());
        }
        List<Image> retained = new ArrayList<>(indices.length);
        for (int index : indices) {
            retained.add(images.get(index));
        }
        images.clear();
        images.addAll(retained);
    }

    /**
     * Vacía la colección, volviendo al estado previo a la generación.
     */
    public void clear() {
        images.clear();
    }

    /**
     * Mayor distancia imagen-receptor de toda la colección, 0 si está vacía.
     */
    public double maxDistance() {
        return images.stream().mapToDouble(Image::maxDistance).max().orElse(0.0);
    }
}
