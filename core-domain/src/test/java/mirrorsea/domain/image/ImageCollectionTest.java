package mirrorsea.domain.image;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static mirrorsea.domain.image.ImageFixtures.image;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class ImageCollectionTest {

    private ImageCollection collection;

    @BeforeEach
    void setUp() {
        collection = new ImageCollection(2, 1);
        collection.append(image("", 2, 1, 10));
        collection.append(image("s", 2, 1, 20));
        collection.append(image("sb", 2, 1, 30));
        collection.append(image("b", 2, 1, 40));
        collection.append(image("bs", 2, 1, 50));
    }

    @Test
    @DisplayName("Búsqueda: devuelve el índice de la primera coincidencia")
    void indexOf_shouldReturnFirstMatch() {
        assertEquals(0, collection.indexOf(Breadcrumb.direct()).getAsInt());
        assertEquals(4, collection.indexOf(Breadcrumb.parse("bs")).getAsInt());
        assertTrue(collection.indexOf(Breadcrumb.parse("bsb")).isEmpty());
    }

    @Test
    @DisplayName("Búsqueda por lotes: los breadcrumbs ausentes se descartan en silencio")
    void indicesOf_shouldDropMissingBreadcrumbs() {
        int[] indices = collection.indicesOf("", "bsbs", "sb", "bsb");

        assertThat(indices).containsExactly(0, 2);
    }

    @Test
    @DisplayName("Búsqueda por lotes: códigos con caracteres desconocidos se descartan sin error")
    void indicesOf_unknownCharacters_shouldBeDropped() {
        int[] indices = collection.indicesOf("", "x", "bsXs", "bs", null);

        assertThat(indices).containsExactly(0, 4);
    }

    @Test
    @DisplayName("retain con todos los índices en orden no cambia nada")
    void retain_allIndicesInOrder_shouldBeIdentity() {
        List<Image> before = new ArrayList<>(collection.images());

        collection.retain(collection.allIndices());

        assertEquals(before.size(), collection.count());
        assertEquals(before, collection.images());
    }

    @Test
    @DisplayName("retain reordena y renumera las imágenes supervivientes")
    void retain_shouldRenumberInGivenOrder() {
        collection.retain(4, 0);

        assertEquals(2, collection.count());
        assertEquals("bs", collection.get(0).breadcrumb().toCode());
        assertEquals("", collection.get(1).breadcrumb().toCode());
        assertEquals(1, collection.indexOf(Breadcrumb.direct()).getAsInt());
    }

    @Test
    @DisplayName("retain con un índice fuera de rango falla sin modificar la colección")
    void retain_outOfRange_shouldFailWithoutMutation() {
        assertThrows(IndexOutOfBoundsException.class, () -> collection.retain(0, 1, 5));
        assertThrows(IndexOutOfBoundsException.class, () -> collection.retain(-1));

        assertEquals(5, collection.count(), "La colección no debe modificarse parcialmente");
    }

    @Test
    @DisplayName("clear vacía la colección pero conserva las dimensiones")
    void clear_shouldEmptyCollection() {
        collection.clear();

        assertTrue(collection.isEmpty());
        assertEquals(0, collection.allIndices().length);
        assertEquals(2, collection.getReceiverCount());
        assertEquals(1, collection.getSourceCount());
        assertEquals(0.0, collection.maxDistance());
    }

    @Test
    @DisplayName("append rechaza imágenes con otra geometría o sin alternancia")
    void append_shouldValidateImages() {
        assertThrows(IllegalArgumentException.class, () -> collection.append(image("s", 3, 1, 10)));
        assertThrows(IllegalArgumentException.class, () -> collection.append(image("ss", 2, 1, 10)));
    }

    @Test
    @DisplayName("La distancia máxima recorre todas las imágenes y receptores")
    void maxDistance_shouldScanAllImages() {
        // La imagen "bs" tiene distancia 50 en el receptor 0 y 51 en el receptor 1
        assertEquals(51.0, collection.maxDistance(), 1e-12);
        log.info("Distancia máxima: {}", collection.maxDistance());
    }

    @Test
    @DisplayName("La vista de imágenes es de solo lectura")
    void images_shouldBeUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> collection.images().clear());
    }
}
