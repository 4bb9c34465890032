package waterquality.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DisjointMappingTest {

    private DisjointMapping<String, Integer> mapping;
    private Map<String, Integer> first;
    private Map<String, Integer> second;

    @BeforeEach
    void setUp() {
        mapping = new DisjointMapping<>();
        first = mapping.addDisjointGroup("first");
        second = mapping.addDisjointGroup("second");
    }

    @Test
    @DisplayName("Una clave insertada en un grupo es visible en el mapa plano y solo en su grupo")
    void groupInsert_shouldBeVisibleInFlatMapAndOwnGroupOnly() {
        first.put("a", 1);

        assertThat(mapping).containsEntry("a", 1);
        assertThat(first).containsOnlyKeys("a");
        assertThat(second).isEmpty();
        assertThat(mapping.getGroupOf("a")).isEqualTo("first");
    }

    @Test
    @DisplayName("Una clave no puede repetirse aunque sea en otro grupo")
    void duplicateKeyAcrossGroups_shouldFail() {
        first.put("a", 1);

        assertThatThrownBy(() -> second.put("a", 2)).isInstanceOf(KeyExistsException.class);
        assertThatThrownBy(() -> mapping.addItemToGroup(null, "a", 3)).isInstanceOf(KeyExistsException.class);
        assertThat(mapping.get("a")).isEqualTo(1);
    }

    @Test
    @DisplayName("Reinsertar en el mismo grupo reemplaza el valor")
    void putSameGroup_shouldReplaceValue() {
        first.put("a", 1);
        first.put("a", 5);

        assertThat(first).containsEntry("a", 5);
        assertThat(mapping).hasSize(1);
    }

    @Test
    @DisplayName("Borrar del mapa plano también lo quita del grupo, y al revés")
    void remove_shouldKeepIndexesInSync() {
        first.put("a", 1);
        second.put("b", 2);

        mapping.remove("a");
        second.remove("b");

        assertThat(first).isEmpty();
        assertThat(mapping).isEmpty();
        assertThat(mapping.getGroupOf("a")).isNull();
        // la clave vuelve a estar libre
        second.put("a", 3);
        assertThat(mapping.getGroupOf("a")).isEqualTo("second");
    }

    @Test
    @DisplayName("El iterador de entradas permite borrar manteniendo los grupos coherentes")
    void entryIteratorRemove_shouldUpdateGroups() {
        first.put("a", 1);
        first.put("b", 2);

        Iterator<Map.Entry<String, Integer>> it = mapping.entrySet().iterator();
        it.next();
        it.remove();

        assertThat(first).containsOnlyKeys("b");
        assertThat(mapping).containsOnlyKeys("b");
    }

    @Test
    @DisplayName("Las claves sin grupo existen en el espacio plano pero en ningún grupo")
    void ungroupedKeys_shouldNotAppearInGroups() {
        mapping.put("x", 9);

        assertThat(mapping.getGroupOf("x")).isNull();
        assertThat(first).doesNotContainKey("x");
        assertThatThrownBy(() -> first.put("x", 1)).isInstanceOf(KeyExistsException.class);
    }

    @Test
    @DisplayName("La iteración respeta el orden de inserción")
    void iteration_shouldFollowInsertionOrder() {
        second.put("z", 1);
        first.put("y", 2);
        second.put("a", 3);

        assertThat(mapping.keySet()).containsExactly("z", "y", "a");
        assertThat(second.keySet()).containsExactly("z", "a");
    }

    @Test
    @DisplayName("Crear un grupo existente o pedir uno inexistente falla")
    void groupManagement_shouldValidateNames() {
        assertThatThrownBy(() -> mapping.addDisjointGroup("first")).isInstanceOf(KeyExistsException.class);
        assertThatThrownBy(() -> mapping.getDisjointGroup("nope")).isInstanceOf(NoSuchElementException.class);
        assertThat(mapping.groupNames()).containsExactly("first", "second");
        assertThat(mapping.getDisjointGroup("first")).isSameAs(first);
    }
}
