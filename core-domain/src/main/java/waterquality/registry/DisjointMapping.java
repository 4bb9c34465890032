package waterquality.registry;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Mapa de nombres únicos particionado en grupos disjuntos.
 * <p>
 * Todas las claves comparten un único espacio de nombres plano (una clave existe como
 * mucho una vez, pertenezca o no a un grupo), pero cada grupo se puede recorrer por
 * separado a través de la vista que devuelve {@link #addDisjointGroup(String)}.
 * <p>
 * Internamente hay un solo mapa de datos más un índice secundario {@code clave -> grupo};
 * las vistas de grupo no duplican los valores.
 * <p>
 * No es thread-safe: la comprobación de unicidad y la inserción no son atómicas.
 *
 * @param <K> tipo de la clave
 * @param <V> tipo del valor
 */
public class DisjointMapping<K, V> extends AbstractMap<K, V> {

    private final Map<K, V> data = new LinkedHashMap<>();
    private final Map<K, String> keyGroups = new HashMap<>();
    private final Map<String, Set<K>> groups = new LinkedHashMap<>();
    private final Map<String, GroupView> views = new HashMap<>();

    /**
     * Crea un nuevo grupo disjunto y devuelve su vista.
     *
     * @param groupName nombre del grupo, no nulo.
     * @return la vista (mapa) del grupo, respaldada por este mapa.
     * @throws KeyExistsException si ya existe un grupo con ese nombre.
     */
    public Map<K, V> addDisjointGroup(String groupName) {
        Objects.requireNonNull(groupName, "El nombre del grupo no puede ser nulo.");
        if (groups.containsKey(groupName)) {
            throw new KeyExistsException("El grupo '" + groupName + "' ya existe.");
        }
        groups.put(groupName, new LinkedHashSet<>());
        GroupView view = new GroupView(groupName);
        views.put(groupName, view);
        return view;
    }

    /**
     * Devuelve la vista de un grupo existente.
     *
     * @throws NoSuchElementException si el grupo no existe.
     */
    public Map<K, V> getDisjointGroup(String groupName) {
        GroupView view = views.get(groupName);
        if (view == null) {
            throw new NoSuchElementException("El grupo '" + groupName + "' no existe.");
        }
        return view;
    }

    /**
     * Inserta una clave nueva, opcionalmente asociada a un grupo.
     *
     * @param groupName grupo destino, o {@code null} para dejar la clave sin grupo.
     * @throws KeyExistsException si la clave ya existe en cualquier parte del espacio de nombres.
     */
    public void addItemToGroup(String groupName, K key, V value) {
        if (data.containsKey(key)) {
            throw new KeyExistsException("La clave '" + key + "' ya existe.");
        }
        if (groupName != null && !groups.containsKey(groupName)) {
            throw new NoSuchElementException("El grupo '" + groupName + "' no existe.");
        }
        data.put(key, value);
        if (groupName != null) {
            keyGroups.put(key, groupName);
            groups.get(groupName).add(key);
        }
    }

    /**
     * Grupo al que pertenece la clave, o {@code null} si no tiene grupo o no existe.
     */
    public String getGroupOf(Object key) {
        return keyGroups.get(key);
    }

    public Set<String> groupNames() {
        return Collections.unmodifiableSet(groups.keySet());
    }

    /**
     * Inserción por el mapa plano. Una clave nueva queda sin grupo; una clave existente
     * conserva su grupo y solo se reemplaza el valor.
     */
    @Override
    public V put(K key, V value) {
        return data.put(key, value);
    }

    @Override
    public V get(Object key) {
        return data.get(key);
    }

    @Override
    public boolean containsKey(Object key) {
        return data.containsKey(key);
    }

    /**
     * Elimina la clave del espacio plano y del grupo al que pertenezca.
     */
    @Override
    public V remove(Object key) {
        if (!data.containsKey(key)) {
            return null;
        }
        String group = keyGroups.remove(key);
        if (group != null) {
            groups.get(group).remove(key);
        }
        return data.remove(key);
    }

    @Override
    public void clear() {
        data.clear();
        keyGroups.clear();
        groups.values().forEach(Set::clear);
    }

    @Override
    public int size() {
        return data.size();
    }

    @Override
    public Set<Entry<K, V>> entrySet() {
        return new AbstractSet<>() {
            @Override
            public Iterator<Entry<K, V>> iterator() {
                Iterator<Entry<K, V>> delegate = data.entrySet().iterator();
                return new Iterator<>() {
                    private Entry<K, V> current;

                    @Override
                    public boolean hasNext() {
                        return delegate.hasNext();
                    }

                    @Override
                    public Entry<K, V> next() {
                        current = delegate.next();
                        return current;
                    }

                    @Override
                    public void remove() {
                        if (current == null) {
                            throw new IllegalStateException();
                        }
                        String group = keyGroups.remove(current.getKey());
                        if (group != null) {
                            groups.get(group).remove(current.getKey());
                        }
                        delegate.remove();
                        current = null;
                    }
                };
            }

            @Override
            public int size() {
                return data.size();
            }
        };
    }

    /**
     * Vista de un grupo. Comparte el espacio de claves con el mapa padre:
     * insertar aquí una clave que exista en cualquier otro sitio falla.
     */
    private final class GroupView extends AbstractMap<K, V> {

        private final String groupName;

        private GroupView(String groupName) {
            this.groupName = groupName;
        }

        private Set<K> keys() {
            return groups.get(groupName);
        }

        @Override
        public V put(K key, V value) {
            if (keys().contains(key)) {
                return data.put(key, value);
            }
            addItemToGroup(groupName, key, value);
            return null;
        }

        @Override
        public V get(Object key) {
            return keys().contains(key) ? data.get(key) : null;
        }

        @Override
        public boolean containsKey(Object key) {
            return keys().contains(key);
        }

        @Override
        public V remove(Object key) {
            if (!keys().contains(key)) {
                return null;
            }
            return DisjointMapping.this.remove(key);
        }

        @Override
        public int size() {
            return keys().size();
        }

        @Override
        public Set<Entry<K, V>> entrySet() {
            return new AbstractSet<>() {
                @Override
                public Iterator<Entry<K, V>> iterator() {
                    Iterator<K> keyIterator = keys().iterator();
                    return new Iterator<>() {
                        private K current;

                        @Override
                        public boolean hasNext() {
                            return keyIterator.hasNext();
                        }

                        @Override
                        public Entry<K, V> next() {
                            current = keyIterator.next();
                            return new SimpleImmutableEntry<>(current, data.get(current));
                        }

                        @Override
                        public void remove() {
                            if (current == null) {
                                throw new IllegalStateException();
                            }
                            keyIterator.remove();
                            keyGroups.remove(current);
                            data.remove(current);
                            current = null;
                        }
                    };
                }

                @Override
                public int size() {
                    return keys().size();
                }
            };
        }
    }
}
