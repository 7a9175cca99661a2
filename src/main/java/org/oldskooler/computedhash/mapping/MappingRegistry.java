package org.oldskooler.computedhash.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fluent mappings by entity type. Types keep their first registration position;
 * registering a type again replaces its mapping.
 */
public final class MappingRegistry {
    private final Map<Class<?>, EntityMapping<?>> mappings = new LinkedHashMap<>();

    public <T> void register(EntityMapping<T> mapping) {
        mappings.put(mapping.type, mapping);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<EntityMapping<T>> find(Class<T> type) {
        return Optional.ofNullable((EntityMapping<T>) mappings.get(type));
    }

    /** Registered entity types, in registration order. */
    public List<Class<?>> types() {
        return new ArrayList<>(mappings.keySet());
    }
}
