package org.oldskooler.computedhash.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of a fluent {@link ModelBuilder.EntityBuilder} configuration.
 * Applied on top of whatever the entity's annotations declare.
 */
public final class EntityMapping<T> {
    public final Class<T> type;
    public final String table;                    // null: keep annotation / convention name
    public final Map<String, PrimaryKey> keys;    // empty: keep annotation keys

    /** property - column name (unquoted) */
    public final Map<String, String> propToColumn;

    /** property - explicit SQL type */
    public final Map<String, String> columnTypes;

    /** property - nullable */
    public final Map<String, Boolean> nullability;

    /**
     * property - computed hash change (declaration or removal).
     * Iteration order is call order.
     */
    public final Map<String, HashChange> hashChanges;

    public EntityMapping(Class<T> type,
                         String table,
                         Map<String, PrimaryKey> keys,
                         Map<String, String> propToColumn,
                         Map<String, String> columnTypes,
                         Map<String, Boolean> nullability,
                         Map<String, HashChange> hashChanges) {
        this.type = Objects.requireNonNull(type, "type");
        this.table = table;
        this.keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        this.propToColumn = Collections.unmodifiableMap(new LinkedHashMap<>(propToColumn));
        this.columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
        this.nullability = Collections.unmodifiableMap(new LinkedHashMap<>(nullability));
        this.hashChanges = Collections.unmodifiableMap(new LinkedHashMap<>(hashChanges));
    }

    /** A fluent {@code hasComputedHash} or {@code removeComputedHash} call. */
    public static final class HashChange {
        public final String algorithmToken;
        public final List<String> sources;
        public final boolean removal;

        private HashChange(String algorithmToken, List<String> sources, boolean removal) {
            this.algorithmToken = algorithmToken;
            this.sources = sources;
            this.removal = removal;
        }

        public static HashChange declare(String algorithmToken, List<String> sources) {
            return new HashChange(algorithmToken,
                    sources == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(sources)), false);
        }

        public static HashChange remove() {
            return new HashChange(null, List.of(), true);
        }
    }
}
