package org.oldskooler.computedhash.mapping;

import org.oldskooler.computedhash.algorithm.HashAlgorithm;
import org.oldskooler.computedhash.functions.SFunction;
import org.oldskooler.computedhash.util.LambdaUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent model configuration, handed to {@code ModelContext#onModelCreating}.
 *
 * <pre>
 * model.entity(Document.class)
 *         .toTable("documents")
 *         .hasId("id")
 *         .hasComputedHash("contentHash", HashAlgorithm.SHA2_512, "title", "content")
 *         .done();
 * </pre>
 */
public final class ModelBuilder {
    private final MappingRegistry registry;

    public ModelBuilder(MappingRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public <T> EntityBuilder<T> entity(Class<T> type) {
        return new EntityBuilder<>(this, Objects.requireNonNull(type, "type"));
    }

    public static final class EntityBuilder<T> {
        private final ModelBuilder owner;
        private final Class<T> type;
        private String table;
        private final Map<String, PrimaryKey> keys = new LinkedHashMap<>();
        private final Map<String, String> propToColumn = new LinkedHashMap<>();
        private final Map<String, String> columnTypes = new LinkedHashMap<>();
        private final Map<String, Boolean> nullability = new LinkedHashMap<>();
        private final Map<String, EntityMapping.HashChange> hashChanges = new LinkedHashMap<>();

        private EntityBuilder(ModelBuilder owner, Class<T> type) {
            this.owner = owner;
            this.type = type;
        }

        public EntityBuilder<T> toTable(String table) {
            this.table = requireName(table, "table");
            return this;
        }

        public EntityBuilder<T> hasId(String property) {
            return hasId(property, null, true);
        }

        public EntityBuilder<T> hasId(String property, String column) {
            return hasId(property, column, true);
        }

        public EntityBuilder<T> hasId(String property, String column, boolean auto) {
            requireName(property, "property");
            if (auto && keys.values().stream().anyMatch(k -> k.auto)) {
                throw new IllegalArgumentException("auto=true not supported when multiple ID columns are declared for type: " + type.getName());
            }
            keys.put(property, new PrimaryKey(property, column, auto));
            if (column != null) propToColumn.put(property, column);
            return this;
        }

        public EntityBuilder<T> map(String property, String column) {
            propToColumn.put(requireName(property, "property"), requireName(column, "column"));
            return this;
        }

        public EntityBuilder<T> hasColumnType(String property, String sqlType) {
            columnTypes.put(requireName(property, "property"), Objects.requireNonNull(sqlType, "sqlType"));
            return this;
        }

        public EntityBuilder<T> isRequired(String property) {
            nullability.put(requireName(property, "property"), Boolean.FALSE);
            return this;
        }

        /**
         * Declares {@code property} as a hash of {@code sources}, computed and persisted by the database.
         * Replaces any {@code @ComputedHash} on the same property.
         *
         * @param algorithm algorithm name, matched case-insensitively
         */
        public EntityBuilder<T> hasComputedHash(String property, String algorithm, String... sources) {
            requireName(property, "property");
            hashChanges.put(property, EntityMapping.HashChange.declare(algorithm,
                    sources == null ? List.of() : Arrays.asList(sources)));
            return this;
        }

        public EntityBuilder<T> hasComputedHash(String property, HashAlgorithm algorithm, String... sources) {
            return hasComputedHash(property, Objects.requireNonNull(algorithm, "algorithm").name(), sources);
        }

        @SafeVarargs
        public final EntityBuilder<T> hasComputedHash(SFunction<T, byte[]> property, HashAlgorithm algorithm,
                                                      SFunction<T, ?>... sources) {
            List<String> names = new ArrayList<>();
            for (SFunction<T, ?> s : sources) {
                names.add(LambdaUtils.propertyName(s));
            }
            return hasComputedHash(LambdaUtils.propertyName(property), algorithm, names.toArray(new String[0]));
        }

        /**
         * Drops any computed hash declaration from {@code property}, annotation or fluent,
         * turning it back into an ordinary column.
         */
        public EntityBuilder<T> removeComputedHash(String property) {
            hashChanges.put(requireName(property, "property"), EntityMapping.HashChange.remove());
            return this;
        }

        public ModelBuilder done() {
            owner.registry.register(new EntityMapping<>(type, table, keys, propToColumn, columnTypes,
                    nullability, hashChanges));
            return owner;
        }

        private static String requireName(String value, String what) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException(what + " must not be blank");
            }
            return value;
        }
    }
}
