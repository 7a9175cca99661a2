package org.oldskooler.computedhash.mapping;

import org.oldskooler.computedhash.annotations.Column;
import org.oldskooler.computedhash.annotations.ComputedHash;
import org.oldskooler.computedhash.annotations.Entity;
import org.oldskooler.computedhash.annotations.Id;
import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.descriptor.DescriptorNormalizer;
import org.oldskooler.computedhash.descriptor.HashDeclaration;
import org.oldskooler.computedhash.error.ComputedHashException;
import org.oldskooler.computedhash.error.Violation;
import org.oldskooler.computedhash.util.Names;
import org.oldskooler.computedhash.util.ReflectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.util.*;

/**
 * Table metadata used for DDL, snapshots and migrations.
 * Merge behavior:
 *   - Starts from annotations (@Entity, @Column, @Id, @ComputedHash), else convention
 *   - Then applies the MappingRegistry entry for the type, if any
 *   - Computed hash declarations from both are normalized here, last writer wins
 */
public final class TableMeta<T> {
    private static final Logger log = LoggerFactory.getLogger(TableMeta.class);

    public final Class<T> type;
    public final String table;
    public final Map<String, PrimaryKey> keys;
    public final Map<String, String> propToColumn; // property -> column

    /**
     * column - ColumnMeta, in field declaration order
     */
    public final Map<String, ColumnMeta> columns;

    public static <T> TableMeta<T> of(Class<T> type, MappingRegistry registry, DescriptorNormalizer normalizer) {
        Draft<T> draft = fromAnnotations(type);
        registry.find(type).ifPresent(draft::apply);
        return draft.build(normalizer);
    }

    public TableMeta(Class<T> type,
                     String table,
                     Map<String, PrimaryKey> keys,
                     Map<String, String> propToColumn,
                     Map<String, ColumnMeta> columns) {
        this.type = Objects.requireNonNull(type, "type");
        this.table = Objects.requireNonNull(table, "table");
        this.keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        this.propToColumn = Collections.unmodifiableMap(new LinkedHashMap<>(propToColumn));
        this.columns = (columns == null) ? Collections.unmodifiableMap(new HashMap<>())
                : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public String qualify(String column) {
        return Names.qualify(table, column);
    }

    /**
     * Descriptor decoded from the column's annotations, re-validated.
     */
    public Optional<ComputedHashDescriptor> computedHash(String column) {
        ColumnMeta meta = columns.get(column);
        if (meta == null) return Optional.empty();
        return ComputedHashAnnotations.decode(meta.annotations, meta.name, qualify(meta.name));
    }

    private static <T> Draft<T> fromAnnotations(Class<T> type) {
        Draft<T> d = new Draft<>(type);

        Entity entity = type.getAnnotation(Entity.class);
        if (entity != null && !entity.table().isEmpty()) {
            d.table = entity.table();
        }

        for (Field f : ReflectionUtils.getInstanceFields(type)) {
            String prop = f.getName();
            Column colAnn = f.getAnnotation(Column.class);
            Id idAnn = f.getAnnotation(Id.class);

            String col = Names.defaultColumnName(prop);
            if (colAnn != null && !colAnn.name().isEmpty()) col = colAnn.name();
            if (idAnn != null && !idAnn.name().isEmpty())   col = idAnn.name();

            d.fields.put(prop, f);
            d.p2c.put(prop, col);
            if (colAnn != null) {
                d.nullable.put(prop, colAnn.nullable());
                d.types.put(prop, colAnn.type());
                d.lengths.put(prop, colAnn.length());
            }

            if (idAnn != null) {
                if (idAnn.auto() && d.keys.values().stream().anyMatch(k -> k.auto)) {
                    throw new IllegalArgumentException("auto=true not supported when multiple ID columns are declared for type: " + type.getName());
                }
                d.keys.put(prop, new PrimaryKey(prop, col, idAnn.auto()));
            }

            ComputedHash hash = f.getAnnotation(ComputedHash.class);
            if (hash != null) {
                String token = hash.algorithm().trim().isEmpty() ? hash.method().name() : hash.algorithm();
                d.hashes.put(prop, EntityMapping.HashChange.declare(token, Arrays.asList(hash.sources())));
            }
        }
        return d;
    }

    /** Mutable working state while annotations and fluent mapping are merged. */
    private static final class Draft<T> {
        final Class<T> type;
        String table;
        final LinkedHashMap<String, Field> fields = new LinkedHashMap<>();
        final LinkedHashMap<String, String> p2c = new LinkedHashMap<>();
        final Map<String, Boolean> nullable = new HashMap<>();
        final Map<String, String> types = new HashMap<>();
        final Map<String, Integer> lengths = new HashMap<>();
        final LinkedHashMap<String, PrimaryKey> keys = new LinkedHashMap<>();
        final LinkedHashMap<String, EntityMapping.HashChange> hashes = new LinkedHashMap<>();

        Draft(Class<T> type) {
            this.type = type;
            this.table = Names.defaultTableName(type);
        }

        void apply(EntityMapping<T> em) {
            if (em.table != null) table = em.table;

            em.propToColumn.forEach((prop, col) -> {
                requireField(prop);
                p2c.put(prop, col);
            });
            em.columnTypes.forEach((prop, t) -> types.put(requireField(prop), t));
            em.nullability.forEach((prop, n) -> nullable.put(requireField(prop), n));

            if (!em.keys.isEmpty()) {
                keys.clear();
                em.keys.forEach((prop, k) -> keys.put(requireField(prop), k));
            }

            em.hashChanges.forEach((prop, change) -> {
                requireField(prop);
                EntityMapping.HashChange previous = change.removal ? hashes.remove(prop) : hashes.put(prop, change);
                if (previous != null && !change.removal) {
                    log.info("{}: fluent computed hash configuration replaces the @ComputedHash declaration",
                            Names.qualify(table, p2c.get(prop)));
                }
            });
        }

        TableMeta<T> build(DescriptorNormalizer normalizer) {
            Map<String, Map<String, Object>> annotations = new HashMap<>();
            for (Map.Entry<String, EntityMapping.HashChange> e : hashes.entrySet()) {
                String prop = e.getKey();
                EntityMapping.HashChange change = e.getValue();

                List<String> sourceColumns = new ArrayList<>(change.sources.size());
                for (String s : change.sources) {
                    sourceColumns.add(s == null ? null : p2c.getOrDefault(s, s));
                }

                HashDeclaration declaration = HashDeclaration.builder()
                        .owner(table)
                        .targetColumn(p2c.get(prop))
                        .targetType(fields.get(prop).getType())
                        .algorithmToken(change.algorithmToken)
                        .sourceNames(sourceColumns)
                        .build();

                ComputedHashDescriptor descriptor = normalizer.normalize(declaration);
                checkSourcesExist(descriptor, declaration.qualifiedName());
                Map<String, Object> a = new LinkedHashMap<>();
                ComputedHashAnnotations.encode(descriptor, a);
                annotations.put(prop, a);
            }

            LinkedHashMap<String, ColumnMeta> cols = new LinkedHashMap<>();
            LinkedHashMap<String, PrimaryKey> resolvedKeys = new LinkedHashMap<>();
            for (Map.Entry<String, Field> e : fields.entrySet()) {
                String prop = e.getKey();
                String col = p2c.get(prop);
                PrimaryKey pk = keys.get(prop);

                // PK forces non-nullable
                boolean isNullable = pk == null && nullable.getOrDefault(prop, true);
                if (pk != null) resolvedKeys.put(prop, pk.withColumn(col));

                cols.put(col, new ColumnMeta(table, prop, col, e.getValue().getType(), isNullable,
                        types.getOrDefault(prop, ""), lengths.getOrDefault(prop, -1),
                        annotations.get(prop)));
            }
            return new TableMeta<>(type, table, resolvedKeys, p2c, cols);
        }

        /** Sources must be mapped columns, neither the hash itself nor another computed hash. */
        private void checkSourcesExist(ComputedHashDescriptor descriptor, String column) {
            Set<String> hashColumns = new HashSet<>();
            for (String prop : hashes.keySet()) {
                hashColumns.add(p2c.get(prop));
            }
            for (String source : descriptor.getSourceColumns()) {
                if (!p2c.containsValue(source)) {
                    throw new ComputedHashException(Violation.INVALID_SOURCE, column,
                            "No property or column named '" + source + "' on " + type.getSimpleName());
                }
                if (source.equals(descriptor.getTargetColumn())) {
                    throw new ComputedHashException(Violation.INVALID_SOURCE, column,
                            "A hash cannot include its own column");
                }
                if (hashColumns.contains(source)) {
                    throw new ComputedHashException(Violation.INVALID_SOURCE, column,
                            "Source '" + source + "' is itself a computed hash");
                }
            }
        }

        private String requireField(String prop) {
            if (!fields.containsKey(prop)) {
                throw new IllegalArgumentException("No field '" + prop + "' on " + type.getName());
            }
            return prop;
        }
    }
}
