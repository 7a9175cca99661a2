package org.oldskooler.computedhash;

import org.oldskooler.computedhash.config.ComputedHashOptions;
import org.oldskooler.computedhash.descriptor.DescriptorNormalizer;
import org.oldskooler.computedhash.descriptor.DescriptorValidator;
import org.oldskooler.computedhash.dialect.SqlDialect;
import org.oldskooler.computedhash.dialect.types.SqlServerDialect;
import org.oldskooler.computedhash.mapping.MappingRegistry;
import org.oldskooler.computedhash.mapping.ModelBuilder;
import org.oldskooler.computedhash.mapping.TableMeta;
import org.oldskooler.computedhash.operations.DbMigrationOperations;
import org.oldskooler.computedhash.snapshot.ModelSnapshot;
import org.oldskooler.computedhash.snapshot.ModelSnapshotBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Abstract base class for a model definition: the entities, their columns and their
 * computed hash declarations.
 * <p>
 * Implementations override {@link #onModelCreating(ModelBuilder)} to list entities and
 * apply fluent configuration. Annotations on the entity classes are read as well; where
 * both configure the same computed hash column, the fluent call wins.
 * </p>
 * <p>
 * The built model is cached per instance. Instances are not thread-safe.
 * </p>
 */
public abstract class ModelContext {
    private final SqlDialect dialect;
    private final ComputedHashOptions options;
    private final DescriptorNormalizer normalizer;

    /** Registry for entity-to-table mappings */
    private final MappingRegistry mappingRegistry = new MappingRegistry();

    /** Built table metadata, in registration order */
    private final Map<Class<?>, TableMeta<?>> tables = new LinkedHashMap<>();

    /** Flag indicating whether the model has been built */
    private boolean modelBuilt = false;

    private final DbMigrationOperations migrations;

    /**
     * SQL Server dialect, options from {@code computed-hash.properties} (or defaults).
     */
    public ModelContext() {
        this(new SqlServerDialect(), ComputedHashOptions.load());
    }

    public ModelContext(SqlDialect dialect, ComputedHashOptions options) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.options = Objects.requireNonNull(options, "options");
        this.normalizer = new DescriptorNormalizer(new DescriptorValidator(), options);
        this.migrations = new DbMigrationOperations(this);
    }

    /**
     * Override this method to register entities and configure mappings.
     * Called once, the first time the model is needed.
     *
     * @param model the model builder to configure mappings
     */
    public abstract void onModelCreating(ModelBuilder model);

    /**
     * Builds the model if that has not happened yet. Any invalid computed hash
     * declaration fails here.
     */
    public void ensureModelBuiltInternal() {
        if (!modelBuilt) {
            onModelCreating(new ModelBuilder(mappingRegistry));
            for (Class<?> type : mappingRegistry.types()) {
                tables.put(type, TableMeta.of(type, mappingRegistry, normalizer));
            }
            modelBuilt = true;
        }
    }

    @SuppressWarnings("unchecked")
    public <T> TableMeta<T> tableMeta(Class<T> type) {
        ensureModelBuiltInternal();
        TableMeta<T> m = (TableMeta<T>) tables.get(type);
        if (m == null) {
            throw new IllegalArgumentException("Entity not registered in onModelCreating: " + type.getName());
        }
        return m;
    }

    public List<TableMeta<?>> tables() {
        ensureModelBuiltInternal();
        return new ArrayList<>(tables.values());
    }

    /**
     * Snapshot of the current model, to be stored and diffed against by the next migration.
     */
    public ModelSnapshot snapshot() {
        return new ModelSnapshotBuilder(dialect).build(tables());
    }

    public DbMigrationOperations migrations() {
        return migrations;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public ComputedHashOptions options() {
        return options;
    }
}
