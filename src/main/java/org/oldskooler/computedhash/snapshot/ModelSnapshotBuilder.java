package org.oldskooler.computedhash.snapshot;

import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.dialect.SqlDialect;
import org.oldskooler.computedhash.mapping.ColumnMeta;
import org.oldskooler.computedhash.mapping.PrimaryKey;
import org.oldskooler.computedhash.mapping.TableMeta;
import org.oldskooler.computedhash.render.HashSqlRenderer;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;

/**
 * Captures built {@link TableMeta}s as a {@link ModelSnapshot}.
 */
public class ModelSnapshotBuilder {
    private final SqlDialect dialect;
    private final HashSqlRenderer renderer;

    public ModelSnapshotBuilder(SqlDialect dialect) {
        this(dialect, new HashSqlRenderer());
    }

    public ModelSnapshotBuilder(SqlDialect dialect, HashSqlRenderer renderer) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public ModelSnapshot build(Collection<TableMeta<?>> tables) {
        ModelSnapshot snapshot = new ModelSnapshot();
        for (TableMeta<?> m : tables) {
            snapshot.getTables().add(table(m));
        }
        return snapshot;
    }

    public TableSnapshot table(TableMeta<?> m) {
        TableSnapshot t = new TableSnapshot(m.table);
        for (PrimaryKey pk : m.keys.values()) {
            t.getPrimaryKey().add(pk.column());
        }

        for (ColumnMeta c : m.columns.values()) {
            boolean identity = m.keys.values().stream()
                    .anyMatch(k -> k.auto() && c.name.equals(k.column()));

            ColumnSnapshot.ColumnSnapshotBuilder b = ColumnSnapshot.builder()
                    .name(c.name)
                    .columnType(c.hasExplicitType() ? c.type : null)
                    .storeType(dialect.resolveSqlType(c))
                    .nullable(c.nullable)
                    .identity(identity)
                    .annotations(new LinkedHashMap<>(c.annotations));

            Optional<ComputedHashDescriptor> hash = m.computedHash(c.name);
            if (hash.isPresent()) {
                b.computedColumnSql(renderer.renderExpression(hash.get())).stored(true);
            }
            t.getColumns().add(b.build());
        }
        return t;
    }
}
