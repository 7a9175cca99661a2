package org.oldskooler.computedhash.operations;

import org.oldskooler.computedhash.operations.model.AddColumnOperation;
import org.oldskooler.computedhash.operations.model.AlterColumnOperation;
import org.oldskooler.computedhash.operations.model.ColumnOperation;
import org.oldskooler.computedhash.operations.model.ColumnState;
import org.oldskooler.computedhash.operations.model.CreateTableOperation;
import org.oldskooler.computedhash.operations.model.DropColumnOperation;
import org.oldskooler.computedhash.operations.model.DropTableOperation;
import org.oldskooler.computedhash.operations.model.MigrationOperation;
import org.oldskooler.computedhash.snapshot.ColumnSnapshot;
import org.oldskooler.computedhash.snapshot.ModelSnapshot;
import org.oldskooler.computedhash.snapshot.TableSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Coarse column-level differ between two model snapshots.
 * <p>
 * Knows nothing about computed hashes: it copies each side's annotations onto the
 * generic operations it emits and leaves interpretation to
 * {@link ComputedHashOperationRewriter}. Renames are not detected; a renamed column
 * is a drop plus an add.
 * </p>
 */
public class SnapshotDiffer {

    public List<MigrationOperation> diff(ModelSnapshot previous, ModelSnapshot next) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(next, "next");

        List<MigrationOperation> ops = new ArrayList<>();
        for (TableSnapshot newTable : next.getTables()) {
            Optional<TableSnapshot> oldTable = previous.table(newTable.getName());
            if (oldTable.isPresent()) {
                diffColumns(oldTable.get(), newTable, ops);
            } else {
                ops.add(createTable(newTable));
            }
        }
        for (TableSnapshot oldTable : previous.getTables()) {
            if (!next.table(oldTable.getName()).isPresent()) {
                ops.add(new DropTableOperation(oldTable.getName()));
            }
        }
        return ops;
    }

    public CreateTableOperation createTable(TableSnapshot table) {
        CreateTableOperation create = new CreateTableOperation(table.getName());
        for (ColumnSnapshot c : table.getColumns()) {
            AddColumnOperation add = fill(new AddColumnOperation(table.getName(), c.getName()), c);
            add.setIdentity(c.isIdentity());
            create.getColumns().add(add);
        }
        create.getPrimaryKey().addAll(table.getPrimaryKey());
        return create;
    }

    private void diffColumns(TableSnapshot oldTable, TableSnapshot newTable, List<MigrationOperation> ops) {
        String table = newTable.getName();

        for (ColumnSnapshot oldCol : oldTable.getColumns()) {
            if (!newTable.column(oldCol.getName()).isPresent()) {
                DropColumnOperation drop = new DropColumnOperation(table, oldCol.getName());
                drop.getOldAnnotations().putAll(oldCol.getAnnotations());
                ops.add(drop);
            }
        }

        for (ColumnSnapshot newCol : newTable.getColumns()) {
            Optional<ColumnSnapshot> oldCol = oldTable.column(newCol.getName());
            if (!oldCol.isPresent()) {
                ops.add(fill(new AddColumnOperation(table, newCol.getName()), newCol));
            } else if (!sameColumn(oldCol.get(), newCol)) {
                ops.add(fill(new AlterColumnOperation(table, newCol.getName(), state(oldCol.get())), newCol));
            }
        }
    }

    private static <O extends ColumnOperation> O fill(O op, ColumnSnapshot c) {
        op.setColumnType(c.getColumnType());
        op.setStoreType(c.getStoreType());
        op.setNullable(c.isNullable());
        op.setComputedColumnSql(c.getComputedColumnSql());
        op.setStored(c.isStored());
        op.getAnnotations().putAll(c.getAnnotations());
        return op;
    }

    private static ColumnState state(ColumnSnapshot c) {
        return ColumnState.builder()
                .columnType(c.getColumnType())
                .storeType(c.getStoreType())
                .nullable(c.isNullable())
                .computedColumnSql(c.getComputedColumnSql())
                .stored(c.isStored())
                .annotations(new LinkedHashMap<>(c.getAnnotations()))
                .build();
    }

    static boolean sameColumn(ColumnSnapshot a, ColumnSnapshot b) {
        return Objects.equals(a.getColumnType(), b.getColumnType())
                && Objects.equals(a.getStoreType(), b.getStoreType())
                && a.isNullable() == b.isNullable()
                && Objects.equals(a.getComputedColumnSql(), b.getComputedColumnSql())
                && a.isStored() == b.isStored()
                && Objects.equals(a.getAnnotations(), b.getAnnotations());
    }
}
