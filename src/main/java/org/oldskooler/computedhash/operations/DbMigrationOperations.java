package org.oldskooler.computedhash.operations;

import org.oldskooler.computedhash.ModelContext;
import org.oldskooler.computedhash.mapping.TableMeta;
import org.oldskooler.computedhash.operations.model.CreateTableOperation;
import org.oldskooler.computedhash.operations.model.DropTableOperation;
import org.oldskooler.computedhash.operations.model.MigrationOperation;
import org.oldskooler.computedhash.snapshot.ModelSnapshot;
import org.oldskooler.computedhash.snapshot.ModelSnapshotBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles DDL generation for a model: CREATE/DROP TABLE and migrations between snapshots.
 * Produces SQL text only; executing it is up to the caller.
 */
public class DbMigrationOperations {
    private static final Logger log = LoggerFactory.getLogger(DbMigrationOperations.class);

    private final ModelContext context;
    private final SnapshotDiffer differ = new SnapshotDiffer();

    public DbMigrationOperations(ModelContext context) {
        this.context = context;
    }

    public <T> String createTableSql(Class<T> type) {
        TableMeta<T> m = context.tableMeta(type);
        CreateTableOperation create = differ.createTable(new ModelSnapshotBuilder(context.dialect()).table(m));
        List<String> sql = generateSql(rewriter().rewrite(List.of(create)));
        return String.join(";\n", sql);
    }

    public <T> String dropTableSql(Class<T> type) {
        TableMeta<T> m = context.tableMeta(type);
        return String.join(";\n", context.dialect().migrationSql(new DropTableOperation(m.table)));
    }

    /**
     * Operations that bring a database at {@code previous} to the current model, with
     * computed hash columns already rewritten.
     */
    public List<MigrationOperation> operations(ModelSnapshot previous) {
        List<MigrationOperation> generic = differ.diff(previous, context.snapshot());
        List<MigrationOperation> rewritten = rewriter().rewrite(generic);
        log.debug("{} operation(s) after computed hash rewriting ({} from differ)", rewritten.size(), generic.size());
        return rewritten;
    }

    public List<String> generateSql(List<MigrationOperation> operations) {
        List<String> out = new ArrayList<>();
        for (MigrationOperation op : operations) {
            out.addAll(context.dialect().migrationSql(op));
        }
        return out;
    }

    public List<String> migrationSql(ModelSnapshot previous) {
        return generateSql(operations(previous));
    }

    private ComputedHashOperationRewriter rewriter() {
        return new ComputedHashOperationRewriter(new TransitionResolver(), context.options());
    }
}
