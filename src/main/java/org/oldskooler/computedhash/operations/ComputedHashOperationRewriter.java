package org.oldskooler.computedhash.operations;

import org.oldskooler.computedhash.config.ComputedHashOptions;
import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.mapping.ComputedHashAnnotations;
import org.oldskooler.computedhash.operations.model.AddColumnOperation;
import org.oldskooler.computedhash.operations.model.AlterColumnOperation;
import org.oldskooler.computedhash.operations.model.ColumnOperation;
import org.oldskooler.computedhash.operations.model.CreateTableOperation;
import org.oldskooler.computedhash.operations.model.DropColumnOperation;
import org.oldskooler.computedhash.operations.model.MigrationOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites generic column operations so they carry the computed hash SQL and storage
 * type derived from the annotation triplet on their old and new sides.
 * <p>
 * Operations are processed in order and each column is resolved from scratch; nothing
 * is remembered between calls.
 * </p>
 */
public class ComputedHashOperationRewriter {
    private static final Logger log = LoggerFactory.getLogger(ComputedHashOperationRewriter.class);

    private final TransitionResolver resolver;
    private final ComputedHashOptions options;

    public ComputedHashOperationRewriter() {
        this(new TransitionResolver(), new ComputedHashOptions());
    }

    public ComputedHashOperationRewriter(TransitionResolver resolver, ComputedHashOptions options) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @return the operations to hand to the dialect; suppressed no-op alters are left out
     */
    public List<MigrationOperation> rewrite(List<? extends MigrationOperation> operations) {
        List<MigrationOperation> out = new ArrayList<>(operations.size());
        for (MigrationOperation operation : operations) {
            if (operation instanceof CreateTableOperation) {
                for (AddColumnOperation column : ((CreateTableOperation) operation).getColumns()) {
                    rewriteColumn(column);
                }
                out.add(operation);
            } else if (operation instanceof ColumnOperation) {
                if (rewriteColumn((ColumnOperation) operation)) {
                    out.add(operation);
                }
            } else if (operation instanceof DropColumnOperation) {
                DropColumnOperation drop = (DropColumnOperation) operation;
                // decoded only so hand-edited state still fails loudly
                decode(drop.getOldAnnotations(), drop.getName(), drop.qualifiedName());
                out.add(operation);
            } else {
                out.add(operation);
            }
        }
        return out;
    }

    /**
     * Resolves and applies one column operation.
     *
     * @return false when the operation should be dropped from the migration
     */
    public boolean rewriteColumn(ColumnOperation operation) {
        String column = operation.qualifiedName();
        Optional<ComputedHashDescriptor> next = decode(operation.getAnnotations(), operation.getName(), column);

        ChangeKind kind;
        Optional<ComputedHashDescriptor> previous;
        if (operation instanceof AlterColumnOperation) {
            kind = ChangeKind.ALTER;
            previous = decode(((AlterColumnOperation) operation).getOldColumn().getAnnotations(),
                    operation.getName(), column);
        } else {
            kind = ChangeKind.ADD;
            previous = Optional.empty();
        }

        ColumnDefinition current = ColumnDefinition.of(operation);
        Resolution resolution = resolver.resolve(column, kind, previous, next, current);

        if (resolution.getTransition() == Transition.NO_OP
                && options.isSuppressNoOpAlters()
                && ((AlterColumnOperation) operation).isShapeUnchanged()) {
            log.debug("{}: computed hash unchanged, alter suppressed", column);
            return false;
        }

        if (resolution.getTransition() != Transition.NOT_TRACKED) {
            log.debug("{}: {} -> type={}, sql={}", column, resolution.getTransition(),
                    resolution.getDefinition().getColumnType(), resolution.getDefinition().getComputedColumnSql());
        }
        resolution.getDefinition().applyTo(operation);
        return true;
    }

    private static Optional<ComputedHashDescriptor> decode(Map<String, Object> annotations, String name,
                                                           String column) {
        return ComputedHashAnnotations.decode(annotations, name, column);
    }
}
