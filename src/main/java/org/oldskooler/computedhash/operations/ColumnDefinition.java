package org.oldskooler.computedhash.operations;

import lombok.Builder;
import lombok.Value;
import org.oldskooler.computedhash.operations.model.ColumnOperation;

/**
 * The SQL payload of a column operation: storage type and generated-column definition.
 */
@Value
@Builder(toBuilder = true)
public class ColumnDefinition {
    String columnType;
    String computedColumnSql;
    boolean stored;

    public static ColumnDefinition of(ColumnOperation operation) {
        return new ColumnDefinition(operation.getColumnType(), operation.getComputedColumnSql(), operation.isStored());
    }

    public void applyTo(ColumnOperation operation) {
        operation.setColumnType(columnType);
        operation.setComputedColumnSql(computedColumnSql);
        operation.setStored(stored);
    }
}
