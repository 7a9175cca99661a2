package org.oldskooler.computedhash.operations.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

@Getter
@ToString(callSuper = true)
public class AlterColumnOperation extends ColumnOperation {
    private final ColumnState oldColumn;

    public AlterColumnOperation(String table, String name, ColumnState oldColumn) {
        super(table, name);
        this.oldColumn = Objects.requireNonNull(oldColumn, "oldColumn");
    }

    /**
     * True when type and nullability match the old column, i.e. the alter only exists
     * because of annotation differences.
     */
    public boolean isShapeUnchanged() {
        return Objects.equals(effectiveType(), oldColumn.effectiveType())
                && isNullable() == oldColumn.isNullable();
    }
}
