package org.oldskooler.computedhash.operations.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.oldskooler.computedhash.util.Names;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Add or alter of a single column. The SQL payload ({@code columnType},
 * {@code computedColumnSql}, {@code stored}) is what the computed hash rewriter replaces.
 */
@Getter
@Setter
@ToString(callSuper = true)
public abstract class ColumnOperation extends MigrationOperation {
    private final String name;

    /** Type the user set explicitly; {@code null} when unspecified. */
    private String columnType;

    /** Type the dialect derived from the Java type; used when {@code columnType} is null. */
    private String storeType;

    private boolean nullable = true;
    private String computedColumnSql;
    private boolean stored;

    /** New-side model annotations, including the computed hash triplet when present. */
    private final Map<String, Object> annotations = new LinkedHashMap<>();

    protected ColumnOperation(String table, String name) {
        super(table);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String qualifiedName() {
        return Names.qualify(getTable(), name);
    }

    /** {@code columnType} if set, else {@code storeType}. */
    public String effectiveType() {
        return columnType != null ? columnType : storeType;
    }

    public boolean isComputed() {
        return computedColumnSql != null;
    }
}
