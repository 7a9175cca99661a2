package org.oldskooler.computedhash.dialect;

import org.oldskooler.computedhash.mapping.ColumnMeta;
import org.oldskooler.computedhash.operations.model.MigrationOperation;

import java.util.List;
import java.util.Locale;

public interface SqlDialect {
    /** Quote an identifier (table/column). */
    String q(String ident);

    /** Return the SQL fragment for auto-increment / identity on a PK column, or empty if none. */
    String autoIncrementClause();

    /** Map a column (Java type, explicit type, computed hash annotations) to a dialect-specific SQL type. */
    String resolveSqlType(ColumnMeta column);

    /**
     * Render one migration operation. Some operations need more than one statement,
     * e.g. replacing a computed column.
     */
    List<String> migrationSql(MigrationOperation operation);

    /** Utility: normalize user-provided explicit type to dialect expectations. */
    static String userTypeOrNull(String userType) {
        if (userType == null) return null;
        String t = userType.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }
}
