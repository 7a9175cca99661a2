package org.oldskooler.computedhash.dialect.types;

import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.dialect.SqlDialect;
import org.oldskooler.computedhash.mapping.ColumnMeta;
import org.oldskooler.computedhash.mapping.ComputedHashAnnotations;
import org.oldskooler.computedhash.operations.model.AddColumnOperation;
import org.oldskooler.computedhash.operations.model.AlterColumnOperation;
import org.oldskooler.computedhash.operations.model.ColumnOperation;
import org.oldskooler.computedhash.operations.model.CreateTableOperation;
import org.oldskooler.computedhash.operations.model.DropColumnOperation;
import org.oldskooler.computedhash.operations.model.DropTableOperation;
import org.oldskooler.computedhash.operations.model.MigrationOperation;
import org.oldskooler.computedhash.render.HashSqlRenderer;

import java.util.*;
import java.util.stream.Collectors;

public class SqlServerDialect implements SqlDialect {

    public static String quote(String ident) { return "[" + ident.replace("]", "]]") + "]"; }

    @Override
    public String q(String ident) { return quote(ident); }

    @Override
    public String autoIncrementClause() { return " IDENTITY(1,1)"; }

    /* =========================
       DDL
       ========================= */

    public String createTableSql(CreateTableOperation op) {
        List<String> defs = new ArrayList<>();
        for (AddColumnOperation c : op.getColumns()) {
            defs.add(columnDefinition(c, false));
        }
        if (!op.getPrimaryKey().isEmpty()) {
            defs.add("PRIMARY KEY (" + op.getPrimaryKey().stream().map(this::q).collect(Collectors.joining(", ")) + ")");
        }
        return "CREATE TABLE " + q(op.getTable()) + " (\n  " + String.join(",\n  ", defs) + "\n)";
    }

    public String dropTableSql(String table, boolean ifExists) {
        // SQL Server supports DROP TABLE IF EXISTS from 2016+
        return "DROP TABLE" + (ifExists ? " IF EXISTS" : "") + " " + q(table);
    }

    @Override
    public List<String> migrationSql(MigrationOperation operation) {
        String table = q(operation.getTable());

        if (operation instanceof CreateTableOperation) {
            return List.of(createTableSql((CreateTableOperation) operation));
        }
        if (operation instanceof DropTableOperation) {
            return List.of(dropTableSql(operation.getTable(), false));
        }
        if (operation instanceof DropColumnOperation) {
            return List.of(dropColumn(table, ((DropColumnOperation) operation).getName()));
        }
        if (operation instanceof AlterColumnOperation) {
            AlterColumnOperation alter = (AlterColumnOperation) operation;
            // SQL Server cannot ALTER COLUMN into or out of a computed definition
            if (alter.isComputed() || alter.getOldColumn().getComputedColumnSql() != null) {
                return List.of(
                        dropColumn(table, alter.getName()),
                        "ALTER TABLE " + table + " ADD " + columnDefinition(alter, true));
            }
            return List.of("ALTER TABLE " + table + " ALTER COLUMN " + q(alter.getName()) + " "
                    + requireType(alter) + (alter.isNullable() ? " NULL" : " NOT NULL"));
        }
        if (operation instanceof AddColumnOperation) {
            return List.of("ALTER TABLE " + table + " ADD " + columnDefinition((AddColumnOperation) operation, true));
        }
        throw new IllegalArgumentException("Unsupported migration operation: " + operation.getClass().getName());
    }

    private String dropColumn(String quotedTable, String column) {
        return "ALTER TABLE " + quotedTable + " DROP COLUMN " + q(column);
    }

    private String columnDefinition(ColumnOperation c, boolean explicitNull) {
        StringBuilder d = new StringBuilder(q(c.getName()));
        if (c.isComputed()) {
            d.append(" AS ").append(c.getComputedColumnSql());
            if (c.isStored() && !c.getComputedColumnSql().trim().endsWith(HashSqlRenderer.PERSISTED)) {
                d.append(' ').append(HashSqlRenderer.PERSISTED);
            }
            // only persisted computed columns accept a nullability constraint
            if (c.isStored() && !c.isNullable()) d.append(" NOT NULL");
            return d.toString();
        }

        d.append(' ').append(requireType(c));
        if (c instanceof AddColumnOperation && ((AddColumnOperation) c).isIdentity()) {
            d.append(autoIncrementClause()); // IDENTITY(1,1)
        }
        if (!c.isNullable()) {
            d.append(" NOT NULL");
        } else if (explicitNull) {
            d.append(" NULL");
        }
        return d.toString();
    }

    private static String requireType(ColumnOperation c) {
        String t = c.effectiveType();
        if (t == null || t.trim().isEmpty()) {
            throw new IllegalStateException("No SQL type for column " + c.qualifiedName());
        }
        return t;
    }

    /* =========================
       Type resolution
       ========================= */

    @Override
    public String resolveSqlType(ColumnMeta c) {
        String user = SqlDialect.userTypeOrNull(c.type);
        int length = c.length;

        if (user != null) {
            // Respect user choice, normalize common shapes
            if (user.contains("CHAR") && !user.contains("(") && length > 0) {
                // Prefer NVARCHAR for Java strings unless explicitly VARCHAR given
                if (user.startsWith("N")) return "NVARCHAR(" + length + ")";
                return "VARCHAR(" + length + ")";
            }
            return user; // assume valid T-SQL type
        }

        Optional<ComputedHashDescriptor> hash =
                ComputedHashAnnotations.decode(c.annotations, c.name, c.qualifiedName());
        if (hash.isPresent()) {
            return hash.get().getAlgorithm().recommendedSqlType();
        }

        Class<?> t = c.javaType;
        if (length > 0 && t == String.class) return "NVARCHAR(" + length + ")";
        if (t == Long.class || t == long.class) return "BIGINT";
        if (t == Integer.class || t == int.class) return "INT";
        if (t == Short.class || t == short.class) return "SMALLINT";
        if (t == Byte.class || t == byte.class) return "TINYINT";
        if (t == Double.class || t == double.class) return "FLOAT(53)"; // double precision
        if (t == Float.class || t == float.class) return "REAL";
        if (t == Boolean.class || t == boolean.class) return "BIT";
        if (t == byte[].class || t == Byte[].class) return "VARBINARY(MAX)";
        if (t == java.math.BigDecimal.class) return "DECIMAL(38,10)";
        if (t == java.util.UUID.class) return "UNIQUEIDENTIFIER";
        if (t == java.time.LocalDate.class || t == java.sql.Date.class) return "DATE";
        if (t == java.time.LocalDateTime.class || t == java.sql.Timestamp.class) return "DATETIME2(6)";
        if (t == java.time.Instant.class) return "DATETIME2(6)"; // store UTC in app layer
        return "NVARCHAR(255)";
    }
}
