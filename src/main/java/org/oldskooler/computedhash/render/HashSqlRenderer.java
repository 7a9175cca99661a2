package org.oldskooler.computedhash.render;

import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.dialect.types.SqlServerDialect;
import org.oldskooler.computedhash.error.ComputedHashException;
import org.oldskooler.computedhash.error.Violation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a descriptor into T-SQL: the {@code BINARY(n)} storage type and the persisted
 * {@code HASHBYTES} expression defining the column.
 * <p>
 * Output depends only on the descriptor, so rendering the same model twice produces
 * byte-identical SQL and no spurious migration.
 * </p>
 * <p>
 * Sources are joined with {@value #DELIMITER}. A source value that itself contains the
 * delimiter can make two different tuples concatenate to the same text; this is a known
 * limitation and values are not escaped.
 * </p>
 */
public final class HashSqlRenderer {

    public static final String DELIMITER = "|";
    public static final String PERSISTED = "PERSISTED";

    private static final Pattern BINARY_TYPE =
            Pattern.compile("^\\s*BINARY\\s*\\(\\s*(\\d{1,5})\\s*\\)\\s*$", Pattern.CASE_INSENSITIVE);

    public StorageType renderStorageType(ComputedHashDescriptor descriptor) {
        return new StorageType(descriptor.storageWidth());
    }

    /**
     * The bare hash expression, e.g.
     * {@code HASHBYTES('SHA2_256', ISNULL(CONVERT(NVARCHAR(MAX), [Title]), N'') + '|' + ...)}.
     */
    public String renderHashExpression(ComputedHashDescriptor descriptor) {
        StringBuilder concat = new StringBuilder();
        for (String source : descriptor.getSourceColumns()) {
            if (concat.length() > 0) {
                concat.append(" + '").append(DELIMITER).append("' + ");
            }
            concat.append("ISNULL(CONVERT(NVARCHAR(MAX), ")
                    .append(SqlServerDialect.quote(source))
                    .append("), N'')");
        }
        return "HASHBYTES('" + descriptor.getAlgorithm().sqlName() + "', " + concat + ")";
    }

    /**
     * The generated-column definition handed to the database: the hash expression marked
     * {@code PERSISTED} so the value is stored on write.
     */
    public String renderExpression(ComputedHashDescriptor descriptor) {
        return renderHashExpression(descriptor) + " " + PERSISTED;
    }

    /**
     * Rejects a storage type the user set explicitly when it is not {@code BINARY(width)}.
     * A {@code null} or blank type means "not specified" and passes.
     *
     * @param column qualified column name for the failure message
     */
    public void checkStorageType(String userType, ComputedHashDescriptor descriptor, String column) {
        if (userType == null || userType.trim().isEmpty()) return;

        StorageType expected = renderStorageType(descriptor);
        Matcher m = BINARY_TYPE.matcher(userType);
        if (m.matches() && Integer.parseInt(m.group(1)) == expected.getWidth()) return;

        throw new ComputedHashException(Violation.INCOMPATIBLE_STORAGE_TYPE, column,
                "Found: " + userType.trim().toUpperCase(Locale.ROOT) + ". For algorithm '"
                        + descriptor.getAlgorithm().sqlName() + "', use " + expected.toSql());
    }
}
