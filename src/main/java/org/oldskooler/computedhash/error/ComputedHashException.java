package org.oldskooler.computedhash.error;

import java.util.Objects;

/**
 * Raised when a computed hash declaration, its annotation state or a migration
 * operation carrying it cannot be turned into valid schema SQL.
 * <p>
 * Always names the offending column ({@code table.column}) and the rule that was
 * broken. These failures are model-definition defects and are never retried.
 * </p>
 */
public class ComputedHashException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Violation violation;
    private final String column;

    public ComputedHashException(Violation violation, String column, String detail) {
        super(format(violation, column, detail));
        this.violation = Objects.requireNonNull(violation, "violation");
        this.column = column;
    }

    /**
     * @return the rule that was broken
     */
    public Violation getViolation() {
        return violation;
    }

    /**
     * @return fully qualified column name, or {@code null} when the failure happened
     *         before a column was known (e.g. a bare algorithm lookup)
     */
    public String getColumn() {
        return column;
    }

    private static String format(Violation violation, String column, String detail) {
        StringBuilder b = new StringBuilder();
        if (column != null && !column.isEmpty()) {
            b.append(column).append(": ");
        }
        b.append(violation.rule());
        if (detail != null && !detail.isEmpty()) {
            b.append(". ").append(detail);
        }
        return b.toString();
    }
}
