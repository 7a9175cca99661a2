package org.oldskooler.computedhash.util;

/**
 * Naming conventions for tables and columns that are not named explicitly.
 */
public final class Names {
    private Names() {}

    public static String defaultTableName(Class<?> type) {
        return toSnake(type.getSimpleName());
    }

    public static String defaultColumnName(String fieldName) {
        return toSnake(fieldName);
    }

    /** {@code table.column}; error messages always name columns this way. */
    public static String qualify(String table, String column) {
        if (table == null || table.isEmpty()) return column;
        return table + "." + column;
    }

    /**
     * camelCase to snake_case. Runs of capitals stay together, so {@code sha256URLHash}
     * becomes {@code sha256_url_hash}.
     */
    public static String toSnake(String camel) {
        StringBuilder b = new StringBuilder(camel.length() + 4);
        for (int i = 0; i < camel.length(); i++) {
            char c = camel.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && !Character.isUpperCase(camel.charAt(i - 1)) && camel.charAt(i - 1) != '_';
                boolean nextLower = i + 1 < camel.length() && Character.isLowerCase(camel.charAt(i + 1));
                boolean prevUpper = i > 0 && Character.isUpperCase(camel.charAt(i - 1));
                if (prevLower || (prevUpper && nextLower)) b.append('_');
                b.append(Character.toLowerCase(c));
            } else {
                b.append(c);
            }
        }
        return b.toString();
    }
}
