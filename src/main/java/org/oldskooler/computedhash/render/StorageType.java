package org.oldskooler.computedhash.render;

import lombok.Value;

/**
 * Fixed-width binary storage type, rendered as {@code BINARY(n)}.
 */
@Value
public class StorageType {
    public static final String BASE = "BINARY";

    int width;

    public String toSql() {
        return BASE + "(" + width + ")";
    }

    @Override
    public String toString() {
        return toSql();
    }
}
