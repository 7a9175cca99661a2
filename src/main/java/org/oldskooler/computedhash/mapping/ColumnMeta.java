package org.oldskooler.computedhash.mapping;

import org.oldskooler.computedhash.util.Names;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Column metadata for DDL and migration rendering (annotation-free). */
public final class ColumnMeta {
    public final String table;      // owning table, for messages
    public final String property;   // entity field name
    public final String name;       // db column name (unquoted)
    public final Class<?> javaType; // declared field type
    public final boolean nullable;  // default true
    public final String type;       // explicit SQL type override; "" when unspecified
    public final int length;        // for NVARCHAR; -1 means "unspecified"

    /**
     * Model annotations for this column. Computed hash intent lives here as the
     * {@link AnnotationKeys} triplet; see {@link ComputedHashAnnotations}.
     */
    public final Map<String, Object> annotations;

    public ColumnMeta(String table, String property, String name, Class<?> javaType, boolean nullable, String type, int length,
                      Map<String, Object> annotations) {
        this.table = table;
        this.property = Objects.requireNonNull(property, "property");
        this.name = Objects.requireNonNull(name, "name");
        this.javaType = Objects.requireNonNull(javaType, "javaType");
        this.nullable = nullable;
        this.type = type == null ? "" : type.trim();
        this.length = length;
        this.annotations = annotations == null ? new LinkedHashMap<>() : new LinkedHashMap<>(annotations);
    }

    /** {@code table.column}. */
    public String qualifiedName() {
        return Names.qualify(table, name);
    }

    public boolean hasExplicitType() {
        return !type.isEmpty();
    }

    public boolean isComputedHash() {
        return ComputedHashAnnotations.isComputedHash(annotations);
    }
}
