package org.oldskooler.computedhash.mapping;

import java.util.Objects;

public class PrimaryKey {
    public final String property;
    public final String column;                  // null until resolved against the column map
    public final boolean auto;

    public PrimaryKey(String property, String column, boolean auto) {
        this.property = Objects.requireNonNull(property, "property");
        this.column = column;
        this.auto = auto;
    }

    public PrimaryKey withColumn(String resolved) {
        return new PrimaryKey(property, resolved, auto);
    }

    public String property() {
        return property;
    }

    public String column() {
        return column;
    }

    public boolean auto() {
        return auto;
    }
}
