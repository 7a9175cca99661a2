package org.oldskooler.computedhash.annotations;

import java.lang.annotation.*;

@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    /** Override column name. */
    String name() default "";

    /** Nullability hint for DDL. */
    boolean nullable() default true;

    /**
     * Explicit SQL type override (e.g. "NVARCHAR", "BINARY(32)").
     * On a computed hash column this must be the algorithm's BINARY(n) or left empty.
     */
    String type() default "";

    /** For variable length types like NVARCHAR. Ignored if type() is non-empty and not length-based. */
    int length() default 255;
}
