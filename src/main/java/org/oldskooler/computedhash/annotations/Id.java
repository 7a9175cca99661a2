package org.oldskooler.computedhash.annotations;

import java.lang.annotation.*;

@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Id {
    /** Column name override. */
    String name() default "";

    /** Rendered as {@code IDENTITY(1,1)}. At most one auto key per entity. */
    boolean auto() default true;
}
