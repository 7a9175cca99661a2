package org.oldskooler.computedhash.annotations;

import java.lang.annotation.*;

/**
 * Marks a model class. Classes still have to be registered in
 * {@code ModelContext#onModelCreating} to become part of the model.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Entity {
    /** Table name; snake_case of the class name when blank. */
    String table() default "";
}
