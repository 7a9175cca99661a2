package org.oldskooler.computedhash.annotations;

import org.oldskooler.computedhash.algorithm.HashAlgorithm;

import java.lang.annotation.*;

/**
 * Marks a {@code byte[]} field as a hash computed and persisted by the database from
 * sibling properties.
 *
 * <pre>
 * &#64;ComputedHash(method = HashAlgorithm.SHA2_512, sources = {"title", "content"})
 * private byte[] contentHash;
 *
 * &#64;ComputedHash(algorithm = "sha2_256", sources = {"content", "lastModified"})
 * private byte[] versionHash;
 * </pre>
 *
 * {@link #algorithm()} wins over {@link #method()} when it is not blank.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ComputedHash {

    /** Algorithm as free text, matched case-insensitively. */
    String algorithm() default "";

    HashAlgorithm method() default HashAlgorithm.SHA2_256;

    /** Source properties (or column names), in hashing order. */
    String[] sources();
}
