package org.oldskooler.computedhash.mapping;

/**
 * Keys of the three annotation entries that carry computed hash intent from the model
 * to migration operations.
 */
public final class AnnotationKeys {
    private AnnotationKeys() {}

    public static final String PREFIX = "Entity4j.ComputedHash:";

    /** Boolean flag. */
    public static final String IS_COMPUTED_HASH = PREFIX + "IsComputedHash";

    /** Canonical algorithm name, e.g. {@code SHA2_256}. */
    public static final String ALGORITHM = PREFIX + "ComputedHashAlgorithm";

    /** Source column names joined with {@link #SOURCE_SEPARATOR}, in order. */
    public static final String SOURCE_PROPERTIES = PREFIX + "ComputedHashSourceProperties";

    public static final String SOURCE_SEPARATOR = ",";
}
