package org.oldskooler.computedhash.descriptor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Raw computed hash intent, exactly as a front end collected it.
 * <p>
 * The attribute scanner and the fluent builder both produce one of these and hand it
 * to {@link DescriptorNormalizer#normalize(HashDeclaration)}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class HashDeclaration {

    /**
     * Table (or entity) owning the column; used to qualify error messages.
     */
    String owner;

    /**
     * Column that receives the hash.
     */
    String targetColumn;

    /**
     * Declared Java type of the target property.
     */
    Class<?> targetType;

    /**
     * Algorithm as typed by the user, e.g. {@code "sha2_256"} or an enum name.
     */
    String algorithmToken;

    /**
     * Source column names in declaration order.
     */
    @Singular
    List<String> sourceNames;

    /** {@code owner.targetColumn}, or just the column when no owner is known. */
    public String qualifiedName() {
        if (owner == null || owner.isEmpty()) return targetColumn;
        return owner + "." + targetColumn;
    }
}
