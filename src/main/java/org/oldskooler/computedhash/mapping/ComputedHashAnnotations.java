package org.oldskooler.computedhash.mapping;

import org.oldskooler.computedhash.algorithm.HashAlgorithm;
import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.descriptor.DescriptorNormalizer;
import org.oldskooler.computedhash.error.ComputedHashException;
import org.oldskooler.computedhash.error.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Encodes a descriptor into the annotation triplet and decodes it back.
 * <p>
 * Decoding re-validates, because annotation maps may have been edited by hand or
 * round-tripped through a snapshot file. Anything inconsistent fails fast.
 * </p>
 */
public final class ComputedHashAnnotations {
    private static final DescriptorNormalizer NORMALIZER = new DescriptorNormalizer();

    private ComputedHashAnnotations() {}

    public static void encode(ComputedHashDescriptor descriptor, Map<String, Object> annotations) {
        Objects.requireNonNull(descriptor, "descriptor");
        annotations.put(AnnotationKeys.IS_COMPUTED_HASH, Boolean.TRUE);
        annotations.put(AnnotationKeys.ALGORITHM, descriptor.getAlgorithm().name());
        annotations.put(AnnotationKeys.SOURCE_PROPERTIES,
                String.join(AnnotationKeys.SOURCE_SEPARATOR, descriptor.getSourceColumns()));
    }

    public static void clear(Map<String, Object> annotations) {
        annotations.remove(AnnotationKeys.IS_COMPUTED_HASH);
        annotations.remove(AnnotationKeys.ALGORITHM);
        annotations.remove(AnnotationKeys.SOURCE_PROPERTIES);
    }

    /**
     * True when the flag entry is present and set. Does not validate the other entries.
     */
    public static boolean isComputedHash(Map<String, Object> annotations) {
        if (annotations == null) return false;
        Object flag = annotations.get(AnnotationKeys.IS_COMPUTED_HASH);
        return Boolean.TRUE.equals(flag) || "true".equalsIgnoreCase(String.valueOf(flag).trim());
    }

    /**
     * @param column        target column name stored in the descriptor
     * @param qualifiedName {@code table.column}, for failure messages
     * @return the descriptor, or empty when the column is not a computed hash
     */
    public static Optional<ComputedHashDescriptor> decode(Map<String, Object> annotations, String column,
                                                          String qualifiedName) {
        if (annotations == null) return Optional.empty();

        Object flag = annotations.get(AnnotationKeys.IS_COMPUTED_HASH);
        Object algorithm = annotations.get(AnnotationKeys.ALGORITHM);
        Object sources = annotations.get(AnnotationKeys.SOURCE_PROPERTIES);

        if (!parseFlag(flag, qualifiedName)) {
            if (algorithm != null || sources != null) {
                throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, qualifiedName,
                        "Algorithm or source entries present without the computed hash flag");
            }
            return Optional.empty();
        }

        if (!(algorithm instanceof String) || ((String) algorithm).trim().isEmpty()) {
            throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, qualifiedName,
                    "Missing algorithm entry " + AnnotationKeys.ALGORITHM);
        }
        if (sources != null && !(sources instanceof String)) {
            throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, qualifiedName,
                    "Source entry must be a delimited string, got " + sources.getClass().getSimpleName());
        }
        if (sources == null) {
            throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, qualifiedName,
                    "Missing source entry " + AnnotationKeys.SOURCE_PROPERTIES);
        }

        HashAlgorithm algo = HashAlgorithm.fromName((String) algorithm, qualifiedName);
        return Optional.of(NORMALIZER.rematerialize(column, algo, splitSources((String) sources), qualifiedName));
    }

    static List<String> splitSources(String raw) {
        List<String> out = new ArrayList<>();
        if (raw.trim().isEmpty()) return out;
        for (String part : raw.split(AnnotationKeys.SOURCE_SEPARATOR, -1)) {
            out.add(part.trim());
        }
        return out;
    }

    private static boolean parseFlag(Object flag, String qualifiedName) {
        if (flag == null) return false;
        if (flag instanceof Boolean) return (Boolean) flag;
        if (flag instanceof String) {
            String s = ((String) flag).trim();
            if (s.equalsIgnoreCase("true")) return true;
            if (s.equalsIgnoreCase("false")) return false;
        }
        throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, qualifiedName,
                "Flag " + AnnotationKeys.IS_COMPUTED_HASH + " must be a boolean, got '" + flag + "'");
    }
}
