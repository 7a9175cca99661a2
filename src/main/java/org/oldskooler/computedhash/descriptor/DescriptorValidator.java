package org.oldskooler.computedhash.descriptor;

import org.oldskooler.computedhash.error.ComputedHashException;
import org.oldskooler.computedhash.error.Violation;
import org.oldskooler.computedhash.mapping.AnnotationKeys;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule set shared by normalization and by re-materialization from annotations.
 * Validation never changes a descriptor; a valid one is returned as-is.
 */
public final class DescriptorValidator {

    public ComputedHashDescriptor validate(ComputedHashDescriptor descriptor) {
        return validate(descriptor, descriptor.getTargetColumn());
    }

    /**
     * @param column qualified column name used in failure messages
     */
    public ComputedHashDescriptor validate(ComputedHashDescriptor descriptor, String column) {
        validateSources(descriptor.getSourceColumns(), column);
        return descriptor;
    }

    public void validateTargetType(Class<?> targetType, String column) {
        if (targetType == null) {
            throw new ComputedHashException(Violation.INVALID_TARGET_TYPE, column, "Found type: <unknown>");
        }
        if (!isByteSequence(targetType)) {
            throw new ComputedHashException(Violation.INVALID_TARGET_TYPE, column,
                    "Found type: " + targetType.getSimpleName());
        }
    }

    /**
     * Sources must be non-empty, trimmed, free of the annotation separator and unique.
     * Uniqueness ignores case, as SQL Server resolves column names case-insensitively.
     */
    public void validateSources(List<String> sources, String column) {
        if (sources == null || sources.isEmpty()) {
            throw new ComputedHashException(Violation.EMPTY_SOURCE_LIST, column, null);
        }
        Set<String> seen = new HashSet<>();
        for (String s : sources) {
            if (s == null || s.trim().isEmpty()) {
                throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, column,
                        "Blank source property name in " + sources);
            }
            if (!s.equals(s.trim())) {
                throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, column,
                        "Source '" + s + "' has leading or trailing whitespace");
            }
            if (s.contains(AnnotationKeys.SOURCE_SEPARATOR)) {
                throw new ComputedHashException(Violation.MALFORMED_ANNOTATION_STATE, column,
                        "Source '" + s + "' contains the separator '" + AnnotationKeys.SOURCE_SEPARATOR + "'");
            }
            if (!seen.add(s.toUpperCase(Locale.ROOT))) {
                throw new ComputedHashException(Violation.DUPLICATE_SOURCE, column, "Repeated: " + s);
            }
        }
    }

    public static boolean isByteSequence(Class<?> type) {
        return type == byte[].class || type == Byte[].class;
    }
}
