package org.oldskooler.computedhash.descriptor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.oldskooler.computedhash.algorithm.HashAlgorithm;

import java.util.List;
import java.util.Objects;

/**
 * Canonical description of a database-computed hash column: which column holds the
 * hash, which algorithm produces it and which columns feed it, in order.
 * <p>
 * Instances are only created by {@link DescriptorNormalizer} or re-materialized from
 * annotation state and re-validated, so the source list is always non-empty and free
 * of duplicates. Width and security are looked up from the algorithm on each call.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ComputedHashDescriptor {
    private final String targetColumn;
    private final HashAlgorithm algorithm;
    private final List<String> sourceColumns;

    ComputedHashDescriptor(String targetColumn, HashAlgorithm algorithm, List<String> sourceColumns) {
        this.targetColumn = Objects.requireNonNull(targetColumn, "targetColumn");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.sourceColumns = List.copyOf(Objects.requireNonNull(sourceColumns, "sourceColumns"));
    }

    /** Digest size in bytes for the current algorithm. */
    public int storageWidth() {
        return algorithm.width();
    }

    public boolean isSecure() {
        return algorithm.isSecure();
    }

    /** Copy with a different algorithm; sources and target are kept. */
    public ComputedHashDescriptor withAlgorithm(HashAlgorithm other) {
        return new ComputedHashDescriptor(targetColumn, other, sourceColumns);
    }
}
