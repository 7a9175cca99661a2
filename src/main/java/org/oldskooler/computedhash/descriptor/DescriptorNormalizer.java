package org.oldskooler.computedhash.descriptor;

import org.oldskooler.computedhash.algorithm.HashAlgorithm;
import org.oldskooler.computedhash.config.ComputedHashOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single entry point turning a {@link HashDeclaration} into a validated
 * {@link ComputedHashDescriptor}.
 * <p>
 * Checks run in a fixed order: target type, algorithm, then sources. Source names are
 * trimmed; their order is kept verbatim.
 * </p>
 */
public final class DescriptorNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DescriptorNormalizer.class);

    private final DescriptorValidator validator;
    private final ComputedHashOptions options;

    public DescriptorNormalizer() {
        this(new DescriptorValidator(), new ComputedHashOptions());
    }

    public DescriptorNormalizer(DescriptorValidator validator, ComputedHashOptions options) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.options = Objects.requireNonNull(options, "options");
    }

    public ComputedHashDescriptor normalize(HashDeclaration declaration) {
        Objects.requireNonNull(declaration, "declaration");
        String column = declaration.qualifiedName();

        validator.validateTargetType(declaration.getTargetType(), column);
        HashAlgorithm algorithm = HashAlgorithm.fromName(declaration.getAlgorithmToken(), column);

        List<String> sources = trimmed(declaration.getSourceNames());
        validator.validateSources(sources, column);

        if (!algorithm.isSecure() && options.isWarnOnInsecureAlgorithms()) {
            log.warn("{} uses {} which is not cryptographically secure; prefer {} or {}",
                    column, algorithm, HashAlgorithm.SHA2_256, HashAlgorithm.SHA2_512);
        }

        ComputedHashDescriptor descriptor =
                new ComputedHashDescriptor(declaration.getTargetColumn(), algorithm, sources);
        return validator.validate(descriptor, column);
    }

    private static List<String> trimmed(List<String> names) {
        if (names == null) return null;
        List<String> out = new ArrayList<>(names.size());
        for (String n : names) {
            out.add(n == null ? null : n.trim());
        }
        return out;
    }

    /**
     * Rebuilds a descriptor from already-decoded parts and runs the validator over it.
     * Used when reading annotation state back, where no Java type is available.
     */
    public ComputedHashDescriptor rematerialize(String column, HashAlgorithm algorithm, List<String> sources,
                                                String qualifiedName) {
        validator.validateSources(sources, qualifiedName);
        return validator.validate(new ComputedHashDescriptor(column, algorithm, sources), qualifiedName);
    }
}
