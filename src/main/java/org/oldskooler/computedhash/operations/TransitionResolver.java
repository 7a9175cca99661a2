package org.oldskooler.computedhash.operations;

import org.oldskooler.computedhash.descriptor.ComputedHashDescriptor;
import org.oldskooler.computedhash.descriptor.DescriptorValidator;
import org.oldskooler.computedhash.render.HashSqlRenderer;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides, from the previous and next descriptor of a column, which {@link Transition}
 * applies and derives the complete payload the operation must carry.
 * <p>
 * Pure: holds no state between calls and never touches the operation itself.
 * Both descriptors are re-validated first; a malformed one aborts with the column name.
 * </p>
 */
public final class TransitionResolver {
    private final HashSqlRenderer renderer;
    private final DescriptorValidator validator;

    public TransitionResolver() {
        this(new HashSqlRenderer(), new DescriptorValidator());
    }

    public TransitionResolver(HashSqlRenderer renderer, DescriptorValidator validator) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @param column   qualified column name, for failure messages
     * @param kind     coarse kind of the host operation
     * @param previous descriptor before the change, empty if the column was not a computed hash
     * @param next     descriptor after the change, empty if it no longer is (or is being dropped)
     * @param current  payload the host put on the operation
     */
    public Resolution resolve(String column, ChangeKind kind,
                              Optional<ComputedHashDescriptor> previous,
                              Optional<ComputedHashDescriptor> next,
                              ColumnDefinition current) {
        previous.ifPresent(d -> validator.validate(d, column));
        next.ifPresent(d -> validator.validate(d, column));

        if (kind == ChangeKind.DROP) {
            return new Resolution(Transition.DROP, current);
        }

        if (!previous.isPresent() && !next.isPresent()) {
            return new Resolution(Transition.NOT_TRACKED, current);
        }

        if (!previous.isPresent()) {
            ComputedHashDescriptor d = next.get();
            renderer.checkStorageType(current.getColumnType(), d, column);
            Transition t = kind == ChangeKind.ADD ? Transition.CREATE : Transition.CONVERT_TO_COMPUTED;
            return new Resolution(t, render(d));
        }

        if (next.isPresent()) {
            ComputedHashDescriptor d = next.get();
            if (d.equals(previous.get())) {
                return new Resolution(Transition.NO_OP, current);
            }
            renderer.checkStorageType(current.getColumnType(), d, column);
            return new Resolution(Transition.ALTER_DEFINITION, render(d));
        }

        // computed -> plain: keep the old storage type unless the new model names one
        String type = current.getColumnType() != null
                ? current.getColumnType()
                : renderer.renderStorageType(previous.get()).toSql();
        return new Resolution(Transition.CONVERT_TO_PLAIN, ColumnDefinition.builder()
                .columnType(type)
                .computedColumnSql(null)
                .stored(false)
                .build());
    }

    /** Payload for a column defined by {@code descriptor}: width and expression always together. */
    public ColumnDefinition render(ComputedHashDescriptor descriptor) {
        return ColumnDefinition.builder()
                .columnType(renderer.renderStorageType(descriptor).toSql())
                .computedColumnSql(renderer.renderExpression(descriptor))
                .stored(true)
                .build();
    }
}
