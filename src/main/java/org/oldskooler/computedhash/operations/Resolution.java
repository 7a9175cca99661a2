package org.oldskooler.computedhash.operations;

import lombok.Value;

/**
 * Outcome of resolving one column: which transition applies and the payload the
 * operation must carry afterwards.
 */
@Value
public class Resolution {
    Transition transition;
    ColumnDefinition definition;

    public boolean changesPayload(ColumnDefinition current) {
        return !definition.equals(current);
    }
}
