package org.oldskooler.computedhash.operations.model;

import lombok.Getter;
import lombok.ToString;
import org.oldskooler.computedhash.util.Names;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Getter
@ToString(callSuper = true)
public class DropColumnOperation extends MigrationOperation {
    private final String name;

    /** Annotations the column had before it was dropped. */
    private final Map<String, Object> oldAnnotations = new LinkedHashMap<>();

    public DropColumnOperation(String table, String name) {
        super(table);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String qualifiedName() {
        return Names.qualify(getTable(), name);
    }
}
