package org.oldskooler.computedhash.snapshot;

import com.google.gson.annotations.SerializedName;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistable picture of the model at one point in time. Migrations are produced by
 * diffing two of these, so "what a column used to be" survives between runs.
 */
@Data
@NoArgsConstructor
public class ModelSnapshot {
    @SerializedName("version")
    private int version = 1;

    @SerializedName("tables")
    private List<TableSnapshot> tables = new ArrayList<>();

    public Optional<TableSnapshot> table(String name) {
        return tables.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    /** Snapshot of an empty model, the starting point of the first migration. */
    public static ModelSnapshot empty() {
        return new ModelSnapshot();
    }
}
