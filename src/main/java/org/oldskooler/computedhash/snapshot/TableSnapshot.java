package org.oldskooler.computedhash.snapshot;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableSnapshot {
    @SerializedName("name")
    private String name;

    @SerializedName("primaryKey")
    private List<String> primaryKey = new ArrayList<>();

    @SerializedName("columns")
    private List<ColumnSnapshot> columns = new ArrayList<>();

    public TableSnapshot(String name) {
        this.name = name;
    }

    public Optional<ColumnSnapshot> column(String column) {
        return columns.stream().filter(c -> c.getName().equals(column)).findFirst();
    }
}
