package org.oldskooler.computedhash.snapshot;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One column as recorded in a model snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnSnapshot {
    @SerializedName("name")
    private String name;

    /** Explicit user type, or null. */
    @SerializedName("columnType")
    private String columnType;

    /** Type derived by the dialect. */
    @SerializedName("storeType")
    private String storeType;

    @SerializedName("nullable")
    private boolean nullable;

    @SerializedName("identity")
    private boolean identity;

    @SerializedName("computedSql")
    private String computedColumnSql;

    @SerializedName("stored")
    private boolean stored;

    @SerializedName("annotations")
    private Map<String, Object> annotations;

    public Map<String, Object> getAnnotations() {
        if (annotations == null) annotations = new LinkedHashMap<>();
        return annotations;
    }
}
