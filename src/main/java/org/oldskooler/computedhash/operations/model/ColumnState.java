package org.oldskooler.computedhash.operations.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a column looked like before an alter.
 */
@Data
@Builder(toBuilder = true)
public class ColumnState {
    private String columnType;
    private String storeType;
    @Builder.Default
    private boolean nullable = true;
    private String computedColumnSql;
    private boolean stored;
    @Builder.Default
    private Map<String, Object> annotations = new LinkedHashMap<>();

    public String effectiveType() {
        return columnType != null ? columnType : storeType;
    }
}
