package io.gridsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Explicit column sizes captured alongside column state, so widths survive even when the column
 * state replay is partially rejected.
 *
 * @param widths pixel widths by column id
 * @param flex   flex weights by column id
 */
public record ColumnSizing(Map<String, Integer> widths, Map<String, Double> flex) {

    public ColumnSizing {
        widths = widths == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(widths));
        flex = flex == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flex));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return widths.isEmpty() && flex.isEmpty();
    }
}
