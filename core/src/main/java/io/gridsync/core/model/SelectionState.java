package io.gridsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Row selection. Client-side grids report row ids; server-side grids with group selection report
 * an opaque selection-state object instead.
 *
 * @param mode                 row selection mode at capture time, e.g. {@code "multiRow"}
 * @param selectedRowIds       selected row ids (client-side)
 * @param serverSideSelection  server-side selection state, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SelectionState(String mode, List<String> selectedRowIds, JsonNode serverSideSelection) {

    public SelectionState {
        selectedRowIds = selectedRowIds == null ? null : List.copyOf(selectedRowIds);
        serverSideSelection = serverSideSelection == null ? null : serverSideSelection.deepCopy();
    }

    @JsonIgnore
    public boolean isServerSide() {
        return serverSideSelection != null && !serverSideSelection.isNull();
    }
}
