package io.gridsync.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.ValueKind;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Every grid option the engine knows how to apply, with its category, value kind and whether the
 * grid only honors it at construction.
 *
 * <p>
 * Option names absent from this enum are treated as free-form: persisted verbatim, never applied.
 * Legacy option names are not listed here; {@link AliasTable} rewrites them to one of these.
 */
public enum CanonicalOption {

    // --- Special handling ---
    DEFAULT_COL_DEF("defaultColDef", ApplyCategory.SPECIAL, ValueKind.FUNCTION_REF),
    STATUS_BAR("statusBar", ApplyCategory.SPECIAL),
    SIDE_BAR("sideBar", ApplyCategory.SPECIAL),

    // --- No refresh needed ---
    ANIMATE_ROWS("animateRows", ApplyCategory.NO_REFRESH),
    SUPPRESS_NO_ROWS_OVERLAY("suppressNoRowsOverlay", ApplyCategory.NO_REFRESH),
    LOADING("loading", ApplyCategory.NO_REFRESH),
    QUICK_FILTER_TEXT("quickFilterText", ApplyCategory.NO_REFRESH),

    // --- Layout ---
    ROW_HEIGHT("rowHeight", ApplyCategory.LAYOUT),
    HEADER_HEIGHT("headerHeight", ApplyCategory.LAYOUT),
    FLOATING_FILTERS_HEIGHT("floatingFiltersHeight", ApplyCategory.LAYOUT),
    PIVOT_HEADER_HEIGHT("pivotHeaderHeight", ApplyCategory.LAYOUT),
    PIVOT_GROUP_HEADER_HEIGHT("pivotGroupHeaderHeight", ApplyCategory.LAYOUT),
    GROUP_HEADER_HEIGHT("groupHeaderHeight", ApplyCategory.LAYOUT),
    DOM_LAYOUT("domLayout", ApplyCategory.LAYOUT),

    // --- Column behavior ---
    SUPPRESS_MOVABLE_COLUMNS("suppressMovableColumns", ApplyCategory.COLUMN_BEHAVIOR),
    SUPPRESS_COLUMN_MOVE_ANIMATION("suppressColumnMoveAnimation", ApplyCategory.COLUMN_BEHAVIOR),
    SUPPRESS_AUTO_SIZE("suppressAutoSize", ApplyCategory.COLUMN_BEHAVIOR, ValueKind.SCALAR, true),
    SUPPRESS_FIELD_DOT_NOTATION("suppressFieldDotNotation", ApplyCategory.COLUMN_BEHAVIOR),
    SUPPRESS_DRAG_LEAVE_HIDES_COLUMNS("suppressDragLeaveHidesColumns", ApplyCategory.COLUMN_BEHAVIOR),
    AUTO_SIZE_PADDING("autoSizePadding", ApplyCategory.COLUMN_BEHAVIOR),
    SKIP_HEADER_ON_AUTO_SIZE("skipHeaderOnAutoSize", ApplyCategory.COLUMN_BEHAVIOR),

    // --- Data ---
    ROW_BUFFER("rowBuffer", ApplyCategory.DATA),
    VALUE_CACHE("valueCache", ApplyCategory.DATA, ValueKind.SCALAR, true),
    CELL_FLASH_DURATION("cellFlashDuration", ApplyCategory.DATA),
    ROW_MODEL_TYPE("rowModelType", ApplyCategory.DATA, ValueKind.SCALAR, true),
    ENABLE_CELL_TEXT_SELECTION("enableCellTextSelection", ApplyCategory.DATA),

    // --- Selection ---
    ROW_SELECTION("rowSelection", ApplyCategory.SELECTION, ValueKind.STRUCTURED),
    CELL_SELECTION("cellSelection", ApplyCategory.SELECTION, ValueKind.STRUCTURED),

    // --- Grouping ---
    GROUP_DISPLAY_TYPE("groupDisplayType", ApplyCategory.GROUPING),
    GROUP_DEFAULT_EXPANDED("groupDefaultExpanded", ApplyCategory.GROUPING),
    PIVOT_MODE("pivotMode", ApplyCategory.GROUPING),
    GROUP_HIDE_OPEN_PARENTS("groupHideOpenParents", ApplyCategory.GROUPING),
    GROUP_HIDE_PARENT_OF_SINGLE_CHILD("groupHideParentOfSingleChild", ApplyCategory.GROUPING),
    GROUP_TOTAL_ROW("groupTotalRow", ApplyCategory.GROUPING),
    GRAND_TOTAL_ROW("grandTotalRow", ApplyCategory.GROUPING),
    ROW_GROUP_PANEL_SHOW("rowGroupPanelShow", ApplyCategory.GROUPING),
    PIVOT_PANEL_SHOW("pivotPanelShow", ApplyCategory.GROUPING, ValueKind.SCALAR, true),
    SUPPRESS_AGG_FUNC_IN_HEADER("suppressAggFuncInHeader", ApplyCategory.GROUPING),

    // --- Editing ---
    EDIT_TYPE("editType", ApplyCategory.EDITING),
    SINGLE_CLICK_EDIT("singleClickEdit", ApplyCategory.EDITING),
    SUPPRESS_CLICK_EDIT("suppressClickEdit", ApplyCategory.EDITING),
    READ_ONLY_EDIT("readOnlyEdit", ApplyCategory.EDITING),
    ENTER_NAVIGATES_VERTICALLY("enterNavigatesVertically", ApplyCategory.EDITING),
    ENTER_NAVIGATES_VERTICALLY_AFTER_EDIT("enterNavigatesVerticallyAfterEdit", ApplyCategory.EDITING),
    UNDO_REDO_CELL_EDITING("undoRedoCellEditing", ApplyCategory.EDITING, ValueKind.SCALAR, true),
    UNDO_REDO_CELL_EDITING_LIMIT("undoRedoCellEditingLimit", ApplyCategory.EDITING, ValueKind.SCALAR, true),
    STOP_EDITING_WHEN_CELLS_LOSE_FOCUS(
            "stopEditingWhenCellsLoseFocus", ApplyCategory.EDITING, ValueKind.SCALAR, true),

    // --- Everything else ---
    MULTI_SORT_KEY("multiSortKey", ApplyCategory.OTHER),
    ACCENTED_SORT("accentedSort", ApplyCategory.OTHER),
    SUPPRESS_MULTI_SORT("suppressMultiSort", ApplyCategory.OTHER),
    UN_SORT_ICON("unSortIcon", ApplyCategory.OTHER),
    ENABLE_ADVANCED_FILTER("enableAdvancedFilter", ApplyCategory.OTHER),
    CACHE_QUICK_FILTER("cacheQuickFilter", ApplyCategory.OTHER, ValueKind.SCALAR, true),
    PAGINATION("pagination", ApplyCategory.OTHER),
    PAGINATION_AUTO_PAGE_SIZE("paginationAutoPageSize", ApplyCategory.OTHER),
    PAGINATION_PAGE_SIZE("paginationPageSize", ApplyCategory.OTHER),
    PAGINATION_PAGE_SIZE_SELECTOR("paginationPageSizeSelector", ApplyCategory.OTHER, ValueKind.SCALAR, true),
    SUPPRESS_PAGINATION_PANEL("suppressPaginationPanel", ApplyCategory.OTHER),
    ROW_CLASS("rowClass", ApplyCategory.OTHER),
    ROW_CLASS_RULES("rowClassRules", ApplyCategory.OTHER),
    SUPPRESS_ROW_HOVER_HIGHLIGHT("suppressRowHoverHighlight", ApplyCategory.OTHER),
    SUPPRESS_MENU_HIDE("suppressMenuHide", ApplyCategory.OTHER),
    SUPPRESS_CONTEXT_MENU("suppressContextMenu", ApplyCategory.OTHER),
    ALWAYS_SHOW_VERTICAL_SCROLL("alwaysShowVerticalScroll", ApplyCategory.OTHER),
    ALWAYS_SHOW_HORIZONTAL_SCROLL("alwaysShowHorizontalScroll", ApplyCategory.OTHER),
    SUPPRESS_SCROLL_ON_NEW_DATA("suppressScrollOnNewData", ApplyCategory.OTHER),
    SUPPRESS_COLUMN_VIRTUALISATION("suppressColumnVirtualisation", ApplyCategory.OTHER),
    SUPPRESS_ROW_VIRTUALISATION("suppressRowVirtualisation", ApplyCategory.OTHER),
    COPY_HEADERS_TO_CLIPBOARD("copyHeadersToClipboard", ApplyCategory.OTHER),
    CLIPBOARD_DELIMITER("clipboardDelimiter", ApplyCategory.OTHER),
    SUPPRESS_COPY_SINGLE_CELL_RANGES("suppressCopySingleCellRanges", ApplyCategory.OTHER),
    CSV_FILENAME("csvFilename", ApplyCategory.OTHER),
    EXCEL_FILENAME("excelFilename", ApplyCategory.OTHER),
    ENABLE_CHARTS("enableCharts", ApplyCategory.OTHER),
    MASTER_DETAIL("masterDetail", ApplyCategory.OTHER),
    DEBUG("debug", ApplyCategory.OTHER, ValueKind.SCALAR, true);

    private static final Map<String, CanonicalOption> BY_KEY;

    static {
        Map<String, CanonicalOption> byKey = new HashMap<>();
        for (CanonicalOption option : values()) {
            byKey.put(option.key, option);
        }
        BY_KEY = Collections.unmodifiableMap(byKey);
    }

    private final String key;
    private final ApplyCategory category;
    private final ValueKind kind;
    private final boolean initializationOnly;

    CanonicalOption(String key, ApplyCategory category) {
        this(key, category, ValueKind.SCALAR, false);
    }

    CanonicalOption(String key, ApplyCategory category, ValueKind kind) {
        this(key, category, kind, false);
    }

    CanonicalOption(String key, ApplyCategory category, ValueKind kind, boolean initializationOnly) {
        this.key = key;
        this.category = category;
        this.kind = kind;
        this.initializationOnly = initializationOnly;
    }

    /**
     * Looks up an option by its grid option name.
     *
     * @return the option, or {@code null} if the name is not canonical
     */
    public static CanonicalOption fromKey(String key) {
        return key == null ? null : BY_KEY.get(key);
    }

    public static boolean isCanonical(String key) {
        return fromKey(key) != null;
    }

    /** The grid option name, e.g. {@code "rowHeight"}. */
    public String key() {
        return key;
    }

    public ApplyCategory category() {
        return category;
    }

    /** Shape of the value when it is pushed to the live grid. */
    public ValueKind kind() {
        return kind;
    }

    /** True when the grid reads this option only at construction. */
    public boolean isInitializationOnly() {
        return initializationOnly;
    }

    /** The redraw a change of this option requires. */
    public RefreshScope refreshScope() {
        // column defaults change how every cell renders
        return this == DEFAULT_COL_DEF ? RefreshScope.CELLS : category.refreshScope();
    }

    /**
     * Wraps a canonical JSON value in the {@link OptionValue} shape held in canonical state.
     * Structured options become {@link OptionValue.Structured} when the value is an object.
     * Function-bearing options are held in their scalar input form; the function is synthesized
     * only when the value is pushed to the grid.
     */
    public OptionValue wrap(JsonNode json) {
        if (kind == ValueKind.STRUCTURED && json != null && json.isObject()) {
            return OptionValue.structured((ObjectNode) json);
        }
        return OptionValue.scalar(json);
    }
}
