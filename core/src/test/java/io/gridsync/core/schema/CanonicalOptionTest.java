package io.gridsync.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.ValueKind;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CanonicalOptionTest {

    @Test
    void keysAreUnique() {
        Set<String> keys = new HashSet<>();
        for (CanonicalOption option : CanonicalOption.values()) {
            assertThat(keys.add(option.key())).as("duplicate key %s", option.key()).isTrue();
        }
    }

    @Test
    void everyOptionMapsToABatchAndARefreshScope() {
        for (CanonicalOption option : CanonicalOption.values()) {
            assertThat(option.category()).as("category of %s", option.key()).isNotNull();
            assertThat(option.category().batch()).as("batch of %s", option.key()).isNotNull();
            assertThat(option.refreshScope()).as("refresh scope of %s", option.key()).isNotNull();
        }
    }

    @Test
    void everyBundledDefaultIsCanonical() {
        EngineDefaults defaults = EngineDefaults.load();

        assertThat(defaults.options().names()).allSatisfy(name -> assertThat(CanonicalOption.isCanonical(name))
                .as("default option %s", name)
                .isTrue());
    }

    @Test
    void lookupByKey() {
        assertThat(CanonicalOption.fromKey("rowHeight")).isEqualTo(CanonicalOption.ROW_HEIGHT);
        assertThat(CanonicalOption.fromKey("notAnOption")).isNull();
        assertThat(CanonicalOption.fromKey(null)).isNull();
    }

    @Test
    void categoriesDecideRefreshScope() {
        assertThat(CanonicalOption.ROW_HEIGHT.refreshScope()).isEqualTo(RefreshScope.HEADER);
        assertThat(CanonicalOption.ROW_SELECTION.refreshScope()).isEqualTo(RefreshScope.CELLS);
        assertThat(CanonicalOption.ANIMATE_ROWS.refreshScope()).isEqualTo(RefreshScope.NONE);
        assertThat(CanonicalOption.PAGINATION.refreshScope()).isEqualTo(RefreshScope.NONE);
    }

    @Test
    void columnDefaultsRedrawCells() {
        assertThat(CanonicalOption.DEFAULT_COL_DEF.category()).isEqualTo(ApplyCategory.SPECIAL);
        assertThat(CanonicalOption.DEFAULT_COL_DEF.refreshScope()).isEqualTo(RefreshScope.CELLS);
    }

    @Test
    void batchesComeInApplicationOrder() {
        assertThat(ApplyBatch.values())
                .containsExactly(
                        ApplyBatch.SPECIAL,
                        ApplyBatch.IMMEDIATE,
                        ApplyBatch.LAYOUT,
                        ApplyBatch.DATA,
                        ApplyBatch.GROUPING,
                        ApplyBatch.EDITING,
                        ApplyBatch.OTHER);
        assertThat(ApplyBatch.IMMEDIATE.isTransactional()).isFalse();
        assertThat(ApplyBatch.LAYOUT.isTransactional()).isTrue();
    }

    @Test
    void initializationOnlyOptions() {
        assertThat(CanonicalOption.ROW_MODEL_TYPE.isInitializationOnly()).isTrue();
        assertThat(CanonicalOption.VALUE_CACHE.isInitializationOnly()).isTrue();
        assertThat(CanonicalOption.ROW_HEIGHT.isInitializationOnly()).isFalse();
    }

    @Test
    void wrapUsesTheOptionKind() {
        OptionValue structured = CanonicalOption.CELL_SELECTION.wrap(
                JsonNodeFactory.instance.objectNode().put("enabled", true));
        OptionValue scalar = CanonicalOption.ANIMATE_ROWS.wrap(BooleanNode.TRUE);
        OptionValue notAnObject = CanonicalOption.CELL_SELECTION.wrap(BooleanNode.TRUE);

        assertThat(structured.kind()).isEqualTo(ValueKind.STRUCTURED);
        assertThat(scalar.kind()).isEqualTo(ValueKind.SCALAR);
        assertThat(notAnObject.kind()).isEqualTo(ValueKind.SCALAR);
    }
}
