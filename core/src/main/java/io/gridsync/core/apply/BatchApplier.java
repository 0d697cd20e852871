package io.gridsync.core.apply;

import io.gridsync.core.model.ApplyResult;
import io.gridsync.core.model.OptionBag;
import io.gridsync.core.model.OptionValue;
import io.gridsync.core.model.RefreshPlan;
import io.gridsync.core.normalize.OptionDelta;
import io.gridsync.core.scheduler.EventLoop;
import io.gridsync.core.schema.ApplyBatch;
import io.gridsync.core.schema.CanonicalOption;
import io.gridsync.core.schema.RefreshScope;
import io.gridsync.core.schema.SpecialOptions;
import io.gridsync.core.spi.GridInstance;
import io.gridsync.core.spi.UpdateTransactions;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes canonical options onto a live grid in category batches, then schedules one redraw.
 *
 * <p>
 * Batch order: special options ({@code defaultColDef}, {@code sideBar}, {@code statusBar}), options
 * that need no refresh, layout, data and selection, grouping, editing, everything else. Batches
 * after the no-refresh one are wrapped in a grid update transaction when the grid offers one.
 *
 * <p>
 * Per key:
 * <ul>
 * <li>initialization-only and unknown options are skipped and reported, never pushed;</li>
 * <li>a value structurally equal to what the grid already holds is skipped, so re-applying the
 * same bag is a no-op;</li>
 * <li>a rejected value is recorded as an error and the pass continues with the next key.</li>
 * </ul>
 *
 * <p>
 * The redraw is scheduled on the next frame with a liveness guard: if the grid dies in between,
 * the redraw is silently skipped.
 */
public final class BatchApplier {

    private static final Logger LOG = LoggerFactory.getLogger(BatchApplier.class);

    private final EventLoop eventLoop;
    private final CellStyleSynthesizer cellStyles;

    public BatchApplier(EventLoop eventLoop) {
        this(eventLoop, new CellStyleSynthesizer());
    }

    public BatchApplier(EventLoop eventLoop, CellStyleSynthesizer cellStyles) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
        this.cellStyles = Objects.requireNonNull(cellStyles, "cellStyles must not be null");
    }

    /** Applies {@code options} with an {@link RefreshPolicy#INCREMENTAL} redraw. */
    public ApplyResult apply(GridInstance grid, OptionBag options) {
        return apply(grid, options, RefreshPolicy.INCREMENTAL);
    }

    /**
     * Applies {@code options} to {@code grid}.
     *
     * @param grid    the live grid; a {@code null} or dead grid yields a result with every key
     *                skipped as {@link ApplyResult.SkipReason#STALE_INSTANCE}
     * @param options canonical options to push
     * @param policy  redraw policy
     * @return what was applied, skipped and rejected, and the redraw scheduled
     */
    public ApplyResult apply(GridInstance grid, OptionBag options, RefreshPolicy policy) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        if (grid == null || !isAlive(grid)) {
            LOG.debug("Grid not live, apply skipped: keys={}", options.size());
            return ApplyResult.staleInstance(options.names());
        }

        ApplyResult.Builder result = ApplyResult.builder();
        Map<ApplyBatch, List<CanonicalOption>> batches = partition(options, result);

        boolean refreshHeader = false;
        boolean refreshCells = false;
        for (ApplyBatch batch : ApplyBatch.values()) {
            List<CanonicalOption> keys = batches.get(batch);
            if (keys == null || keys.isEmpty()) {
                continue;
            }
            List<CanonicalOption> applied = applyBatch(grid, batch, keys, options, result);
            for (CanonicalOption option : applied) {
                RefreshScope scope = option.refreshScope();
                refreshHeader |= scope == RefreshScope.HEADER;
                refreshCells |= scope == RefreshScope.CELLS;
            }
        }

        RefreshPlan plan = policy == RefreshPolicy.FORCED
                ? RefreshPlan.FORCED
                : RefreshPlan.incremental(refreshHeader, refreshCells);
        result.refresh(plan);
        if (!plan.isEmpty()) {
            scheduleRefresh(grid, plan);
        }

        ApplyResult built = result.build();
        LOG.info(
                "Applied options: applied={}, skipped={}, errors={}, policy={}, refresh_header={}, refresh_cells={}",
                built.applied().size(),
                built.skipped().size(),
                built.errors().size(),
                policy,
                plan.header(),
                plan.cells());
        return built;
    }

    /** Converts a canonical value into what the grid takes. */
    OptionValue liveValue(CanonicalOption option, OptionValue canonical) {
        return switch (option) {
            case DEFAULT_COL_DEF -> cellStyles.toLiveValue(canonical.toJson());
            case SIDE_BAR -> OptionValue.scalar(SpecialOptions.canonicalSideBar(canonical.toJson()));
            case STATUS_BAR -> OptionValue.scalar(SpecialOptions.liveStatusBar(canonical.toJson()));
            default -> canonical;
        };
    }

    // --- Private helpers ---

    private static Map<ApplyBatch, List<CanonicalOption>> partition(OptionBag options, ApplyResult.Builder result) {
        Map<ApplyBatch, List<CanonicalOption>> batches = new EnumMap<>(ApplyBatch.class);
        for (String key : options.names()) {
            CanonicalOption option = CanonicalOption.fromKey(key);
            if (option == null) {
                LOG.debug("Unknown option not applied: key={}", key);
                result.skip(key, ApplyResult.SkipReason.UNKNOWN_OPTION);
            } else if (option.isInitializationOnly()) {
                LOG.debug("Initialization-only option not applied to live grid: key={}", key);
                result.skip(key, ApplyResult.SkipReason.INITIALIZATION_ONLY);
            } else {
                batches.computeIfAbsent(option.category().batch(), b -> new ArrayList<>())
                        .add(option);
            }
        }
        return batches;
    }

    private List<CanonicalOption> applyBatch(
            GridInstance grid,
            ApplyBatch batch,
            List<CanonicalOption> keys,
            OptionBag options,
            ApplyResult.Builder result) {
        Optional<UpdateTransactions> tx = batch.isTransactional() ? beginTransaction(grid, batch) : Optional.empty();
        List<CanonicalOption> applied = new ArrayList<>();
        try {
            for (CanonicalOption option : keys) {
                if (applyOne(grid, option, options.get(option.key()), result)) {
                    applied.add(option);
                }
            }
        } finally {
            tx.ifPresent(t -> completeTransaction(t, batch));
        }
        return applied;
    }

    private boolean applyOne(
            GridInstance grid, CanonicalOption option, OptionValue canonical, ApplyResult.Builder result) {
        String key = option.key();
        try {
            OptionValue live = liveValue(option, canonical);
            if (OptionDelta.sameValue(grid.getOption(key), live)) {
                result.skip(key, ApplyResult.SkipReason.UNCHANGED);
                return false;
            }
            grid.setOption(key, live);
            result.applied(key);
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Grid rejected option: key={}, detail={}", key, e.getMessage());
            result.error(key, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return false;
        }
    }

    private static Optional<UpdateTransactions> beginTransaction(GridInstance grid, ApplyBatch batch) {
        try {
            Optional<UpdateTransactions> tx = grid.transactions();
            tx.ifPresent(UpdateTransactions::begin);
            return tx;
        } catch (RuntimeException e) {
            LOG.warn("Could not open update transaction, applying without: batch={}", batch, e);
            return Optional.empty();
        }
    }

    private static void completeTransaction(UpdateTransactions tx, ApplyBatch batch) {
        try {
            tx.complete();
        } catch (RuntimeException e) {
            LOG.warn("Could not complete update transaction: batch={}", batch, e);
        }
    }

    private void scheduleRefresh(GridInstance grid, RefreshPlan plan) {
        eventLoop.nextFrame("refresh", () -> isAlive(grid), () -> refresh(grid, plan));
    }

    private static void refresh(GridInstance grid, RefreshPlan plan) {
        if (plan.header()) {
            try {
                grid.refreshHeader();
            } catch (RuntimeException e) {
                LOG.warn("Header refresh failed", e);
            }
        }
        if (plan.cells()) {
            try {
                grid.refreshCells(plan.force(), plan.suppressFlash());
            } catch (RuntimeException e) {
                LOG.warn("Cell refresh failed", e);
            }
        }
        LOG.debug("Refreshed grid: header={}, cells={}, force={}", plan.header(), plan.cells(), plan.force());
    }

    private static boolean isAlive(GridInstance grid) {
        try {
            return grid.isAlive();
        } catch (RuntimeException e) {
            LOG.warn("Grid liveness check failed, treating as dead", e);
            return false;
        }
    }
}
