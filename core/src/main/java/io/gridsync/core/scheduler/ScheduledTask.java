package io.gridsync.core.scheduler;

/** Handle to a task submitted to an {@link EventLoop}. */
public interface ScheduledTask {

    String name();

    TaskPhase phase();

    /**
     * Cancels the task. A cancelled task never runs; cancelling a finished task has no effect.
     */
    void cancel();

    boolean isCancelled();

    /** True once the task has run, been skipped by its liveness guard, or been cancelled. */
    boolean isDone();
}
