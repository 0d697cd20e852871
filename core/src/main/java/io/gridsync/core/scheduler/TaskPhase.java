package io.gridsync.core.scheduler;

/** When a scheduled task runs relative to the current one. */
public enum TaskPhase {
    /** After the current task finishes, before any frame or timer task. Delay is ignored. */
    MICROTASK,
    /** On the next rendering frame, plus any extra delay. */
    FRAME,
    /** After the given delay. */
    TIMER
}
