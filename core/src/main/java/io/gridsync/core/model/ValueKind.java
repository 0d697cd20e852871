package io.gridsync.core.model;

/** How an option value is shaped when it reaches the live grid. */
public enum ValueKind {
    /** Plain JSON value, replaced wholesale. */
    SCALAR,
    /** JSON object whose fields merge shallowly onto the current value. */
    STRUCTURED,
    /** JSON object carrying a behavioral function synthesized from scalar inputs. */
    FUNCTION_REF
}
