package io.gridsync.core.error;

/**
 * Abstract base for all grid-sync exceptions. Never thrown directly; use one of the concrete
 * subclasses.
 *
 * <p>
 * Option application and state extraction never raise these: failures there are isolated per key
 * or per facet and reported in result objects. Exceptions are reserved for failures the caller has
 * to act on (bad configuration, unreadable snapshots, store I/O, profile naming conflicts).
 */
public abstract class GridSyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Area of the system in which the error occurred. */
    public enum Area {
        CONFIGURATION,
        SNAPSHOT,
        STORE,
        PROFILE
    }

    private final Area area;

    protected GridSyncException(String message, Area area) {
        super(message);
        this.area = area;
    }

    protected GridSyncException(String message, Throwable cause, Area area) {
        super(message, cause);
        this.area = area;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The area in which the error occurred. */
    public Area area() {
        return area;
    }
}
