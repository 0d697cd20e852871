package io.gridsync.core.spi;

/**
 * Batching hooks some grids expose: option updates made between {@link #begin()} and
 * {@link #complete()} are laid out once instead of once per update.
 */
public interface UpdateTransactions {

    /** Opens a batch. */
    void begin();

    /** Closes the batch opened by the last {@link #begin()}. */
    void complete();
}
