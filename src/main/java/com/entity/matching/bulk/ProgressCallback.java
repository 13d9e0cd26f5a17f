package com.entity.matching.bulk;

/**
 * Callback for long-running steps such as scoring all candidate pairs or loading a table.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of items processed so far
     * @param total     the total number of items (may be -1 if unknown)
     * @param message   short description of the step
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
