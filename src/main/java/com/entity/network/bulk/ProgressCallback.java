package com.entity.network.bulk;

/**
 * Receives import progress on the importing thread: every hundred records written
 * to the store, then once when the import finishes.
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NOOP = (processed, total, message) -> {
    };

    /**
     * @param processed records handled so far; the final call counts every input line
     * @param total     records to write, or input lines on the final call
     */
    void onProgress(long processed, long total, String message);
}
