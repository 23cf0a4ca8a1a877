package com.routing.core;

/**
 * Receives periodic progress notices from an aggregator. Has no effect on results.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total) -> { };

    /**
     * @param processed groups handled so far
     * @param total     total group count, or a negative value when unknown
     */
    void onProgress(long processed, long total);
}
