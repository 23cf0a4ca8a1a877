package com.routing.core;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Reads route records, groups them by key and reports the group with the longest
 * simple cycle.
 */
public interface CycleAggregator {

    /**
     * Consumes the reader to the end. The reader is not closed.
     *
     * @throws IOException if reading fails
     */
    BestResult aggregate(BufferedReader reader) throws IOException;
}
