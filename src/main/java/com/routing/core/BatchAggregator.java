package com.routing.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Buffers every group in memory, then searches each one. Input order does not matter
 * for the result; groups are searched in order of first sighting.
 *
 * <p>Node names are mapped through a single table shared by all groups to avoid
 * repeated string hashing. The ids are never compared across groups.</p>
 */
public class BatchAggregator implements CycleAggregator {
    private static final Logger logger = LoggerFactory.getLogger(BatchAggregator.class);

    private final CycleFinder finder;
    private final int progressInterval;
    private final ProgressListener progressListener;

    public BatchAggregator(CycleFinder finder, int progressInterval, ProgressListener progressListener) {
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive: " + progressInterval);
        }
        this.finder = finder;
        this.progressInterval = progressInterval;
        this.progressListener = progressListener;
    }

    @Override
    public BestResult aggregate(BufferedReader reader) throws IOException {
        Map<GroupKey, Set<Edge>> groups = loadGroups(reader);
        logger.info("Loaded {} groups. Starting cycle search...", groups.size());

        BestResult best = new BestResult();
        long total = groups.size();
        long processed = 0;
        long searched = 0;
        for (Map.Entry<GroupKey, Set<Edge>> entry : groups.entrySet()) {
            processed++;
            if (processed % progressInterval == 0) {
                progressListener.onProgress(processed, total);
            }
            Set<Edge> edges = entry.getValue();
            if (best.isPrunable(edges.size())) {
                continue;
            }
            searched++;
            int cycleLength = finder.findLongestCycle(edges);
            if (best.offer(entry.getKey(), cycleLength)) {
                logger.debug("New best: {}", best);
            }
        }
        logger.info("Searched {} of {} groups", searched, total);
        return best;
    }

    private Map<GroupKey, Set<Edge>> loadGroups(BufferedReader reader) throws IOException {
        NodeIndex nodeIndex = new NodeIndex();
        Map<GroupKey, Set<Edge>> groups = new LinkedHashMap<>();
        long skipped = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            RouteRecord record = RecordParser.parse(line);
            if (record == null) {
                skipped++;
                continue;
            }
            int source = nodeIndex.indexOf(record.getSource());
            int target = nodeIndex.indexOf(record.getDestination());
            groups.computeIfAbsent(record.getKey(), k -> new HashSet<>()).add(new Edge(source, target));
        }
        logger.debug("Skipped {} empty or malformed lines, {} distinct nodes", skipped, nodeIndex.size());
        return groups;
    }
}
