package com.routing.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Searches one group at a time, holding only the open group and the best result.
 *
 * <p>The caller must supply input sorted by group key. The order is not checked:
 * unsorted input splits groups and silently yields a wrong answer.</p>
 */
public class StreamingAggregator implements CycleAggregator {
    private static final Logger logger = LoggerFactory.getLogger(StreamingAggregator.class);

    private final CycleFinder finder;
    private final int progressInterval;
    private final ProgressListener progressListener;

    public StreamingAggregator(CycleFinder finder, int progressInterval, ProgressListener progressListener) {
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive: " + progressInterval);
        }
        this.finder = finder;
        this.progressInterval = progressInterval;
        this.progressListener = progressListener;
    }

    @Override
    public BestResult aggregate(BufferedReader reader) throws IOException {
        BestResult best = new BestResult();
        NodeIndex nodeIndex = new NodeIndex();
        GroupKey currentKey = null;
        Set<StringEdge> currentEdges = new HashSet<>();
        long groupCount = 0;
        long skipped = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            RouteRecord record = RecordParser.parse(line);
            if (record == null) {
                skipped++;
                continue;
            }
            if (!record.getKey().equals(currentKey)) {
                if (currentKey != null) {
                    closeGroup(currentKey, currentEdges, nodeIndex, best);
                }
                currentKey = record.getKey();
                currentEdges = new HashSet<>();
                groupCount++;
                if (groupCount % progressInterval == 0) {
                    progressListener.onProgress(groupCount, -1);
                }
            }
            currentEdges.add(new StringEdge(record.getSource(), record.getDestination()));
        }

        if (currentKey != null) {
            closeGroup(currentKey, currentEdges, nodeIndex, best);
        }
        logger.info("Streamed {} groups, skipped {} empty or malformed lines", groupCount, skipped);
        return best;
    }

    private void closeGroup(GroupKey key, Set<StringEdge> edges, NodeIndex nodeIndex, BestResult best) {
        if (edges.isEmpty() || best.isPrunable(edges.size())) {
            return;
        }
        // 每组清空编号表, 内存只与当前组大小相关
        nodeIndex.clear();
        List<Edge> intEdges = new ArrayList<>(edges.size());
        for (StringEdge edge : edges) {
            int source = nodeIndex.indexOf(edge.getSource());
            int target = nodeIndex.indexOf(edge.getTarget());
            intEdges.add(new Edge(source, target));
        }
        int cycleLength = finder.findLongestCycle(intEdges);
        if (best.offer(key, cycleLength)) {
            logger.debug("New best: {}", best);
        }
    }
}
