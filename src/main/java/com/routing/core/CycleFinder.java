package com.routing.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the longest simple directed cycle in one group's edge set.
 *
 * <p>Every vertex is tried as a start and all simple paths leaving it are
 * enumerated depth-first, so the cost is exponential in the worst case. This is
 * only feasible because a group is expected to hold tens to low hundreds of
 * vertices.</p>
 */
public class CycleFinder {
    private static final Logger logger = LoggerFactory.getLogger(CycleFinder.class);

    /**
     * @param edges directed edges of one group; duplicates are ignored
     * @return hop count of the longest simple cycle, or 0 if the edges contain no cycle
     */
    public int findLongestCycle(Collection<Edge> edges) {
        if (edges.isEmpty()) {
            return 0;
        }

        // 重新编号为连续下标, 便于用 BitSet 记录访问状态
        Map<Integer, Integer> localIds = new HashMap<>();
        Set<Edge> distinct = new LinkedHashSet<>();
        for (Edge edge : edges) {
            int source = localIds.computeIfAbsent(edge.getSource(), k -> localIds.size());
            int target = localIds.computeIfAbsent(edge.getTarget(), k -> localIds.size());
            distinct.add(new Edge(source, target));
        }

        int nodeCount = localIds.size();
        List<List<Integer>> adjacencyList = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            adjacencyList.add(new ArrayList<>());
        }
        for (Edge edge : distinct) {
            adjacencyList.get(edge.getSource()).add(edge.getTarget());
        }

        int longest = 0;
        for (int start = 0; start < nodeCount; start++) {
            longest = Math.max(longest, longestCycleFrom(start, adjacencyList, nodeCount));
        }
        logger.debug("Searched {} nodes and {} edges, longest cycle {}", nodeCount, distinct.size(), longest);
        return longest;
    }

    private int longestCycleFrom(int start, List<List<Integer>> adjacencyList, int nodeCount) {
        int longest = 0;
        Deque<Path> stack = new ArrayDeque<>();
        BitSet initial = new BitSet(nodeCount);
        initial.set(start);
        stack.push(new Path(start, initial, 1));

        while (!stack.isEmpty()) {
            Path path = stack.pop();
            for (int neighbor : adjacencyList.get(path.node)) {
                if (neighbor == start) {
                    // 找到环
                    longest = Math.max(longest, path.depth);
                } else if (!path.visited.get(neighbor)) {
                    BitSet visited = (BitSet) path.visited.clone();
                    visited.set(neighbor);
                    stack.push(new Path(neighbor, visited, path.depth + 1));
                }
            }
        }
        return longest;
    }

    /**
     * A simple path from the start vertex: its last vertex, the vertices on it,
     * and how many vertices it holds.
     */
    private static final class Path {
        final int node;
        final BitSet visited;
        final int depth;

        Path(int node, BitSet visited, int depth) {
            this.node = node;
            this.visited = visited;
            this.depth = depth;
        }
    }
}
