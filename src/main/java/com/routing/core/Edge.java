package com.routing.core;

/**
 * Directed edge between two integer node ids. Ids only have meaning inside the
 * group they were assigned for.
 */
public final class Edge {

    private final int source;
    private final int target;

    public Edge(int source, int target) {
        this.source = source;
        this.target = target;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Edge) {
            Edge o = (Edge) obj;
            return source == o.source && target == o.target;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * source + target;
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
