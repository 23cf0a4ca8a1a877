package com.routing.core;

/**
 * Running best answer of a scan: the longest cycle seen so far and the group
 * that owns it. Ordered by length descending, then key ascending.
 */
public class BestResult {

    static final String NO_CYCLE = "0,0,0";

    private GroupKey key;
    private int length;

    /**
     * Folds one group's result in.
     *
     * @return {@code true} if the candidate replaced the current best
     */
    public boolean offer(GroupKey candidate, int cycleLength) {
        if (cycleLength <= 0) {
            return false;
        }
        if (cycleLength > length || (cycleLength == length && (key == null || candidate.compareTo(key) < 0))) {
            key = candidate;
            length = cycleLength;
            return true;
        }
        return false;
    }

    /**
     * A cycle cannot have more hops than its group has edges, so a group with fewer
     * edges than the current best length cannot win.
     */
    public boolean isPrunable(int edgeCount) {
        return edgeCount < length;
    }

    public GroupKey getKey() {
        return key;
    }

    public int getLength() {
        return length;
    }

    public boolean isEmpty() {
        return key == null;
    }

    /**
     * @return {@code claim_id,status_code,cycle_length}, or {@code 0,0,0} if no cycle was found
     */
    public String format() {
        if (key == null) {
            return NO_CYCLE;
        }
        return key.getClaimId() + "," + key.getStatusCode() + "," + length;
    }

    @Override
    public String toString() {
        return format();
    }
}
