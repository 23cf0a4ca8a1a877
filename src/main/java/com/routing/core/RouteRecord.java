package com.routing.core;

/**
 * One parsed input line: a directed hop from {@code source} to {@code destination}
 * belonging to the group identified by {@code key}.
 */
public final class RouteRecord {

    private final String source;
    private final String destination;
    private final GroupKey key;

    public RouteRecord(String source, String destination, GroupKey key) {
        this.source = source;
        this.destination = destination;
        this.key = key;
    }

    public String getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }

    public GroupKey getKey() {
        return key;
    }

    @Override
    public String toString() {
        return source + " -> " + destination + " [" + key + "]";
    }
}
