package com.routing.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Assigns dense integer ids to node names in order of first sighting.
 */
public final class NodeIndex {

    private final Map<String, Integer> ids = new HashMap<>();

    public int indexOf(String node) {
        Integer id = ids.get(node);
        if (id == null) {
            id = ids.size();
            ids.put(node, id);
        }
        return id;
    }

    public int size() {
        return ids.size();
    }

    public void clear() {
        ids.clear();
    }
}
