package com.routing.core;

/**
 * Directed edge between two raw node names, held while a streaming group is open.
 */
final class StringEdge {

    private final String source;
    private final String target;

    StringEdge(String source, String target) {
        this.source = source;
        this.target = target;
    }

    String getSource() {
        return source;
    }

    String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof StringEdge) {
            StringEdge o = (StringEdge) obj;
            return source.equals(o.source) && target.equals(o.target);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + target.hashCode();
    }
}
