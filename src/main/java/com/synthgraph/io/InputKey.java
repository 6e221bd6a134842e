package com.synthgraph.io;

/** Identifies one input port of one node. */
public record InputKey(String nodeId, String portId) {

    @Override
    public String toString() {
        return nodeId + "." + portId;
    }
}
