package com.synthgraph.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency order of a patch's nodes.
 *
 * <p>
 * Built with Kahn's algorithm. The initial queue holds every node without
 * inbound edges sorted by id; nodes released later are appended in the order
 * their last inbound edge was relaxed, so the same graph always yields the
 * same order. When the graph has a cycle the order is partial and
 * {@link #hasCycle()} is true; no attempt is made to name the cycle.
 */
public final class TopologicalOrder {
    private final List<String> order;
    private final Map<String, Integer> position;
    private final int nodeCount;

    private TopologicalOrder(List<String> order, int nodeCount) {
        this.order = Collections.unmodifiableList(order);
        this.nodeCount = nodeCount;
        this.position = new HashMap<>(order.size() * 2);
        for (int i = 0; i < order.size(); i++)
            position.put(order.get(i), i);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public boolean hasCycle() {
        return order.size() != nodeCount;
    }

    /** Node ids in execution order; partial when {@link #hasCycle()}. */
    public List<String> order() {
        return order;
    }

    /** Position of the node in the order, or -1 if it was not reached. */
    public int position(String nodeId) {
        Integer idx = position.get(nodeId);
        return idx == null ? -1 : idx;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Collects node ids and dependency edges. */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(String id) {
            if (idToIdx.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            idToIdx.put(id, nodes.size());
            nodes.add(id);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** Adds an edge; a self-edge is kept and shows up as a cycle. */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        public boolean contains(String id) {
            return idToIdx.containsKey(id);
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. In-degrees
            for (List<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            // 2. Roots, sorted by id
            List<Integer> roots = new ArrayList<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    roots.add(i);
            roots.sort((a, b) -> nodes.get(a).compareTo(nodes.get(b)));

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int r : roots)
                queue[tail++] = r;

            // 3. Kahn
            List<String> ordered = new ArrayList<>(n);
            while (head < tail) {
                int curr = queue[head++];
                ordered.add(nodes.get(curr));
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            return new TopologicalOrder(ordered, n);
        }
    }
}
