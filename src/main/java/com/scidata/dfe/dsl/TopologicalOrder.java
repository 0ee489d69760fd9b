package com.scidata.dfe.dsl;

import com.scidata.dfe.exception.GraphConstructionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSR-encoded static DAG over string identifiers (stage names or node instance
 * ids).
 *
 * Edges point in the direction data flows: producer to consumer, child to
 * container. Iterating indices 0..n therefore visits every node after everything
 * it waits on.
 *
 * Data layout:
 * - order: identifiers sorted topologically.
 * - childrenList: flattened topological indices of all children.
 * - childrenOffset: node i's children are childrenList[childrenOffset[i]]
 * inclusive to childrenList[childrenOffset[i+1]] exclusive.
 */
public final class TopologicalOrder {
    private final String[] order;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> idToIndex;

    private TopologicalOrder(String[] order, int[] childrenOffset, int[] childrenList, int[] parentCount,
            Map<String, Integer> idToIndex) {
        this.order = order;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.idToIndex = idToIndex;
    }

    public int nodeCount() {
        return order.length;
    }

    /** Identifier at the given topological index. */
    public String id(int ti) {
        return order[ti];
    }

    public int topoIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** All identifiers in topological order. */
    public List<String> ids() {
        return List.of(order);
    }

    /** Identifiers with no incoming edge, in topological order. */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (int ti = 0; ti < order.length; ti++)
            if (parentCount[ti] == 0)
                roots.add(order[ti]);
        return roots;
    }

    /** Identifiers with no outgoing edge, in topological order. */
    public List<String> leaves() {
        List<String> leaves = new ArrayList<>();
        for (int ti = 0; ti < order.length; ti++)
            if (childCount(ti) == 0)
                leaves.add(order[ti]);
        return leaves;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> ids = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(String id) {
            if (idToIdx.containsKey(id))
                throw new GraphConstructionException("Duplicate node: " + id);
            int idx = ids.size();
            ids.add(id);
            idToIdx.put(id, idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        public boolean contains(String id) {
            return idToIdx.containsKey(id);
        }

        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new GraphConstructionException("Self-edge not allowed: " + from);
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new GraphConstructionException("Unknown node: " + id);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         *
         * @throws GraphConstructionException naming the nodes left on a cycle.
         */
        public TopologicalOrder build() {
            int n = ids.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Seed with nodes having in-degree 0, in declaration order
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Kahn's algorithm
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n) {
                List<String> unresolved = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        unresolved.add(ids.get(i));
                throw new GraphConstructionException("Cycle detected among " + unresolved);
            }

            // 4. Compact arrays
            String[] ordered = new String[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newIdToIndex = new LinkedHashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = ids.get(reverseMap[ti]);
                newIdToIndex.put(ordered[ti], ti);
            }

            // 5. CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new TopologicalOrder(ordered, offsets, flatChildren, parentCounts, newIdToIndex);
        }
    }
}
