package org.Aayush.arbor.tree;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.experimental.UtilityClass;
import org.Aayush.arbor.core.LayoutEngine;
import org.Aayush.arbor.core.LayoutException;
import org.Aayush.arbor.core.id.IDMapper;
import org.Aayush.arbor.model.LayoutEdge;
import org.Aayush.arbor.model.LayoutNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts a flat node/edge list into a {@link LayoutTree}.
 *
 * <p>Root selection depends on caller node order: the first node with no incoming
 * edge wins, otherwise the first node overall. Children are discovered breadth-first
 * in edge-list order and each node keeps the first parent that reaches it, so
 * multi-parent input and cycles collapse to a spanning tree.</p>
 */
@UtilityClass
public final class TreeAssembler {

    /**
     * Assembles one call-scoped tree.
     *
     * @param nodes caller nodes in input order.
     * @param edges ownership edges; null is treated as empty.
     * @return assembled tree, empty when {@code nodes} is empty.
     * @throws LayoutException when a node or edge element violates the input contract.
     */
    public static LayoutTree assemble(List<LayoutNode> nodes, List<LayoutEdge> edges) {
        IDMapper ids = IDMapper.fromOrderedIds(requireNodeIds(nodes));
        int n = ids.size();
        List<LayoutEdge> edgeList = edges == null ? List.of() : edges;

        IntArrayList[] outgoing = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            outgoing[i] = new IntArrayList();
        }
        int[] inDegree = new int[n];
        int dropped = 0;
        for (int i = 0; i < edgeList.size(); i++) {
            LayoutEdge edge = edgeList.get(i);
            if (edge == null) {
                throw new LayoutException(LayoutEngine.REASON_EDGE_REQUIRED, i, "edges[" + i + "] must be non-null");
            }
            int source = ids.indexOf(edge.getSource());
            int target = ids.indexOf(edge.getTarget());
            if (source == IDMapper.UNKNOWN || target == IDMapper.UNKNOWN) {
                dropped++;
                continue;
            }
            outgoing[source].add(target);
            inDegree[target]++;
        }

        int[] parent = new int[n];
        Arrays.fill(parent, LayoutTree.NO_NODE);
        int[] level = new int[n];
        boolean[] reachable = new boolean[n];
        IntList[] children = new IntList[n];
        for (int i = 0; i < n; i++) {
            children[i] = new IntArrayList();
        }
        List<IntList> levels = new ArrayList<>();
        if (n == 0) {
            return new LayoutTree(ids, LayoutTree.NO_NODE, parent, children, level, reachable, levels, dropped);
        }

        int root = selectRoot(inDegree);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        reachable[root] = true;
        queue.enqueue(root);
        while (!queue.isEmpty()) {
            int v = queue.dequeueInt();
            if (level[v] == levels.size()) {
                levels.add(new IntArrayList());
            }
            levels.get(level[v]).add(v);
            IntArrayList targets = outgoing[v];
            for (int i = 0; i < targets.size(); i++) {
                int child = targets.getInt(i);
                if (reachable[child]) {
                    continue;
                }
                reachable[child] = true;
                parent[child] = v;
                level[child] = level[v] + 1;
                children[v].add(child);
                queue.enqueue(child);
            }
        }
        return new LayoutTree(ids, root, parent, children, level, reachable, levels, dropped);
    }

    /**
     * First zero in-degree index, falling back to index 0.
     */
    static int selectRoot(int[] inDegree) {
        for (int i = 0; i < inDegree.length; i++) {
            if (inDegree[i] == 0) {
                return i;
            }
        }
        return 0;
    }

    private static List<String> requireNodeIds(List<LayoutNode> nodes) {
        if (nodes == null) {
            throw new LayoutException(LayoutEngine.REASON_NODES_REQUIRED, "nodes must be provided");
        }
        List<String> ids = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            LayoutNode node = nodes.get(i);
            if (node == null) {
                throw new LayoutException(LayoutEngine.REASON_NODE_REQUIRED, i, "nodes[" + i + "] must be non-null");
            }
            String id = node.getId();
            if (id == null || id.isBlank()) {
                throw new LayoutException(LayoutEngine.REASON_NODE_ID_REQUIRED, i, "nodes[" + i + "].id must be non-blank");
            }
            ids.add(id);
        }
        return ids;
    }
}
