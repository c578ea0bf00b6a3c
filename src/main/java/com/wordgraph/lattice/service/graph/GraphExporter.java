package com.wordgraph.lattice.service.graph;

import com.wordgraph.lattice.dto.graph.GraphEdge;
import com.wordgraph.lattice.dto.graph.GraphMetadata;
import com.wordgraph.lattice.dto.graph.GraphNode;
import com.wordgraph.lattice.dto.graph.LatticeSnapshot;
import com.wordgraph.lattice.model.LatticeGraph;
import com.wordgraph.lattice.model.LatticeNode;
import com.wordgraph.lattice.model.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a verified arena into the node/edge snapshot consumed by traversal and visualizers.
 *
 * Ids follow BFS discovery from the root with children in character order, so one input
 * always exports the same ids. Level is the BFS distance at first discovery, which is the
 * minimum over all paths. Terminal nodes share one END node.
 */
@Service
@Slf4j
public class GraphExporter {

    private static final int UNASSIGNED = -1;

    public LatticeSnapshot export(LatticeGraph graph) {
        int[] exportId = new int[graph.size()];
        int[] level = new int[graph.size()];
        Arrays.fill(exportId, UNASSIGNED);

        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        int nextId = 0;
        int endId = UNASSIGNED;
        int endLevel = 0;

        LatticeNode root = graph.root();
        exportId[root.getId()] = nextId++;
        level[root.getId()] = 0;
        nodes.add(toGraphNode(exportId[root.getId()], root.getKind(), root.label(), 0));

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root.getId());
        while (!queue.isEmpty()) {
            int id = queue.poll();
            LatticeNode node = graph.node(id);
            int source = exportId[id];

            for (int childId : node.getTransitions().values()) {
                LatticeNode child = graph.node(childId);
                if (exportId[childId] == UNASSIGNED) {
                    exportId[childId] = nextId++;
                    level[childId] = level[id] + 1;
                    nodes.add(toGraphNode(exportId[childId], child.getKind(), child.label(), level[childId]));
                    queue.add(childId);
                }
                edges.add(GraphEdge.of(source, exportId[childId], child.label()));
            }

            if (node.isTerminal()) {
                if (endId == UNASSIGNED) {
                    endId = nextId++;
                    endLevel = level[id] + 1;
                    nodes.add(toGraphNode(endId, NodeKind.END, NodeKind.END.label('\0'), endLevel));
                }
                edges.add(GraphEdge.of(source, endId, NodeKind.END.label('\0')));
            }
        }

        int maxLevel = nodes.stream().mapToInt(GraphNode::getLevel).max().orElse(0);
        log.debug("Exported lattice: {} nodes, {} edges, max level {}", nodes.size(), edges.size(), maxLevel);

        return LatticeSnapshot.builder()
                .nodes(nodes)
                .edges(edges)
                .metadata(GraphMetadata.builder()
                        .nodeCount(nodes.size())
                        .edgeCount(edges.size())
                        .maxLevel(maxLevel)
                        .build())
                .truncated(false)
                .build();
    }

    /**
     * Display view limited to the first {@code maxNodes} nodes in id order.
     * Edges with a dropped endpoint are removed. Not valid for traversal or verification.
     */
    public LatticeSnapshot truncate(LatticeSnapshot snapshot, int maxNodes) {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive");
        }
        if (snapshot.getNodes().size() <= maxNodes) {
            return snapshot;
        }

        List<GraphNode> kept = snapshot.getNodes().stream()
                .sorted(Comparator.comparingInt(GraphNode::getId))
                .limit(maxNodes)
                .toList();
        Set<Integer> keptIds = new HashSet<>();
        kept.forEach(node -> keptIds.add(node.getId()));

        List<GraphEdge> keptEdges = snapshot.getEdges().stream()
                .filter(edge -> keptIds.contains(edge.getSource()) && keptIds.contains(edge.getTarget()))
                .toList();

        log.warn("Lattice has {} nodes, displaying {} after truncation to {}",
                snapshot.getNodes().size(), kept.size(), maxNodes);

        return LatticeSnapshot.builder()
                .nodes(kept)
                .edges(keptEdges)
                .metadata(snapshot.getMetadata())
                .truncated(true)
                .build();
    }

    private GraphNode toGraphNode(int id, NodeKind kind, String label, int level) {
        return GraphNode.builder()
                .id(id)
                .label(label)
                .kind(kind)
                .level(level)
                .build();
    }
}
