package com.wordgraph.lattice.service.graph;

import com.wordgraph.lattice.model.LatticeGraph;
import com.wordgraph.lattice.model.LatticeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimizes a trie (or an already shared lattice) by merging nodes with equal signatures.
 *
 * Nodes are visited by ascending height, i.e. longest distance to a leaf, so every child
 * already has its canonical id when its parent's signature is computed. The first node seen
 * for a signature becomes the representative and keeps that role for the whole pass.
 * The result is a fresh, compacted arena; the input graph is left untouched.
 */
@Service
@Slf4j
public class SuffixCanonicalizer {

    private static final int UNVISITED = -1;
    private static final int IN_PROGRESS = -2;

    public LatticeGraph minimize(LatticeGraph graph) {
        int[] height = computeHeights(graph);
        List<List<Integer>> byHeight = bucketByHeight(height);

        int[] canonical = new int[graph.size()];
        Arrays.fill(canonical, UNVISITED);
        NodeSignature[] representativeSignatures = new NodeSignature[graph.size()];
        Map<NodeSignature, Integer> table = new HashMap<>();
        int merged = 0;

        for (List<Integer> bucket : byHeight) {
            for (int id : bucket) {
                NodeSignature signature = signatureOf(graph.node(id), canonical);
                Integer representative = table.putIfAbsent(signature, id);
                if (representative == null) {
                    canonical[id] = id;
                    representativeSignatures[id] = signature;
                } else {
                    canonical[id] = representative;
                    merged++;
                }
            }
        }

        LatticeGraph minimized = compact(graph, canonical, representativeSignatures);
        log.debug("Canonicalized {} nodes into {} ({} merged, {} unreachable pruned), transitions {} -> {}",
                graph.size(), minimized.size(), merged, graph.size() - minimized.size() - merged,
                graph.transitionCount(), minimized.transitionCount());
        return minimized;
    }

    private NodeSignature signatureOf(LatticeNode node, int[] canonical) {
        List<NodeSignature.Transition> transitions = new ArrayList<>(node.getTransitions().size());
        for (Map.Entry<Character, Integer> entry : node.getTransitions().entrySet()) {
            int child = canonical[entry.getValue()];
            if (child == UNVISITED) {
                throw new IllegalStateException("Child " + entry.getValue() + " of node " + node.getId()
                        + " was not canonicalized before its parent");
            }
            transitions.add(new NodeSignature.Transition(entry.getKey(), child));
        }
        return new NodeSignature(node.getKind(), node.getSymbol(), node.isTerminal(), transitions);
    }

    /**
     * Height of every node reachable from the root, UNVISITED for the rest.
     * Iterative post-order; a cycle is an IllegalStateException.
     */
    int[] computeHeights(LatticeGraph graph) {
        int[] height = new int[graph.size()];
        Arrays.fill(height, UNVISITED);

        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(LatticeGraph.ROOT_ID);
        while (!stack.isEmpty()) {
            int id = stack.peek();
            LatticeNode node = graph.node(id);
            if (height[id] == UNVISITED) {
                height[id] = IN_PROGRESS;
                for (int child : node.getTransitions().values()) {
                    if (height[child] == IN_PROGRESS) {
                        throw new IllegalStateException("Cycle through node " + child + " while computing heights");
                    }
                    if (height[child] == UNVISITED) {
                        stack.push(child);
                    }
                }
            } else if (height[id] == IN_PROGRESS) {
                int h = 0;
                for (int child : node.getTransitions().values()) {
                    h = Math.max(h, height[child] + 1);
                }
                height[id] = h;
                stack.pop();
            } else {
                stack.pop();
            }
        }
        return height;
    }

    private List<List<Integer>> bucketByHeight(int[] height) {
        int max = 0;
        for (int h : height) max = Math.max(max, h);

        List<List<Integer>> buckets = new ArrayList<>(max + 1);
        for (int i = 0; i <= max; i++) buckets.add(new ArrayList<>());
        for (int id = 0; id < height.length; id++) {
            if (height[id] >= 0) {
                buckets.get(height[id]).add(id);
            }
        }
        return buckets;
    }

    /**
     * Copy the representatives reachable from the root into a new arena in BFS order.
     */
    private LatticeGraph compact(LatticeGraph graph, int[] canonical, NodeSignature[] signatures) {
        LatticeGraph out = new LatticeGraph();
        int[] remap = new int[graph.size()];
        Arrays.fill(remap, UNVISITED);

        int root = canonical[LatticeGraph.ROOT_ID];
        remap[root] = LatticeGraph.ROOT_ID;

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int id = queue.poll();
            NodeSignature signature = signatures[id];
            LatticeNode copy = out.node(remap[id]);
            copy.setTerminal(signature.terminal());

            for (NodeSignature.Transition transition : signature.transitions()) {
                int target = transition.target();
                if (remap[target] == UNVISITED) {
                    LatticeNode original = graph.node(target);
                    remap[target] = out.addNode(original.getSymbol(), original.getDepth()).getId();
                    queue.add(target);
                }
                copy.link(transition.symbol(), remap[target]);
            }
        }
        return out;
    }
}
