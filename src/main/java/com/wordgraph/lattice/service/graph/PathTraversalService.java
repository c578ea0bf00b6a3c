package com.wordgraph.lattice.service.graph;

import com.wordgraph.lattice.config.LatticeSettings;
import com.wordgraph.lattice.dto.graph.GraphNode;
import com.wordgraph.lattice.dto.graph.NodeNeighborhoodResponse;
import com.wordgraph.lattice.dto.graph.NodePathsResponse;
import com.wordgraph.lattice.model.SnapshotIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Reconstructs strings around a pivot node of an exported lattice.
 *
 * Prefixes walk incoming edges back to ROOT and include the pivot's own character.
 * Suffixes walk outgoing edges forward to END and start after the pivot.
 * Words through the pivot are every prefix joined with every suffix.
 *
 * Walks keep their own stack instead of recursing, and terminate because the snapshot passed
 * the acyclicity check before it was published. The lattice is deterministic,
 * so every path yields a distinct string and the work done is proportional to the output.
 * Every list is capped; the lexicographically smallest values are kept.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PathTraversalService {

    private final LatticeSettings settings;

    /**
     * Prefixes, suffixes and words through a node, capped at the configured result limit.
     */
    public NodePathsResponse paths(SnapshotIndex index, int nodeId) {
        GraphNode node = index.node(nodeId);
        int limit = settings.getMaxTraversalResults();

        PathSet prefixes = prefixes(index, nodeId, limit);
        PathSet suffixes = suffixes(index, nodeId, limit);
        PathSet words = join(prefixes.getValues(), suffixes.getValues(), limit);

        boolean truncated = prefixes.isTruncated() || suffixes.isTruncated() || words.isTruncated();
        if (truncated) {
            log.warn("Path query on node {} hit the result cap of {}", nodeId, limit);
        }

        return NodePathsResponse.builder()
                .node(node)
                .prefixes(prefixes.getValues())
                .suffixes(suffixes.getValues())
                .words(words.getValues())
                .truncated(truncated)
                .build();
    }

    public PathSet prefixes(SnapshotIndex index, int nodeId, int limit) {
        index.node(nodeId);
        Walk walk = new Walk(limit);
        List<String> values = prefixWalk(index, nodeId, walk);
        return new PathSet(values, walk.truncated);
    }

    public PathSet suffixes(SnapshotIndex index, int nodeId, int limit) {
        index.node(nodeId);
        Walk walk = new Walk(limit);
        List<String> values = suffixWalk(index, nodeId, walk);
        return new PathSet(values, walk.truncated);
    }

    public PathSet wordsThrough(SnapshotIndex index, int nodeId, int limit) {
        PathSet prefixes = prefixes(index, nodeId, limit);
        PathSet suffixes = suffixes(index, nodeId, limit);
        PathSet words = join(prefixes.getValues(), suffixes.getValues(), limit);
        return new PathSet(words.getValues(),
                prefixes.isTruncated() || suffixes.isTruncated() || words.isTruncated());
    }

    /**
     * Every word the snapshot spells, i.e. the suffixes of ROOT.
     */
    public PathSet allWords(SnapshotIndex index, int limit) {
        return suffixes(index, index.root().getId(), limit);
    }

    public NodeNeighborhoodResponse neighborhood(SnapshotIndex index, int nodeId) {
        GraphNode node = index.node(nodeId);
        return NodeNeighborhoodResponse.builder()
                .node(node)
                .ancestorIds(reachable(nodeId, index::incoming))
                .descendantIds(reachable(nodeId, index::outgoing))
                .build();
    }

    /**
     * Explicit-stack DFS forward to END. Children are taken in label order with END first, so
     * suffixes come out in lexicographic order and the walk stops once the cap is exceeded.
     */
    private List<String> suffixWalk(SnapshotIndex index, int start, Walk walk) {
        if (index.node(start).isEnd()) {
            walk.add("");
            return walk.values();
        }

        StringBuilder path = new StringBuilder();
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(byLabel(index, index.outgoing(start)), 0));
        while (!frames.isEmpty() && !walk.truncated) {
            Frame frame = frames.peek();
            if (!frame.pending.hasNext()) {
                frames.pop();
                path.setLength(frame.mark);
                continue;
            }

            GraphNode child = index.node(frame.pending.next());
            if (child.isEnd()) {
                walk.add(path.toString());
                continue;
            }
            int mark = path.length();
            path.append(child.text());
            frames.push(new Frame(byLabel(index, index.outgoing(child.getId())), mark));
        }
        return walk.values();
    }

    /**
     * Explicit-stack DFS backward to ROOT. Characters are collected in reverse and flipped on arrival.
     */
    private List<String> prefixWalk(SnapshotIndex index, int start, Walk walk) {
        GraphNode pivot = index.node(start);
        if (pivot.isRoot()) {
            walk.add("");
            return walk.values();
        }

        StringBuilder reversed = new StringBuilder(pivot.text());
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(index.incoming(start).iterator(), reversed.length()));
        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (!frame.pending.hasNext()) {
                frames.pop();
                reversed.setLength(frame.mark);
                continue;
            }

            GraphNode parent = index.node(frame.pending.next());
            if (parent.isRoot()) {
                walk.add(new StringBuilder(reversed).reverse().toString());
                continue;
            }
            int mark = reversed.length();
            reversed.append(parent.text());
            frames.push(new Frame(index.incoming(parent.getId()).iterator(), mark));
        }
        return walk.values();
    }

    private Iterator<Integer> byLabel(SnapshotIndex index, List<Integer> ids) {
        List<Integer> sorted = new ArrayList<>(ids);
        sorted.sort(Comparator.comparing((Integer id) -> index.node(id).text()));
        return sorted.iterator();
    }

    private PathSet join(List<String> prefixes, List<String> suffixes, int limit) {
        Walk walk = new Walk(limit);
        for (String prefix : prefixes) {
            for (String suffix : suffixes) {
                walk.add(prefix + suffix);
            }
        }
        return new PathSet(walk.values(), walk.truncated);
    }

    private List<Integer> reachable(int start, Function<Integer, List<Integer>> next) {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            for (int neighbor : next.apply(queue.poll())) {
                if (seen.add(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }
        seen.remove(start);
        List<Integer> ids = new ArrayList<>(seen);
        Collections.sort(ids);
        return ids;
    }

    /**
     * Capped, sorted result set for one walk.
     */
    private static final class Walk {
        private final int limit;
        private final TreeSet<String> out = new TreeSet<>();
        private boolean truncated;

        private Walk(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            this.limit = limit;
        }

        private void add(String value) {
            out.add(value);
            if (out.size() > limit) {
                out.pollLast();
                truncated = true;
            }
        }

        private List<String> values() {
            return List.copyOf(out);
        }
    }

    /**
     * Remaining neighbors of one node on the DFS stack, and the path length to restore when it is popped.
     */
    private static final class Frame {
        private final Iterator<Integer> pending;
        private final int mark;

        private Frame(Iterator<Integer> pending, int mark) {
            this.pending = pending;
            this.mark = mark;
        }
    }
}
