package com.wordgraph.lattice.service.graph;

import com.wordgraph.lattice.dto.graph.GraphEdge;
import com.wordgraph.lattice.dto.graph.GraphNode;
import com.wordgraph.lattice.dto.graph.IntegrityReport;
import com.wordgraph.lattice.exception.IntegrityViolationException;
import com.wordgraph.lattice.model.LatticeGraph;
import com.wordgraph.lattice.model.LatticeNode;
import com.wordgraph.lattice.model.SnapshotIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Proves that a minimized lattice still encodes exactly its input words.
 *
 * Two checks:
 * 1. Acyclicity: DFS with an active-stack set, reporting a witness path on the first back edge
 * 2. Language: every root-to-terminal path spelled out and compared with the distinct input words
 *
 * The language check only runs on an acyclic graph, so path enumeration always terminates.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IntegrityChecker {

    private final PathTraversalService pathTraversalService;

    /**
     * Verify a minimized arena against the words it was built from.
     */
    public IntegrityReport verify(LatticeGraph graph, Collection<String> words) {
        Set<String> expected = new TreeSet<>(words);
        IntegrityReport.IntegrityReportBuilder report = IntegrityReport.builder()
                .expectedWordCount(expected.size());

        Optional<List<Integer>> cycle = findCycle(LatticeGraph.ROOT_ID,
                id -> new ArrayList<>(graph.node(id).getTransitions().values()));
        if (cycle.isPresent()) {
            cycle.get().forEach(id -> report.cycleStep(graph.node(id).label()));
            return report.build();
        }

        return compare(report, expected, spell(graph)).build();
    }

    /**
     * Verify an exported snapshot: one ROOT reaching every node, no cycle, exact word set.
     */
    public IntegrityReport verifySnapshot(SnapshotIndex index, Collection<String> words) {
        Set<String> expected = new TreeSet<>(words);
        IntegrityReport.IntegrityReportBuilder report = IntegrityReport.builder()
                .expectedWordCount(expected.size());

        boolean dangling = false;
        for (GraphEdge edge : index.snapshot().getEdges()) {
            for (int endpoint : new int[]{edge.getSource(), edge.getTarget()}) {
                if (!index.contains(endpoint)) {
                    report.unreachableNodeId(endpoint);
                    dangling = true;
                }
            }
        }
        if (dangling) {
            return report.build();
        }

        int rootId = index.root().getId();
        Optional<List<Integer>> cycle = findCycle(rootId, index::outgoing);
        if (cycle.isPresent()) {
            cycle.get().forEach(id -> report.cycleStep(index.node(id).getLabel()));
            return report.build();
        }

        for (GraphNode node : index.snapshot().getNodes()) {
            if (!node.isRoot() && index.incoming(node.getId()).isEmpty()) {
                report.unreachableNodeId(node.getId());
            }
        }

        PathSet spelled = pathTraversalService.allWords(index, Integer.MAX_VALUE);
        return compare(report, expected, new TreeSet<>(spelled.getValues())).build();
    }

    /**
     * Verify and throw if the graph does not encode exactly {@code words}.
     */
    public void requireIntegrity(LatticeGraph graph, Collection<String> words) {
        IntegrityReport report = verify(graph, words);
        if (!report.isPassed()) {
            log.error("Minimized lattice failed integrity check: {}", report.describe());
            throw new IntegrityViolationException(report);
        }
        log.debug("Integrity check passed: {}", report.describe());
    }

    public void requireSnapshotIntegrity(SnapshotIndex index, Collection<String> words) {
        IntegrityReport report = verifySnapshot(index, words);
        if (!report.isPassed()) {
            log.error("Exported snapshot failed round-trip check: {}", report.describe());
            throw new IntegrityViolationException(report);
        }
    }

    private IntegrityReport.IntegrityReportBuilder compare(IntegrityReport.IntegrityReportBuilder report,
                                                          Set<String> expected, Set<String> actual) {
        report.reconstructedWordCount(actual.size());
        for (String word : expected) {
            if (!actual.contains(word)) report.missingWord(word);
        }
        for (String word : actual) {
            if (!expected.contains(word)) report.unexpectedWord(word);
        }
        return report;
    }

    /**
     * Every word the arena spells, by explicit-stack DFS. Only called once the graph is known acyclic.
     */
    private Set<String> spell(LatticeGraph graph) {
        Set<String> words = new TreeSet<>();
        StringBuilder path = new StringBuilder();
        Deque<Iterator<Integer>> frames = new ArrayDeque<>();

        if (graph.root().isTerminal()) {
            words.add("");
        }
        frames.push(graph.root().getTransitions().values().iterator());
        while (!frames.isEmpty()) {
            Iterator<Integer> children = frames.peek();
            if (!children.hasNext()) {
                frames.pop();
                if (path.length() > 0) {
                    path.setLength(path.length() - 1);
                }
                continue;
            }

            LatticeNode child = graph.node(children.next());
            path.append(child.getSymbol());
            if (child.isTerminal()) {
                words.add(path.toString());
            }
            frames.push(child.getTransitions().values().iterator());
        }
        return words;
    }

    /**
     * Find a cycle reachable from {@code start}.
     * Returns the node ids along the cycle with the first id repeated at the end.
     */
    Optional<List<Integer>> findCycle(int start, Function<Integer, ? extends Iterable<Integer>> successors) {
        Set<Integer> visited = new HashSet<>();
        Set<Integer> inStack = new HashSet<>();
        List<Integer> path = new ArrayList<>();
        Deque<Iterator<Integer>> frames = new ArrayDeque<>();

        visited.add(start);
        inStack.add(start);
        path.add(start);
        frames.push(successors.apply(start).iterator());

        while (!frames.isEmpty()) {
            Iterator<Integer> neighbors = frames.peek();
            if (!neighbors.hasNext()) {
                frames.pop();
                inStack.remove(path.remove(path.size() - 1));
                continue;
            }

            int next = neighbors.next();
            if (inStack.contains(next)) {
                List<Integer> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return Optional.of(cycle);
            }
            if (visited.add(next)) {
                inStack.add(next);
                path.add(next);
                frames.push(successors.apply(next).iterator());
            }
        }
        return Optional.empty();
    }
}
