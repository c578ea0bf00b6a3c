package com.wordgraph.lattice.service.graph;

import com.wordgraph.lattice.config.LatticeSettings;
import com.wordgraph.lattice.dto.graph.GraphNode;
import com.wordgraph.lattice.dto.graph.LatticeSnapshot;
import com.wordgraph.lattice.model.LatticeGraph;
import com.wordgraph.lattice.model.LatticeNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SuffixCanonicalizerTest {

    private final TrieBuilder trieBuilder = new TrieBuilder();
    private final SuffixCanonicalizer canonicalizer = new SuffixCanonicalizer();
    private final GraphExporter exporter = new GraphExporter();
    private final IntegrityChecker integrityChecker =
            new IntegrityChecker(new PathTraversalService(LatticeSettings.defaults()));

    @Test
    void sharesCommonSuffix_whenWordsDifferOnlyInFirstLetter() {
        List<String> words = List.of("cats", "rats", "bats");
        LatticeGraph trie = trieBuilder.build(words);
        LatticeGraph minimized = canonicalizer.minimize(trie);

        LatticeSnapshot snapshot = exporter.export(minimized);

        // ROOT + b, c, r + a, t, s + END
        assertThat(snapshot.getNodes()).hasSize(8);
        assertThat(snapshot.getNodes().size()).isLessThan(trie.size());

        int c = minimized.root().child('c');
        int r = minimized.root().child('r');
        int b = minimized.root().child('b');
        assertThat(List.of(c, r, b)).doesNotHaveDuplicates();
        assertThat(minimized.node(c).child('a'))
                .isEqualTo(minimized.node(r).child('a'))
                .isEqualTo(minimized.node(b).child('a'));

        long sharedA = snapshot.getNodes().stream().filter(n -> n.getLabel().equals("a")).count();
        assertThat(sharedA).isEqualTo(1);
        assertThat(integrityChecker.verify(minimized, words).isPassed()).isTrue();
    }

    @Test
    void keepsTerminalAndNonTerminalNodesApart_whenOtherwiseIdentical() {
        // "a" after c ends a word, "a" after d does not; both continue with "b"
        List<String> words = List.of("cab", "dab", "ca");
        LatticeGraph minimized = canonicalizer.minimize(trieBuilder.build(words));

        LatticeNode c = minimized.node(minimized.root().child('c'));
        LatticeNode d = minimized.node(minimized.root().child('d'));
        assertThat(c.child('a')).isNotEqualTo(d.child('a'));
        assertThat(minimized.node(c.child('a')).child('b')).isEqualTo(minimized.node(d.child('a')).child('b'));

        // root, c, d, two distinct a's, one shared b
        assertThat(minimized.size()).isEqualTo(6);
        assertThat(integrityChecker.verify(minimized, words).getUnexpectedWords()).isEmpty();
    }

    @Test
    void doesNotMergeNodesWithDifferentLabels_whenChildrenMatch() {
        List<String> words = List.of("xa", "ya");
        LatticeGraph minimized = canonicalizer.minimize(trieBuilder.build(words));

        assertThat(minimized.root().child('x')).isNotEqualTo(minimized.root().child('y'));
        assertThat(minimized.size()).isEqualTo(4);
    }

    @Test
    void changesNothing_whenGraphIsAlreadyMinimal() {
        LatticeGraph once = canonicalizer.minimize(trieBuilder.build(
                List.of("walk", "walked", "walking", "talk", "talked", "talking", "stalk")));
        LatticeGraph twice = canonicalizer.minimize(once);

        assertThat(twice.size()).isEqualTo(once.size());
        assertThat(twice.transitionCount()).isEqualTo(once.transitionCount());

        LatticeSnapshot first = exporter.export(once);
        LatticeSnapshot second = exporter.export(twice);
        assertThat(second.getNodes()).isEqualTo(first.getNodes());
        assertThat(second.getEdges()).isEqualTo(first.getEdges());
    }

    @Test
    void leavesInputGraphUntouched() {
        LatticeGraph trie = trieBuilder.build(List.of("cats", "rats"));
        int sizeBefore = trie.size();
        int transitionsBefore = trie.transitionCount();

        canonicalizer.minimize(trie);

        assertThat(trie.size()).isEqualTo(sizeBefore);
        assertThat(trie.transitionCount()).isEqualTo(transitionsBefore);
    }

    @Test
    void computesHeightsFromLeaves() {
        LatticeGraph trie = trieBuilder.build(List.of("ab", "c"));
        int[] heights = canonicalizer.computeHeights(trie);

        LatticeNode a = trie.node(trie.root().child('a'));
        assertThat(heights[LatticeGraph.ROOT_ID]).isEqualTo(2);
        assertThat(heights[a.getId()]).isEqualTo(1);
        assertThat(heights[a.child('b')]).isZero();
        assertThat(heights[trie.root().child('c')]).isZero();
    }

    @Test
    void preservesWordSet_forRandomDictionaries() {
        Random random = new Random(42);
        for (int round = 0; round < 25; round++) {
            Set<String> words = new LinkedHashSet<>();
            int count = 1 + random.nextInt(60);
            while (words.size() < count) {
                int length = 1 + random.nextInt(7);
                StringBuilder word = new StringBuilder();
                for (int i = 0; i < length; i++) {
                    word.append((char) ('a' + random.nextInt(4)));
                }
                words.add(word.toString());
            }

            LatticeGraph trie = trieBuilder.build(words);
            LatticeGraph minimized = canonicalizer.minimize(trie);

            assertThat(integrityChecker.verify(minimized, words).isPassed())
                    .withFailMessage("Minimization changed the word set of %s", words)
                    .isTrue();
            assertThat(minimized.size()).isLessThanOrEqualTo(trie.size());

            List<String> labels = new ArrayList<>();
            for (GraphNode node : exporter.export(minimized).getNodes()) {
                labels.add(node.getLabel());
            }
            assertThat(labels).containsOnlyOnce("ROOT", "END");
        }
    }
}
