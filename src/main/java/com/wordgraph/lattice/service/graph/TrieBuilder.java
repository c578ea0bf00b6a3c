package com.wordgraph.lattice.service.graph;

import com.wordgraph.lattice.model.LatticeGraph;
import com.wordgraph.lattice.model.LatticeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Assembles the raw trie: one path per word from the shared root, new nodes only where paths diverge.
 *
 * Transitions are kept in character order, so the resulting shape does not depend on the
 * order in which words arrive. Inserting the same word twice is a no-op.
 */
@Service
@Slf4j
public class TrieBuilder {

    /**
     * Build a raw trie from already validated words.
     */
    public LatticeGraph build(Iterable<String> words) {
        LatticeGraph trie = new LatticeGraph();
        int inserted = 0;
        for (String word : words) {
            insert(trie, word);
            inserted++;
        }
        log.debug("Raw trie built from {} words: {} nodes, {} terminal", inserted, trie.size(), trie.terminalCount());
        return trie;
    }

    /**
     * Insert one word into an existing trie.
     */
    public void insert(LatticeGraph trie, String word) {
        if (word == null || word.isEmpty()) {
            throw new IllegalArgumentException("Cannot insert an empty word");
        }

        LatticeNode current = trie.root();
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            Integer next = current.child(c);
            if (next == null) {
                LatticeNode created = trie.addNode(c, i + 1);
                current.link(c, created.getId());
                current = created;
            } else {
                current = trie.node(next);
            }
        }
        current.setTerminal(true);
    }
}
