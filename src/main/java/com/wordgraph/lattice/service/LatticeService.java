package com.wordgraph.lattice.service;

import com.wordgraph.lattice.config.LatticeSettings;
import com.wordgraph.lattice.dto.BuildLatticeRequest;
import com.wordgraph.lattice.dto.BuildLatticeResponse;
import com.wordgraph.lattice.dto.LatticeSummary;
import com.wordgraph.lattice.dto.WordListResponse;
import com.wordgraph.lattice.dto.graph.GraphMetadata;
import com.wordgraph.lattice.dto.graph.LatticeSnapshot;
import com.wordgraph.lattice.dto.graph.NodeNeighborhoodResponse;
import com.wordgraph.lattice.dto.graph.NodePathsResponse;
import com.wordgraph.lattice.exception.LatticeNotFoundException;
import com.wordgraph.lattice.model.LatticeGraph;
import com.wordgraph.lattice.model.SnapshotIndex;
import com.wordgraph.lattice.model.StoredLattice;
import com.wordgraph.lattice.repository.LatticeRepository;
import com.wordgraph.lattice.service.graph.GraphExporter;
import com.wordgraph.lattice.service.graph.IntegrityChecker;
import com.wordgraph.lattice.service.graph.PathSet;
import com.wordgraph.lattice.service.graph.PathTraversalService;
import com.wordgraph.lattice.service.graph.SuffixCanonicalizer;
import com.wordgraph.lattice.service.graph.TrieBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Orchestrates lattice construction and serves queries over stored lattices.
 *
 * Flow:
 * 1. Validate and normalize the word records
 * 2. Build the raw trie
 * 3. Canonicalize shared suffixes
 * 4. Verify the minimized graph (fatal on failure, nothing is exported)
 * 5. Export the node/edge snapshot
 * 6. Re-verify the snapshot through traversal
 * 7. Store it for querying until it expires
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LatticeService {

    private final InputValidator inputValidator;
    private final TrieBuilder trieBuilder;
    private final SuffixCanonicalizer suffixCanonicalizer;
    private final IntegrityChecker integrityChecker;
    private final GraphExporter graphExporter;
    private final PathTraversalService pathTraversalService;
    private final LatticeRepository latticeRepository;
    private final LatticeSettings settings;

    public BuildLatticeResponse buildLattice(BuildLatticeRequest request) {
        ValidatedInput input = inputValidator.validate(request.getWords(), request.isFailFast());
        String latticeId = UUID.randomUUID().toString().substring(0, 8);
        log.info("Building lattice {} from {} records ({} distinct words, {} rejected)",
                latticeId, input.getRecordCount(), input.getWords().size(), input.getRejectedRecords().size());

        LatticeSnapshot snapshot = construct(input);
        SnapshotIndex index = SnapshotIndex.of(snapshot);
        integrityChecker.requireSnapshotIntegrity(index, input.getWords());

        LocalDateTime now = LocalDateTime.now();
        StoredLattice stored = latticeRepository.save(StoredLattice.builder()
                .latticeId(latticeId)
                .snapshot(snapshot)
                .index(index)
                .words(input.getWords())
                .rejectedRecords(input.getRejectedRecords())
                .createdAt(now)
                .expiresAt(now.plusHours(settings.getTtlHours()))
                .build());

        GraphMetadata metadata = snapshot.getMetadata();
        log.info("Lattice {} ready: {} raw nodes minimized to {} ({} edges) in {} ms",
                latticeId, metadata.getRawNodeCount(), metadata.getNodeCount(),
                metadata.getEdgeCount(), metadata.getBuildMillis());

        return BuildLatticeResponse.builder()
                .latticeId(stored.getLatticeId())
                .metadata(metadata)
                .rejectedRecords(stored.getRejectedRecords())
                .createdAt(stored.getCreatedAt())
                .expiresAt(stored.getExpiresAt())
                .build();
    }

    /**
     * Run build, minimize, verify and export over validated input without storing the result.
     */
    public LatticeSnapshot construct(ValidatedInput input) {
        long t0 = System.nanoTime();

        LatticeGraph trie = trieBuilder.build(input.getWords());
        LatticeGraph minimized = suffixCanonicalizer.minimize(trie);
        integrityChecker.requireIntegrity(minimized, input.getWords());
        LatticeSnapshot exported = graphExporter.export(minimized);

        long ms = (System.nanoTime() - t0) / 1_000_000;
        GraphMetadata metadata = exported.getMetadata().toBuilder()
                .inputRecordCount(input.getRecordCount())
                .distinctWordCount(input.getWords().size())
                .rejectedRecordCount(input.getRejectedRecords().size())
                .rawNodeCount(trie.size())
                .mergedNodeCount(trie.size() - minimized.size())
                .buildMillis(ms)
                .build();
        return exported.toBuilder().metadata(metadata).build();
    }

    /**
     * Full snapshot, or a truncated display view when {@code maxNodes} is given.
     */
    public LatticeSnapshot getSnapshot(String latticeId, Integer maxNodes) {
        StoredLattice lattice = findLattice(latticeId);
        if (maxNodes == null) {
            return lattice.getSnapshot();
        }
        return graphExporter.truncate(lattice.getSnapshot(), maxNodes);
    }

    public LatticeSnapshot getDisplaySnapshot(String latticeId) {
        return getSnapshot(latticeId, settings.getDefaultMaxExportNodes());
    }

    public NodePathsResponse getNodePaths(String latticeId, int nodeId) {
        StoredLattice lattice = findLattice(latticeId);
        log.debug("Reconstructing paths through node {} of lattice {}", nodeId, latticeId);
        return pathTraversalService.paths(lattice.getIndex(), nodeId);
    }

    public NodeNeighborhoodResponse getNeighborhood(String latticeId, int nodeId) {
        StoredLattice lattice = findLattice(latticeId);
        return pathTraversalService.neighborhood(lattice.getIndex(), nodeId);
    }

    public WordListResponse listWords(String latticeId) {
        StoredLattice lattice = findLattice(latticeId);
        PathSet words = pathTraversalService.allWords(lattice.getIndex(), settings.getMaxTraversalResults());
        return WordListResponse.builder()
                .latticeId(latticeId)
                .count(words.getValues().size())
                .words(words.getValues())
                .truncated(words.isTruncated())
                .build();
    }

    /**
     * Live lattices, newest first.
     */
    public List<LatticeSummary> listLattices() {
        LocalDateTime now = LocalDateTime.now();
        return latticeRepository.findAllOrderByCreatedAtDesc().stream()
                .filter(lattice -> !lattice.isExpired(now))
                .map(this::toSummary)
                .toList();
    }

    public void deleteLattice(String latticeId) {
        if (!latticeRepository.deleteById(latticeId)) {
            throw new LatticeNotFoundException("Lattice not found: " + latticeId);
        }
        log.info("Deleted lattice {}", latticeId);
    }

    /**
     * Remove lattices past their TTL. Returns the number removed.
     */
    public int cleanupExpiredLattices() {
        List<StoredLattice> expired = latticeRepository.findByExpiresAtBefore(LocalDateTime.now());
        for (StoredLattice lattice : expired) {
            latticeRepository.deleteById(lattice.getLatticeId());
            log.debug("Evicted expired lattice {}", lattice.getLatticeId());
        }
        if (!expired.isEmpty()) {
            log.info("Evicted {} expired lattices, {} still stored", expired.size(), latticeRepository.count());
        }
        return expired.size();
    }

    private LatticeSummary toSummary(StoredLattice lattice) {
        GraphMetadata metadata = lattice.getSnapshot().getMetadata();
        return LatticeSummary.builder()
                .latticeId(lattice.getLatticeId())
                .wordCount(lattice.getWords().size())
                .rejectedRecordCount(lattice.getRejectedRecords().size())
                .nodeCount(metadata.getNodeCount())
                .edgeCount(metadata.getEdgeCount())
                .createdAt(lattice.getCreatedAt())
                .expiresAt(lattice.getExpiresAt())
                .build();
    }

    private StoredLattice findLattice(String latticeId) {
        StoredLattice lattice = latticeRepository.findById(latticeId)
                .orElseThrow(() -> new LatticeNotFoundException("Lattice not found: " + latticeId));
        if (lattice.isExpired(LocalDateTime.now())) {
            throw new LatticeNotFoundException("Lattice expired: " + latticeId);
        }
        return lattice;
    }
}
