package com.wordgraph.lattice.controller;

import com.wordgraph.lattice.dto.BuildLatticeRequest;
import com.wordgraph.lattice.dto.BuildLatticeResponse;
import com.wordgraph.lattice.dto.LatticeSummary;
import com.wordgraph.lattice.dto.WordListResponse;
import com.wordgraph.lattice.dto.graph.LatticeSnapshot;
import com.wordgraph.lattice.dto.graph.NodeNeighborhoodResponse;
import com.wordgraph.lattice.dto.graph.NodePathsResponse;
import com.wordgraph.lattice.service.LatticeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for building lattices and querying their exported graphs.
 */
@RestController
@RequestMapping("/api/lattices")
@RequiredArgsConstructor
@Slf4j
public class LatticeController {

    private final LatticeService latticeService;

    /**
     * Build a lattice from a word list.
     * Malformed records are skipped and reported unless failFast is set.
     */
    @PostMapping
    public ResponseEntity<BuildLatticeResponse> buildLattice(@Valid @RequestBody BuildLatticeRequest request) {
        log.info("Building lattice from {} records, failFast: {}", request.getWords().size(), request.isFailFast());
        BuildLatticeResponse response = latticeService.buildLattice(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * List live lattices, newest first.
     */
    @GetMapping
    public ResponseEntity<List<LatticeSummary>> listLattices() {
        log.info("Listing lattices");
        return ResponseEntity.ok(latticeService.listLattices());
    }

    /**
     * Get the exported node/edge snapshot.
     *
     * @param maxNodes Optional cap; when set, returns a truncated display view
     */
    @GetMapping("/{latticeId}/graph")
    public ResponseEntity<LatticeSnapshot> getGraph(
            @PathVariable String latticeId,
            @RequestParam(required = false) Integer maxNodes) {
        log.info("Getting graph for lattice: {}, maxNodes: {}", latticeId, maxNodes);
        return ResponseEntity.ok(latticeService.getSnapshot(latticeId, maxNodes));
    }

    /**
     * Get the snapshot capped at the configured display size.
     */
    @GetMapping("/{latticeId}/visualization")
    public ResponseEntity<LatticeSnapshot> getVisualization(@PathVariable String latticeId) {
        log.info("Getting visualization for lattice: {}", latticeId);
        return ResponseEntity.ok(latticeService.getDisplaySnapshot(latticeId));
    }

    /**
     * Get prefixes, suffixes and generated words through a node.
     */
    @GetMapping("/{latticeId}/nodes/{nodeId}/paths")
    public ResponseEntity<NodePathsResponse> getNodePaths(@PathVariable String latticeId, @PathVariable int nodeId) {
        log.info("Getting paths for lattice: {}, node: {}", latticeId, nodeId);
        return ResponseEntity.ok(latticeService.getNodePaths(latticeId, nodeId));
    }

    /**
     * Get ancestor and descendant node ids of a node.
     */
    @GetMapping("/{latticeId}/nodes/{nodeId}/neighborhood")
    public ResponseEntity<NodeNeighborhoodResponse> getNeighborhood(@PathVariable String latticeId, @PathVariable int nodeId) {
        log.info("Getting neighborhood for lattice: {}, node: {}", latticeId, nodeId);
        return ResponseEntity.ok(latticeService.getNeighborhood(latticeId, nodeId));
    }

    @GetMapping("/{latticeId}/words")
    public ResponseEntity<WordListResponse> listWords(@PathVariable String latticeId) {
        log.info("Listing words for lattice: {}", latticeId);
        return ResponseEntity.ok(latticeService.listWords(latticeId));
    }

    @DeleteMapping("/{latticeId}")
    public ResponseEntity<Void> deleteLattice(@PathVariable String latticeId) {
        log.info("Deleting lattice: {}", latticeId);
        latticeService.deleteLattice(latticeId);
        return ResponseEntity.noContent().build();
    }
}
