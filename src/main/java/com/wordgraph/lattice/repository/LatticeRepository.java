package com.wordgraph.lattice.repository;

import com.wordgraph.lattice.model.StoredLattice;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of built lattices keyed by lattice id.
 * Entries are immutable, so readers never need to lock.
 */
@Repository
public class LatticeRepository {

    private final Map<String, StoredLattice> lattices = new ConcurrentHashMap<>();

    public StoredLattice save(StoredLattice lattice) {
        lattices.put(lattice.getLatticeId(), lattice);
        return lattice;
    }

    public Optional<StoredLattice> findById(String latticeId) {
        return Optional.ofNullable(lattices.get(latticeId));
    }

    public List<StoredLattice> findAllOrderByCreatedAtDesc() {
        List<StoredLattice> all = new ArrayList<>(lattices.values());
        all.sort(Comparator.comparing(StoredLattice::getCreatedAt).reversed());
        return all;
    }

    public List<StoredLattice> findByExpiresAtBefore(LocalDateTime dateTime) {
        return lattices.values().stream()
                .filter(lattice -> lattice.isExpired(dateTime))
                .toList();
    }

    public boolean deleteById(String latticeId) {
        return lattices.remove(latticeId) != null;
    }

    public long count() {
        return lattices.size();
    }
}
