package com.wordgraph.lattice.repository;

import com.wordgraph.lattice.model.StoredLattice;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LatticeRepositoryTest {

    private final LatticeRepository repository = new LatticeRepository();

    @Test
    void savesAndFindsById() {
        StoredLattice lattice = lattice("a1", LocalDateTime.now(), 24);

        repository.save(lattice);

        assertThat(repository.findById("a1")).containsSame(lattice);
        assertThat(repository.findById("missing")).isEmpty();
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void findsOnlyExpiredLattices() {
        LocalDateTime now = LocalDateTime.now();
        repository.save(lattice("fresh", now, 24));
        repository.save(lattice("stale", now.minusHours(30), 24));

        List<StoredLattice> expired = repository.findByExpiresAtBefore(now);

        assertThat(expired).extracting(StoredLattice::getLatticeId).containsExactly("stale");
    }

    @Test
    void ordersByCreationNewestFirst() {
        LocalDateTime now = LocalDateTime.now();
        repository.save(lattice("old", now.minusHours(2), 24));
        repository.save(lattice("new", now, 24));
        repository.save(lattice("mid", now.minusHours(1), 24));

        assertThat(repository.findAllOrderByCreatedAtDesc())
                .extracting(StoredLattice::getLatticeId)
                .containsExactly("new", "mid", "old");
    }

    @Test
    void reportsWhetherDeleteRemovedAnything() {
        repository.save(lattice("a1", LocalDateTime.now(), 24));

        assertThat(repository.deleteById("a1")).isTrue();
        assertThat(repository.deleteById("a1")).isFalse();
        assertThat(repository.count()).isZero();
    }

    private StoredLattice lattice(String id, LocalDateTime createdAt, int ttlHours) {
        return StoredLattice.builder()
                .latticeId(id)
                .words(List.of("a"))
                .rejectedRecords(List.of())
                .createdAt(createdAt)
                .expiresAt(createdAt.plusHours(ttlHours))
                .build();
    }
}
