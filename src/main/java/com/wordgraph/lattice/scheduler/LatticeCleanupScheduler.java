package com.wordgraph.lattice.scheduler;

import com.wordgraph.lattice.service.LatticeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts stored lattices once their TTL has passed.
 * The interval is lattice.store.cleanup-interval-ms, hourly by default.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LatticeCleanupScheduler {

    private final LatticeService latticeService;

    @Scheduled(fixedRateString = "${lattice.store.cleanup-interval-ms:3600000}")
    public void evictExpiredLattices() {
        try {
            int evicted = latticeService.cleanupExpiredLattices();
            log.debug("Lattice eviction pass removed {} lattices", evicted);
        } catch (RuntimeException e) {
            log.error("Lattice eviction pass failed, retrying on next tick", e);
        }
    }
}
