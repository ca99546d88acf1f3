package com.gemflush.orchestrator.pipeline;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process set of businesses with an active run.
 *
 * This only covers a single orchestrator instance. Across instances the
 * conditional status updates in BusinessRepository are what reject the loser.
 */
@Component
public class SingleFlightRegistry {

    private final Set<UUID> active = ConcurrentHashMap.newKeySet();

    /** @return true if the caller now owns the business; false if a run is active. */
    public boolean tryAcquire(UUID businessId) {
        return active.add(businessId);
    }

    public void release(UUID businessId) {
        active.remove(businessId);
    }

    public boolean isActive(UUID businessId) {
        return active.contains(businessId);
    }

    public int activeCount() {
        return active.size();
    }
}
