package com.gemflush.orchestrator.repository;

import com.gemflush.orchestrator.model.Fingerprint;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FingerprintRepository extends JpaRepository<Fingerprint, UUID> {

    /** "Latest" fingerprint: rows are immutable, so newest createdAt wins. */
    Optional<Fingerprint> findFirstByBusinessIdOrderByCreatedAtDesc(UUID businessId);

    List<Fingerprint> findByBusinessIdOrderByCreatedAtDesc(UUID businessId);
}
