package com.gemflush.orchestrator.repository;

import com.gemflush.orchestrator.model.WikidataEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WikidataEntityRepository extends JpaRepository<WikidataEntity, UUID> {

    /** Currently published state of a business's entity. */
    Optional<WikidataEntity> findFirstByBusinessIdOrderByVersionDesc(UUID businessId);

    List<WikidataEntity> findByBusinessIdOrderByVersionAsc(UUID businessId);
}
