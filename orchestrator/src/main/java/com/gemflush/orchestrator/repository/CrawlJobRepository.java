package com.gemflush.orchestrator.repository;

import com.gemflush.orchestrator.model.CrawlJob;
import com.gemflush.orchestrator.model.JobType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only history of stage attempts.
 */
public interface CrawlJobRepository extends JpaRepository<CrawlJob, UUID> {

    List<CrawlJob> findByBusinessIdOrderByCreatedAtDesc(UUID businessId);

    Optional<CrawlJob> findFirstByBusinessIdAndJobTypeOrderByCreatedAtDesc(UUID businessId, JobType jobType);
}
