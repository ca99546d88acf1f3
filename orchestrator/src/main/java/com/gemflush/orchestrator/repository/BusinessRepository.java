package com.gemflush.orchestrator.repository;

import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.BusinessStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Business reads plus the only write paths for status.
 *
 * Every status update is a compare-and-set: the WHERE clause carries the
 * status the caller expects to replace. A return value of 0 means another
 * writer moved the row first (or it was deleted), so the caller must not
 * assume its transition happened.
 */
public interface BusinessRepository extends JpaRepository<Business, UUID> {

    @EntityGraph(attributePaths = "team")
    Optional<Business> findWithTeamById(UUID id);

    /** Candidates for the periodic automation tick. */
    @EntityGraph(attributePaths = "team")
    List<Business> findByAutomationEnabledTrue();

    /** Rows sitting in one of the given statuses since before the cutoff. */
    List<Business> findByStatusInAndUpdatedAtBefore(Collection<BusinessStatus> statuses, Instant cutoff);

    @Query("SELECT b.status FROM Business b WHERE b.id = :id")
    Optional<BusinessStatus> findStatusById(@Param("id") UUID id);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Business b
            SET b.status = :to, b.updatedAt = :now
            WHERE b.id = :id AND b.status = :from
            """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("from") BusinessStatus from,
                            @Param("to") BusinessStatus to,
                            @Param("now") Instant now);

    /** Same as compareAndSetStatus, also recording the human-readable cause. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Business b
            SET b.status = :to, b.errorMessage = :error, b.updatedAt = :now
            WHERE b.id = :id AND b.status = :from
            """)
    int compareAndSetStatusWithError(@Param("id") UUID id,
                                     @Param("from") BusinessStatus from,
                                     @Param("to") BusinessStatus to,
                                     @Param("error") String error,
                                     @Param("now") Instant now);

    /** GENERATING → PUBLISHED together with the QID, in one statement. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Business b
            SET b.status = com.gemflush.orchestrator.model.BusinessStatus.PUBLISHED,
                b.wikidataQid = :qid,
                b.wikidataPublishedAt = :publishedAt,
                b.errorMessage = NULL,
                b.updatedAt = :now
            WHERE b.id = :id AND b.status = :from
            """)
    int markPublished(@Param("id") UUID id,
                      @Param("from") BusinessStatus from,
                      @Param("qid") String qid,
                      @Param("publishedAt") Instant publishedAt,
                      @Param("now") Instant now);

    /** Refresh of an already published entity; status stays PUBLISHED. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Business b
            SET b.wikidataQid = :qid, b.wikidataPublishedAt = :publishedAt, b.updatedAt = :now
            WHERE b.id = :id
              AND b.status = com.gemflush.orchestrator.model.BusinessStatus.PUBLISHED
            """)
    int updatePublication(@Param("id") UUID id,
                          @Param("qid") String qid,
                          @Param("publishedAt") Instant publishedAt,
                          @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Business b
            SET b.crawlData = :crawlData, b.lastCrawledAt = :crawledAt, b.updatedAt = :now
            WHERE b.id = :id
            """)
    int recordCrawlData(@Param("id") UUID id,
                        @Param("crawlData") String crawlData,
                        @Param("crawledAt") Instant crawledAt,
                        @Param("now") Instant now);

    /** Marks a publish gate run; automation will not run the gate again until a newer crawl. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Business b
            SET b.lastPublishAttemptAt = :attemptedAt, b.updatedAt = :attemptedAt
            WHERE b.id = :id
            """)
    void recordPublishAttempt(@Param("id") UUID id, @Param("attemptedAt") Instant attemptedAt);
}
