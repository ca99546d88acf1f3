package com.gemflush.orchestrator.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.automation.AutomationConfig;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.crawl.CrawlData;
import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.Fingerprint;
import com.gemflush.orchestrator.model.WikidataEntity;
import com.gemflush.orchestrator.pipeline.StageCallExecutor;
import com.gemflush.orchestrator.pipeline.StageException;
import com.gemflush.orchestrator.repository.WikidataEntityRepository;
import com.gemflush.orchestrator.storage.ManualEntityStore;
import com.gemflush.orchestrator.storage.ManualStorageException;
import com.gemflush.orchestrator.storage.StoredManualEntity;
import com.gemflush.orchestrator.storage.StoredNotability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publish gate: notability → entity assembly → eligibility → manual storage
 * → publish attempt.
 *
 * The entity is written to manual storage exactly once per pass, before the
 * publisher is called, so no assembled entity is lost whatever happens next.
 * Publisher failures are reported once and never retried. This class does not
 * touch Business.status; the orchestrator owns that.
 */
@Component
public class PublishGate {

    private static final Logger log = LoggerFactory.getLogger(PublishGate.class);

    static final String TEST_INSTANCE = "test.wikidata.org";
    static final String PRODUCTION_INSTANCE = "www.wikidata.org";

    private final NotabilityAssessor       notability;
    private final EntityAssembler          assembler;
    private final EligibilityPolicy        eligibility;
    private final ManualEntityStore        manualStore;
    private final Publisher                publisher;
    private final WikidataEntityRepository entityRepo;
    private final StageCallExecutor        calls;
    private final CfpProperties            props;
    private final ObjectMapper             json;
    private final Clock                    clock;

    public PublishGate(NotabilityAssessor notability,
                       EntityAssembler assembler,
                       EligibilityPolicy eligibility,
                       ManualEntityStore manualStore,
                       Publisher publisher,
                       WikidataEntityRepository entityRepo,
                       StageCallExecutor calls,
                       CfpProperties props,
                       ObjectMapper json,
                       Clock clock) {
        this.notability  = notability;
        this.assembler   = assembler;
        this.eligibility = eligibility;
        this.manualStore = manualStore;
        this.publisher   = publisher;
        this.entityRepo  = entityRepo;
        this.calls       = calls;
        this.props       = props;
        this.json        = json;
        this.clock       = clock;
    }

    public GateResult run(Business business, CrawlData crawl, Fingerprint fingerprint,
                          AutomationConfig config, boolean userInitiated) {
        String name = crawl.name() != null ? crawl.name() : business.getName();

        NotabilityVerdict verdict = notability.assess(name, business.getUrl(), crawl);
        CandidateEntity entity = assembler.assemble(business, crawl, verdict, config.entityRichness());
        boolean canPublish = eligibility.canPublish(verdict, config, userInitiated);

        StoredManualEntity stored = null;
        String storageError = null;
        try {
            stored = manualStore.store(business.getId(), name, entity, canPublish,
                    StoredNotability.of(verdict), annotations(fingerprint, verdict, config));
        } catch (ManualStorageException e) {
            storageError = e.getMessage();
            log.error("Manual storage failed for business {}: {}", business.getId(), e.getMessage(), e);
        }

        if (!canPublish) {
            log.info("Business {} not eligible for publishing (notable={}, confidence={})",
                    business.getId(), verdict.notable(), verdict.confidence());
            return new GateResult(PublishOutcome.INELIGIBLE, false, null, verdict, stored, null, storageError);
        }

        boolean production = props.getPublish().isProduction();
        String existingQid = business.getWikidataQid();
        PublishResult result;
        try {
            result = calls.callOnce("publish", props.getCalls().getPublish().getTimeout(), () ->
                    existingQid == null
                            ? publisher.publishEntity(entity, production)
                            : publisher.updateEntity(existingQid, entity, production));
        } catch (StageException e) {
            log.warn("Publisher failed for business {}: {}", business.getId(), e.getMessage());
            return new GateResult(PublishOutcome.FAILED, true, null, verdict, stored, e.getMessage(), storageError);
        }

        if (result == null || !result.success() || result.qid() == null || result.qid().isBlank()) {
            String error = result == null || result.error() == null ? "Publisher returned no QID" : result.error();
            log.warn("Publisher rejected entity for business {}: {}", business.getId(), error);
            return new GateResult(PublishOutcome.FAILED, true, null, verdict, stored, error, storageError);
        }

        int version = entityRepo.findFirstByBusinessIdOrderByVersionDesc(business.getId())
                .map(e -> e.getVersion() + 1)
                .orElse(1);
        entityRepo.save(new WikidataEntity(
                business.getId(),
                result.qid(),
                toJson(entity),
                production ? PRODUCTION_INSTANCE : TEST_INSTANCE,
                version,
                config.entityRichness().level(),
                clock.instant()));
        log.info("Published business {} as {} (version {}, {})",
                business.getId(), result.qid(), version, production ? PRODUCTION_INSTANCE : TEST_INSTANCE);
        return new GateResult(PublishOutcome.PUBLISHED, true, result.qid(), verdict, stored, null, storageError);
    }

    private static Map<String, Object> annotations(Fingerprint fingerprint, NotabilityVerdict verdict,
                                                   AutomationConfig config) {
        Map<String, Object> a = new LinkedHashMap<>();
        if (fingerprint != null) {
            a.put("visibilityScore", fingerprint.getVisibilityScore());
            a.put("fingerprintCreatedAt", String.valueOf(fingerprint.getCreatedAt()));
        }
        a.put("entityRichness", config.entityRichness().name());
        a.put("qualifyingReferences", verdict.qualifyingReferenceCount());
        return a;
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StageException("Could not serialize entity", false, e);
        }
    }
}
