package com.gemflush.orchestrator.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.TestFixtures;
import com.gemflush.orchestrator.automation.AutomationConfig;
import com.gemflush.orchestrator.automation.CrawlFrequency;
import com.gemflush.orchestrator.automation.EntityRichness;
import com.gemflush.orchestrator.automation.SubscriptionTier;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.crawl.CrawlData;
import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.BusinessStatus;
import com.gemflush.orchestrator.model.WikidataEntity;
import com.gemflush.orchestrator.pipeline.PublisherRejectionException;
import com.gemflush.orchestrator.pipeline.StageCallExecutor;
import com.gemflush.orchestrator.repository.WikidataEntityRepository;
import com.gemflush.orchestrator.storage.ManualEntityStore;
import com.gemflush.orchestrator.storage.ManualStorageException;
import com.gemflush.orchestrator.storage.StoredManualEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PublishGateTest {

    static final AutomationConfig PRO = new AutomationConfig(
            CrawlFrequency.WEEKLY, CrawlFrequency.WEEKLY, true, EntityRichness.ENHANCED, false);

    @Mock NotabilityAssessor       notability;
    @Mock ManualEntityStore        manualStore;
    @Mock Publisher                publisher;
    @Mock WikidataEntityRepository entityRepo;
    @Mock StageCallExecutor        calls;

    PublishGate gate;
    Business business;
    CrawlData crawl = new CrawlData("Brown Physical Therapy", null, null, null, null, "Seattle", "WA", "US",
            null, null, null, null, null, null, null);
    StoredManualEntity stored;

    @BeforeEach
    void setUp() {
        CfpProperties props = new CfpProperties();
        gate = new PublishGate(notability, new EntityAssembler(), new EligibilityPolicy(props), manualStore,
                publisher, entityRepo, calls, props, new ObjectMapper(), TestFixtures.CLOCK);
        business = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.GENERATING);
        stored = new StoredManualEntity(business.getId(), business.getName(), "e.json", "e.metadata.json",
                true, null, TestFixtures.NOW);

        lenient().when(manualStore.store(any(), any(), any(), anyBoolean(), any(), any())).thenReturn(stored);
        lenient().when(calls.callOnce(anyString(), any(), any())).thenAnswer(inv -> {
            Supplier<?> call = inv.getArgument(2);
            return call.get();
        });
    }

    @Test
    void run_eligibleAndPublisherAssignsQid_recordsVersionedEntity() {
        when(notability.assess(any(), any(), any())).thenReturn(verdict(true, 0.9));
        when(publisher.publishEntity(any(), eq(false))).thenReturn(PublishResult.published("Q123"));
        when(entityRepo.findFirstByBusinessIdOrderByVersionDesc(business.getId())).thenReturn(Optional.empty());

        GateResult result = gate.run(business, crawl, null, PRO, false);

        assertThat(result.published()).isTrue();
        assertThat(result.qid()).isEqualTo("Q123");
        assertThat(result.stored()).isSameAs(stored);
        ArgumentCaptor<WikidataEntity> saved = ArgumentCaptor.forClass(WikidataEntity.class);
        verify(entityRepo).save(saved.capture());
        assertThat(saved.getValue().getVersion()).isEqualTo(1);
        assertThat(saved.getValue().getPublishedTo()).isEqualTo("test.wikidata.org");
        assertThat(saved.getValue().getEnrichmentLevel()).isEqualTo(2);
    }

    @Test
    void run_existingQid_updatesInsteadOfCreating() {
        business.setWikidataQid("Q77");
        when(notability.assess(any(), any(), any())).thenReturn(verdict(true, 0.9));
        when(publisher.updateEntity(eq("Q77"), any(), eq(false))).thenReturn(PublishResult.published("Q77"));
        WikidataEntity previous = mock(WikidataEntity.class);
        when(previous.getVersion()).thenReturn(3);
        when(entityRepo.findFirstByBusinessIdOrderByVersionDesc(business.getId())).thenReturn(Optional.of(previous));

        gate.run(business, crawl, null, PRO, false);

        verify(publisher, never()).publishEntity(any(), anyBoolean());
        ArgumentCaptor<WikidataEntity> saved = ArgumentCaptor.forClass(WikidataEntity.class);
        verify(entityRepo).save(saved.capture());
        assertThat(saved.getValue().getVersion()).isEqualTo(4);
    }

    @Test
    void run_notEligible_storesEntityButNeverCallsPublisher() {
        when(notability.assess(any(), any(), any())).thenReturn(verdict(false, 0.0));

        GateResult result = gate.run(business, crawl, null, PRO, false);

        assertThat(result.outcome()).isEqualTo(PublishOutcome.INELIGIBLE);
        verify(manualStore).store(eq(business.getId()), anyString(), any(), eq(false), any(), any());
        verifyNoInteractions(publisher);
    }

    @Test
    void run_publisherRejects_failedOutcomeAndEntityStoredOnce() {
        when(notability.assess(any(), any(), any())).thenReturn(verdict(true, 0.9));
        when(publisher.publishEntity(any(), anyBoolean()))
                .thenThrow(new PublisherRejectionException("P969 not allowed"));

        GateResult result = gate.run(business, crawl, null, PRO, false);

        assertThat(result.outcome()).isEqualTo(PublishOutcome.FAILED);
        assertThat(result.error()).contains("P969");
        verify(manualStore, times(1)).store(any(), any(), any(), anyBoolean(), any(), any());
        verify(entityRepo, never()).save(any());
    }

    @Test
    void run_publisherReturnsNoQid_failedOutcome() {
        when(notability.assess(any(), any(), any())).thenReturn(verdict(true, 0.9));
        when(publisher.publishEntity(any(), anyBoolean())).thenReturn(PublishResult.rejected("quota"));

        GateResult result = gate.run(business, crawl, null, PRO, false);

        assertThat(result.outcome()).isEqualTo(PublishOutcome.FAILED);
        assertThat(result.error()).isEqualTo("quota");
    }

    @Test
    void run_storageFails_publishStillAttempted() {
        when(notability.assess(any(), any(), any())).thenReturn(verdict(true, 0.9));
        when(manualStore.store(any(), any(), any(), anyBoolean(), any(), any()))
                .thenThrow(new ManualStorageException("disk full"));
        when(publisher.publishEntity(any(), anyBoolean())).thenReturn(PublishResult.published("Q5"));
        when(entityRepo.findFirstByBusinessIdOrderByVersionDesc(any())).thenReturn(Optional.empty());

        GateResult result = gate.run(business, crawl, null, PRO, false);

        assertThat(result.published()).isTrue();
        assertThat(result.stored()).isNull();
        assertThat(result.storageError()).isEqualTo("disk full");
    }

    private static NotabilityVerdict verdict(boolean notable, double confidence) {
        int qualifying = notable ? 2 : 0;
        return new NotabilityVerdict(notable, confidence, qualifying, qualifying, qualifying, qualifying,
                "test", List.of());
    }
}
