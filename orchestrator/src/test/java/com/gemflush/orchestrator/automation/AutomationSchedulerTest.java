package com.gemflush.orchestrator.automation;

import com.gemflush.orchestrator.TestFixtures;
import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.BusinessStatus;
import com.gemflush.orchestrator.model.Team;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AutomationSchedulerTest {

    AutomationScheduler scheduler = new AutomationScheduler(TestFixtures.CLOCK);

    // ------------------------------------------------------------------
    // getAutomationConfig()
    // ------------------------------------------------------------------

    @Test
    void config_freeTier_isManualOnly() {
        AutomationConfig config = scheduler.getAutomationConfig(TestFixtures.team(SubscriptionTier.FREE));

        assertThat(config).isEqualTo(AutomationConfig.MANUAL_ONLY);
        assertThat(config.autoPublish()).isFalse();
        assertThat(config.crawlFrequency().interval()).isEmpty();
    }

    @Test
    void config_proTier_weeklyWithAutoPublish() {
        AutomationConfig config = scheduler.getAutomationConfig(TestFixtures.team(SubscriptionTier.PRO));

        assertThat(config.crawlFrequency()).isEqualTo(CrawlFrequency.WEEKLY);
        assertThat(config.autoPublish()).isTrue();
        assertThat(config.entityRichness()).isEqualTo(EntityRichness.ENHANCED);
    }

    @Test
    void config_agencyTier_completeRichnessWithProgressiveEnrichment() {
        AutomationConfig config = scheduler.getAutomationConfig(TestFixtures.team(SubscriptionTier.AGENCY));

        assertThat(config.entityRichness()).isEqualTo(EntityRichness.COMPLETE);
        assertThat(config.progressiveEnrichment()).isTrue();
    }

    @Test
    void config_lapsedSubscription_fallsBackToFree() {
        Team team = TestFixtures.team(SubscriptionTier.PRO);
        team.setSubscriptionStatus("canceled");

        assertThat(scheduler.getAutomationConfig(team)).isEqualTo(AutomationConfig.MANUAL_ONLY);
    }

    @Test
    void config_trialingSubscription_keepsPaidPolicy() {
        Team team = TestFixtures.team(SubscriptionTier.PRO);
        team.setSubscriptionStatus("TRIALING");

        assertThat(scheduler.getAutomationConfig(team).autoPublish()).isTrue();
    }

    @Test
    void config_missingTeam_isManualOnly() {
        assertThat(scheduler.getAutomationConfig(null)).isEqualTo(AutomationConfig.MANUAL_ONLY);
    }

    // ------------------------------------------------------------------
    // shouldAutoCrawl() / shouldAutoPublish()
    // ------------------------------------------------------------------

    @Test
    void freeTier_automationDisabled_neitherCrawlsNorPublishes() {
        Business b = TestFixtures.business(SubscriptionTier.FREE, BusinessStatus.CRAWLED);
        b.setAutomationEnabled(false);

        assertThat(scheduler.shouldAutoCrawl(b, b.getTeam())).isFalse();
        assertThat(scheduler.shouldAutoPublish(b, b.getTeam())).isFalse();
    }

    @Test
    void proTier_crawledWithoutQid_autoPublishes() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.CRAWLED);

        assertThat(b.getWikidataQid()).isNull();
        assertThat(scheduler.shouldAutoPublish(b, b.getTeam())).isTrue();
    }

    @Test
    void shouldAutoPublish_inFlightOrError_isFalse() {
        Team team = TestFixtures.team(SubscriptionTier.PRO);

        assertThat(scheduler.shouldAutoPublish(TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.GENERATING), team)).isFalse();
        assertThat(scheduler.shouldAutoPublish(TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.ERROR), team)).isFalse();
    }

    @Test
    void shouldAutoPublish_publishedAndRecrawledSince_isTrue() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.PUBLISHED);
        b.setWikidataQid("Q1");
        b.setWikidataPublishedAt(TestFixtures.NOW.minus(Duration.ofDays(8)));
        b.setLastCrawledAt(TestFixtures.NOW.minus(Duration.ofHours(1)));

        assertThat(scheduler.shouldAutoPublish(b, b.getTeam())).isTrue();
    }

    @Test
    void shouldAutoPublish_publishedAndNotRecrawled_isFalse() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.PUBLISHED);
        b.setLastCrawledAt(TestFixtures.NOW.minus(Duration.ofDays(2)));
        b.setWikidataPublishedAt(TestFixtures.NOW.minus(Duration.ofDays(1)));

        assertThat(scheduler.shouldAutoPublish(b, b.getTeam())).isFalse();
    }

    @Test
    void shouldAutoPublish_crawledAlreadyThroughGate_waitsForNextCrawl() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.CRAWLED);
        b.setLastCrawledAt(TestFixtures.NOW.minus(Duration.ofHours(2)));
        b.setLastPublishAttemptAt(TestFixtures.NOW.minus(Duration.ofHours(1)));

        assertThat(scheduler.shouldAutoPublish(b, b.getTeam())).isFalse();

        b.setLastCrawledAt(TestFixtures.NOW.minus(Duration.ofMinutes(5)));
        assertThat(scheduler.shouldAutoPublish(b, b.getTeam())).isTrue();
    }

    @Test
    void shouldAutoPublish_republishAttemptFailed_notRetriedUntilRecrawl() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.PUBLISHED);
        b.setWikidataQid("Q1");
        b.setWikidataPublishedAt(TestFixtures.NOW.minus(Duration.ofDays(8)));
        b.setLastCrawledAt(TestFixtures.NOW.minus(Duration.ofHours(2)));
        b.setLastPublishAttemptAt(TestFixtures.NOW.minus(Duration.ofHours(1)));

        assertThat(scheduler.shouldAutoPublish(b, b.getTeam())).isFalse();
    }

    @Test
    void shouldAutoCrawl_neverCrawled_isTrue() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.PENDING);
        b.setAutomationEnabled(true);

        assertThat(scheduler.shouldAutoCrawl(b, b.getTeam())).isTrue();
        assertThat(scheduler.nextCrawlDue(b, b.getTeam())).contains(TestFixtures.NOW);
    }

    @Test
    void shouldAutoCrawl_intervalNotElapsed_isFalse() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.CRAWLED);
        b.setAutomationEnabled(true);
        b.setLastCrawledAt(TestFixtures.NOW.minus(Duration.ofDays(3)));

        assertThat(scheduler.shouldAutoCrawl(b, b.getTeam())).isFalse();
        assertThat(scheduler.nextCrawlDue(b, b.getTeam())).contains(TestFixtures.NOW.plus(Duration.ofDays(4)));
    }

    @Test
    void shouldAutoCrawl_intervalElapsed_isTrue() {
        Business b = TestFixtures.business(SubscriptionTier.PRO, BusinessStatus.PUBLISHED);
        b.setAutomationEnabled(true);
        b.setLastCrawledAt(TestFixtures.NOW.minus(Duration.ofDays(7)));

        assertThat(scheduler.shouldAutoCrawl(b, b.getTeam())).isTrue();
    }

    @Test
    void shouldAutoCrawl_midPipelineOrError_isFalse() {
        Business crawling = TestFixtures.business(SubscriptionTier.AGENCY, BusinessStatus.CRAWLING);
        crawling.setAutomationEnabled(true);
        Business failed = TestFixtures.business(SubscriptionTier.AGENCY, BusinessStatus.ERROR);
        failed.setAutomationEnabled(true);

        assertThat(scheduler.shouldAutoCrawl(crawling, crawling.getTeam())).isFalse();
        assertThat(scheduler.shouldAutoCrawl(failed, failed.getTeam())).isFalse();
    }
}
