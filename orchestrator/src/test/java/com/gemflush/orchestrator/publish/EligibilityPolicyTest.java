package com.gemflush.orchestrator.publish;

import com.gemflush.orchestrator.automation.AutomationConfig;
import com.gemflush.orchestrator.automation.CrawlFrequency;
import com.gemflush.orchestrator.automation.EntityRichness;
import com.gemflush.orchestrator.config.CfpProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EligibilityPolicyTest {

    static final AutomationConfig AUTO = new AutomationConfig(
            CrawlFrequency.WEEKLY, CrawlFrequency.WEEKLY, true, EntityRichness.ENHANCED, false);

    EligibilityPolicy policy = new EligibilityPolicy(new CfpProperties());

    @Test
    void notable_confidenceAboveThreshold_canPublish() {
        assertThat(policy.canPublish(verdict(true, 0.8, 2), AUTO, false)).isTrue();
    }

    @Test
    void notable_confidenceBelowThreshold_cannotPublish() {
        assertThat(policy.canPublish(verdict(true, 0.6, 2), AUTO, false)).isFalse();
    }

    @Test
    void notNotable_noQualifyingReferences_cannotPublish() {
        assertThat(policy.canPublish(verdict(false, 0.5, 0), AUTO, false)).isFalse();
    }

    @Test
    void notNotable_oneQualifyingReference_borderlinePasses() {
        assertThat(policy.canPublish(verdict(false, 0.4, 1), AUTO, false)).isTrue();
    }

    @Test
    void notNotable_confidenceBelowBorderline_cannotPublish() {
        assertThat(policy.canPublish(verdict(false, 0.1, 1), AUTO, false)).isFalse();
    }

    @Test
    void manualTier_onlyWhenUserAsks() {
        NotabilityVerdict strong = verdict(true, 0.9, 3);

        assertThat(policy.canPublish(strong, AutomationConfig.MANUAL_ONLY, false)).isFalse();
        assertThat(policy.canPublish(strong, AutomationConfig.MANUAL_ONLY, true)).isTrue();
    }

    @Test
    void missingVerdict_cannotPublish() {
        assertThat(policy.canPublish(null, AUTO, true)).isFalse();
    }

    private static NotabilityVerdict verdict(boolean notable, double confidence, int qualifying) {
        return new NotabilityVerdict(notable, confidence, qualifying, qualifying, qualifying, qualifying,
                "test", List.of());
    }
}
