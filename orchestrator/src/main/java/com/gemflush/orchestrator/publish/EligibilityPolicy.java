package com.gemflush.orchestrator.publish;

import com.gemflush.orchestrator.automation.AutomationConfig;
import com.gemflush.orchestrator.config.CfpProperties;
import org.springframework.stereotype.Component;

/**
 * canPublish = permitted AND confident enough.
 *
 * permitted: the tier publishes automatically, or a user asked explicitly.
 * Notable entities need confidence ≥ publishThreshold. Entities that miss
 * notability still pass with at least one qualifying reference and
 * confidence ≥ borderlineThreshold, so borderline cases reach a reviewer.
 */
@Component
public class EligibilityPolicy {

    private final CfpProperties props;

    public EligibilityPolicy(CfpProperties props) {
        this.props = props;
    }

    public boolean canPublish(NotabilityVerdict verdict, AutomationConfig config, boolean userInitiated) {
        boolean permitted = userInitiated || (config != null && config.autoPublish());
        if (!permitted || verdict == null) {
            return false;
        }
        CfpProperties.Notability n = props.getNotability();
        if (verdict.notable()) {
            return verdict.confidence() >= n.getPublishThreshold();
        }
        return verdict.qualifyingReferenceCount() >= 1
                && verdict.confidence() >= n.getBorderlineThreshold();
    }
}
