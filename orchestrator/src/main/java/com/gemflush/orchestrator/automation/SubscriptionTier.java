package com.gemflush.orchestrator.automation;

public enum SubscriptionTier {
    FREE,
    PRO,
    AGENCY
}
