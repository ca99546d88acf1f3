package com.gemflush.orchestrator.automation;

import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.BusinessStatus;
import com.gemflush.orchestrator.model.Team;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Pure decision functions: given a business and its team, should a stage run
 * without a user asking for it? No I/O; the clock is the only input besides
 * the arguments. AutomationRunner is what acts on the answers.
 */
@Component
public class AutomationScheduler {

    // Billing states that keep the paid plan's privileges.
    private static final Set<String> PAID_STATUSES = Set.of("active", "trialing");

    private static final AutomationConfig PRO = new AutomationConfig(
            CrawlFrequency.WEEKLY, CrawlFrequency.WEEKLY, true, EntityRichness.ENHANCED, false);

    private static final AutomationConfig AGENCY = new AutomationConfig(
            CrawlFrequency.WEEKLY, CrawlFrequency.WEEKLY, true, EntityRichness.COMPLETE, true);

    private final Clock clock;

    public AutomationScheduler(Clock clock) {
        this.clock = clock;
    }

    /** Tier policy. A missing team or a lapsed subscription gets the free policy. */
    public AutomationConfig getAutomationConfig(Team team) {
        return switch (effectiveTier(team)) {
            case FREE   -> AutomationConfig.MANUAL_ONLY;
            case PRO    -> PRO;
            case AGENCY -> AGENCY;
        };
    }

    public SubscriptionTier effectiveTier(Team team) {
        if (team == null || team.getPlanName() == null) {
            return SubscriptionTier.FREE;
        }
        if (team.getPlanName() == SubscriptionTier.FREE) {
            return SubscriptionTier.FREE;
        }
        String status = team.getSubscriptionStatus();
        if (status == null || !PAID_STATUSES.contains(status.toLowerCase(Locale.ROOT))) {
            return SubscriptionTier.FREE;
        }
        return team.getPlanName();
    }

    /**
     * True when automation is on, the business is idle and healthy, and the
     * crawl interval has elapsed (or it was never crawled).
     */
    public boolean shouldAutoCrawl(Business business, Team team) {
        AutomationConfig config = getAutomationConfig(team);
        Optional<Duration> interval = config.crawlFrequency().interval();
        if (interval.isEmpty() || !business.isAutomationEnabled()) {
            return false;
        }
        BusinessStatus status = business.getStatus();
        // ERROR needs a reset or a user retry before automation resumes.
        if (status.isInFlight() || status == BusinessStatus.ERROR) {
            return false;
        }
        Instant last = business.getLastCrawledAt();
        if (last == null) {
            return true;
        }
        return !clock.instant().isBefore(last.plus(interval.get()));
    }

    /**
     * True when the tier publishes automatically and the business has results
     * the publish gate has not seen yet: it rests at CRAWLED or PUBLISHED and
     * its last crawl is newer than the last gate run. An ineligible or
     * rejected entity is therefore not retried until the next crawl.
     */
    public boolean shouldAutoPublish(Business business, Team team) {
        if (!getAutomationConfig(team).autoPublish()) {
            return false;
        }
        return switch (business.getStatus()) {
            case CRAWLED -> hasUnpublishedCrawl(business, business.getLastPublishAttemptAt());
            case PUBLISHED -> business.getLastCrawledAt() != null
                    && hasUnpublishedCrawl(business, latest(business.getWikidataPublishedAt(),
                                                            business.getLastPublishAttemptAt()));
            default -> false;
        };
    }

    /** When the next unattended crawl becomes due; empty for manual tiers. */
    public Optional<Instant> nextCrawlDue(Business business, Team team) {
        Optional<Duration> interval = getAutomationConfig(team).crawlFrequency().interval();
        if (interval.isEmpty()) {
            return Optional.empty();
        }
        Instant last = business.getLastCrawledAt();
        return Optional.of(last == null ? clock.instant() : last.plus(interval.get()));
    }

    private static boolean hasUnpublishedCrawl(Business business, Instant lastGateRun) {
        if (lastGateRun == null) {
            return true;
        }
        Instant crawled = business.getLastCrawledAt();
        return crawled != null && crawled.isAfter(lastGateRun);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }
}
