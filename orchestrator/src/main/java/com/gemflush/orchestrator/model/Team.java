package com.gemflush.orchestrator.model;

import com.gemflush.orchestrator.automation.SubscriptionTier;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Owning team of one or more businesses. Only the subscription fields matter
 * to the pipeline: they decide the automation policy.
 *
 * DB table: teams
 */
@Entity
@Table(name = "teams")
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_name", nullable = false)
    private SubscriptionTier planName = SubscriptionTier.FREE;

    // As reported by billing: "active", "trialing", "past_due", "canceled", ...
    @Column(name = "subscription_status")
    private String subscriptionStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Team() {}   // required by JPA

    public Team(String name, SubscriptionTier planName, String subscriptionStatus) {
        this.name               = name;
        this.planName           = planName;
        this.subscriptionStatus = subscriptionStatus;
    }

    public UUID             getId()                 { return id; }
    public String           getName()               { return name; }
    public SubscriptionTier getPlanName()           { return planName; }
    public String           getSubscriptionStatus() { return subscriptionStatus; }
    public Instant          getCreatedAt()          { return createdAt; }

    public void setPlanName(SubscriptionTier planName)  { this.planName = planName; }
    public void setSubscriptionStatus(String status)    { this.subscriptionStatus = status; }
}
