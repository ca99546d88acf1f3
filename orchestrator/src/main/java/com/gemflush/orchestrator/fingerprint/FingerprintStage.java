package com.gemflush.orchestrator.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.crawl.CrawlData;
import com.gemflush.orchestrator.fingerprint.leaderboard.CompetitiveLeaderboard;
import com.gemflush.orchestrator.fingerprint.leaderboard.CompetitiveLeaderboardBuilder;
import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.CrawlJob;
import com.gemflush.orchestrator.model.Fingerprint;
import com.gemflush.orchestrator.model.JobType;
import com.gemflush.orchestrator.pipeline.StageCallExecutor;
import com.gemflush.orchestrator.pipeline.StageException;
import com.gemflush.orchestrator.repository.CrawlJobRepository;
import com.gemflush.orchestrator.repository.FingerprintRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fingerprint stage: asks every configured model the same recommendation
 * question, analyzes each answer, and stores one immutable Fingerprint row
 * with the scores and the competitive leaderboard.
 *
 * A model that fails after its retries becomes an error observation; the
 * stage only fails when no model answered.
 */
@Component
public class FingerprintStage {

    private static final Logger log = LoggerFactory.getLogger(FingerprintStage.class);

    private final ScoringProvider               scoring;
    private final PromptBuilder                 prompts;
    private final ResponseAnalyzer              analyzer;
    private final CompetitiveLeaderboardBuilder leaderboards;
    private final FingerprintRepository         fingerprintRepo;
    private final CrawlJobRepository            jobRepo;
    private final StageCallExecutor             calls;
    private final CfpProperties                 props;
    private final ObjectMapper                  json;
    private final Clock                         clock;

    public FingerprintStage(ScoringProvider scoring,
                            PromptBuilder prompts,
                            ResponseAnalyzer analyzer,
                            CompetitiveLeaderboardBuilder leaderboards,
                            FingerprintRepository fingerprintRepo,
                            CrawlJobRepository jobRepo,
                            StageCallExecutor calls,
                            CfpProperties props,
                            ObjectMapper json,
                            Clock clock) {
        this.scoring         = scoring;
        this.prompts         = prompts;
        this.analyzer        = analyzer;
        this.leaderboards    = leaderboards;
        this.fingerprintRepo = fingerprintRepo;
        this.jobRepo         = jobRepo;
        this.calls           = calls;
        this.props           = props;
        this.json            = json;
        this.clock           = clock;
    }

    public Fingerprint execute(Business business, CrawlData crawl) {
        CrawlJob job = new CrawlJob(business.getId(), JobType.FINGERPRINT);
        jobRepo.save(job);
        job.markRunning(clock.instant());
        jobRepo.save(job);

        try {
            String targetName = crawl.name() != null ? crawl.name() : business.getName();
            String prompt = prompts.recommendationPrompt(crawl, business.getCategory());

            List<ModelObservation> observations = new ArrayList<>();
            StageException lastFailure = null;
            for (String model : props.getFingerprint().getModels()) {
                try {
                    ScoringResponse response = calls.callWithRetry(
                            "score:" + model, props.getCalls().getScoring(), () -> scoring.query(model, prompt));
                    observations.add(analyzer.analyze(response, model, targetName));
                } catch (StageException e) {
                    log.warn("Model {} failed for business {}: {}", model, business.getId(), e.getMessage());
                    observations.add(ModelObservation.failed(model, e.getMessage()));
                    lastFailure = e;
                }
            }

            if (observations.stream().noneMatch(ModelObservation::succeeded)) {
                if (lastFailure != null) {
                    throw lastFailure;
                }
                throw new StageException("No scoring models configured", false);
            }

            VisibilityMetrics metrics = VisibilityMetrics.compute(observations);
            CompetitiveLeaderboard leaderboard = leaderboards.build(targetName, observations);

            Fingerprint fingerprint = new Fingerprint(
                    business.getId(),
                    metrics.visibilityScore(),
                    metrics.mentionRate(),
                    metrics.sentimentScore(),
                    metrics.accuracyScore(),
                    metrics.avgRankPosition(),
                    toJson(observations),
                    toJson(leaderboard),
                    clock.instant());
            fingerprintRepo.save(fingerprint);

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("visibilityScore", metrics.visibilityScore());
            summary.put("mentionRate", metrics.mentionRate());
            summary.put("models", observations.size());
            summary.put("failedModels", observations.stream().filter(o -> !o.succeeded()).count());
            summary.put("competitors", leaderboard.competitors().size());
            job.markCompleted(toJson(summary), clock.instant());
            jobRepo.save(job);

            log.info("Fingerprint for business {}: visibility={} mentionRate={} competitors={}",
                    business.getId(), metrics.visibilityScore(), metrics.mentionRate(),
                    leaderboard.competitors().size());
            return fingerprint;

        } catch (RuntimeException e) {
            job.markFailed(e.getMessage(), clock.instant());
            jobRepo.save(job);
            throw e;
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StageException("Could not serialize fingerprint data", false, e);
        }
    }
}
