package com.gemflush.orchestrator.crawl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.CrawlJob;
import com.gemflush.orchestrator.model.JobType;
import com.gemflush.orchestrator.pipeline.BusinessNotFoundException;
import com.gemflush.orchestrator.pipeline.InvalidInputException;
import com.gemflush.orchestrator.pipeline.RetryableIoException;
import com.gemflush.orchestrator.pipeline.StageCallExecutor;
import com.gemflush.orchestrator.pipeline.StageException;
import com.gemflush.orchestrator.repository.BusinessRepository;
import com.gemflush.orchestrator.repository.CrawlJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Crawl stage: one CrawlJob row per attempt, crawler call under retry, and the
 * normalized snapshot written to the business.
 *
 * Job lifecycle: QUEUED → RUNNING → COMPLETED (progress 100) or FAILED.
 * lastCrawledAt only moves on success.
 */
@Component
public class CrawlStage {

    private static final Logger log = LoggerFactory.getLogger(CrawlStage.class);

    private final Crawler             crawler;
    private final CrawlDataNormalizer normalizer;
    private final CrawlJobRepository  jobRepo;
    private final BusinessRepository  businessRepo;
    private final StageCallExecutor   calls;
    private final CfpProperties       props;
    private final ObjectMapper        json;
    private final Clock               clock;

    public CrawlStage(Crawler crawler,
                      CrawlDataNormalizer normalizer,
                      CrawlJobRepository jobRepo,
                      BusinessRepository businessRepo,
                      StageCallExecutor calls,
                      CfpProperties props,
                      ObjectMapper json,
                      Clock clock) {
        this.crawler      = crawler;
        this.normalizer   = normalizer;
        this.jobRepo      = jobRepo;
        this.businessRepo = businessRepo;
        this.calls        = calls;
        this.props        = props;
        this.json         = json;
        this.clock        = clock;
    }

    /**
     * @return the normalized snapshot, already persisted on the business
     * @throws InvalidInputException for a malformed URL (crawler never called)
     * @throws StageException        when the crawler fails after retries
     */
    public CrawlData execute(Business business) {
        CrawlJob job = new CrawlJob(business.getId(), JobType.CRAWL);
        jobRepo.save(job);

        try {
            String url = validateUrl(business.getUrl());

            job.markRunning(clock.instant());
            jobRepo.save(job);
            log.info("Crawling {} for business {}", url, business.getId());

            CrawlResult result = calls.callWithRetry("crawl", props.getCalls().getCrawl(), () -> {
                CrawlResult r = crawler.crawl(url);
                if (r == null || !r.success() || r.data() == null) {
                    String error = r == null || r.error() == null ? "crawler returned no data" : r.error();
                    if (r == null || r.retryable()) {
                        throw new RetryableIoException("Crawl failed: " + error);
                    }
                    throw new InvalidInputException("Crawl failed: " + error);
                }
                return r;
            });

            CrawlData data = normalizer.normalize(result.data(), business.getName());
            String snapshot = toJson(data);
            Instant now = clock.instant();
            if (businessRepo.recordCrawlData(business.getId(), snapshot, now, now) == 0) {
                throw new BusinessNotFoundException(business.getId());
            }

            job.markCompleted(snapshot, clock.instant());
            jobRepo.save(job);
            log.info("Crawl completed for business {} ({} tags, {} social links)",
                    business.getId(), data.tags().size(), data.socialLinks().size());
            return data;

        } catch (RuntimeException e) {
            job.markFailed(e.getMessage(), clock.instant());
            jobRepo.save(job);
            log.warn("Crawl failed for business {}: {}", business.getId(), e.getMessage());
            throw e;
        }
    }

    static String validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidInputException("Business has no URL");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidInputException("Malformed URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https"))
                || uri.getHost() == null || uri.getHost().isBlank()) {
            throw new InvalidInputException("URL must be an absolute http(s) address: " + url);
        }
        return uri.toString();
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StageException("Could not serialize crawl data", false, e);
        }
    }
}
