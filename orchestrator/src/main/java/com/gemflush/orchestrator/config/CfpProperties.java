package com.gemflush.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code gemflush.*} block in application.yml.
 *
 * Defaults here are the production values; application.yml only overrides
 * what differs per environment.
 */
@ConfigurationProperties(prefix = "gemflush")
public class CfpProperties {

    private Pipeline pipeline = new Pipeline();
    private Capabilities capabilities = new Capabilities();
    private Calls calls = new Calls();
    private Fingerprint fingerprint = new Fingerprint();
    private Notability notability = new Notability();
    private Publish publish = new Publish();
    private Storage storage = new Storage();
    private Automation automation = new Automation();

    public Pipeline getPipeline()                     { return pipeline; }
    public void setPipeline(Pipeline pipeline)        { this.pipeline = pipeline; }
    public Capabilities getCapabilities()             { return capabilities; }
    public void setCapabilities(Capabilities c)       { this.capabilities = c; }
    public Calls getCalls()                           { return calls; }
    public void setCalls(Calls calls)                 { this.calls = calls; }
    public Fingerprint getFingerprint()               { return fingerprint; }
    public void setFingerprint(Fingerprint f)         { this.fingerprint = f; }
    public Notability getNotability()                 { return notability; }
    public void setNotability(Notability notability)  { this.notability = notability; }
    public Publish getPublish()                       { return publish; }
    public void setPublish(Publish publish)           { this.publish = publish; }
    public Storage getStorage()                       { return storage; }
    public void setStorage(Storage storage)           { this.storage = storage; }
    public Automation getAutomation()                 { return automation; }
    public void setAutomation(Automation automation)  { this.automation = automation; }

    // ------------------------------------------------------------------

    public static class Pipeline {
        // Concurrent CFP runs across different businesses.
        private int workers = 4;
        // Threads that carry external calls so they can be timed out.
        private int externalCallThreads = 8;
        // A CRAWLING/GENERATING row untouched this long has lost its run.
        private Duration staleRunTimeout = Duration.ofMinutes(30);

        public int getWorkers()                         { return workers; }
        public void setWorkers(int workers)             { this.workers = workers; }
        public int getExternalCallThreads()             { return externalCallThreads; }
        public void setExternalCallThreads(int n)       { this.externalCallThreads = n; }
        public Duration getStaleRunTimeout()            { return staleRunTimeout; }
        public void setStaleRunTimeout(Duration timeout) { this.staleRunTimeout = timeout; }
    }

    /** Base URLs of the sidecar services behind the four capability contracts. */
    public static class Capabilities {
        private String crawlerUrl = "http://localhost:8101";
        private String scoringUrl = "http://localhost:8102";
        private String searchUrl = "http://localhost:8103";
        private String publisherUrl = "http://localhost:8104";
        private Duration connectTimeout = Duration.ofSeconds(10);

        public String getCrawlerUrl()                   { return crawlerUrl; }
        public void setCrawlerUrl(String v)             { this.crawlerUrl = v; }
        public String getScoringUrl()                   { return scoringUrl; }
        public void setScoringUrl(String v)             { this.scoringUrl = v; }
        public String getSearchUrl()                    { return searchUrl; }
        public void setSearchUrl(String v)              { this.searchUrl = v; }
        public String getPublisherUrl()                 { return publisherUrl; }
        public void setPublisherUrl(String v)           { this.publisherUrl = v; }
        public Duration getConnectTimeout()             { return connectTimeout; }
        public void setConnectTimeout(Duration v)       { this.connectTimeout = v; }
    }

    public static class Calls {
        private CallPolicy crawl = new CallPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30), Duration.ofSeconds(60));
        private CallPolicy scoring = new CallPolicy(2, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), Duration.ofSeconds(45));
        private CallPolicy search = new CallPolicy(2, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), Duration.ofSeconds(15));
        // Publisher calls are never retried.
        private CallPolicy publish = new CallPolicy(1, Duration.ofSeconds(1), 1.0, Duration.ofSeconds(1), Duration.ofSeconds(30));

        public CallPolicy getCrawl()                    { return crawl; }
        public void setCrawl(CallPolicy crawl)          { this.crawl = crawl; }
        public CallPolicy getScoring()                  { return scoring; }
        public void setScoring(CallPolicy scoring)      { this.scoring = scoring; }
        public CallPolicy getSearch()                   { return search; }
        public void setSearch(CallPolicy search)        { this.search = search; }
        public CallPolicy getPublish()                  { return publish; }
        public void setPublish(CallPolicy publish)      { this.publish = publish; }
    }

    /** Retry budget and hard timeout for one external capability. */
    public static class CallPolicy {
        private int maxAttempts;
        private Duration initialBackoff;
        private double multiplier;
        private Duration maxBackoff;
        private Duration timeout;

        public CallPolicy() {
            this(1, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), Duration.ofSeconds(30));
        }

        public CallPolicy(int maxAttempts, Duration initialBackoff, double multiplier,
                          Duration maxBackoff, Duration timeout) {
            this.maxAttempts    = maxAttempts;
            this.initialBackoff = initialBackoff;
            this.multiplier     = multiplier;
            this.maxBackoff     = maxBackoff;
            this.timeout        = timeout;
        }

        public int getMaxAttempts()                     { return maxAttempts; }
        public void setMaxAttempts(int v)               { this.maxAttempts = v; }
        public Duration getInitialBackoff()             { return initialBackoff; }
        public void setInitialBackoff(Duration v)       { this.initialBackoff = v; }
        public double getMultiplier()                   { return multiplier; }
        public void setMultiplier(double v)             { this.multiplier = v; }
        public Duration getMaxBackoff()                 { return maxBackoff; }
        public void setMaxBackoff(Duration v)           { this.maxBackoff = v; }
        public Duration getTimeout()                    { return timeout; }
        public void setTimeout(Duration v)              { this.timeout = v; }
    }

    public static class Fingerprint {
        private List<String> models = new ArrayList<>(List.of(
                "openai/gpt-4-turbo",
                "anthropic/claude-3-opus",
                "google/gemini-2.5-flash"));

        public List<String> getModels()                 { return models; }
        public void setModels(List<String> models)      { this.models = models; }
    }

    public static class Notability {
        private int minSeriousReferences = 2;
        private double publishThreshold = 0.7;
        private double borderlineThreshold = 0.2;
        private int maxReferences = 15;
        // Model used to judge each reference.
        private String assessmentModel = "openai/gpt-4-turbo";

        public int getMinSeriousReferences()            { return minSeriousReferences; }
        public void setMinSeriousReferences(int v)      { this.minSeriousReferences = v; }
        public double getPublishThreshold()             { return publishThreshold; }
        public void setPublishThreshold(double v)       { this.publishThreshold = v; }
        public double getBorderlineThreshold()          { return borderlineThreshold; }
        public void setBorderlineThreshold(double v)    { this.borderlineThreshold = v; }
        public int getMaxReferences()                   { return maxReferences; }
        public void setMaxReferences(int v)             { this.maxReferences = v; }
        public String getAssessmentModel()              { return assessmentModel; }
        public void setAssessmentModel(String v)        { this.assessmentModel = v; }
    }

    public static class Publish {
        // false = test.wikidata.org
        private boolean production = false;

        public boolean isProduction()                   { return production; }
        public void setProduction(boolean production)   { this.production = production; }
    }

    public static class Storage {
        private String directory = ".wikidata-manual-publish";

        public String getDirectory()                    { return directory; }
        public void setDirectory(String directory)      { this.directory = directory; }
    }

    public static class Automation {
        private boolean enabled = true;
        private long tickIntervalMs = 300_000;
        private long initialDelayMs = 30_000;

        public boolean isEnabled()                      { return enabled; }
        public void setEnabled(boolean enabled)         { this.enabled = enabled; }
        public long getTickIntervalMs()                 { return tickIntervalMs; }
        public void setTickIntervalMs(long v)           { this.tickIntervalMs = v; }
        public long getInitialDelayMs()                 { return initialDelayMs; }
        public void setInitialDelayMs(long v)           { this.initialDelayMs = v; }
    }
}
