package com.gemflush.orchestrator.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.crawl.CrawlData;
import com.gemflush.orchestrator.fingerprint.ScoringProvider;
import com.gemflush.orchestrator.fingerprint.ScoringResponse;
import com.gemflush.orchestrator.pipeline.StageCallExecutor;
import com.gemflush.orchestrator.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a business has enough independent, serious, public
 * references to justify a knowledge-graph entry.
 *
 *   1. search a few query shapes, de-duplicate by URL, cap the list
 *   2. ask the language provider to classify every reference (one JSON call)
 *   3. fall back to a domain heuristic for anything it could not classify
 *   4. isNotable  = qualifying ≥ minSeriousReferences
 *      confidence = min(1, Σ trust(qualifying) / (minSeriousReferences × 100))
 */
@Component
public class NotabilityAssessor {

    private static final Logger log = LoggerFactory.getLogger(NotabilityAssessor.class);

    private static final String[] NEWS_HINTS = {"news", "times", "herald", "gazette", "tribune", "journal", "post."};
    private static final String[] DIRECTORY_HINTS = {"directory", "yelp", "google", "yellowpages", "bbb.org", "mapquest", "manta"};

    private final SearchProvider    search;
    private final ScoringProvider   language;
    private final StageCallExecutor calls;
    private final CfpProperties     props;
    private final ObjectMapper      json;

    public NotabilityAssessor(SearchProvider search,
                              ScoringProvider language,
                              StageCallExecutor calls,
                              CfpProperties props,
                              ObjectMapper json) {
        this.search   = search;
        this.language = language;
        this.calls    = calls;
        this.props    = props;
        this.json     = json;
    }

    public NotabilityVerdict assess(String businessName, String businessUrl, CrawlData crawl) {
        List<SearchResult> references = gatherReferences(businessName, crawl);
        if (references.isEmpty()) {
            return verdict(List.of());
        }
        List<ReferenceAssessment> assessed = classify(businessName, businessUrl, references);
        NotabilityVerdict verdict = verdict(assessed);
        log.info("Notability for '{}': notable={} confidence={} qualifying={}/{}",
                businessName, verdict.notable(), verdict.confidence(),
                verdict.qualifyingReferenceCount(), assessed.size());
        return verdict;
    }

    // ------------------------------------------------------------------
    // Search
    // ------------------------------------------------------------------

    List<String> queries(String businessName, CrawlData crawl) {
        String location = crawl == null ? "" : crawl.locationLabel();
        Set<String> queries = new LinkedHashSet<>();
        queries.add(("\"" + businessName + "\" " + location).trim());
        String stripped = businessName
                .replaceAll("(?i)[,\\s]+(inc|llc|ltd|corp|co|company|corporation)\\.?$", "")
                .trim();
        if (!stripped.isEmpty() && !stripped.equalsIgnoreCase(businessName)) {
            queries.add(("\"" + stripped + "\" " + location).trim());
        }
        queries.add("\"" + businessName + "\" site:.gov OR site:.edu");
        return new ArrayList<>(queries);
    }

    private List<SearchResult> gatherReferences(String businessName, CrawlData crawl) {
        Map<String, SearchResult> byUrl = new LinkedHashMap<>();
        int max = props.getNotability().getMaxReferences();
        for (String query : queries(businessName, crawl)) {
            List<SearchResult> results;
            try {
                results = calls.callWithRetry("search", props.getCalls().getSearch(), () -> search.search(query));
            } catch (StageException e) {
                // one failed query narrows the evidence; the others still count
                log.warn("Search failed for query [{}]: {}", query, e.getMessage());
                continue;
            }
            if (results == null) {
                continue;
            }
            for (SearchResult r : results) {
                if (r.url() == null || r.url().isBlank()) continue;
                byUrl.putIfAbsent(urlKey(r.url()), r);
                if (byUrl.size() >= max) {
                    return new ArrayList<>(byUrl.values());
                }
            }
        }
        return new ArrayList<>(byUrl.values());
    }

    private static String urlKey(String url) {
        String key = url.trim().toLowerCase(Locale.ROOT);
        return key.endsWith("/") ? key.substring(0, key.length() - 1) : key;
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    private List<ReferenceAssessment> classify(String businessName, String businessUrl, List<SearchResult> refs) {
        Map<Integer, JsonNode> modelVerdicts = askModel(businessName, refs);
        String ownHost = hostOf(businessUrl);

        List<ReferenceAssessment> out = new ArrayList<>(refs.size());
        for (int i = 0; i < refs.size(); i++) {
            SearchResult ref = refs.get(i);
            String host = hostOf(ref.url());
            boolean ownSite = ownHost != null && host != null
                    && (host.equals(ownHost) || host.endsWith("." + ownHost));
            JsonNode v = modelVerdicts.get(i);
            if (ownSite) {
                out.add(new ReferenceAssessment(ref.url(), ref.title(), ReferenceSourceType.COMPANY, false, true, false));
            } else if (v != null) {
                ReferenceSourceType type = ReferenceSourceType.fromLabel(v.path("sourceType").asText(null));
                out.add(new ReferenceAssessment(ref.url(), ref.title(), type,
                        v.path("isSerious").asBoolean(type.serious()),
                        v.path("isPubliclyAvailable").asBoolean(true),
                        v.path("isIndependent").asBoolean(type != ReferenceSourceType.COMPANY)));
            } else {
                out.add(heuristic(ref));
            }
        }
        return out;
    }

    /** Index → per-reference JSON; empty when the model is unavailable or answered garbage. */
    private Map<Integer, JsonNode> askModel(String businessName, List<SearchResult> refs) {
        String model = props.getNotability().getAssessmentModel();
        String prompt = assessmentPrompt(businessName, refs);
        ScoringResponse response;
        try {
            response = calls.callWithRetry("notability:" + model, props.getCalls().getScoring(),
                    () -> language.query(model, prompt));
        } catch (StageException e) {
            log.warn("Reference assessment unavailable, using domain heuristics: {}", e.getMessage());
            return Map.of();
        }

        Map<Integer, JsonNode> byIndex = new HashMap<>();
        JsonNode root = parseJson(response == null ? null : response.content());
        for (JsonNode item : root.path("references")) {
            if (item.path("index").canConvertToInt()) {
                byIndex.put(item.path("index").asInt(), item);
            }
        }
        return byIndex;
    }

    private JsonNode parseJson(String content) {
        if (content == null) {
            return json.createObjectNode();
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return json.createObjectNode();
        }
        try {
            return json.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            log.warn("Reference assessment was not valid JSON, using domain heuristics");
            return json.createObjectNode();
        }
    }

    private static String assessmentPrompt(String businessName, List<SearchResult> refs) {
        StringBuilder sb = new StringBuilder();
        sb.append("Assess these references about the business \"").append(businessName)
          .append("\" for knowledge-graph notability.\n\n");
        for (int i = 0; i < refs.size(); i++) {
            SearchResult r = refs.get(i);
            sb.append(i).append(". ").append(r.title() == null ? "" : r.title())
              .append(" (").append(r.url()).append(")\n   ")
              .append(r.snippet() == null ? "" : r.snippet()).append('\n');
        }
        sb.append("""

                For each reference decide isSerious, isPubliclyAvailable, isIndependent and a
                sourceType of news, government, academic, database, directory, review, company
                or other. Return ONLY JSON:
                {"references": [{"index": 0, "isSerious": true, "isPubliclyAvailable": true,
                                 "isIndependent": true, "sourceType": "news"}]}
                """);
        return sb.toString();
    }

    static ReferenceAssessment heuristic(SearchResult ref) {
        String url = ref.url().toLowerCase(Locale.ROOT);
        String host = hostOf(ref.url());
        ReferenceSourceType type;
        if (host != null && (host.endsWith(".gov") || host.contains(".gov."))) {
            type = ReferenceSourceType.GOVERNMENT;
        } else if (host != null && (host.endsWith(".edu") || host.contains(".ac."))) {
            type = ReferenceSourceType.ACADEMIC;
        } else if (containsAny(url, NEWS_HINTS)) {
            type = ReferenceSourceType.NEWS;
        } else if (containsAny(url, DIRECTORY_HINTS)) {
            type = ReferenceSourceType.DIRECTORY;
        } else if (url.contains("review") || url.contains("tripadvisor")) {
            type = ReferenceSourceType.REVIEW;
        } else if (url.contains("chamber") || url.contains("database") || url.contains("opencorporates")) {
            type = ReferenceSourceType.DATABASE;
        } else {
            type = ReferenceSourceType.OTHER;
        }
        return new ReferenceAssessment(ref.url(), ref.title(), type, type.serious(), true, true);
    }

    // ------------------------------------------------------------------
    // Verdict
    // ------------------------------------------------------------------

    NotabilityVerdict verdict(List<ReferenceAssessment> refs) {
        int minSerious = Math.max(1, props.getNotability().getMinSeriousReferences());
        int serious = 0, publicCount = 0, independent = 0, qualifying = 0, qualifyingTrust = 0;
        for (ReferenceAssessment r : refs) {
            if (r.serious()) serious++;
            if (r.publiclyAvailable()) publicCount++;
            if (r.independent()) independent++;
            if (r.qualifies()) {
                qualifying++;
                qualifyingTrust += r.trustScore();
            }
        }
        boolean notable = qualifying >= minSerious;
        double confidence = Math.min(1.0, qualifyingTrust / (minSerious * 100.0));

        String recommendation;
        if (refs.isEmpty()) {
            recommendation = "No references found. Seek coverage from news, government records, directories or review platforms.";
        } else if (notable) {
            recommendation = "Meets notability with " + qualifying + " independent serious references.";
        } else if (qualifying > 0) {
            recommendation = "Borderline: " + qualifying + " qualifying reference(s), "
                    + minSerious + " needed. Review manually before publishing.";
        } else {
            recommendation = "References found but none are independent and serious. Add directory, review or news sources.";
        }
        return new NotabilityVerdict(notable, confidence, serious, publicCount, independent,
                qualifying, recommendation, refs);
    }

    private static boolean containsAny(String s, String[] needles) {
        for (String n : needles) {
            if (s.contains(n)) return true;
        }
        return false;
    }

    static String hostOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
