package com.gemflush.orchestrator.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.crawl.CrawlData;
import com.gemflush.orchestrator.fingerprint.ScoringProvider;
import com.gemflush.orchestrator.fingerprint.ScoringResponse;
import com.gemflush.orchestrator.pipeline.RetryableIoException;
import com.gemflush.orchestrator.pipeline.StageCallExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotabilityAssessorTest {

    @Mock SearchProvider    search;
    @Mock ScoringProvider   language;
    @Mock StageCallExecutor calls;

    NotabilityAssessor assessor;
    CrawlData crawl = new CrawlData("Brown Physical Therapy", null, null, null, null, "Seattle", "WA", "US",
            null, null, null, null, null, null, null);

    static final List<SearchResult> RESULTS = List.of(
            new SearchResult("https://www.seattletimes.com/health/brown-pt", "Local clinic expands", "..."),
            new SearchResult("https://brownpt.example.com/about", "About us", "..."),
            new SearchResult("https://blog.random.net/post", "My visit", "..."));

    @BeforeEach
    void setUp() {
        assessor = new NotabilityAssessor(search, language, calls, new CfpProperties(), new ObjectMapper());
        lenient().when(calls.callWithRetry(anyString(), any(), any())).thenAnswer(inv -> {
            Supplier<?> call = inv.getArgument(2);
            return call.get();
        });
    }

    @Test
    void assess_modelClassification_ownSiteNeverCounts() {
        when(search.search(anyString())).thenReturn(RESULTS);
        when(language.query(anyString(), anyString())).thenReturn(new ScoringResponse("""
                Here is my assessment:
                {"references": [
                  {"index": 0, "isSerious": true, "isPubliclyAvailable": true, "isIndependent": true, "sourceType": "news"},
                  {"index": 1, "isSerious": true, "isPubliclyAvailable": true, "isIndependent": true, "sourceType": "news"},
                  {"index": 2, "isSerious": false, "isPubliclyAvailable": true, "isIndependent": true, "sourceType": "other"}
                ]}
                """, 200, "m"));

        NotabilityVerdict verdict = assessor.assess("Brown Physical Therapy", "https://brownpt.example.com", crawl);

        assertThat(verdict.references()).hasSize(3);
        assertThat(verdict.references().get(1).sourceType()).isEqualTo(ReferenceSourceType.COMPANY);
        assertThat(verdict.qualifyingReferenceCount()).isEqualTo(1);
        assertThat(verdict.notable()).isFalse();
        // 85 trust over 2 × 100 needed
        assertThat(verdict.confidence()).isCloseTo(0.425, within(1e-9));
        assertThat(verdict.recommendation()).startsWith("Borderline");
    }

    @Test
    void assess_modelUnavailable_fallsBackToDomainHeuristics() {
        when(search.search(anyString())).thenReturn(List.of(
                new SearchResult("https://www.sba.gov/success/brown-pt", "SBA story", null),
                new SearchResult("https://www.yelp.com/biz/brown-pt", "Yelp", null)));
        when(language.query(anyString(), anyString())).thenThrow(new RetryableIoException("down"));

        NotabilityVerdict verdict = assessor.assess("Brown Physical Therapy", "https://brownpt.example.com", crawl);

        assertThat(verdict.notable()).isTrue();
        assertThat(verdict.qualifyingReferenceCount()).isEqualTo(2);
        // (90 + 75) / 200
        assertThat(verdict.confidence()).isCloseTo(0.825, within(1e-9));
    }

    @Test
    void assess_oneSearchQueryFails_othersStillUsed() {
        when(search.search(contains("site:.gov"))).thenThrow(new RetryableIoException("rate limited"));
        when(search.search(contains("Seattle"))).thenReturn(List.of(
                new SearchResult("https://news.example.com/a", "A", null)));
        when(language.query(anyString(), anyString())).thenReturn(new ScoringResponse("no json here", 5, "m"));

        NotabilityVerdict verdict = assessor.assess("Brown Physical Therapy", "https://brownpt.example.com", crawl);

        assertThat(verdict.references()).singleElement()
                .satisfies(r -> assertThat(r.sourceType()).isEqualTo(ReferenceSourceType.NEWS));
    }

    @Test
    void assess_noReferences_notNotableWithZeroConfidence() {
        when(search.search(anyString())).thenReturn(List.of());

        NotabilityVerdict verdict = assessor.assess("Brown Physical Therapy", "https://brownpt.example.com", crawl);

        assertThat(verdict.notable()).isFalse();
        assertThat(verdict.confidence()).isZero();
        verifyNoInteractions(language);
    }

    @Test
    void queries_stripLegalSuffixAndAddOfficialSources() {
        assertThat(assessor.queries("Acme Widgets, Inc.", crawl)).containsExactly(
                "\"Acme Widgets, Inc.\" Seattle, WA",
                "\"Acme Widgets\" Seattle, WA",
                "\"Acme Widgets, Inc.\" site:.gov OR site:.edu");
    }

    @Test
    void heuristic_unknownDomain_isNotSerious() {
        ReferenceAssessment r = NotabilityAssessor.heuristic(new SearchResult("https://example.org/page", null, null));

        assertThat(r.sourceType()).isEqualTo(ReferenceSourceType.OTHER);
        assertThat(r.qualifies()).isFalse();
    }
}
