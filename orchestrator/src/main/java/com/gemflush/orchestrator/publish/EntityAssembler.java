package com.gemflush.orchestrator.publish;

import com.gemflush.orchestrator.automation.EntityRichness;
import com.gemflush.orchestrator.crawl.CrawlData;
import com.gemflush.orchestrator.model.Business;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the candidate entity from crawl data, whatever the eligibility
 * outcome, so the full entity can always be stored for review.
 *
 *   BASIC     P31 instance of business, P856 website, P1448 official name
 *   ENHANCED  + P1329 phone, P968 email, P969 street address, P625 coordinates
 *   COMPLETE  + P571 inception, P2013 Facebook, P2003 Instagram, P4264 LinkedIn, P2002 X
 *
 * Every claim cites the business website plus up to two qualifying
 * notability references.
 */
@Component
public class EntityAssembler {

    static final String BUSINESS_ITEM = "Q4830453";
    static final int MAX_DESCRIPTION = 250;

    private static final Map<String, String> SOCIAL_PROPERTIES = new LinkedHashMap<>();
    static {
        SOCIAL_PROPERTIES.put("facebook",  "P2013");
        SOCIAL_PROPERTIES.put("instagram", "P2003");
        SOCIAL_PROPERTIES.put("linkedin",  "P4264");
        SOCIAL_PROPERTIES.put("twitter",   "P2002");
    }

    public CandidateEntity assemble(Business business, CrawlData crawl, NotabilityVerdict verdict,
                                    EntityRichness richness) {
        String name = crawl.name() != null ? crawl.name() : business.getName();
        List<String> refs = new ArrayList<>();
        refs.add(business.getUrl());
        if (verdict != null) {
            verdict.topReferences(2).forEach(r -> refs.add(r.url()));
        }

        Map<String, List<Claim>> claims = new LinkedHashMap<>();
        add(claims, "P31", "wikibase-item", BUSINESS_ITEM, refs);
        add(claims, "P856", "url", business.getUrl(), refs);
        add(claims, "P1448", "monolingualtext", Map.of("text", name, "language", "en"), refs);

        if (richness.includes(EntityRichness.ENHANCED)) {
            add(claims, "P1329", "string", crawl.phone(), refs);
            add(claims, "P968", "url", crawl.email() == null ? null : "mailto:" + crawl.email(), refs);
            add(claims, "P969", "string", crawl.address(), refs);
            if (crawl.hasCoordinates()) {
                add(claims, "P625", "globe-coordinate", Map.of(
                        "latitude", crawl.latitude(),
                        "longitude", crawl.longitude(),
                        "precision", 0.0001,
                        "globe", "http://www.wikidata.org/entity/Q2"), refs);
            }
        }

        if (richness.includes(EntityRichness.COMPLETE)) {
            if (crawl.foundedYear() != null) {
                add(claims, "P571", "time", Map.of(
                        "time", "+" + crawl.foundedYear() + "-00-00T00:00:00Z",
                        "precision", 9), refs);
            }
            for (Map.Entry<String, String> e : SOCIAL_PROPERTIES.entrySet()) {
                String handle = socialHandle(crawl.socialLinks().get(e.getKey()));
                add(claims, e.getValue(), "external-id", handle, refs);
            }
        }

        return new CandidateEntity(
                Map.of("en", name),
                Map.of("en", description(crawl)),
                claims);
    }

    static String description(CrawlData crawl) {
        String d = crawl.description();
        if (d != null && !d.isBlank()) {
            d = d.trim().replaceAll("\\s+", " ");
            return d.length() <= MAX_DESCRIPTION ? d : d.substring(0, MAX_DESCRIPTION - 3).trim() + "...";
        }
        String location = crawl.locationLabel();
        return location.isEmpty() ? "business" : "business in " + location;
    }

    /** Last path segment of a profile URL: "https://x.com/acme/" → "acme". */
    static String socialHandle(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim().replaceAll("[?#].*$", "").replaceAll("/+$", "");
        int slash = trimmed.lastIndexOf('/');
        String handle = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        handle = handle.startsWith("@") ? handle.substring(1) : handle;
        return handle.isBlank() || handle.contains(".") ? null : handle;
    }

    private static void add(Map<String, List<Claim>> claims, String property, String datatype,
                            Object value, List<String> refs) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            return;
        }
        claims.computeIfAbsent(property, p -> new ArrayList<>()).add(new Claim(property, datatype, value, refs));
    }
}
