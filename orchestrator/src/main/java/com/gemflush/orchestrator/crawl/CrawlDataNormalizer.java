package com.gemflush.orchestrator.crawl;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps whatever shape the crawler returned into {@link CrawlData}.
 *
 * Providers disagree on layout (flat fields vs. nested "location", social
 * links as a map vs. a list of URLs), so every field is looked up in the
 * known places and missing values stay null.
 */
@Component
public class CrawlDataNormalizer {

    private static final Map<String, String> SOCIAL_HOSTS = Map.of(
            "facebook.com",  "facebook",
            "instagram.com", "instagram",
            "linkedin.com",  "linkedin",
            "twitter.com",   "twitter",
            "x.com",         "twitter",
            "youtube.com",   "youtube");

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    public CrawlData normalize(JsonNode raw, String fallbackName) {
        JsonNode location = raw.path("location");
        JsonNode address  = raw.path("address");
        JsonNode enhanced = raw.path("llmEnhanced");

        String name = firstText(raw.path("name"), raw.path("businessName"));
        if (name == null) {
            name = fallbackName;
        }

        return new CrawlData(
                name,
                firstText(raw.path("description"), enhanced.path("summary")),
                firstText(raw.path("phone"), raw.path("contact").path("phone")),
                firstText(raw.path("email"), raw.path("contact").path("email")),
                address.isTextual() ? text(address) : firstText(address.path("street"), location.path("address")),
                firstText(location.path("city"), address.path("city"), raw.path("city")),
                firstText(location.path("state"), location.path("region"), address.path("state"), raw.path("region")),
                firstText(location.path("country"), address.path("country"), raw.path("country")),
                number(location.path("lat"), location.path("latitude"), raw.path("latitude")),
                number(location.path("lng"), location.path("longitude"), raw.path("longitude")),
                year(raw.path("foundedYear"), raw.path("founded"), enhanced.path("foundedYear")),
                socialLinks(raw),
                tags(enhanced.path("categories"), raw.path("categories"), raw.path("keywords"), enhanced.path("keywords")),
                firstText(enhanced.path("businessCategory"), raw.path("category")),
                strings(enhanced.path("services").isArray() ? enhanced.path("services") : raw.path("services")));
    }

    // ------------------------------------------------------------------
    // Field helpers
    // ------------------------------------------------------------------

    private static Map<String, String> socialLinks(JsonNode raw) {
        Map<String, String> links = new LinkedHashMap<>();
        JsonNode explicit = raw.path("socialLinks");
        if (explicit.isObject()) {
            explicit.fields().forEachRemaining(e -> {
                String value = text(e.getValue());
                if (value != null) {
                    String key = e.getKey().toLowerCase(Locale.ROOT);
                    links.put(key.equals("x") ? "twitter" : key, value);
                }
            });
        }
        List<String> urls = new ArrayList<>(strings(explicit.isArray() ? explicit : raw.path("links")));
        for (String url : urls) {
            String network = networkOf(url);
            if (network != null) {
                links.putIfAbsent(network, url);
            }
        }
        return links;
    }

    static String networkOf(String url) {
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        for (Map.Entry<String, String> e : SOCIAL_HOSTS.entrySet()) {
            if (host.equals(e.getKey()) || host.endsWith("." + e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }

    private static List<String> tags(JsonNode... sources) {
        Set<String> tags = new LinkedHashSet<>();
        for (JsonNode source : sources) {
            for (String s : strings(source)) {
                String tag = s.trim().toLowerCase(Locale.ROOT);
                if (!tag.isEmpty()) {
                    tags.add(tag);
                }
            }
        }
        return new ArrayList<>(tags);
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String s = text(item);
                if (s != null) {
                    out.add(s);
                }
            }
        } else if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                if (!part.isBlank()) {
                    out.add(part.trim());
                }
            }
        }
        return out;
    }

    private static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            String s = text(node);
            if (s != null) {
                return s;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return null;
        }
        String s = node.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static Double number(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            if (node.isNumber()) {
                return node.asDouble();
            }
            if (node.isTextual() && NUMERIC.matcher(node.asText().trim()).matches()) {
                return Double.parseDouble(node.asText().trim());
            }
        }
        return null;
    }

    private static Integer year(JsonNode... nodes) {
        Double value = number(nodes);
        if (value == null) {
            return null;
        }
        int year = value.intValue();
        return year >= 1000 && year <= 9999 ? year : null;
    }
}
