package com.gemflush.orchestrator.crawl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Normalized snapshot stored on Business.crawlData.
 *
 * socialLinks is keyed by network: facebook, instagram, linkedin, twitter, youtube.
 * tags are lower-case and unique, in first-seen order.
 */
public record CrawlData(
        String name,
        String description,
        String phone,
        String email,
        String address,
        String city,
        String region,
        String country,
        Double latitude,
        Double longitude,
        Integer foundedYear,
        Map<String, String> socialLinks,
        List<String> tags,
        String businessCategory,
        List<String> services
) {
    public CrawlData {
        socialLinks = socialLinks == null ? Map.of() : Map.copyOf(socialLinks);
        tags        = tags == null ? List.of() : List.copyOf(tags);
        services    = services == null ? List.of() : List.copyOf(services);
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    /** "Springfield, IL" style label, or empty when nothing is known. */
    public String locationLabel() {
        List<String> parts = new ArrayList<>(2);
        if (city != null && !city.isBlank())     parts.add(city);
        if (region != null && !region.isBlank()) parts.add(region);
        return String.join(", ", parts);
    }
}
