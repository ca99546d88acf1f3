package com.gemflush.orchestrator.fingerprint;

import com.gemflush.orchestrator.crawl.CrawlData;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the recommendation-style question sent to every model.
 *
 * The question names the category and place, never the business itself, so
 * a mention in the answer is organic.
 */
@Component
public class PromptBuilder {

    private record Industry(String plural, String service) {}

    private static final Industry DEFAULT_INDUSTRY = new Industry("businesses", "professional services");

    private static final Map<String, Industry> INDUSTRIES = new LinkedHashMap<>();
    static {
        INDUSTRIES.put("dental",      new Industry("dental practices", "dental care"));
        INDUSTRIES.put("medical",     new Industry("medical practices", "medical services"));
        INDUSTRIES.put("healthcare",  new Industry("healthcare providers", "medical care"));
        INDUSTRIES.put("veterinary",  new Industry("veterinary clinics", "pet care"));
        INDUSTRIES.put("legal",       new Industry("law firms", "legal services"));
        INDUSTRIES.put("law",         new Industry("law firms", "legal services"));
        INDUSTRIES.put("accounting",  new Industry("accounting firms", "financial services"));
        INDUSTRIES.put("consulting",  new Industry("consulting firms", "business consulting"));
        INDUSTRIES.put("real estate", new Industry("real estate agencies", "property services"));
        INDUSTRIES.put("restaurant",  new Industry("restaurants", "dining"));
        INDUSTRIES.put("cafe",        new Industry("cafes", "coffee and food"));
        INDUSTRIES.put("hotel",       new Industry("hotels", "accommodation"));
        INDUSTRIES.put("retail",      new Industry("retail stores", "shopping"));
        INDUSTRIES.put("automotive",  new Industry("auto services", "vehicle maintenance"));
        INDUSTRIES.put("beauty",      new Industry("beauty salons", "beauty services"));
        INDUSTRIES.put("fitness",     new Industry("fitness centers", "fitness training"));
        INDUSTRIES.put("technology",  new Industry("tech companies", "technology solutions"));
        INDUSTRIES.put("marketing",   new Industry("marketing agencies", "marketing services"));
        INDUSTRIES.put("construction", new Industry("construction companies", "construction services"));
        INDUSTRIES.put("cleaning",    new Industry("cleaning services", "cleaning"));
    }

    public String recommendationPrompt(CrawlData crawl, String category) {
        Industry industry = industryOf(crawl, category);
        String location = crawl.locationLabel();
        String where = location.isEmpty() ? "" : " in " + location;
        return "What are the best " + industry.plural() + where + "? "
                + "I'm looking for top recommendations for quality " + industry.service()
                + " providers in the area. Please answer with a numbered list of business names, "
                + "each followed by a short reason.";
    }

    private static Industry industryOf(CrawlData crawl, String category) {
        StringBuilder haystack = new StringBuilder();
        if (category != null) haystack.append(category).append(' ');
        if (crawl.businessCategory() != null) haystack.append(crawl.businessCategory()).append(' ');
        crawl.tags().forEach(t -> haystack.append(t).append(' '));
        String text = haystack.toString().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Industry> e : INDUSTRIES.entrySet()) {
            if (text.contains(e.getKey())) {
                return e.getValue();
            }
        }
        return DEFAULT_INDUSTRY;
    }
}
