package com.gemflush.orchestrator.fingerprint.leaderboard;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default grouping key: case-folded, punctuation-free, without a leading
 * article or trailing legal suffixes.
 *
 *   "The Competitor LLC"  → "competitor"
 *   "Competitor, Inc."    → "competitor"
 *   "Smith & Sons Co"     → "smith and sons"
 *
 * A name made only of suffix words keeps its last word so it never
 * collapses to an empty key.
 */
@Component
public class LegalSuffixNameNormalizer implements CompetitorNameNormalizer {

    private static final Set<String> ARTICLES = Set.of("the", "a", "an");

    private static final Set<String> LEGAL_SUFFIXES = Set.of(
            "inc", "incorporated", "llc", "llp", "ltd", "limited", "corp", "corporation",
            "co", "company", "plc", "gmbh");

    @Override
    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        String folded = name.toLowerCase(Locale.ROOT)
                .replace("&", " and ")
                .replaceAll("[.,'’\"]", "")
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim();
        if (folded.isEmpty()) {
            return "";
        }

        List<String> words = new ArrayList<>(Arrays.asList(folded.split(" ")));
        if (words.size() > 1 && ARTICLES.contains(words.get(0))) {
            words.remove(0);
        }
        while (words.size() > 1 && LEGAL_SUFFIXES.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return String.join(" ", words);
    }
}
