package com.gemflush.orchestrator.fingerprint;

import com.gemflush.orchestrator.fingerprint.leaderboard.CompetitorNameNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a model response for one business: was it mentioned, in what tone,
 * at which list position, and which other businesses were listed.
 *
 * Everything here is keyword and layout heuristics; confidence reflects how
 * much structure the response gave us to work with.
 */
@Component
public class ResponseAnalyzer {

    private static final List<String> POSITIVE = List.of(
            "excellent", "outstanding", "great", "amazing", "fantastic", "wonderful",
            "professional", "reliable", "trustworthy", "reputable", "quality",
            "highly recommended", "top-rated", "best", "leading", "premier",
            "experienced", "skilled", "expert", "knowledgeable", "competent",
            "friendly", "helpful", "responsive", "efficient", "thorough",
            "satisfied", "pleased", "happy", "impressed", "delighted");

    private static final List<String> NEGATIVE = List.of(
            "terrible", "awful", "horrible", "disappointing", "poor", "bad",
            "unprofessional", "unreliable", "untrustworthy", "questionable",
            "avoid", "warning", "complaint", "problem", "issue", "concern",
            "rude", "unhelpful", "slow", "inefficient", "careless",
            "overpriced", "expensive", "low-quality", "subpar",
            "dissatisfied", "unhappy", "frustrated", "disappointed", "regret");

    private static final List<String> NEUTRAL = List.of(
            "okay", "average", "decent", "standard", "typical", "normal",
            "adequate", "acceptable", "reasonable", "fair", "moderate",
            "mixed", "varies", "depends", "sometimes", "generally");

    private static final List<Pattern> IMPLICIT_POSITIVE = List.of(
            Pattern.compile("would\\s+recommend", Pattern.CASE_INSENSITIVE),
            Pattern.compile("good\\s+choice", Pattern.CASE_INSENSITIVE),
            Pattern.compile("solid\\s+option", Pattern.CASE_INSENSITIVE),
            Pattern.compile("worth\\s+considering", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> IMPLICIT_NEGATIVE = List.of(
            Pattern.compile("would\\s+not\\s+recommend", Pattern.CASE_INSENSITIVE),
            Pattern.compile("be\\s+careful", Pattern.CASE_INSENSITIVE),
            Pattern.compile("limited\\s+information", Pattern.CASE_INSENSITIVE),
            Pattern.compile("insufficient\\s+data", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> RANK_PHRASES = List.of(
            Pattern.compile("(?:number\\s+|#)(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)(?:st|nd|rd|th)\\s+(?:place|choice|option)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("ranked\\s+(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("position\\s+(\\d+)", Pattern.CASE_INSENSITIVE));

    // "1. Name - blurb", "2) **Name**: blurb"
    private static final Pattern NUMBERED_ITEM = Pattern.compile(
            "^\\s*(\\d+)[.)]\\s+\\**([A-Z][\\p{L}\\p{N}&'’. \\t]*?)\\**\\s*(?:[-–—:(,]|$)", Pattern.MULTILINE);

    // "- Name", "* Name", "• Name"
    private static final Pattern BULLET_ITEM = Pattern.compile(
            "^\\s*[-*•]\\s+\\**([A-Z][\\p{L}\\p{N}&'’. \\t]*?)\\**\\s*(?:[-–—:(,]|$)", Pattern.MULTILINE);

    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*(\\d+)[.)]");

    private static final Pattern ANY_NUMBERED_LINE = Pattern.compile("^\\s*\\d+[.)]", Pattern.MULTILINE);

    private static final Pattern NOT_A_NAME = Pattern.compile(
            "^(here are|i'd recommend|i recommend|to give you|each of these|these businesses"
            + "|some top|top recommendations|recommendations for|a great|great question"
            + "|what you're|you're looking|looking for"
            + "|(and|or|but|if|when|where|why|how|is|are|was|were|can|could|should|would|will"
            + "|this|that|these|those|it|they|we|you)\\s).*",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> GENERIC_WORDS = Set.of(
            "quality", "professional", "local", "community", "excellence", "choice",
            "group", "services", "solutions", "note", "summary", "conclusion");

    private static final List<String> FALSE_POSITIVES = List.of(
            "google", "facebook", "twitter", "linkedin", "instagram", "better business bureau",
            "bbb", "yelp", "tripadvisor", "united states", "new york", "california", "texas",
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday");

    private final CompetitorNameNormalizer nameNormalizer;

    public ResponseAnalyzer(CompetitorNameNormalizer nameNormalizer) {
        this.nameNormalizer = nameNormalizer;
    }

    public ModelObservation analyze(ScoringResponse response, String model, String businessName) {
        String content = response.content() == null ? "" : response.content();
        String lower = content.toLowerCase(Locale.ROOT);

        double mentionConfidence;
        boolean mentioned;
        if (lower.contains(businessName.toLowerCase(Locale.ROOT))) {
            mentioned = true;
            mentionConfidence = 0.95;
        } else if (nameVariations(businessName).stream().anyMatch(lower::contains)) {
            mentioned = true;
            mentionConfidence = 0.85;
        } else {
            mentioned = false;
            mentionConfidence = 0.9;
        }

        SentimentReading sentiment = mentioned ? readSentiment(content, lower) : new SentimentReading(Sentiment.NEUTRAL, 0.5);
        Integer rank = mentioned ? findRank(content, businessName) : null;
        List<CompetitorMention> competitors = extractCompetitors(content, businessName);
        double listConfidence = listConfidence(lower, content, competitors.size());

        double confidence = mentionConfidence * 0.5 + sentiment.confidence() * 0.3 + listConfidence * 0.2;
        return new ModelObservation(model, mentioned, sentiment.sentiment(), confidence, rank,
                competitors, response.tokensUsed(), null);
    }

    // ------------------------------------------------------------------
    // Mention
    // ------------------------------------------------------------------

    /** Lower-case spellings of the business name that count as a mention. */
    Set<String> nameVariations(String businessName) {
        Set<String> variations = new LinkedHashSet<>();
        String lower = businessName.trim().toLowerCase(Locale.ROOT);
        variations.add(lower);
        variations.add(lower.replace("&", "and"));
        variations.add(lower.replace(" and ", " & "));
        variations.add(lower.replaceFirst("^(the|a|an)\\s+", ""));
        String key = nameNormalizer.normalize(businessName);
        // a one-word key like "acme" is distinctive enough; shorter keys are not
        if (key.length() >= 4) {
            variations.add(key);
        }
        variations.removeIf(String::isBlank);
        return variations;
    }

    // ------------------------------------------------------------------
    // Sentiment
    // ------------------------------------------------------------------

    private record SentimentReading(Sentiment sentiment, double confidence) {}

    private static SentimentReading readSentiment(String content, String lower) {
        long pos = POSITIVE.stream().filter(lower::contains).count();
        long neg = NEGATIVE.stream().filter(lower::contains).count();
        long neu = NEUTRAL.stream().filter(lower::contains).count();
        long total = pos + neg + neu;

        if (total == 0) {
            long implicitPos = IMPLICIT_POSITIVE.stream().filter(p -> p.matcher(content).find()).count();
            long implicitNeg = IMPLICIT_NEGATIVE.stream().filter(p -> p.matcher(content).find()).count();
            if (implicitPos > implicitNeg) return new SentimentReading(Sentiment.POSITIVE, 0.6);
            if (implicitNeg > implicitPos) return new SentimentReading(Sentiment.NEGATIVE, 0.6);
            return new SentimentReading(Sentiment.NEUTRAL, 0.8);
        }

        double score = (double) (pos - neg) / total;
        if (score > 0.3) {
            return new SentimentReading(Sentiment.POSITIVE, Math.min(0.95, 0.6 + score * 0.35));
        }
        if (score < -0.3) {
            return new SentimentReading(Sentiment.NEGATIVE, Math.min(0.95, 0.6 + Math.abs(score) * 0.35));
        }
        return new SentimentReading(Sentiment.NEUTRAL, 0.7);
    }

    // ------------------------------------------------------------------
    // Rank
    // ------------------------------------------------------------------

    /**
     * A numbered list line naming the business wins; otherwise a rank phrase
     * ("#2", "ranked 3") on a line that names it. Ranks outside 1..10 are ignored.
     */
    private Integer findRank(String content, String businessName) {
        Set<String> variations = nameVariations(businessName);
        String[] lines = content.split("\\R");
        for (String line : lines) {
            String lowerLine = line.toLowerCase(Locale.ROOT);
            if (variations.stream().noneMatch(lowerLine::contains)) {
                continue;
            }
            Matcher m = NUMBERED_LINE.matcher(line);
            if (m.find()) {
                Integer rank = inRange(m.group(1));
                if (rank != null) return rank;
            }
        }
        for (String line : lines) {
            String lowerLine = line.toLowerCase(Locale.ROOT);
            if (variations.stream().noneMatch(lowerLine::contains)) {
                continue;
            }
            for (Pattern p : RANK_PHRASES) {
                Matcher m = p.matcher(line);
                if (m.find()) {
                    Integer rank = inRange(m.group(1));
                    if (rank != null) return rank;
                }
            }
        }
        return null;
    }

    private static Integer inRange(String digits) {
        if (digits.length() > 2) {
            return null;
        }
        int n = Integer.parseInt(digits);
        return n >= 1 && n <= 10 ? n : null;
    }

    // ------------------------------------------------------------------
    // Competitors
    // ------------------------------------------------------------------

    List<CompetitorMention> extractCompetitors(String content, String businessName) {
        String targetKey = nameNormalizer.normalize(businessName);
        List<CompetitorMention> found = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        Matcher numbered = NUMBERED_ITEM.matcher(content);
        while (numbered.find()) {
            Integer position = inRange(numbered.group(1));
            addIfCompetitor(found, seen, numbered.group(2), position, targetKey);
        }
        Matcher bullet = BULLET_ITEM.matcher(content);
        int bulletIndex = 0;
        while (bullet.find()) {
            bulletIndex++;
            addIfCompetitor(found, seen, bullet.group(1), bulletIndex, targetKey);
        }
        return found;
    }

    private void addIfCompetitor(List<CompetitorMention> found, Set<String> seen,
                                 String raw, Integer position, String targetKey) {
        String name = raw.trim().replaceAll("\\s+", " ").replaceAll("[.\\s]+$", "");
        if (!looksLikeBusinessName(name)) {
            return;
        }
        String key = nameNormalizer.normalize(name);
        if (key.isEmpty() || key.equals(targetKey) || !seen.add(name)) {
            return;
        }
        found.add(new CompetitorMention(name, position));
    }

    static boolean looksLikeBusinessName(String name) {
        if (name.length() < 2 || name.length() > 80 || !Character.isUpperCase(name.charAt(0))) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (GENERIC_WORDS.contains(lower) || NOT_A_NAME.matcher(name).matches()) {
            return false;
        }
        for (String fp : FALSE_POSITIVES) {
            if (lower.contains(fp)) {
                return false;
            }
        }
        return true;
    }

    private static double listConfidence(String lower, String content, int competitorCount) {
        double confidence = 0.5;
        if (lower.contains("recommend") || lower.contains("top") || lower.contains("best")) {
            confidence += 0.2;
        }
        if (ANY_NUMBERED_LINE.matcher(content).find()) {
            confidence += 0.2;
        }
        if (competitorCount > 10) {
            confidence -= 0.2;
        } else if (competitorCount == 0) {
            confidence -= 0.3;
        }
        return Math.max(0.1, Math.min(0.95, confidence));
    }
}
