package com.gemflush.orchestrator.fingerprint;

import com.gemflush.orchestrator.fingerprint.leaderboard.LegalSuffixNameNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseAnalyzerTest {

    ResponseAnalyzer analyzer = new ResponseAnalyzer(new LegalSuffixNameNormalizer());

    static final String LIST_ANSWER = """
            Here are the top physical therapy clinics in Seattle, WA:

            1. Peak Performance PT - excellent sports rehab
            2. Brown Physical Therapy - highly recommended, friendly staff
            3. Evergreen Rehab Center: reliable and experienced team
            """;

    // ------------------------------------------------------------------
    // mention / rank / sentiment
    // ------------------------------------------------------------------

    @Test
    void analyze_numberedListNamingTheBusiness_detectsMentionRankAndSentiment() {
        ModelObservation obs = analyzer.analyze(
                new ScoringResponse(LIST_ANSWER, 120, "openai/gpt-4-turbo"), "openai/gpt-4-turbo", "Brown Physical Therapy");

        assertThat(obs.succeeded()).isTrue();
        assertThat(obs.mentioned()).isTrue();
        assertThat(obs.rankPosition()).isEqualTo(2);
        assertThat(obs.sentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(obs.tokensUsed()).isEqualTo(120);
        assertThat(obs.confidence()).isBetween(0.0, 1.0);
    }

    @Test
    void analyze_businessAbsent_notMentionedAndNeutral() {
        ModelObservation obs = analyzer.analyze(
                new ScoringResponse(LIST_ANSWER, 50, "m"), "m", "Harbor Chiropractic");

        assertThat(obs.mentioned()).isFalse();
        assertThat(obs.rankPosition()).isNull();
        assertThat(obs.sentiment()).isEqualTo(Sentiment.NEUTRAL);
        assertThat(obs.competitorMentions()).hasSize(3);
    }

    @Test
    void analyze_ampersandSpelledOut_stillCountsAsMention() {
        ModelObservation obs = analyzer.analyze(
                new ScoringResponse("I would suggest Smith and Sons Plumbing for emergency work.", 10, "m"),
                "m", "Smith & Sons Plumbing");

        assertThat(obs.mentioned()).isTrue();
    }

    @Test
    void analyze_negativeWording_isNegative() {
        String text = "Brown Physical Therapy has had complaints; several patients were unhappy and found the staff rude.";

        ModelObservation obs = analyzer.analyze(new ScoringResponse(text, 10, "m"), "m", "Brown Physical Therapy");

        assertThat(obs.sentiment()).isEqualTo(Sentiment.NEGATIVE);
    }

    @Test
    void analyze_rankPhrase_usedWhenNoNumberedLine() {
        String text = "Among local clinics, Brown Physical Therapy is ranked 3 by most reviewers.";

        ModelObservation obs = analyzer.analyze(new ScoringResponse(text, 10, "m"), "m", "Brown Physical Therapy");

        assertThat(obs.rankPosition()).isEqualTo(3);
    }

    @Test
    void analyze_nullContent_treatedAsEmpty() {
        ModelObservation obs = analyzer.analyze(new ScoringResponse(null, 0, "m"), "m", "Acme");

        assertThat(obs.mentioned()).isFalse();
        assertThat(obs.competitorMentions()).isEmpty();
    }

    // ------------------------------------------------------------------
    // extractCompetitors()
    // ------------------------------------------------------------------

    @Test
    void extractCompetitors_numberedList_excludesTargetAndKeepsPositions() {
        List<CompetitorMention> found = analyzer.extractCompetitors(LIST_ANSWER, "Brown Physical Therapy");

        assertThat(found).containsExactly(
                new CompetitorMention("Peak Performance PT", 1),
                new CompetitorMention("Evergreen Rehab Center", 3));
    }

    @Test
    void extractCompetitors_bullets_positionedByOrder() {
        String text = """
                - Alpha Clinic
                - Beta Health: good hours
                """;

        assertThat(analyzer.extractCompetitors(text, "Target"))
                .extracting(CompetitorMention::position)
                .containsExactly(1, 2);
    }

    @Test
    void extractCompetitors_filtersDirectoriesAndSentences() {
        String text = """
                1. Yelp - read the reviews
                2. Here are some more options
                3. Quality
                4. Acme Dental - gentle cleanings
                """;

        assertThat(analyzer.extractCompetitors(text, "Target"))
                .extracting(CompetitorMention::name)
                .containsExactly("Acme Dental");
    }

    @Test
    void nameVariations_includeArticleAndSuffixFreeForms() {
        assertThat(analyzer.nameVariations("The Acme Widget Co."))
                .contains("the acme widget co.", "acme widget co.", "acme widget");
    }
}
