package com.gemflush.orchestrator.fingerprint.leaderboard;

import com.gemflush.orchestrator.fingerprint.CompetitorMention;
import com.gemflush.orchestrator.fingerprint.ModelObservation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the competitive leaderboard from per-model observations.
 *
 * Counting rules:
 *   - only successful observations count as recommendation queries
 *   - a competitor counts at most once per query, whatever spellings appear
 *   - spellings sharing a normalized key are merged into one row
 *   - no rows are dropped, so target + Σ competitors == totalMentions
 */
@Component
public class CompetitiveLeaderboardBuilder {

    private static final Comparator<CompetitorEntry> LEADERBOARD_ORDER =
            Comparator.comparingInt(CompetitorEntry::mentionCount).reversed()
                    .thenComparing(CompetitorEntry::avgPosition, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(CompetitorEntry::name);

    private final CompetitorNameNormalizer normalizer;

    public CompetitiveLeaderboardBuilder(CompetitorNameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public CompetitiveLeaderboard build(String targetName, List<ModelObservation> observations) {
        int queries = 0;
        int targetMentions = 0;
        List<Integer> targetPositions = new ArrayList<>();
        Map<String, MutableTally> byRawName = new LinkedHashMap<>();
        String targetKey = normalizer.normalize(targetName);

        for (ModelObservation obs : observations) {
            if (!obs.succeeded()) {
                continue;
            }
            queries++;
            if (obs.mentioned()) {
                targetMentions++;
                if (obs.rankPosition() != null) {
                    targetPositions.add(obs.rankPosition());
                }
            }

            Set<String> seenThisQuery = new HashSet<>();
            for (CompetitorMention mention : obs.competitorMentions()) {
                String key = normalizer.normalize(mention.name());
                if (key.isEmpty() || key.equals(targetKey) || !seenThisQuery.add(key)) {
                    continue;
                }
                MutableTally tally = byRawName.computeIfAbsent(mention.name(), MutableTally::new);
                tally.count++;
                if (mention.position() != null) {
                    tally.positions.add(mention.position());
                }
                if (obs.mentioned()) {
                    tally.withTarget++;
                }
            }
        }

        List<CompetitorTally> tallies = new ArrayList<>(byRawName.size());
        for (MutableTally t : byRawName.values()) {
            tallies.add(new CompetitorTally(t.name, t.count, mean(t.positions), t.positions, t.withTarget));
        }

        Double targetAvg = mean(targetPositions);
        TargetEntry target = new TargetEntry(
                targetName,
                targetAvg == null ? null : (int) Math.round(targetAvg),
                targetMentions,
                targetAvg);
        return new CompetitiveLeaderboard(target, merge(tallies), queries);
    }

    /**
     * Groups tallies by normalized name and ranks the result.
     *
     * mentionCount and appearsWithTarget are summed. avgPosition is recomputed
     * from the members' raw positions; when any member lacks them it falls
     * back to a mention-weighted mean of the members' averages. The display
     * name is the most-mentioned spelling (first seen on ties).
     */
    public List<CompetitorEntry> merge(List<CompetitorTally> tallies) {
        Map<String, List<CompetitorTally>> groups = new LinkedHashMap<>();
        for (CompetitorTally t : tallies) {
            groups.computeIfAbsent(normalizer.normalize(t.name()), k -> new ArrayList<>()).add(t);
        }

        List<CompetitorEntry> merged = new ArrayList<>(groups.size());
        for (List<CompetitorTally> members : groups.values()) {
            CompetitorTally display = members.get(0);
            int count = 0;
            int withTarget = 0;
            boolean allHavePositions = true;
            List<Integer> positions = new ArrayList<>();
            for (CompetitorTally m : members) {
                count += m.mentionCount();
                withTarget += m.appearsWithTarget();
                if (m.mentionCount() > display.mentionCount()) {
                    display = m;
                }
                if (m.positions().isEmpty() && m.avgPosition() != null) {
                    allHavePositions = false;
                }
                positions.addAll(m.positions());
            }
            Double avg = allHavePositions ? mean(positions) : weightedMean(members);
            merged.add(new CompetitorEntry(display.name(), count, avg, withTarget, 0));
        }

        merged.sort(LEADERBOARD_ORDER);
        List<CompetitorEntry> ranked = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            CompetitorEntry e = merged.get(i);
            ranked.add(new CompetitorEntry(e.name(), e.mentionCount(), e.avgPosition(), e.appearsWithTarget(), i + 1));
        }
        return ranked;
    }

    // ------------------------------------------------------------------

    private static Double mean(List<Integer> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (int v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static Double weightedMean(List<CompetitorTally> members) {
        double sum = 0;
        int weight = 0;
        for (CompetitorTally m : members) {
            Double avg = m.positions().isEmpty() ? m.avgPosition() : mean(m.positions());
            if (avg != null) {
                sum += avg * m.mentionCount();
                weight += m.mentionCount();
            }
        }
        return weight == 0 ? null : sum / weight;
    }

    private static final class MutableTally {
        final String name;
        final List<Integer> positions = new ArrayList<>();
        int count;
        int withTarget;

        MutableTally(String name) {
            this.name = name;
        }
    }
}
