package com.pacaccounting.matching;

import com.pacaccounting.ledger.TimeRecord;
import com.pacaccounting.util.names.NameNormalizer;
import com.pacaccounting.utils.Utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a client registry company name to its entry in one year of the ledger.
 * <p>
 * Three tiers are tried in order and the first success wins:
 * <ol>
 *     <li>exact: equal matching keys;</li>
 *     <li>token inclusion: the significant tokens of one name are a subset of the other's;</li>
 *     <li>bounded fuzzy: the best similarity ratio among the twenty closest keys, accepted
 *     only above the threshold and with a clear lead over the runner-up.</li>
 * </ol>
 * Deleted records are never matched. When nothing is accepted, the three best fuzzy
 * candidates are returned for manual review.
 */
public class CompanyMatcher {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.92;
    public static final double DEFAULT_FUZZY_MARGIN = 0.03;

    private static final double PREFILTER_CUTOFF = 0.80;
    private static final int PREFILTER_LIMIT = 20;
    private static final int UNFILTERED_LIMIT = 200;
    private static final int CANDIDATES_REPORTED = 3;
    private static final double EPSILON = 1e-9;

    private final double fuzzyThreshold;
    private final double fuzzyMargin;

    public CompanyMatcher() {
        this(DEFAULT_FUZZY_THRESHOLD, DEFAULT_FUZZY_MARGIN);
    }

    public CompanyMatcher(double fuzzyThreshold, double fuzzyMargin) {
        this.fuzzyThreshold = fuzzyThreshold;
        this.fuzzyMargin = fuzzyMargin;
    }

    /**
     * Precomputes keys and tokens of a year slice so that many names can be matched against it.
     */
    public LedgerIndex index(Map<String, TimeRecord> yearSlice) {
        return new LedgerIndex(yearSlice);
    }

    public CompanyMatch match(String companyName, Map<String, TimeRecord> yearSlice) {
        return match(companyName, index(yearSlice));
    }

    public CompanyMatch match(String companyName, LedgerIndex index) {
        if (index.isEmpty()) {
            return CompanyMatch.none(List.of());
        }
        String original = companyName == null ? "" : companyName.trim();
        String key = NameNormalizer.matchingKey(original);
        if (key.isEmpty()) {
            return CompanyMatch.none(List.of());
        }

        // 1) exact
        List<String> bucket = index.originalsByKey.get(key);
        if (bucket != null) {
            String chosen = chooseOriginal(original, bucket);
            return CompanyMatch.matched(chosen, index.records.get(chosen), MatchTier.EXACT);
        }

        // 2) token inclusion
        String inclusionKey = matchByTokenInclusion(key, index);
        if (inclusionKey != null) {
            String chosen = chooseOriginal(original, index.originalsByKey.get(inclusionKey));
            return CompanyMatch.matched(chosen, index.records.get(chosen), MatchTier.TOKEN_INCLUSION);
        }

        // 3) bounded fuzzy
        List<ScoredCandidate> ratios = fuzzyCandidates(key, index);
        if (!ratios.isEmpty()) {
            ScoredCandidate best = ratios.get(0);
            double second = ratios.size() > 1 ? ratios.get(1).score() : 0.0;
            boolean clearLead = ratios.size() == 1 || best.score() - second >= fuzzyMargin - EPSILON;
            if (best.score() >= fuzzyThreshold - EPSILON && clearLead) {
                String chosen = chooseOriginal(original, index.originalsByKey.get(best.name()));
                return CompanyMatch.matched(chosen, index.records.get(chosen), MatchTier.FUZZY);
            }
        }

        List<ScoredCandidate> top = new ArrayList<>();
        for (ScoredCandidate candidate : ratios.subList(0, Math.min(CANDIDATES_REPORTED, ratios.size()))) {
            String chosen = chooseOriginal(original, index.originalsByKey.get(candidate.name()));
            top.add(new ScoredCandidate(chosen, candidate.score()));
        }
        return CompanyMatch.none(top);
    }

    private String matchByTokenInclusion(String key, LedgerIndex index) {
        Set<String> nameTokens = new HashSet<>(NameNormalizer.significantTokens(key));
        if (nameTokens.isEmpty()) {
            return null;
        }
        String bestKey = null;
        int bestOverlap = -1;
        double bestRatio = -1.0;
        for (String candidateKey : index.keys) {
            Set<String> candidateTokens = index.tokensByKey.get(candidateKey);
            if (candidateTokens.isEmpty()) {
                continue;
            }
            if (!candidateTokens.containsAll(nameTokens) && !nameTokens.containsAll(candidateTokens)) {
                continue;
            }
            Set<String> common = new HashSet<>(nameTokens);
            common.retainAll(candidateTokens);
            int overlap = common.size();
            double ratio = SimilarityRatio.ratio(key, candidateKey);
            boolean better = overlap > bestOverlap
                    || (overlap == bestOverlap && ratio > bestRatio)
                    || (overlap == bestOverlap && ratio == bestRatio && candidateKey.length() < bestKey.length());
            if (better) {
                bestKey = candidateKey;
                bestOverlap = overlap;
                bestRatio = ratio;
            }
        }
        return bestKey;
    }

    /**
     * Ledger keys scored by similarity ratio, best first. Only keys at or above the cutoff are
     * kept, at most twenty of them; when none reaches it, the first two hundred keys are scored
     * so that the closest ones can still be suggested. Equal ratios are ordered by Jaro-Winkler.
     */
    private List<ScoredCandidate> fuzzyCandidates(String key, LedgerIndex index) {
        List<ScoredCandidate> close = new ArrayList<>();
        for (String candidateKey : index.keys) {
            double ratio = SimilarityRatio.ratio(key, candidateKey);
            if (ratio >= PREFILTER_CUTOFF - EPSILON) {
                close.add(new ScoredCandidate(candidateKey, ratio));
            }
        }
        List<ScoredCandidate> scored = close;
        int limit = PREFILTER_LIMIT;
        if (close.isEmpty()) {
            scored = new ArrayList<>();
            for (String candidateKey : index.keys.subList(0, Math.min(UNFILTERED_LIMIT, index.keys.size()))) {
                scored.add(new ScoredCandidate(candidateKey, SimilarityRatio.ratio(key, candidateKey)));
            }
            limit = UNFILTERED_LIMIT;
        }
        Comparator<ScoredCandidate> byRatio = Comparator.comparingDouble(ScoredCandidate::score).reversed();
        scored.sort(byRatio.thenComparing(
                Comparator.comparingDouble((ScoredCandidate candidate) -> Utils.jaroWinkler(key, candidate.name()))
                        .reversed()));
        return scored.subList(0, Math.min(limit, scored.size()));
    }

    /**
     * Among ledger spellings sharing one key, the one textually closest to the query.
     */
    private static String chooseOriginal(String query, List<String> originals) {
        if (originals.size() == 1) {
            return originals.get(0);
        }
        String target = query.toUpperCase(Locale.ROOT);
        String best = originals.get(0);
        double bestRatio = -1.0;
        for (String candidate : originals) {
            double ratio = SimilarityRatio.ratio(target, candidate.trim().toUpperCase(Locale.ROOT));
            if (ratio > bestRatio) {
                bestRatio = ratio;
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Matching keys and tokens of the non-deleted companies of one year.
     */
    public static final class LedgerIndex {

        private final Map<String, List<String>> originalsByKey = new LinkedHashMap<>();
        private final Map<String, TimeRecord> records = new LinkedHashMap<>();
        private final Map<String, Set<String>> tokensByKey = new LinkedHashMap<>();
        private final List<String> keys;

        private LedgerIndex(Map<String, TimeRecord> yearSlice) {
            for (Map.Entry<String, TimeRecord> entry : yearSlice.entrySet()) {
                TimeRecord record = entry.getValue();
                if (record == null || record.isDeleted()) {
                    continue;
                }
                String key = NameNormalizer.matchingKey(entry.getKey());
                if (key.isEmpty()) {
                    continue;
                }
                records.put(entry.getKey(), record);
                originalsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(entry.getKey());
                tokensByKey.computeIfAbsent(key, k -> new HashSet<>(NameNormalizer.significantTokens(k)));
            }
            this.keys = List.copyOf(originalsByKey.keySet());
        }

        public boolean isEmpty() {
            return keys.isEmpty();
        }

        public int size() {
            return keys.size();
        }
    }
}
