package com.pacaccounting.matching;

import com.pacaccounting.ledger.TimeRecord;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of matching a free-text company name against one year of the ledger.
 *
 * @param ledgerKey  matched ledger company key, null when unmatched
 * @param record     matched record, null when unmatched
 * @param tier       tier that produced the match, {@link MatchTier#NONE} when unmatched
 * @param candidates best fuzzy candidates (at most three), only filled when unmatched
 */
public record CompanyMatch(String ledgerKey, TimeRecord record, MatchTier tier, List<ScoredCandidate> candidates) {

    public CompanyMatch {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static CompanyMatch matched(String ledgerKey, TimeRecord record, MatchTier tier) {
        return new CompanyMatch(ledgerKey, record, tier, List.of());
    }

    public static CompanyMatch none(List<ScoredCandidate> candidates) {
        return new CompanyMatch(null, null, MatchTier.NONE, candidates);
    }

    public boolean isMatched() {
        return tier != MatchTier.NONE;
    }

    public Optional<TimeRecord> recordIfMatched() {
        return Optional.ofNullable(record);
    }

    /**
     * Suggestions line shown next to an unmatched client, empty when there is nothing to suggest.
     */
    public String suggestions() {
        if (candidates.isEmpty()) {
            return "";
        }
        return "Suggestions: " + candidates.stream()
                .map(ScoredCandidate::toString)
                .collect(Collectors.joining("; "));
    }
}
