package com.pacaccounting.matching;

import java.util.Locale;

/**
 * A ledger company proposed for manual review together with its similarity ratio.
 */
public record ScoredCandidate(String name, double score) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%.2f)", name, score);
    }
}
