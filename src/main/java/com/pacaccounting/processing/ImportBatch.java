package com.pacaccounting.processing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated facts of one upload for one month. Exists only while the upload is processed.
 */
public class ImportBatch {

    private final int month;
    private final List<ImportFact> facts;
    private final Map<String, String> displayNameByKey;

    public ImportBatch(int month, List<ImportFact> facts) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12: " + month);
        }
        this.month = month;
        this.facts = List.copyOf(facts);
        Map<String, String> names = new LinkedHashMap<>();
        for (ImportFact fact : facts) {
            names.putIfAbsent(fact.companyKey(), fact.companyName());
        }
        this.displayNameByKey = Collections.unmodifiableMap(names);
    }

    public int getMonth() {
        return month;
    }

    public List<ImportFact> getFacts() {
        return facts;
    }

    /**
     * Strong keys of every company the batch touches, in first-seen order.
     */
    public Set<String> getAffectedCompanyKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(displayNameByKey.keySet()));
    }

    /**
     * First spelling seen for a company key, used when the company is new to the ledger.
     */
    public String displayNameFor(String companyKey) {
        return displayNameByKey.get(companyKey);
    }

    public long totalMinutes() {
        return facts.stream().mapToLong(ImportFact::minutes).sum();
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }

    /**
     * Same month, different facts; display names are recomputed from the new facts.
     */
    public ImportBatch withFacts(List<ImportFact> newFacts) {
        return new ImportBatch(month, new ArrayList<>(newFacts));
    }

    @Override
    public String toString() {
        return "ImportBatch{month=" + month + ", facts=" + facts.size() + ", companies=" + displayNameByKey.size() + '}';
    }
}
