package com.pacaccounting.ledger;

import com.fasterxml.jackson.annotation.JsonValue;
import com.pacaccounting.util.names.NameNormalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Year to company to {@link TimeRecord}. Company keys are the first-seen spelling and are
 * never renamed; lookups by strong company key find an existing entry under another spelling.
 */
public class Ledger {

    private final Map<String, Map<String, TimeRecord>> years = new LinkedHashMap<>();

    @JsonValue
    Map<String, Map<String, TimeRecord>> asMap() {
        return years;
    }

    public Set<String> years() {
        return Collections.unmodifiableSet(years.keySet());
    }

    public boolean isEmpty() {
        return years.isEmpty();
    }

    /**
     * Companies of a year, creating the year when it does not exist.
     */
    public Map<String, TimeRecord> year(int year) {
        return years.computeIfAbsent(yearKey(year), k -> new LinkedHashMap<>());
    }

    /**
     * Read-only companies of a year; empty when the year has no data.
     */
    public Map<String, TimeRecord> yearView(int year) {
        Map<String, TimeRecord> companies = years.get(yearKey(year));
        return companies == null ? Collections.emptyMap() : Collections.unmodifiableMap(companies);
    }

    public Optional<TimeRecord> find(int year, String company) {
        return Optional.ofNullable(yearView(year).get(company));
    }

    /**
     * Existing key of a year whose strong company key equals the given one.
     */
    public Optional<String> findKeyByNormalizedName(int year, String normalizedCompany) {
        if (normalizedCompany == null || normalizedCompany.isEmpty()) {
            return Optional.empty();
        }
        for (String company : yearView(year).keySet()) {
            if (normalizedCompany.equals(NameNormalizer.normalizeCompany(company))) {
                return Optional.of(company);
            }
        }
        return Optional.empty();
    }

    public TimeRecord getOrCreate(int year, String company) {
        return year(year).computeIfAbsent(company, TimeRecord::new);
    }

    void put(String year, String company, TimeRecord record) {
        record.setCompanyDisplayName(company);
        years.computeIfAbsent(year, k -> new LinkedHashMap<>()).put(company, record);
    }

    void ensureYear(String year) {
        years.computeIfAbsent(year, k -> new LinkedHashMap<>());
    }

    public void clear() {
        years.clear();
    }

    /**
     * Total minute volume of the whole ledger, deleted records included.
     */
    public long totalMinutes() {
        long total = 0;
        for (Map<String, TimeRecord> companies : years.values()) {
            for (TimeRecord record : companies.values()) {
                total += record.totalMinutes();
            }
        }
        return total;
    }

    public int companyCount() {
        return years.values().stream().mapToInt(Map::size).sum();
    }

    public Ledger copy() {
        Ledger copy = new Ledger();
        years.forEach((year, companies) -> {
            copy.ensureYear(year);
            companies.forEach((company, record) -> copy.put(year, company, record.copy()));
        });
        return copy;
    }

    static String yearKey(int year) {
        if (year <= 0) {
            throw new IllegalArgumentException("Year must be positive: " + year);
        }
        return Integer.toString(year);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Ledger other && years.equals(other.years);
    }

    @Override
    public int hashCode() {
        return years.hashCode();
    }

    @Override
    public String toString() {
        return "Ledger" + years;
    }
}
