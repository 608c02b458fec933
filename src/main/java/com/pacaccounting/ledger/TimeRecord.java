package com.pacaccounting.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.pacaccounting.utils.Utils;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One company's time data for one year.
 * <p>
 * Months are 1..12 and every stored minute value is a positive integer; zero entries are
 * removed instead of stored. Additions saturate at {@code Integer.MAX_VALUE}. The per-technician breakdown is a coarse attribution and may
 * sum to less than the month total. The JSON property names are those of the deployed
 * ledger file.
 */
@JsonPropertyOrder({"meses", "extra_mensal", "apagado", "por_tecnico"})
public class TimeRecord {

    @JsonIgnore
    private String companyDisplayName;

    @JsonProperty("meses")
    private final SortedMap<Integer, Integer> monthlyMinutes = new TreeMap<>();

    @JsonProperty("extra_mensal")
    private int extraMonthlyMinutes;

    @JsonProperty("apagado")
    private boolean deleted;

    @JsonProperty("por_tecnico")
    private final SortedMap<String, SortedMap<Integer, Integer>> perTechnicianMonthlyMinutes = new TreeMap<>();

    public TimeRecord() {
    }

    public TimeRecord(String companyDisplayName) {
        this.companyDisplayName = companyDisplayName;
    }

    public String getCompanyDisplayName() {
        return companyDisplayName;
    }

    void setCompanyDisplayName(String companyDisplayName) {
        this.companyDisplayName = companyDisplayName;
    }

    public Map<Integer, Integer> getMonthlyMinutes() {
        return Collections.unmodifiableMap(monthlyMinutes);
    }

    public int minutesFor(int month) {
        return monthlyMinutes.getOrDefault(month, 0);
    }

    public void setMonthMinutes(int month, int minutes) {
        checkMonth(month);
        if (minutes <= 0) {
            monthlyMinutes.remove(month);
        } else {
            monthlyMinutes.put(month, minutes);
        }
    }

    public void addMonthMinutes(int month, int minutes) {
        if (minutes <= 0) {
            return;
        }
        checkMonth(month);
        monthlyMinutes.merge(month, minutes, Utils::saturatedSum);
    }

    public int getExtraMonthlyMinutes() {
        return extraMonthlyMinutes;
    }

    public void setExtraMonthlyMinutes(int extraMonthlyMinutes) {
        this.extraMonthlyMinutes = Math.max(0, extraMonthlyMinutes);
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public Map<String, SortedMap<Integer, Integer>> getPerTechnicianMonthlyMinutes() {
        return Collections.unmodifiableMap(perTechnicianMonthlyMinutes);
    }

    public void addTechnicianMinutes(String technician, int month, int minutes) {
        if (minutes <= 0 || technician == null || technician.isBlank()) {
            return;
        }
        checkMonth(month);
        perTechnicianMonthlyMinutes
                .computeIfAbsent(technician, k -> new TreeMap<>())
                .merge(month, minutes, Utils::saturatedSum);
    }

    /**
     * Removes one month from the total and from every technician's breakdown.
     */
    public void clearMonth(int month) {
        monthlyMinutes.remove(month);
        perTechnicianMonthlyMinutes.values().forEach(months -> months.remove(month));
        perTechnicianMonthlyMinutes.values().removeIf(Map::isEmpty);
    }

    public void clearTechnicianBreakdown() {
        perTechnicianMonthlyMinutes.clear();
    }

    /**
     * Minutes logged in the year: every month plus twelve times the recurring extra.
     */
    public long totalMinutes() {
        long total = 0;
        for (int minutes : monthlyMinutes.values()) {
            total += minutes;
        }
        return total + 12L * extraMonthlyMinutes;
    }

    /**
     * Average monthly load: the year's month minutes spread over twelve months plus the extra.
     */
    public int averageMonthlyMinutes() {
        long sum = 0;
        for (int minutes : monthlyMinutes.values()) {
            sum += minutes;
        }
        return (int) Math.max(0, Math.round(sum / 12.0 + extraMonthlyMinutes));
    }

    public TimeRecord copy() {
        TimeRecord copy = new TimeRecord(companyDisplayName);
        copy.monthlyMinutes.putAll(monthlyMinutes);
        copy.extraMonthlyMinutes = extraMonthlyMinutes;
        copy.deleted = deleted;
        perTechnicianMonthlyMinutes.forEach((technician, months) ->
                copy.perTechnicianMonthlyMinutes.put(technician, new TreeMap<>(months)));
        return copy;
    }

    private static void checkMonth(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be within 1..12: " + month);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeRecord other)) {
            return false;
        }
        return extraMonthlyMinutes == other.extraMonthlyMinutes
                && deleted == other.deleted
                && monthlyMinutes.equals(other.monthlyMinutes)
                && perTechnicianMonthlyMinutes.equals(other.perTechnicianMonthlyMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(monthlyMinutes, extraMonthlyMinutes, deleted, perTechnicianMonthlyMinutes);
    }

    @Override
    public String toString() {
        return "TimeRecord{" + companyDisplayName + ", months=" + monthlyMinutes
                + ", extra=" + extraMonthlyMinutes + ", deleted=" + deleted
                + ", perTechnician=" + perTechnicianMonthlyMinutes + "}";
    }
}
