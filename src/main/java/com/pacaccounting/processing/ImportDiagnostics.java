package com.pacaccounting.processing;

import com.pacaccounting.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Side reports of one import batch, keyed by company or technician for manual follow-up.
 * Nothing recorded here is applied to the ledger.
 */
public class ImportDiagnostics {

    private final Map<String, Integer> unknownTechnicians = new LinkedHashMap<>();
    private final Map<String, Integer> ignoredByCompany = new LinkedHashMap<>();
    private final Map<String, Integer> ignoredSummaryByCompany = new LinkedHashMap<>();
    private final Map<String, Integer> duplicatesByCompany = new LinkedHashMap<>();
    private final Map<String, Integer> uninferredByCompany = new LinkedHashMap<>();
    private final Map<String, SheetLayout.LayoutKind> sheetLayouts = new LinkedHashMap<>();
    private final Map<String, String> unreadableFiles = new LinkedHashMap<>();
    private final List<String> files = new ArrayList<>();
    private long totalDuplicateMinutes;

    /**
     * Minutes of a technician spelling outside every alias set; they also count as ignored for the company.
     */
    public void addUnknownTechnician(String technician, String company, int minutes) {
        unknownTechnicians.merge(technician, minutes, Utils::saturatedSum);
        ignoredByCompany.merge(company, minutes, Utils::saturatedSum);
    }

    /**
     * Inline company total left out because per-technician rows already carry the minutes.
     */
    public void addIgnoredSummary(String company, int minutes) {
        ignoredSummaryByCompany.merge(company, minutes, Utils::saturatedSum);
        ignoredByCompany.merge(company, minutes, Utils::saturatedSum);
    }

    public void addDuplicate(String company, int minutes) {
        duplicatesByCompany.merge(company, minutes, Utils::saturatedSum);
        totalDuplicateMinutes += minutes;
    }

    public void addUninferred(String company, int minutes) {
        uninferredByCompany.merge(company, minutes, Utils::saturatedSum);
    }

    public void recordFile(String fileName) {
        files.add(fileName);
    }

    public void recordUnreadableFile(String fileName, String reason) {
        unreadableFiles.put(fileName, reason);
    }

    public void recordLayout(String source, SheetLayout.LayoutKind kind) {
        sheetLayouts.put(source, kind);
    }

    /**
     * Whether anything needs manual follow-up.
     */
    public boolean hasFindings() {
        return !unknownTechnicians.isEmpty()
                || !ignoredByCompany.isEmpty()
                || !ignoredSummaryByCompany.isEmpty()
                || !duplicatesByCompany.isEmpty()
                || !uninferredByCompany.isEmpty()
                || !unreadableFiles.isEmpty();
    }

    public Map<String, Integer> getUnknownTechnicians() {
        return Collections.unmodifiableMap(unknownTechnicians);
    }

    public Map<String, Integer> getIgnoredByCompany() {
        return Collections.unmodifiableMap(ignoredByCompany);
    }

    public Map<String, Integer> getIgnoredSummaryByCompany() {
        return Collections.unmodifiableMap(ignoredSummaryByCompany);
    }

    public Map<String, Integer> getDuplicatesByCompany() {
        return Collections.unmodifiableMap(duplicatesByCompany);
    }

    public Map<String, Integer> getUninferredByCompany() {
        return Collections.unmodifiableMap(uninferredByCompany);
    }

    public Map<String, SheetLayout.LayoutKind> getSheetLayouts() {
        return Collections.unmodifiableMap(sheetLayouts);
    }

    public Map<String, String> getUnreadableFiles() {
        return Collections.unmodifiableMap(unreadableFiles);
    }

    public List<String> getFiles() {
        return Collections.unmodifiableList(files);
    }

    public long getTotalDuplicateMinutes() {
        return totalDuplicateMinutes;
    }

    /**
     * The {@code limit} largest entries of a report map, by minutes descending.
     */
    public static List<Map.Entry<String, Integer>> top(Map<String, Integer> minutesByName, int limit) {
        return minutesByName.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .toList();
    }
}
