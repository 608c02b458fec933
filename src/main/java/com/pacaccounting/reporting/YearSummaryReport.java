package com.pacaccounting.reporting;

import com.pacaccounting.ledger.LedgerStore;
import com.pacaccounting.ledger.TimeRecord;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.registry.ClientRecord;
import com.pacaccounting.registry.ClientRegistry;
import com.pacaccounting.util.names.NameNormalizer;
import com.pacaccounting.utils.Utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Month by month view of one ledger year.
 * <p>
 * By default the average divides the adjusted total by the number of months that have any
 * minutes in the year, so that a year in progress is not averaged over twelve months.
 */
public class YearSummaryReport {

    private final LedgerStore ledgerStore;
    private final ClientRegistry clientRegistry;
    private final TechnicianResolver technicianResolver;

    public YearSummaryReport(LedgerStore ledgerStore, ClientRegistry clientRegistry,
                             TechnicianResolver technicianResolver) {
        this.ledgerStore = ledgerStore;
        this.clientRegistry = clientRegistry;
        this.technicianResolver = technicianResolver;
    }

    public List<YearSummaryRow> summarize(int year) {
        return summarize(year, 0);
    }

    /**
     * @param averageMonths months to average over; outside 1..12 the months with records are used
     */
    public List<YearSummaryRow> summarize(int year, int averageMonths) {
        return summarize(year, averageMonths, null, null);
    }

    /**
     * Summary restricted to some companies. The average divisor is still computed over the
     * whole year.
     *
     * @param averageMonths    months to average over; outside 1..12 the months with records are used
     * @param companyFilter    text the company's normalized name must contain, blank for all
     * @param technicianFilter technician, any known spelling, the row's technician must equal; blank for all
     */
    public List<YearSummaryRow> summarize(int year, int averageMonths, String companyFilter, String technicianFilter) {
        Map<String, TimeRecord> companies = ledgerStore.ledger().yearView(year);
        int divisor = averageMonths >= 1 && averageMonths <= 12 ? averageMonths : monthsWithRecords(year);
        Map<String, String> technicianByKey = technicianByCompanyKey();
        String companyNeedle = companyFilter == null || companyFilter.isBlank()
                ? "" : NameNormalizer.normalizeCompany(companyFilter);
        String wantedTechnician = technicianFilter == null || technicianFilter.isBlank()
                ? null : technicianResolver.canonicalName(technicianFilter);

        List<YearSummaryRow> rows = new ArrayList<>();
        for (Map.Entry<String, TimeRecord> entry : companies.entrySet()) {
            TimeRecord record = entry.getValue();
            if (record.isDeleted()) {
                continue;
            }
            String companyKey = NameNormalizer.normalizeCompany(entry.getKey());
            String technician = technicianByKey.getOrDefault(companyKey, technicianResolver.unassignedLabel());
            if (!companyNeedle.isEmpty() && !companyKey.contains(companyNeedle)) {
                continue;
            }
            if (wantedTechnician != null && !wantedTechnician.equals(technician)) {
                continue;
            }
            int extra = record.getExtraMonthlyMinutes();
            List<Integer> monthly = new ArrayList<>(12);
            long base = 0;
            for (int month = 1; month <= 12; month++) {
                int minutes = record.minutesFor(month);
                base += minutes;
                monthly.add(Utils.saturatedSum(minutes, extra));
            }
            long adjusted = base + 12L * extra;
            int average = adjusted > 0 ? (int) Math.round((double) adjusted / divisor) : 0;
            rows.add(new YearSummaryRow(entry.getKey(), technician, monthly, base, extra, adjusted, average));
        }
        rows.sort(Comparator.comparing(row -> row.company().toUpperCase(Locale.ROOT)));
        return rows;
    }

    /**
     * Distinct months with minutes in any non-deleted company of the year, twelve when there are none.
     */
    public int monthsWithRecords(int year) {
        TreeSet<Integer> months = new TreeSet<>();
        for (TimeRecord record : ledgerStore.ledger().yearView(year).values()) {
            if (!record.isDeleted()) {
                months.addAll(record.getMonthlyMinutes().keySet());
            }
        }
        return months.isEmpty() ? 12 : months.size();
    }

    private Map<String, String> technicianByCompanyKey() {
        Map<String, String> technicianByKey = new HashMap<>();
        for (ClientRecord client : clientRegistry.clients()) {
            String key = NameNormalizer.normalizeCompany(client.displayName());
            if (!key.isEmpty()) {
                technicianByKey.putIfAbsent(key, technicianResolver.canonicalName(client.primaryTechnician()));
            }
        }
        return technicianByKey;
    }
}
