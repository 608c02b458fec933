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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Yearly maps per technician.
 * <p>
 * A company's minutes belong to the technician the client registry names for it: first the
 * client with the same normalized name, then a client whose normalized name contains the
 * company's or is contained in it, otherwise the unassigned label. Registry clients without
 * minutes are listed under their technician as well, unless their ledger record is deleted.
 * Deleted records never contribute.
 */
public class TechnicianMapReport {

    private final LedgerStore ledgerStore;
    private final ClientRegistry clientRegistry;
    private final TechnicianResolver technicianResolver;

    public TechnicianMapReport(LedgerStore ledgerStore, ClientRegistry clientRegistry,
                               TechnicianResolver technicianResolver) {
        this.ledgerStore = ledgerStore;
        this.clientRegistry = clientRegistry;
        this.technicianResolver = technicianResolver;
    }

    public TechnicianMaps build(int year) {
        Map<String, TimeRecord> companies = ledgerStore.ledger().yearView(year);
        List<ClientRecord> clients = clientRegistry.clients();

        Map<String, String> technicianByKey = new LinkedHashMap<>();
        for (ClientRecord client : clients) {
            String key = NameNormalizer.normalizeCompany(client.displayName());
            if (!key.isEmpty()) {
                technicianByKey.putIfAbsent(key, technicianResolver.canonicalName(client.primaryTechnician()));
            }
        }

        // technician -> company -> month -> minutes
        SortedMap<String, Map<String, Map<Integer, Integer>>> raw = new TreeMap<>();
        for (Map.Entry<String, TimeRecord> entry : companies.entrySet()) {
            TimeRecord record = entry.getValue();
            if (record.isDeleted() || record.getMonthlyMinutes().isEmpty()) {
                continue;
            }
            String technician = technicianFor(NameNormalizer.normalizeCompany(entry.getKey()), technicianByKey);
            raw.computeIfAbsent(technician, k -> new LinkedHashMap<>())
                    .put(entry.getKey(), record.getMonthlyMinutes());
        }

        Map<String, String> ledgerNameByKey = new LinkedHashMap<>();
        for (String company : companies.keySet()) {
            String key = NameNormalizer.normalizeCompany(company);
            if (!key.isEmpty()) {
                ledgerNameByKey.putIfAbsent(key, company);
            }
        }
        for (ClientRecord client : clients) {
            if (client.displayName() == null || client.displayName().isBlank()) {
                continue;
            }
            String name = client.displayName().trim();
            String company = ledgerNameByKey.getOrDefault(NameNormalizer.normalizeCompany(name), name);
            TimeRecord record = companies.get(company);
            if (record != null && record.isDeleted()) {
                continue;
            }
            String technician = technicianResolver.canonicalName(client.primaryTechnician());
            raw.computeIfAbsent(technician, k -> new LinkedHashMap<>()).putIfAbsent(company, Map.of());
        }

        List<TechnicianMap> maps = new ArrayList<>();
        int[] monthTotals = new int[12];
        long yearMinutes = 0;
        for (Map.Entry<String, Map<String, Map<Integer, Integer>>> entry : raw.entrySet()) {
            TechnicianMap map = technicianMap(entry.getKey(), entry.getValue(), companies);
            for (int month = 1; month <= 12; month++) {
                monthTotals[month - 1] = Utils.saturatedSum(monthTotals[month - 1], map.minutesFor(month));
            }
            yearMinutes += map.adjustedMinutes();
            maps.add(map);
        }
        return new TechnicianMaps(year, maps, toList(monthTotals), yearMinutes, averageOverYear(yearMinutes));
    }

    private String technicianFor(String companyKey, Map<String, String> technicianByKey) {
        String technician = technicianByKey.get(companyKey);
        if (technician == null && !companyKey.isEmpty()) {
            for (Map.Entry<String, String> client : technicianByKey.entrySet()) {
                if (companyKey.contains(client.getKey()) || client.getKey().contains(companyKey)) {
                    technician = client.getValue();
                    break;
                }
            }
        }
        return technician == null ? technicianResolver.unassignedLabel() : technician;
    }

    private static TechnicianMap technicianMap(String technician, Map<String, Map<Integer, Integer>> monthsByCompany,
                                               Map<String, TimeRecord> companies) {
        List<String> names = new ArrayList<>(monthsByCompany.keySet());
        names.sort(Comparator.comparing(name -> name.toUpperCase(Locale.ROOT)));

        List<TechnicianClientRow> rows = new ArrayList<>();
        int[] monthTotals = new int[12];
        long base = 0;
        int extras = 0;
        for (String company : names) {
            TechnicianClientRow row = clientRow(technician, company, monthsByCompany.get(company), companies.get(company));
            for (int month = 1; month <= 12; month++) {
                monthTotals[month - 1] = Utils.saturatedSum(monthTotals[month - 1], row.minutesFor(month));
            }
            base += row.baseMinutes();
            extras = Utils.saturatedSum(extras, row.extraMonthly());
            rows.add(row);
        }
        long adjusted = base + 12L * extras;
        return new TechnicianMap(technician, rows, toList(monthTotals), base, extras, adjusted,
                averageOverYear(adjusted));
    }

    private static TechnicianClientRow clientRow(String technician, String company, Map<Integer, Integer> months,
                                                 TimeRecord record) {
        boolean active = record != null && !record.isDeleted();
        int extra = active ? record.getExtraMonthlyMinutes() : 0;

        List<Integer> monthly = new ArrayList<>(12);
        long base = 0;
        for (int month = 1; month <= 12; month++) {
            int minutes = months.getOrDefault(month, 0);
            base += minutes;
            monthly.add(Utils.saturatedSum(minutes, extra));
        }
        long adjusted = base + 12L * extra;

        long detail = 0;
        if (active) {
            Map<Integer, Integer> own = record.getPerTechnicianMonthlyMinutes().get(technician);
            if (own != null) {
                for (int minutes : own.values()) {
                    detail += minutes;
                }
            }
        }
        boolean elsewhere = base == 0 && active
                && (!record.getMonthlyMinutes().isEmpty() || record.getExtraMonthlyMinutes() > 0);
        return new TechnicianClientRow(company, monthly, base, extra, adjusted, averageOverYear(adjusted), detail,
                adjusted == 0, elsewhere);
    }

    private static int averageOverYear(long minutes) {
        return minutes > 0 ? (int) Math.round(minutes / 12.0) : 0;
    }

    private static List<Integer> toList(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int value : values) {
            list.add(value);
        }
        return list;
    }
}
