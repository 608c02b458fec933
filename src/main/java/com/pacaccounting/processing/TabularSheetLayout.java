package com.pacaccounting.processing;

import com.pacaccounting.matching.TechnicianClassification;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.util.names.NameNormalizer;
import com.pacaccounting.utils.Utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat table with a header row naming the company, technician and duration columns.
 * <p>
 * The header is the first row holding a known synonym for each of the three columns.
 * Below it every row is a (company, technician, duration) triple. Rows without a technician
 * are company summaries: they are kept only for companies that have no resolved technician
 * rows, otherwise they are reported as ignored so the minutes are not counted twice.
 */
public class TabularSheetLayout implements SheetLayout {

    private final TechnicianResolver technicianResolver;
    private final HeaderSynonyms headerSynonyms;

    public TabularSheetLayout(TechnicianResolver technicianResolver, HeaderSynonyms headerSynonyms) {
        this.technicianResolver = technicianResolver;
        this.headerSynonyms = headerSynonyms;
    }

    @Override
    public LayoutKind kind() {
        return LayoutKind.TABULAR;
    }

    @Override
    public Optional<List<RawFact>> read(String source, List<SheetRow> rows, ImportDiagnostics diagnostics) {
        Optional<Header> found = findHeader(rows);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Header header = found.get();

        Map<String, List<RawFact>> detailByCompany = new LinkedHashMap<>();
        Map<String, Integer> summaryByCompany = new LinkedHashMap<>();

        for (SheetRow row : rows) {
            if (row.index() <= header.rowIndex() || row.isBlank()) {
                continue;
            }
            String company = trimmed(row.cell(header.companyColumn()));
            if (company.isEmpty() || NameNormalizer.isTotalMarker(company)) {
                continue;
            }
            int minutes = DurationParser.toMinutes(row.cell(header.durationColumn()));
            if (minutes <= 0) {
                continue;
            }

            String technician = trimmed(row.cell(header.technicianColumn()));
            if (technician.isEmpty()) {
                summaryByCompany.merge(company, minutes, Utils::saturatedSum);
                continue;
            }
            if (NameNormalizer.isTotalMarker(technician)) {
                continue;
            }

            TechnicianClassification classification = technicianResolver.resolve(technician);
            switch (classification.kind()) {
                case UNKNOWN -> diagnostics.addUnknownTechnician(technician, company, minutes);
                case CANONICAL -> detailByCompany.computeIfAbsent(company, k -> new ArrayList<>())
                        .add(RawFact.canonical(company, classification.canonicalName(), minutes, source));
                case INFERRED_FROM_CLIENT -> detailByCompany.computeIfAbsent(company, k -> new ArrayList<>())
                        .add(RawFact.inferred(company, minutes, source));
            }
        }

        List<RawFact> facts = new ArrayList<>();
        for (Map.Entry<String, List<RawFact>> entry : detailByCompany.entrySet()) {
            Integer summary = summaryByCompany.remove(entry.getKey());
            if (summary != null && summary > 0) {
                diagnostics.addIgnoredSummary(entry.getKey(), summary);
            }
            facts.addAll(entry.getValue());
        }
        summaryByCompany.forEach((company, minutes) -> facts.add(RawFact.summary(company, minutes, source)));
        return Optional.of(facts);
    }

    Optional<Header> findHeader(List<SheetRow> rows) {
        for (SheetRow row : rows) {
            int companyColumn = -1;
            int technicianColumn = -1;
            int durationColumn = -1;
            for (int column = 0; column < row.width(); column++) {
                String name = NameNormalizer.normalizeHeader(row.cell(column));
                if (name.isEmpty()) {
                    continue;
                }
                if (companyColumn < 0 && headerSynonyms.isCompany(name)) {
                    companyColumn = column;
                } else if (technicianColumn < 0 && headerSynonyms.isTechnician(name)) {
                    technicianColumn = column;
                } else if (durationColumn < 0 && headerSynonyms.isDuration(name)) {
                    durationColumn = column;
                }
            }
            if (companyColumn >= 0 && technicianColumn >= 0 && durationColumn >= 0) {
                return Optional.of(new Header(row.index(), companyColumn, technicianColumn, durationColumn));
            }
        }
        return Optional.empty();
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }

    record Header(int rowIndex, int companyColumn, int technicianColumn, int durationColumn) {
    }
}
