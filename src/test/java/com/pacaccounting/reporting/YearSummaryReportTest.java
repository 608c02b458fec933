package com.pacaccounting.reporting;

import static org.assertj.core.api.Assertions.*;

import com.pacaccounting.ledger.FileLedgerStore;
import com.pacaccounting.ledger.TimeRecord;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.registry.ClientRecord;
import com.pacaccounting.registry.InMemoryClientRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

class YearSummaryReportTest {

    private final TechnicianResolver resolver = TechnicianResolver.withDefaultAliases();

    @TempDir
    Path tempDir;

    private YearSummaryReport report;

    @BeforeEach
    void setUp() {
        FileLedgerStore store = new FileLedgerStore(tempDir.resolve("ledger.json"), resolver);
        TimeRecord beta = store.ledger().getOrCreate(2024, "beta");
        beta.addMonthMinutes(1, 60);
        beta.addMonthMinutes(2, 120);
        beta.setExtraMonthlyMinutes(10);
        store.ledger().getOrCreate(2024, "Acme").addMonthMinutes(1, 30);
        TimeRecord gone = store.ledger().getOrCreate(2024, "Gone");
        gone.addMonthMinutes(3, 500);
        gone.setDeleted(true);

        report = new YearSummaryReport(store,
            new InMemoryClientRegistry(List.of(new ClientRecord("Beta SA", "M. Luzia Moreira"))), resolver);
    }

    @Test
    void testAverageOverMonthsWithRecords() {
        assertThat(report.monthsWithRecords(2024)).isEqualTo(2);

        List<YearSummaryRow> rows = report.summarize(2024);

        assertThat(rows).extracting(YearSummaryRow::company).containsExactly("Acme", "beta");
        YearSummaryRow beta = rows.get(1);
        assertThat(beta.minutesFor(1)).isEqualTo(70);
        assertThat(beta.minutesFor(2)).isEqualTo(130);
        assertThat(beta.minutesFor(12)).isEqualTo(10);
        assertThat(beta.baseMinutes()).isEqualTo(180);
        assertThat(beta.adjustedMinutes()).isEqualTo(300);
        assertThat(beta.averageMinutes()).isEqualTo(150);
        assertThat(beta.formattedAverage()).isEqualTo("2h30m");
        assertThat(beta.formattedAdjusted()).isEqualTo("5h00m");
        assertThat(beta.technician()).isEqualTo("M Luzia Moreira");
        assertThat(rows.get(0).technician()).isEqualTo("Unassigned");
        assertThat(rows.get(0).averageMinutes()).isEqualTo(15);
    }

    @Test
    void testExplicitAverageMonths() {
        YearSummaryRow beta = report.summarize(2024, 12).get(1);

        assertThat(beta.averageMinutes()).isEqualTo(25);
    }

    @Test
    void testCompanyFilterMatchesPartOfTheName() {
        List<YearSummaryRow> rows = report.summarize(2024, 0, "  Bet ", null);

        assertThat(rows).extracting(YearSummaryRow::company).containsExactly("beta");
        // the divisor still counts the months of every company
        assertThat(rows.get(0).averageMinutes()).isEqualTo(150);
        assertThat(report.summarize(2024, 0, "Gone", null)).isEmpty();
        assertThat(report.summarize(2024, 0, " ", null)).hasSize(2);
    }

    @Test
    void testTechnicianFilterUsesCanonicalName() {
        assertThat(report.summarize(2024, 0, null, "M. Luzia Moreira"))
            .extracting(YearSummaryRow::company).containsExactly("beta");
        assertThat(report.summarize(2024, 0, null, "Unassigned"))
            .extracting(YearSummaryRow::company).containsExactly("Acme");
        assertThat(report.summarize(2024, 0, "acme", "M. Luzia Moreira")).isEmpty();
    }

    @Test
    void testYearWithoutData() {
        assertThat(report.summarize(2019)).isEmpty();
        assertThat(report.monthsWithRecords(2019)).isEqualTo(12);
    }
}
