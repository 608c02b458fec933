package com.pacaccounting.service;

import static com.pacaccounting.service.TestWorkbooks.row;
import static com.pacaccounting.service.TestWorkbooks.tabular;
import static com.pacaccounting.service.TestWorkbooks.withEntryReplaced;
import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacaccounting.ledger.FileLedgerStore;
import com.pacaccounting.ledger.Ledger;
import com.pacaccounting.ledger.TimeRecord;
import com.pacaccounting.matching.CompanyMatcher;
import com.pacaccounting.matching.MatchTier;
import com.pacaccounting.matching.TechnicianAliasTable;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.registry.ClientRecord;
import com.pacaccounting.registry.ClientRegistry;
import com.pacaccounting.registry.InMemoryClientRegistry;
import com.pacaccounting.reporting.ClientTimingReport;
import com.pacaccounting.reporting.ClientTimingRow;
import com.pacaccounting.reporting.YearSummaryReport;
import com.pacaccounting.reporting.YearSummaryRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class TimesheetImportServiceTest {

    private final TechnicianResolver resolver = new TechnicianResolver(TechnicianAliasTable.builder()
        .register("John Smith", "J. Smith", "Johnny Smith")
        .register("M Albertina Alves", "M. Albertina Alves")
        .inferredFromClient("Armando Dias")
        .build());

    @TempDir
    Path tempDir;

    private Path reportFile;
    private FileLedgerStore store;
    private InMemoryClientRegistry registry;
    private TimesheetImportService service;

    @BeforeEach
    void setUp() {
        reportFile = tempDir.resolve("report.json");
        store = new FileLedgerStore(tempDir.resolve("ledger.json"), resolver);
        store.load();
        registry = new InMemoryClientRegistry(List.of(new ClientRecord("Delta Lda", "M. Albertina Alves")));
        service = TimesheetImportService.create(resolver, registry, store, reportFile);
    }

    @Test
    void testImportAttributesMinutes() {
        ImportReport report = service.importWorkbooks(2024, 3, List.of(tabular("marco.xlsx", "Mar",
            row("Acme, Lda.", "J. Smith", "2h30"),
            row("Beta", null, "45"),
            row("Delta, Lda.", "Armando Dias", "60"))));

        assertThat(report.persisted()).isTrue();
        assertThat(report.isRejected()).isFalse();
        assertThat(report.factsApplied()).isEqualTo(3);
        assertThat(report.minutesApplied()).isEqualTo(255);
        assertThat(report.companiesTouched()).isEqualTo(3);
        assertThat(report.files()).containsExactly("marco.xlsx");

        TimeRecord acme = store.ledger().find(2024, "Acme, Lda.").orElseThrow();
        assertThat(acme.minutesFor(3)).isEqualTo(150);
        assertThat(acme.getPerTechnicianMonthlyMinutes().get("John Smith")).containsEntry(3, 150);
        assertThat(store.ledger().find(2024, "Beta").orElseThrow().getPerTechnicianMonthlyMinutes()).isEmpty();
        TimeRecord delta = store.ledger().find(2024, "Delta, Lda.").orElseThrow();
        assertThat(delta.getPerTechnicianMonthlyMinutes().get("M Albertina Alves")).containsEntry(3, 60);
    }

    @Test
    void testSameImportTwiceGivesSameLedger() {
        WorkbookUpload upload = tabular("marco.xlsx", "Mar",
            row("Acme, Lda.", "J. Smith", "2h30"),
            row("Beta", null, "45"));

        service.importWorkbooks(2024, 3, List.of(upload));
        Ledger first = store.ledger().copy();
        ImportReport second = service.importWorkbooks(2024, 3, List.of(upload));

        assertThat(second.persisted()).isTrue();
        assertThat(store.ledger()).isEqualTo(first);
        assertThat(store.ledger().totalMinutes()).isEqualTo(195);
    }

    @Test
    void testDuplicateAcrossWorkbooksCountsOnce() throws IOException {
        ImportReport report = service.importWorkbooks(2024, 3, List.of(
            tabular("a.xlsx", "Mar", row("Acme, Lda.", "J. Smith", "2h30")),
            tabular("b.xlsx", "Mar", row("ACME LDA", "Johnny Smith", "150"))));

        assertThat(report.factsApplied()).isEqualTo(1);
        assertThat(store.ledger().find(2024, "Acme, Lda.").orElseThrow().minutesFor(3)).isEqualTo(150);
        assertThat(report.diagnostics().getDuplicatesByCompany()).containsExactly(entry("ACME LDA", 150));
        assertThat(report.reportFile()).isEqualTo(reportFile);

        JsonNode written = new ObjectMapper().readTree(Files.readString(reportFile, StandardCharsets.UTF_8));
        assertThat(written.path("total_minutos_deduplicados").asLong()).isEqualTo(150);
        assertThat(written.path("duplicados_por_empresa").path("ACME LDA").asInt()).isEqualTo(150);
    }

    @Test
    void testUnreadableAndEmptyUploadsAreSkipped() {
        ImportReport report = service.importWorkbooks(2024, 3, List.of(
            new WorkbookUpload("broken.xlsx", "garbage".getBytes(StandardCharsets.UTF_8)),
            new WorkbookUpload("empty.xlsx", new byte[0]),
            tabular("good.xlsx", "Mar", row("Beta", "", "45"))));

        assertThat(report.persisted()).isTrue();
        assertThat(report.files()).containsExactly("good.xlsx");
        assertThat(report.diagnostics().getUnreadableFiles()).containsOnlyKeys("broken.xlsx");
        assertThat(store.ledger().find(2024, "Beta").orElseThrow().minutesFor(3)).isEqualTo(45);
        assertThat(Files.exists(reportFile)).isTrue();
    }

    @Test
    void testDamagedWorkbookDoesNotStopTheBatch() {
        WorkbookUpload good = tabular("good.xlsx", "Mar", row("Beta", "J. Smith", "45"));
        WorkbookUpload damaged = withEntryReplaced(tabular("x.xlsx", "Mar", row("Gama", "J. Smith", "30")),
            "damaged.xlsx", "xl/workbook.xml", "<workbook><broken");

        ImportReport report = service.importWorkbooks(2024, 3, List.of(good, damaged));

        assertThat(report.persisted()).isTrue();
        assertThat(report.files()).containsExactly("good.xlsx");
        assertThat(report.diagnostics().getUnreadableFiles()).containsOnlyKeys("damaged.xlsx");
        assertThat(store.ledger().find(2024, "Beta").orElseThrow().minutesFor(3)).isEqualTo(45);
        assertThat(store.ledger().find(2024, "Gama")).isEmpty();
    }

    @Test
    void testUnknownTechnicianIsReportedNotApplied() {
        ImportReport report = service.importWorkbooks(2024, 3, List.of(tabular("marco.xlsx", "Mar",
            row("Acme, Lda.", "J. Smith", "60"),
            row("Acme, Lda.", "Someone Else", "30"))));

        assertThat(store.ledger().find(2024, "Acme, Lda.").orElseThrow().minutesFor(3)).isEqualTo(60);
        assertThat(report.diagnostics().getUnknownTechnicians()).containsExactly(entry("Someone Else", 30));
        assertThat(report.diagnostics().getIgnoredByCompany()).containsEntry("Acme, Lda.", 30);
    }

    @Test
    void testSpecialCaseWithoutRegistryTechnicianStaysUnattributed() {
        ImportReport report = service.importWorkbooks(2024, 3, List.of(tabular("marco.xlsx", "Mar",
            row("Omega", "Armando Dias", "60"))));

        TimeRecord omega = store.ledger().find(2024, "Omega").orElseThrow();
        assertThat(omega.minutesFor(3)).isEqualTo(60);
        assertThat(omega.getPerTechnicianMonthlyMinutes()).isEmpty();
        assertThat(report.diagnostics().getUninferredByCompany()).containsExactly(entry("Omega", 60));
    }

    @Test
    void testImportReactivatesDeletedCompany() {
        TimeRecord beta = store.ledger().getOrCreate(2024, "Beta");
        beta.addMonthMinutes(1, 30);
        beta.setDeleted(true);
        ClientRegistry betaOnly = () -> List.of(new ClientRecord("Beta", "J. Smith"));
        YearSummaryReport summary = new YearSummaryReport(store, betaOnly, resolver);
        ClientTimingReport timings = new ClientTimingReport(store, betaOnly, new CompanyMatcher(), resolver);

        assertThat(summary.summarize(2024)).isEmpty();
        assertThat(timings.rows(2024)).extracting(ClientTimingRow::tier).containsExactly(MatchTier.NONE);

        service.importWorkbooks(2024, 3, List.of(tabular("marco.xlsx", "Mar", row("Beta", null, "45"))));

        assertThat(store.ledger().find(2024, "Beta").orElseThrow().isDeleted()).isFalse();
        List<YearSummaryRow> rows = summary.summarize(2024);
        assertThat(rows).extracting(YearSummaryRow::company).containsExactly("Beta");
        assertThat(rows.get(0).minutesFor(3)).isEqualTo(45);
        assertThat(rows.get(0).technician()).isEqualTo("John Smith");
        ClientTimingRow row = timings.rows(2024).get(0);
        assertThat(row.tier()).isEqualTo(MatchTier.EXACT);
        assertThat(row.ledgerKey()).isEqualTo("Beta");
        assertThat(row.averageMonthlyMinutes()).isEqualTo(6);
        assertThat(row.noTimings()).isFalse();
    }

    @Test
    void testRejectedWriteIsReported() {
        store.ledger().getOrCreate(2024, "Acme, Lda.").addMonthMinutes(3, 10_000);
        store.save();

        ImportReport report = service.importWorkbooks(2024, 3, List.of(tabular("marco.xlsx", "Mar",
            row("Acme, Lda.", "J. Smith", "60"))));

        assertThat(report.persisted()).isFalse();
        assertThat(report.isRejected()).isTrue();
        assertThat(report.rejectionMessage()).contains("10000");
        assertThat(store.isDiskInSync()).isFalse();
        // the working copy still holds the import
        assertThat(store.ledger().find(2024, "Acme, Lda.").orElseThrow().minutesFor(3)).isEqualTo(60);
    }

    @Test
    void testCleanImportWritesNoReport() {
        ImportReport report = service.importWorkbooks(2024, 3, List.of(tabular("marco.xlsx", "Mar",
            row("Acme, Lda.", "J. Smith", "60"))));

        assertThat(report.reportFile()).isNull();
        assertThat(Files.exists(reportFile)).isFalse();
    }

    @Test
    void testNothingToImport() {
        ImportReport report = service.importWorkbooks(2024, 3, List.of());

        assertThat(report.factsApplied()).isZero();
        assertThat(report.persisted()).isFalse();
        assertThat(store.ledger().isEmpty()).isTrue();
    }

    @Test
    void testInvalidPeriod() {
        assertThatThrownBy(() -> service.importWorkbooks(2024, 0, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.importWorkbooks(-1, 3, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
