package com.pacaccounting.service;

import com.pacaccounting.ledger.LedgerStore;
import com.pacaccounting.ledger.LedgerWriteRejectedException;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.processing.HeaderSynonyms;
import com.pacaccounting.processing.ImportBatch;
import com.pacaccounting.processing.ImportDeduplicator;
import com.pacaccounting.processing.ImportDiagnostics;
import com.pacaccounting.processing.RawFact;
import com.pacaccounting.processing.SpreadsheetParseException;
import com.pacaccounting.processing.SpreadsheetParser;
import com.pacaccounting.registry.ClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Imports the timesheet workbooks of one month into the ledger.
 * <p>
 * The uploaded files are parsed, their facts deduplicated across files and sheets, the
 * special-case technician attributed from the client registry, and the month of every
 * company touched is replaced in the ledger, which is then saved. Problems are isolated:
 * an unreadable file is skipped, unknown technicians and ignored minutes are reported, and a
 * write refused by the volume guard is returned in the report instead of failing the import.
 */
public class TimesheetImportService {

    private static final Logger logger = LoggerFactory.getLogger(TimesheetImportService.class);

    static final int TOP_LIMIT = 30;

    private final SpreadsheetParser parser;
    private final ImportDeduplicator deduplicator;
    private final InferredTechnicianAttributor attributor;
    private final LedgerStore ledgerStore;
    private final ImportReportWriter reportWriter;
    private final Path reportFile;

    public TimesheetImportService(SpreadsheetParser parser,
                                  ImportDeduplicator deduplicator,
                                  InferredTechnicianAttributor attributor,
                                  LedgerStore ledgerStore,
                                  ImportReportWriter reportWriter,
                                  Path reportFile) {
        this.parser = parser;
        this.deduplicator = deduplicator;
        this.attributor = attributor;
        this.ledgerStore = ledgerStore;
        this.reportWriter = reportWriter;
        this.reportFile = reportFile;
    }

    public static TimesheetImportService create(TechnicianResolver technicianResolver,
                                                ClientRegistry clientRegistry,
                                                LedgerStore ledgerStore,
                                                Path reportFile) {
        return new TimesheetImportService(
                new SpreadsheetParser(technicianResolver, HeaderSynonyms.loadDefault()),
                new ImportDeduplicator(),
                new InferredTechnicianAttributor(technicianResolver, clientRegistry),
                ledgerStore,
                new ImportReportWriter(),
                reportFile);
    }

    public ImportReport importWorkbooks(int year, int month, List<WorkbookUpload> uploads) {
        if (year <= 0) {
            throw new IllegalArgumentException("Year must be positive: " + year);
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be within 1..12: " + month);
        }

        ImportDiagnostics diagnostics = new ImportDiagnostics();
        List<RawFact> rawFacts = new ArrayList<>();
        for (WorkbookUpload upload : uploads) {
            if (upload.isEmpty()) {
                logger.warn("Skipping empty upload {}", upload.fileName());
                continue;
            }
            try {
                rawFacts.addAll(parser.parse(upload.fileName(), upload.content(), diagnostics));
            } catch (SpreadsheetParseException e) {
                logger.warn("Skipping unreadable workbook {}: {}", upload.fileName(), e.getMessage());
                diagnostics.recordUnreadableFile(upload.fileName(), e.getMessage());
            }
        }

        ImportBatch batch = deduplicator.deduplicate(rawFacts, month, diagnostics);
        batch = attributor.attribute(batch, diagnostics);

        int companiesTouched = 0;
        boolean persisted = false;
        String rejectionMessage = null;
        if (!batch.isEmpty()) {
            companiesTouched = ledgerStore.applyImport(year, month, batch);
            try {
                ledgerStore.save();
                persisted = true;
            } catch (LedgerWriteRejectedException e) {
                logger.error("Import of {}-{} kept in memory only, the ledger file was not replaced: {}",
                        year, month, e.getMessage());
                rejectionMessage = e.getMessage();
            }
        }

        Path writtenReport = null;
        if (diagnostics.hasFindings()) {
            logFindings(diagnostics);
            writtenReport = writeReport(diagnostics);
        }

        logger.info("Imported {} facts ({} minutes) into {} companies for {}-{} from {} files",
                batch.getFacts().size(), batch.totalMinutes(), companiesTouched, year, month,
                diagnostics.getFiles().size());
        return new ImportReport(year, month, diagnostics.getFiles(), batch.getFacts().size(), batch.totalMinutes(),
                companiesTouched, diagnostics, persisted, rejectionMessage, writtenReport);
    }

    private Path writeReport(ImportDiagnostics diagnostics) {
        if (reportFile == null) {
            return null;
        }
        try {
            reportWriter.write(diagnostics, reportFile);
            logger.info("Import report written to {}", reportFile.toAbsolutePath());
            return reportFile;
        } catch (IOException e) {
            logger.error("Failed to write import report {}", reportFile, e);
            return null;
        }
    }

    private static void logFindings(ImportDiagnostics diagnostics) {
        logTop("Unknown technicians", diagnostics.getUnknownTechnicians());
        logTop("Companies with ignored minutes", diagnostics.getIgnoredByCompany());
        logTop("Ignored summary rows", diagnostics.getIgnoredSummaryByCompany());
        logTop("Duplicates within the batch", diagnostics.getDuplicatesByCompany());
        logTop("Special-case minutes without an inferred technician", diagnostics.getUninferredByCompany());
        diagnostics.getUnreadableFiles().forEach((file, reason) -> logger.warn("Unreadable file {}: {}", file, reason));
    }

    private static void logTop(String title, Map<String, Integer> minutesByName) {
        if (minutesByName.isEmpty()) {
            return;
        }
        logger.warn("{} (top {}):", title, TOP_LIMIT);
        for (Map.Entry<String, Integer> entry : ImportDiagnostics.top(minutesByName, TOP_LIMIT)) {
            logger.warn("  - {}: {} min", entry.getKey(), entry.getValue());
        }
    }
}
