package com.pacaccounting.service;

import com.pacaccounting.processing.ImportDiagnostics;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one spreadsheet import.
 *
 * @param files            files read, in upload order; unreadable files are listed in the diagnostics instead
 * @param factsApplied     deduplicated facts written to the ledger
 * @param minutesApplied   minutes of those facts
 * @param companiesTouched companies whose month was replaced
 * @param persisted        whether the ledger file was written
 * @param rejectionMessage reason the write was refused, null when it was not
 * @param reportFile       diagnostics file written for this import, null when there was nothing to report
 */
public record ImportReport(int year,
                           int month,
                           List<String> files,
                           int factsApplied,
                           long minutesApplied,
                           int companiesTouched,
                           ImportDiagnostics diagnostics,
                           boolean persisted,
                           String rejectionMessage,
                           Path reportFile) {

    public ImportReport {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean isRejected() {
        return rejectionMessage != null;
    }
}
