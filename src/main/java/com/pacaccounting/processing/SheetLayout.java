package com.pacaccounting.processing;

import java.util.List;
import java.util.Optional;

/**
 * One of the physical layouts a timesheet sheet can have.
 */
public interface SheetLayout {

    LayoutKind kind();

    /**
     * Reads the sheet when it has this layout.
     *
     * @return the facts of the sheet, or empty when the sheet does not have this layout
     */
    Optional<List<RawFact>> read(String source, List<SheetRow> rows, ImportDiagnostics diagnostics);

    enum LayoutKind {
        TABULAR,
        WORKLOAD
    }
}
