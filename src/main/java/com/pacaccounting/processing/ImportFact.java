package com.pacaccounting.processing;

import java.util.Objects;

/**
 * A deduplicated fact of an import batch, ready to be written to the ledger.
 *
 * @param companyKey  strong company key
 * @param companyName first spelling of the company seen in the batch
 * @param attribution how the minutes are attributed
 * @param technician  canonical technician, or null for company-level minutes
 * @param minutes     positive minute count
 */
public record ImportFact(String companyKey, String companyName, Attribution attribution, String technician,
                         int minutes) {

    public ImportFact {
        Objects.requireNonNull(companyKey, "companyKey");
        Objects.requireNonNull(attribution, "attribution");
    }

    public boolean hasTechnician() {
        return technician != null && !technician.isBlank();
    }

    /**
     * Copy with the technician resolved through the client registry.
     */
    public ImportFact withTechnician(String resolvedTechnician) {
        return new ImportFact(companyKey, companyName, attribution, resolvedTechnician, minutes);
    }
}
