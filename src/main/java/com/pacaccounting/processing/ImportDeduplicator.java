package com.pacaccounting.processing;

import com.pacaccounting.util.names.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collapses facts read more than once in the same upload, e.g. the same month tab present
 * in two exported workbooks.
 * <p>
 * Two facts are the same observation only when company key, attributed identity, month and
 * minutes are all equal. Equal company and technician with different minutes are kept, they
 * are separate entries. Repetitions beyond the first are reported, never applied.
 */
public class ImportDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(ImportDeduplicator.class);

    static final String INFERRED_IDENTITY = "__INFERRED__";
    static final String SUMMARY_IDENTITY = "__SUMMARY__";

    public ImportBatch deduplicate(List<RawFact> rawFacts, int month, ImportDiagnostics diagnostics) {
        Set<Identity> seen = new HashSet<>();
        List<ImportFact> facts = new ArrayList<>();
        int skipped = 0;

        for (RawFact raw : rawFacts) {
            String companyKey = NameNormalizer.normalizeCompany(raw.company());
            if (companyKey.isEmpty() || raw.minutes() <= 0) {
                skipped++;
                continue;
            }
            Identity identity = new Identity(companyKey, identityOf(raw), month, raw.minutes());
            if (!seen.add(identity)) {
                diagnostics.addDuplicate(raw.company().trim(), raw.minutes());
                continue;
            }
            facts.add(new ImportFact(companyKey, raw.company().trim(), raw.attribution(), raw.technician(),
                    raw.minutes()));
        }

        if (skipped > 0) {
            logger.debug("Skipped {} facts without a usable company name", skipped);
        }
        return new ImportBatch(month, facts);
    }

    private static String identityOf(RawFact raw) {
        return switch (raw.attribution()) {
            case CANONICAL -> NameNormalizer.normalizePersonName(raw.technician());
            case INFERRED_FROM_CLIENT -> INFERRED_IDENTITY;
            case SUMMARY -> SUMMARY_IDENTITY;
        };
    }

    private record Identity(String companyKey, String technician, int month, int minutes) {
    }
}
