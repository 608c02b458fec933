package com.pacaccounting.reporting;

import com.pacaccounting.matching.MatchTier;

/**
 * One registry client in the timing report.
 *
 * @param clientName             name in the client registry
 * @param ledgerKey              matched ledger company, null when unmatched
 * @param tier                   tier of the match
 * @param averageMonthlyMinutes  year's month minutes over twelve months plus the recurring extra
 * @param averageMonthly         the average as "XhYYm", empty when zero
 * @param technician             canonical technician of the client
 * @param noTimings              no ledger entry matched, or the matched entry has no minutes
 * @param suggestions            closest ledger names when unmatched, empty otherwise
 */
public record ClientTimingRow(String clientName,
                              String ledgerKey,
                              MatchTier tier,
                              int averageMonthlyMinutes,
                              String averageMonthly,
                              String technician,
                              boolean noTimings,
                              String suggestions) {
}
