package com.pacaccounting.reporting;

import com.pacaccounting.ledger.LedgerStore;
import com.pacaccounting.ledger.TimeRecord;
import com.pacaccounting.matching.CompanyMatch;
import com.pacaccounting.matching.CompanyMatcher;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.registry.ClientRecord;
import com.pacaccounting.registry.ClientRegistry;
import com.pacaccounting.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Average monthly time per registry client, found in the ledger by company name matching.
 * Clients without a confident match are flagged with the closest ledger names instead of
 * being guessed.
 */
public class ClientTimingReport {

    private final LedgerStore ledgerStore;
    private final ClientRegistry clientRegistry;
    private final CompanyMatcher companyMatcher;
    private final TechnicianResolver technicianResolver;

    public ClientTimingReport(LedgerStore ledgerStore,
                              ClientRegistry clientRegistry,
                              CompanyMatcher companyMatcher,
                              TechnicianResolver technicianResolver) {
        this.ledgerStore = ledgerStore;
        this.clientRegistry = clientRegistry;
        this.companyMatcher = companyMatcher;
        this.technicianResolver = technicianResolver;
    }

    public List<ClientTimingRow> rows(int year) {
        Map<String, TimeRecord> yearSlice = ledgerStore.ledger().yearView(year);
        CompanyMatcher.LedgerIndex index = companyMatcher.index(yearSlice);

        List<ClientTimingRow> rows = new ArrayList<>();
        for (ClientRecord client : clientRegistry.clients()) {
            CompanyMatch match = companyMatcher.match(client.displayName(), index);
            int average = match.recordIfMatched().map(TimeRecord::averageMonthlyMinutes).orElse(0);
            rows.add(new ClientTimingRow(
                    client.displayName(),
                    match.ledgerKey(),
                    match.tier(),
                    average,
                    average > 0 ? Utils.formatMinutes(average) : "",
                    technicianResolver.canonicalName(client.primaryTechnician()),
                    !match.isMatched() || average == 0,
                    match.suggestions()));
        }
        return rows;
    }
}
