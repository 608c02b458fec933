package com.pacaccounting.service;

import com.pacaccounting.ledger.Ledger;
import com.pacaccounting.ledger.LedgerStore;
import com.pacaccounting.ledger.MigrationResult;
import com.pacaccounting.ledger.SaveMode;
import com.pacaccounting.ledger.TimeRecord;
import com.pacaccounting.registry.ClientRecord;
import com.pacaccounting.registry.ClientRegistry;
import com.pacaccounting.util.names.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Manual changes to the ledger made from the back office. Every change is saved at once.
 * A save refused by the volume guard propagates as
 * {@link com.pacaccounting.ledger.LedgerWriteRejectedException}.
 */
public class LedgerMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerMaintenanceService.class);

    public static final String CLEAR_CONFIRMATION = "DELETE";

    private final LedgerStore ledgerStore;
    private final ClientRegistry clientRegistry;

    public LedgerMaintenanceService(LedgerStore ledgerStore, ClientRegistry clientRegistry) {
        this.ledgerStore = ledgerStore;
        this.clientRegistry = clientRegistry;
    }

    /**
     * Sets every month of the year to the same minutes. The recurring extra is kept, the
     * per-technician detail is dropped and a deleted company is reactivated.
     *
     * @return false when minutes is not positive and nothing was changed
     */
    public boolean setUniformAverage(int year, String company, int minutes) {
        requireCompany(company);
        if (minutes <= 0) {
            return false;
        }
        TimeRecord record = recordFor(year, company);
        for (int month = 1; month <= 12; month++) {
            record.setMonthMinutes(month, minutes);
        }
        record.clearTechnicianBreakdown();
        record.setDeleted(false);
        ledgerStore.save();
        logger.info("Set {} minutes in every month of {} for {}", minutes, year, company);
        return true;
    }

    /**
     * Sets the recurring monthly extra; months, detail and deleted flag are kept.
     */
    public void setExtraMonthly(int year, String company, int minutes) {
        requireCompany(company);
        TimeRecord record = recordFor(year, company);
        record.setExtraMonthlyMinutes(minutes);
        ledgerStore.save();
        logger.info("Set monthly extra of {} in {} to {} minutes", company, year, record.getExtraMonthlyMinutes());
    }

    /**
     * Marks a company deleted for a year. A company without a record gets an empty deleted
     * one, so that it stays hidden when it comes from the client registry.
     */
    public void softDelete(int year, String company) {
        requireCompany(company);
        TimeRecord record = recordFor(year, company);
        record.setDeleted(true);
        ledgerStore.save();
        logger.info("Company {} deleted for {}", company, year);
    }

    /**
     * Adds an empty record for every registry client that has no entry in the year.
     *
     * @return number of records added
     */
    public int syncClients(int year) {
        Ledger ledger = ledgerStore.ledger();
        Set<String> known = new HashSet<>();
        for (String company : ledger.year(year).keySet()) {
            String key = NameNormalizer.normalizeCompany(company);
            if (!key.isEmpty()) {
                known.add(key);
            }
        }

        int added = 0;
        for (ClientRecord client : clientRegistry.clients()) {
            String name = client.displayName() == null ? "" : client.displayName().trim();
            String key = NameNormalizer.normalizeCompany(name);
            if (key.isEmpty() || !known.add(key)) {
                continue;
            }
            ledger.getOrCreate(year, name);
            added++;
        }
        if (added > 0) {
            logger.info("Clients synchronized: {} new records in {}", added, year);
        }
        ledgerStore.save();
        return added;
    }

    /**
     * Removes every record of every year.
     *
     * @param confirmation must be {@value #CLEAR_CONFIRMATION}
     */
    public void clearLedger(String confirmation) {
        if (!CLEAR_CONFIRMATION.equals(confirmation)) {
            throw new IllegalArgumentException("Clearing the ledger must be confirmed with " + CLEAR_CONFIRMATION);
        }
        long previous = ledgerStore.ledger().totalMinutes();
        ledgerStore.ledger().clear();
        ledgerStore.save(SaveMode.ALLOW_VOLUME_DROP);
        logger.warn("Ledger cleared, {} minutes removed", previous);
    }

    /**
     * Re-reads and migrates the ledger file, then saves the result.
     */
    public MigrationResult migrateNow() {
        MigrationResult result = ledgerStore.reloadAndMigrate();
        ledgerStore.save();
        logger.info("Manual migration done: {} -> {} minutes", result.previousTotalMinutes(),
                result.migratedTotalMinutes());
        return result;
    }

    private TimeRecord recordFor(int year, String company) {
        Ledger ledger = ledgerStore.ledger();
        String name = company.trim();
        Optional<TimeRecord> exact = ledger.find(year, name);
        if (exact.isPresent()) {
            return exact.get();
        }
        String key = ledger.findKeyByNormalizedName(year, NameNormalizer.normalizeCompany(name)).orElse(name);
        return ledger.getOrCreate(year, key);
    }

    private static void requireCompany(String company) {
        if (company == null || company.isBlank()) {
            throw new IllegalArgumentException("Company name is required");
        }
    }
}
