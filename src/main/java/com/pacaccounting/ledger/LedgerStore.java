package com.pacaccounting.ledger;

import com.pacaccounting.processing.ImportBatch;

/**
 * Owner of the ledger: its in-memory working copy, its persisted form and the evolution of
 * that form.
 */
public interface LedgerStore {

    /**
     * The working copy. Mutations are persisted by {@link #save()}.
     */
    Ledger ledger();

    /**
     * Reads the persisted ledger, migrating older shapes, and makes it the working copy.
     * An unreadable file loads as an empty ledger.
     */
    Ledger load();

    /**
     * Replaces one month of every company the batch touches with the batch's facts.
     * Companies regaining minutes are reactivated.
     *
     * @return number of companies touched
     */
    int applyImport(int year, int month, ImportBatch batch);

    default void save() {
        save(SaveMode.GUARDED);
    }

    /**
     * Writes the working copy.
     *
     * @throws LedgerWriteRejectedException when the guarded volume check refuses the write
     * @throws LedgerException              when the file cannot be written
     */
    void save(SaveMode mode);

    /**
     * Whether the file holds the working copy; false after a rejected write until the next successful save.
     */
    boolean isDiskInSync();

    /**
     * Re-reads the file, migrates it and replaces the working copy, taking a backup first.
     * Nothing is written; callers save afterwards.
     */
    MigrationResult reloadAndMigrate();
}
