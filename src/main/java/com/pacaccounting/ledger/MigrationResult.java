package com.pacaccounting.ledger;

import java.nio.file.Path;

/**
 * Outcome of an operator-triggered migration of the ledger file.
 *
 * @param schema             shape the file had before migration
 * @param previousTotalMinutes minute volume of the ledger held before the reload
 * @param migratedTotalMinutes minute volume of the re-read, migrated ledger
 * @param backup             copy of the file taken before the in-memory ledger was replaced, null when there was no file
 */
public record MigrationResult(LedgerSchema schema, long previousTotalMinutes, long migratedTotalMinutes, Path backup) {
}
