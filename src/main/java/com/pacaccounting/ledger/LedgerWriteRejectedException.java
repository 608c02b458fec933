package com.pacaccounting.ledger;

import java.nio.file.Path;

/**
 * A save refused because the new minute volume dropped below the retained share of the
 * volume on disk. The file is left untouched; the in-memory ledger is not rolled back.
 */
public class LedgerWriteRejectedException extends LedgerException {

    private final long previousTotalMinutes;
    private final long attemptedTotalMinutes;

    public LedgerWriteRejectedException(Path file, long previousTotalMinutes, long attemptedTotalMinutes) {
        super(String.format("Write to %s rejected: total minutes would drop from %d to %d",
                file, previousTotalMinutes, attemptedTotalMinutes));
        this.previousTotalMinutes = previousTotalMinutes;
        this.attemptedTotalMinutes = attemptedTotalMinutes;
    }

    public long getPreviousTotalMinutes() {
        return previousTotalMinutes;
    }

    public long getAttemptedTotalMinutes() {
        return attemptedTotalMinutes;
    }
}
