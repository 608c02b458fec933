package com.pacaccounting.ledger;

/**
 * Shapes of the ledger file met in deployments.
 */
public enum LedgerSchema {
    /** No file, or an empty document. */
    EMPTY,
    /** Year to company to record with {@code meses}, {@code extra_mensal}, {@code apagado}, {@code por_tecnico}. */
    CURRENT,
    /** Root {@code timings} and {@code timings_extra} sections, each year wrapping its companies in {@code empresas}. */
    LEGACY_SPLIT,
    /** Year to company to month to decimal hours, without a record wrapper. */
    LEGACY_FLAT_HOURS,
    /** A file that is not valid JSON or not an object; read as an empty ledger. */
    UNREADABLE;

    public boolean isLegacy() {
        return this == LEGACY_SPLIT || this == LEGACY_FLAT_HOURS;
    }
}
