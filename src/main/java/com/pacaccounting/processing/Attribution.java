package com.pacaccounting.processing;

/**
 * Who a fact's minutes are attributed to.
 */
public enum Attribution {
    /** A known technician, by canonical name. */
    CANONICAL,
    /** The special-case identity; the technician is taken from the client registry. */
    INFERRED_FROM_CLIENT,
    /** Company-level total without technician detail. */
    SUMMARY
}
