package com.pacaccounting.ledger;

public enum SaveMode {
    /** Rejects a write that would shrink the persisted minute volume below the retained ratio. */
    GUARDED,
    /** Operator-confirmed mass removal; the volume guard is skipped. */
    ALLOW_VOLUME_DROP
}
