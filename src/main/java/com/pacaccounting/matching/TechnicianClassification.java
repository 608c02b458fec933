package com.pacaccounting.matching;

import java.util.Objects;

/**
 * Outcome of resolving a raw technician spelling.
 *
 * @param kind          which of the three classifications applies
 * @param canonicalName canonical identity, only set for {@link Kind#CANONICAL}
 */
public record TechnicianClassification(Kind kind, String canonicalName) {

    public enum Kind {
        /** Not found in any alias set; minutes go to the unresolved-technician report. */
        UNKNOWN,
        /** Alias of a known identity. */
        CANONICAL,
        /** Special-case identity whose hours belong to the client's primary technician. */
        INFERRED_FROM_CLIENT
    }

    private static final TechnicianClassification UNKNOWN_INSTANCE = new TechnicianClassification(Kind.UNKNOWN, null);
    private static final TechnicianClassification INFERRED_INSTANCE =
            new TechnicianClassification(Kind.INFERRED_FROM_CLIENT, null);

    public TechnicianClassification {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.CANONICAL && (canonicalName == null || canonicalName.isBlank())) {
            throw new IllegalArgumentException("canonical classification needs a name");
        }
    }

    public static TechnicianClassification unknown() {
        return UNKNOWN_INSTANCE;
    }

    public static TechnicianClassification canonical(String canonicalName) {
        return new TechnicianClassification(Kind.CANONICAL, canonicalName);
    }

    public static TechnicianClassification inferredFromClient() {
        return INFERRED_INSTANCE;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }
}
