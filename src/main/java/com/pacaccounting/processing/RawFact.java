package com.pacaccounting.processing;

import java.util.Objects;

/**
 * Minutes read from one sheet for one company.
 *
 * @param company     company name as written in the sheet
 * @param attribution how the minutes are attributed
 * @param technician  canonical technician for {@link Attribution#CANONICAL}, otherwise null
 * @param minutes     positive minute count
 * @param source      "file/sheet" the fact was read from
 */
public record RawFact(String company, Attribution attribution, String technician, int minutes, String source) {

    public RawFact {
        Objects.requireNonNull(company, "company");
        Objects.requireNonNull(attribution, "attribution");
        if (attribution == Attribution.CANONICAL && (technician == null || technician.isBlank())) {
            throw new IllegalArgumentException("canonical fact needs a technician");
        }
    }

    public static RawFact canonical(String company, String technician, int minutes, String source) {
        return new RawFact(company, Attribution.CANONICAL, technician, minutes, source);
    }

    public static RawFact inferred(String company, int minutes, String source) {
        return new RawFact(company, Attribution.INFERRED_FROM_CLIENT, null, minutes, source);
    }

    public static RawFact summary(String company, int minutes, String source) {
        return new RawFact(company, Attribution.SUMMARY, null, minutes, source);
    }
}
