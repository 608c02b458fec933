package com.pacaccounting.utils;

import org.apache.commons.text.similarity.JaroWinklerSimilarity;

import java.text.Normalizer;
import java.util.Map;

public class Utils {

    private static final JaroWinklerSimilarity JARO_WINKLER = new JaroWinklerSimilarity();

    private static final Map<String, String> SPECIAL_CHAR_MAPPING = Map.of(
        // characters NFD does not decompose
        "ß", "ss",
        "Æ", "AE",
        "æ", "ae",
        "Ø", "O",
        "ø", "o",
        "Ł", "L",
        "ł", "l",
        "Đ", "D",
        "đ", "d"
    );

    private Utils() {
    }

    /**
     * Removes diacritical marks ("ç" becomes "c", "ã" becomes "a") and maps the few
     * letters that Unicode decomposition leaves untouched. Case is preserved.
     *
     * @param input text that may contain diacritical marks, may be null
     * @return the folded text, or an empty string for null input
     */
    public static String removeDiacritics(String input) {
        if (input == null) {
            return "";
        }
        String result = input;
        for (Map.Entry<String, String> entry : SPECIAL_CHAR_MAPPING.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        // NFD separates base characters from combining marks (category Mn)
        String normalized = Normalizer.normalize(result, Normalizer.Form.NFD);
        return normalized.replaceAll("\\p{M}", "");
    }

    /**
     * Jaro-Winkler similarity between two strings, 0.0 when either is null.
     */
    public static double jaroWinkler(String first, String second) {
        if (first == null || second == null) {
            return 0.0;
        }
        return JARO_WINKLER.apply(first, second);
    }

    /**
     * Adds two minute counts, saturating at {@code Integer.MAX_VALUE} instead of wrapping.
     */
    public static int saturatedSum(int a, int b) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, (long) a + b));
    }

    /**
     * Formats a minute count as hours and zero padded minutes, e.g. 150 becomes "2h30m".
     * Negative values are shown as zero.
     */
    public static String formatMinutes(long minutes) {
        long value = Math.max(0, minutes);
        return String.format("%dh%02dm", value / 60, value % 60);
    }
}
