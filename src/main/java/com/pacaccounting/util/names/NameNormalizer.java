package com.pacaccounting.util.names;

import com.pacaccounting.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonicalizes free-text company, technician and header names into comparable keys.
 * <p>
 * Two strengths exist. The light person-name key only folds case, accents, a few
 * punctuation marks and name particles, so technician names keep every meaningful token.
 * The strong company key additionally strips legal-entity words ("Lda", "Unipessoal",
 * "S.A.", ...) because client names routinely differ only in their corporate form.
 * <p>
 * All methods return an empty string for null or blank input. An empty key means
 * "unmatched" and must never be used as a wildcard.
 */
public class NameNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(NameNormalizer.class);

    private static final Set<String> LEGAL_SUFFIXES = new LinkedHashSet<>();
    private static final Set<String> STOP_TOKENS = new LinkedHashSet<>();
    private static final Set<String> NAME_PARTICLES = new LinkedHashSet<>();
    private static final Set<String> TOTAL_WORDS = Set.of("total", "totais", "subtotal", "soma", "sum");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PERSON_PUNCTUATION = Pattern.compile("[.,;:]");
    private static final Pattern COMPANY_PUNCTUATION = Pattern.compile("[.,;:\\-_/()\\[\\]{}&'\"+]");
    private static final Pattern NON_ALNUM_LOWER = Pattern.compile("[^a-z0-9]+");
    private static final Pattern NON_ALNUM_UPPER = Pattern.compile("[^A-Z0-9]+");

    private static final Pattern LEGAL_SUFFIX_PATTERN;

    static {
        loadWordList("/legal_suffixes.txt", LEGAL_SUFFIXES, false);
        loadWordList("/company_stop_tokens.txt", STOP_TOKENS, true);
        loadWordList("/name_particles.txt", NAME_PARTICLES, true);
        LEGAL_SUFFIX_PATTERN = buildLegalSuffixPattern();
    }

    private NameNormalizer() {
    }

    private static void loadWordList(String resourcePath, Set<String> target, boolean upperCase) {
        InputStream is = NameNormalizer.class.getResourceAsStream(resourcePath);
        if (is == null) {
            logger.warn("Word list not found: {}", resourcePath);
            return;
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            int count = 0;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                target.add(upperCase ? line.toUpperCase(Locale.ROOT) : line.toLowerCase(Locale.ROOT));
                count++;
            }
            logger.info("Loaded {} entries from {}", count, resourcePath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load word list from " + resourcePath, e);
        }
    }

    private static Pattern buildLegalSuffixPattern() {
        if (LEGAL_SUFFIXES.isEmpty()) {
            return null;
        }
        // multi word forms ("s a") must be tried before their single word parts
        List<String> forms = new ArrayList<>(LEGAL_SUFFIXES);
        forms.sort((a, b) -> Integer.compare(b.length(), a.length()));
        String alternatives = forms.stream()
                .map(form -> Arrays.stream(form.split("\\s+"))
                        .map(Pattern::quote)
                        .collect(Collectors.joining("\\s+")))
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Light normalization used for technician alias lookups.
     * "Ana Catarina Lourenço  Rodrigues" becomes "ANA CATARINA LOURENCO RODRIGUES",
     * "João da Silva" becomes "JOAO SILVA".
     */
    public static String normalizePersonName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String cleaned = Utils.removeDiacritics(name.trim()).toUpperCase(Locale.ROOT);
        cleaned = PERSON_PUNCTUATION.matcher(cleaned).replaceAll(" ");
        return Arrays.stream(WHITESPACE.split(cleaned.trim()))
                .filter(token -> !token.isEmpty())
                .filter(token -> !NAME_PARTICLES.contains(token))
                .collect(Collectors.joining(" "));
    }

    /**
     * Strong normalization used to identify companies across imports.
     * "Acme Unipessoal, Lda." and "ACME" both become "acme".
     * When stripping legal words would leave nothing, the text before stripping is returned.
     */
    public static String normalizeCompany(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String text = Utils.removeDiacritics(name.trim()).toLowerCase(Locale.ROOT);
        text = COMPANY_PUNCTUATION.matcher(text).replaceAll(" ");
        text = collapse(text);
        if (text.isEmpty()) {
            return "";
        }
        if (LEGAL_SUFFIX_PATTERN == null) {
            return text;
        }
        String stripped = collapse(LEGAL_SUFFIX_PATTERN.matcher(text).replaceAll(" "));
        return stripped.isEmpty() ? text : stripped;
    }

    /**
     * Header normalization: lower case, no accents, anything but letters and digits becomes a space.
     * "Técnico / Responsável" becomes "tecnico responsavel".
     */
    public static String normalizeHeader(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String text = Utils.removeDiacritics(value.trim()).toLowerCase(Locale.ROOT);
        return collapse(NON_ALNUM_LOWER.matcher(text).replaceAll(" "));
    }

    /**
     * Key used by the company matcher: upper case, no accents, punctuation removed,
     * legal words kept. "Acme Unipessoal, Lda." becomes "ACME UNIPESSOAL LDA".
     */
    public static String matchingKey(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String text = Utils.removeDiacritics(name.trim()).toUpperCase(Locale.ROOT);
        return collapse(NON_ALNUM_UPPER.matcher(text).replaceAll(" "));
    }

    /**
     * Tokens of a matching key without corporate-form and connector words.
     */
    public static List<String> significantTokens(String matchingKey) {
        if (matchingKey == null || matchingKey.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(WHITESPACE.split(matchingKey.trim()))
                .filter(token -> !token.isEmpty())
                .filter(token -> !STOP_TOKENS.contains(token.toUpperCase(Locale.ROOT)))
                .toList();
    }

    /**
     * Whether a cell reads as a total or subtotal line of a report rather than data.
     */
    public static boolean isTotalMarker(String text) {
        String norm = normalizeHeader(text);
        if (norm.isEmpty()) {
            return false;
        }
        return Arrays.stream(norm.split(" ")).anyMatch(TOTAL_WORDS::contains);
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
