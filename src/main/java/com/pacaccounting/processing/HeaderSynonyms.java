package com.pacaccounting.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacaccounting.util.names.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Known header spellings of the company, technician and duration columns of a tabular timesheet.
 * Spellings are compared after {@link NameNormalizer#normalizeHeader(String)}.
 */
public final class HeaderSynonyms {

    private static final Logger logger = LoggerFactory.getLogger(HeaderSynonyms.class);

    public static final String DEFAULT_RESOURCE = "sheet_headers.json";

    private final Set<String> company;
    private final Set<String> technician;
    private final Set<String> duration;

    public HeaderSynonyms(Set<String> company, Set<String> technician, Set<String> duration) {
        this.company = normalizeAll(company);
        this.technician = normalizeAll(technician);
        this.duration = normalizeAll(duration);
    }

    public static HeaderSynonyms loadDefault() {
        ObjectMapper objectMapper = new ObjectMapper();
        try (InputStream is = HeaderSynonyms.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Header synonyms resource not found: " + DEFAULT_RESOURCE);
            }
            JsonNode rootNode = objectMapper.readTree(is);
            HeaderSynonyms synonyms = new HeaderSynonyms(
                    texts(rootNode.path("company")),
                    texts(rootNode.path("technician")),
                    texts(rootNode.path("duration")));
            logger.info("Loaded header synonyms: {} company, {} technician, {} duration",
                    synonyms.company.size(), synonyms.technician.size(), synonyms.duration.size());
            return synonyms;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read header synonyms from " + DEFAULT_RESOURCE, e);
        }
    }

    public boolean isCompany(String normalizedHeader) {
        return company.contains(normalizedHeader);
    }

    public boolean isTechnician(String normalizedHeader) {
        return technician.contains(normalizedHeader);
    }

    public boolean isDuration(String normalizedHeader) {
        return duration.contains(normalizedHeader);
    }

    private static Set<String> texts(JsonNode arrayNode) {
        Set<String> result = new HashSet<>();
        for (JsonNode node : arrayNode) {
            result.add(node.asText());
        }
        return result;
    }

    private static Set<String> normalizeAll(Set<String> spellings) {
        Set<String> result = new HashSet<>();
        for (String spelling : spellings) {
            String norm = NameNormalizer.normalizeHeader(spelling);
            if (!norm.isEmpty()) {
                result.add(norm);
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
