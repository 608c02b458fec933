package com.pacaccounting.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacaccounting.util.names.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from every known technician spelling to its canonical identity.
 * <p>
 * Each spelling is registered through {@link NameNormalizer#normalizePersonName(String)},
 * so lookups are insensitive to case, accents, punctuation and name particles.
 * One identity can be registered as "inferred from client": its spellings are recognized
 * but never attributed literally.
 */
public final class TechnicianAliasTable {

    private static final Logger logger = LoggerFactory.getLogger(TechnicianAliasTable.class);

    public static final String DEFAULT_RESOURCE = "technician_aliases.json";
    public static final String DEFAULT_UNASSIGNED_LABEL = "Unassigned";

    private final Map<String, String> canonicalByAlias;
    private final Set<String> inferredAliases;
    private final Set<String> canonicalNames;
    private final String unassignedLabel;

    private TechnicianAliasTable(Builder builder) {
        this.canonicalByAlias = Collections.unmodifiableMap(new HashMap<>(builder.canonicalByAlias));
        this.inferredAliases = Collections.unmodifiableSet(new HashSet<>(builder.inferredAliases));
        this.canonicalNames = Collections.unmodifiableSet(new LinkedHashSet<>(builder.canonicalNames));
        this.unassignedLabel = builder.unassignedLabel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the alias table shipped on the classpath.
     */
    public static TechnicianAliasTable loadDefault() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public static TechnicianAliasTable loadFromClasspath(String resourceName) {
        ObjectMapper objectMapper = new ObjectMapper();
        try (InputStream is = TechnicianAliasTable.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                throw new IllegalStateException("Technician alias resource not found: " + resourceName);
            }
            JsonNode rootNode = objectMapper.readTree(is);
            Builder builder = builder();

            if (rootNode.hasNonNull("unassigned_label")) {
                builder.unassignedLabel(rootNode.get("unassigned_label").asText());
            }
            for (JsonNode node : rootNode.path("technicians")) {
                String canonical = node.path("canonical").asText("");
                if (canonical.isBlank()) {
                    continue;
                }
                JsonNode variantsNode = node.path("variants");
                String[] variants = new String[variantsNode.size()];
                for (int i = 0; i < variantsNode.size(); i++) {
                    variants[i] = variantsNode.get(i).asText();
                }
                builder.register(canonical, variants);
            }
            for (JsonNode node : rootNode.path("inferred_from_client")) {
                builder.inferredFromClient(node.asText());
            }

            TechnicianAliasTable table = builder.build();
            logger.info("Loaded {} technician identities ({} spellings) from {}",
                    table.canonicalNames.size(), table.canonicalByAlias.size(), resourceName);
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read technician aliases from " + resourceName, e);
        }
    }

    /**
     * Canonical identity for an already normalized spelling.
     */
    public Optional<String> canonicalFor(String normalizedName) {
        return Optional.ofNullable(canonicalByAlias.get(normalizedName));
    }

    public boolean isInferredFromClient(String normalizedName) {
        return inferredAliases.contains(normalizedName);
    }

    public Set<String> canonicalNames() {
        return canonicalNames;
    }

    /**
     * Label used for minutes that cannot be attributed to any technician.
     */
    public String unassignedLabel() {
        return unassignedLabel;
    }

    public static final class Builder {

        private final Map<String, String> canonicalByAlias = new HashMap<>();
        private final Set<String> inferredAliases = new HashSet<>();
        private final Set<String> canonicalNames = new LinkedHashSet<>();
        private String unassignedLabel = DEFAULT_UNASSIGNED_LABEL;

        private Builder() {
        }

        /**
         * Registers a canonical identity together with all spellings observed for it.
         * The canonical name itself is always registered as a spelling.
         */
        public Builder register(String canonical, String... variants) {
            canonicalNames.add(canonical);
            putAlias(canonical, canonical);
            for (String variant : variants) {
                putAlias(variant, canonical);
            }
            return this;
        }

        public Builder inferredFromClient(String... spellings) {
            for (String spelling : spellings) {
                String norm = NameNormalizer.normalizePersonName(spelling);
                if (!norm.isEmpty()) {
                    inferredAliases.add(norm);
                }
            }
            return this;
        }

        public Builder unassignedLabel(String label) {
            if (label != null && !label.isBlank()) {
                this.unassignedLabel = label.trim();
            }
            return this;
        }

        public TechnicianAliasTable build() {
            return new TechnicianAliasTable(this);
        }

        private void putAlias(String spelling, String canonical) {
            String norm = NameNormalizer.normalizePersonName(spelling);
            if (norm.isEmpty()) {
                return;
            }
            String previous = canonicalByAlias.put(norm, canonical);
            if (previous != null && !previous.equals(canonical)) {
                logger.warn("Spelling '{}' registered for both '{}' and '{}', keeping '{}'",
                        spelling, previous, canonical, canonical);
            }
        }
    }
}
