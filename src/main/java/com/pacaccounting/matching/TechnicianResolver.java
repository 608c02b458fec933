package com.pacaccounting.matching;

import com.pacaccounting.registry.ClientRecord;
import com.pacaccounting.registry.ClientRegistry;
import com.pacaccounting.util.names.NameNormalizer;

import java.util.Optional;

/**
 * Maps arbitrary technician spellings to the closed set of canonical identities.
 */
public class TechnicianResolver {

    private final TechnicianAliasTable aliasTable;

    public TechnicianResolver(TechnicianAliasTable aliasTable) {
        this.aliasTable = aliasTable;
    }

    public static TechnicianResolver withDefaultAliases() {
        return new TechnicianResolver(TechnicianAliasTable.loadDefault());
    }

    /**
     * Classifies a spelling found in a spreadsheet or in the client registry.
     * Blank input and spellings outside every alias set are {@code UNKNOWN}.
     */
    public TechnicianClassification resolve(String rawName) {
        String norm = NameNormalizer.normalizePersonName(rawName);
        if (norm.isEmpty()) {
            return TechnicianClassification.unknown();
        }
        if (aliasTable.isInferredFromClient(norm)) {
            return TechnicianClassification.inferredFromClient();
        }
        return aliasTable.canonicalFor(norm)
                .map(TechnicianClassification::canonical)
                .orElse(TechnicianClassification.unknown());
    }

    /**
     * Name under which a technician is stored in the per-technician breakdown.
     * Aliases collapse to their canonical identity; blank input and the special-case
     * identity become the unassigned label; any other spelling is kept as written.
     */
    public String canonicalName(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return aliasTable.unassignedLabel();
        }
        TechnicianClassification classification = resolve(rawName);
        return switch (classification.kind()) {
            case CANONICAL -> classification.canonicalName();
            case INFERRED_FROM_CLIENT -> aliasTable.unassignedLabel();
            case UNKNOWN -> rawName.trim();
        };
    }

    /**
     * Infers who really worked for a company from the registry's primary technician.
     *
     * @return the canonical technician, the registry's spelling when it is not a known alias,
     * or empty when the company is not in the registry or has no technician recorded
     */
    public Optional<String> inferForCompany(String companyName, ClientRegistry registry) {
        String target = NameNormalizer.normalizeCompany(companyName);
        if (target.isEmpty() || registry == null) {
            return Optional.empty();
        }
        for (ClientRecord client : registry.clients()) {
            if (!target.equals(NameNormalizer.normalizeCompany(client.displayName()))) {
                continue;
            }
            if (!client.hasPrimaryTechnician()) {
                return Optional.empty();
            }
            TechnicianClassification classification = resolve(client.primaryTechnician());
            if (classification.kind() == TechnicianClassification.Kind.CANONICAL) {
                return Optional.of(classification.canonicalName());
            }
            if (classification.kind() == TechnicianClassification.Kind.INFERRED_FROM_CLIENT) {
                // the registry names the special-case identity itself, nothing to infer from
                return Optional.empty();
            }
            return Optional.of(client.primaryTechnician().trim());
        }
        return Optional.empty();
    }

    public String unassignedLabel() {
        return aliasTable.unassignedLabel();
    }
}
