package com.pacaccounting.service;

import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.processing.Attribution;
import com.pacaccounting.processing.ImportBatch;
import com.pacaccounting.processing.ImportDiagnostics;
import com.pacaccounting.processing.ImportFact;
import com.pacaccounting.registry.ClientRegistry;
import com.pacaccounting.registry.InMemoryClientRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Gives the special-case facts of a batch the technician the client registry records for
 * their company. Facts that cannot be attributed keep their minutes at company level and are
 * reported for follow-up.
 */
public class InferredTechnicianAttributor {

    private final TechnicianResolver technicianResolver;
    private final ClientRegistry clientRegistry;

    public InferredTechnicianAttributor(TechnicianResolver technicianResolver, ClientRegistry clientRegistry) {
        this.technicianResolver = technicianResolver;
        this.clientRegistry = clientRegistry;
    }

    public ImportBatch attribute(ImportBatch batch, ImportDiagnostics diagnostics) {
        boolean anyInferred = batch.getFacts().stream()
                .anyMatch(fact -> fact.attribution() == Attribution.INFERRED_FROM_CLIENT);
        if (!anyInferred) {
            return batch;
        }

        // one registry read per batch
        ClientRegistry snapshot = new InMemoryClientRegistry(clientRegistry.clients());
        List<ImportFact> facts = new ArrayList<>(batch.getFacts().size());
        for (ImportFact fact : batch.getFacts()) {
            if (fact.attribution() != Attribution.INFERRED_FROM_CLIENT) {
                facts.add(fact);
                continue;
            }
            Optional<String> technician = technicianResolver.inferForCompany(fact.companyName(), snapshot);
            if (technician.isPresent()) {
                facts.add(fact.withTechnician(technician.get()));
            } else {
                diagnostics.addUninferred(fact.companyName(), fact.minutes());
                facts.add(fact.withTechnician(null));
            }
        }
        return batch.withFacts(facts);
    }
}
