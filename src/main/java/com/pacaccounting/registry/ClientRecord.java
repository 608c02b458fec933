package com.pacaccounting.registry;

/**
 * A client as kept by the client registry.
 *
 * @param displayName       company name as entered in the registry
 * @param primaryTechnician technician responsible for the client, may be null
 */
public record ClientRecord(String displayName, String primaryTechnician) {

    public boolean hasPrimaryTechnician() {
        return primaryTechnician != null && !primaryTechnician.isBlank();
    }
}
