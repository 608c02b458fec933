package com.pacaccounting.registry;

import java.util.List;

/**
 * Read-only view of the firm's client registry.
 */
public interface ClientRegistry {

    List<ClientRecord> clients();
}
