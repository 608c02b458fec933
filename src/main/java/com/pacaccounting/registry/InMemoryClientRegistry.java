package com.pacaccounting.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class InMemoryClientRegistry implements ClientRegistry {

    private final List<ClientRecord> clients;

    public InMemoryClientRegistry(List<ClientRecord> clients) {
        this.clients = Collections.unmodifiableList(new ArrayList<>(clients));
    }

    public static InMemoryClientRegistry empty() {
        return new InMemoryClientRegistry(List.of());
    }

    @Override
    public List<ClientRecord> clients() {
        return clients;
    }
}
