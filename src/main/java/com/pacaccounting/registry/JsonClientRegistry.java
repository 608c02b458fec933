package com.pacaccounting.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Client registry read from the application's JSON data file.
 * <p>
 * The file holds a {@code clientes} array (or is itself an array). The display name is taken
 * from the first present field of {@code nome}, {@code cliente}, {@code empresa},
 * {@code designacao}; the technician from {@code tecnico}, then {@code carteira}, then
 * {@code responsavel}. The file is re-read on every call so that edits made by the client
 * forms are seen without a restart.
 */
public class JsonClientRegistry implements ClientRegistry {

    private static final Logger logger = LoggerFactory.getLogger(JsonClientRegistry.class);

    private static final String[] NAME_FIELDS = {"nome", "cliente", "empresa", "designacao"};
    private static final String[] TECHNICIAN_FIELDS = {"tecnico", "carteira", "responsavel"};

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonClientRegistry(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonClientRegistry(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ClientRecord> clients() {
        if (!Files.exists(file)) {
            logger.warn("Client registry file not found: {}", file.toAbsolutePath());
            return Collections.emptyList();
        }
        try (InputStream is = Files.newInputStream(file)) {
            return parse(objectMapper.readTree(is));
        } catch (IOException e) {
            logger.warn("Client registry file {} is unreadable, using no clients", file.toAbsolutePath(), e);
            return Collections.emptyList();
        }
    }

    static List<ClientRecord> parse(JsonNode root) {
        JsonNode clientsNode = root != null && root.isObject() ? root.path("clientes") : root;
        if (clientsNode == null || !clientsNode.isArray()) {
            return Collections.emptyList();
        }
        List<ClientRecord> result = new ArrayList<>();
        for (JsonNode node : clientsNode) {
            if (!node.isObject()) {
                continue;
            }
            String name = firstText(node, NAME_FIELDS);
            if (name == null) {
                continue;
            }
            result.add(new ClientRecord(name, firstText(node, TECHNICIAN_FIELDS)));
        }
        return result;
    }

    private static String firstText(JsonNode node, String[] fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }
}
