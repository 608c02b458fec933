package com.pacaccounting.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pacaccounting.processing.ImportDiagnostics;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the diagnostics of an import as the JSON report file read by the back office.
 */
public class ImportReportWriter {

    private final ObjectMapper objectMapper;

    public ImportReportWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ImportReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(ImportDiagnostics diagnostics, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), toDocument(diagnostics));
    }

    Map<String, Object> toDocument(ImportDiagnostics diagnostics) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("invalidos", diagnostics.getUnknownTechnicians());
        document.put("ignorados_por_empresa", diagnostics.getIgnoredByCompany());
        document.put("minutos_ignorados_resumo_por_empresa", diagnostics.getIgnoredSummaryByCompany());
        document.put("duplicados_por_empresa", diagnostics.getDuplicatesByCompany());
        document.put("total_minutos_deduplicados", diagnostics.getTotalDuplicateMinutes());
        document.put("sem_tecnico_inferido", diagnostics.getUninferredByCompany());
        document.put("ficheiros", diagnostics.getFiles());
        document.put("ficheiros_ilegiveis", diagnostics.getUnreadableFiles());
        document.put("layouts", diagnostics.getSheetLayouts());
        return document;
    }
}
