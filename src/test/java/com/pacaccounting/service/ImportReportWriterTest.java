package com.pacaccounting.service;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacaccounting.processing.ImportDiagnostics;
import com.pacaccounting.processing.SheetLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

class ImportReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testReportDocument() throws IOException {
        ImportDiagnostics diagnostics = new ImportDiagnostics();
        diagnostics.addUnknownTechnician("Fulano", "Acme", 30);
        diagnostics.addIgnoredSummary("Beta", 120);
        diagnostics.addDuplicate("Acme", 45);
        diagnostics.addUninferred("Omega", 60);
        diagnostics.recordFile("marco.xlsx");
        diagnostics.recordUnreadableFile("broken.xlsx", "unsupported file type");
        diagnostics.recordLayout("marco.xlsx/Mar", SheetLayout.LayoutKind.TABULAR);

        Path file = tempDir.resolve("reports/import.json");
        new ImportReportWriter().write(diagnostics, file);
        JsonNode root = new ObjectMapper().readTree(file.toFile());

        assertThat(root.path("invalidos").path("Fulano").asInt()).isEqualTo(30);
        assertThat(root.path("ignorados_por_empresa").path("Acme").asInt()).isEqualTo(30);
        assertThat(root.path("ignorados_por_empresa").path("Beta").asInt()).isEqualTo(120);
        assertThat(root.path("minutos_ignorados_resumo_por_empresa").path("Beta").asInt()).isEqualTo(120);
        assertThat(root.path("duplicados_por_empresa").path("Acme").asInt()).isEqualTo(45);
        assertThat(root.path("total_minutos_deduplicados").asLong()).isEqualTo(45);
        assertThat(root.path("sem_tecnico_inferido").path("Omega").asInt()).isEqualTo(60);
        assertThat(root.path("ficheiros").get(0).asText()).isEqualTo("marco.xlsx");
        assertThat(root.path("ficheiros_ilegiveis").path("broken.xlsx").asText()).isEqualTo("unsupported file type");
        assertThat(root.path("layouts").path("marco.xlsx/Mar").asText()).isEqualTo("TABULAR");
    }
}
