package com.pacaccounting.processing;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import java.util.List;

class ImportDeduplicatorTest {

    private final ImportDeduplicator deduplicator = new ImportDeduplicator();

    @Test
    void testSameObservationFromTwoSheetsCountsOnce() {
        ImportDiagnostics diagnostics = new ImportDiagnostics();
        ImportBatch batch = deduplicator.deduplicate(List.of(
            RawFact.canonical("Acme, Lda.", "Ana Rodrigues", 150, "a.xlsx/Mar"),
            RawFact.canonical("ACME LDA", "ana rodrigues", 150, "b.xlsx/Mar"),
            RawFact.summary("Beta", 60, "a.xlsx/Mar"),
            RawFact.summary("Beta", 60, "b.xlsx/Mar")), 3, diagnostics);

        assertThat(batch.getFacts()).hasSize(2);
        assertThat(batch.totalMinutes()).isEqualTo(210);
        assertThat(diagnostics.getDuplicatesByCompany()).containsEntry("ACME LDA", 150).containsEntry("Beta", 60);
        assertThat(diagnostics.getTotalDuplicateMinutes()).isEqualTo(210);
    }

    @Test
    void testDifferentMinutesOrIdentityAreKept() {
        ImportBatch batch = deduplicator.deduplicate(List.of(
            RawFact.canonical("Acme", "Ana Rodrigues", 150, "a/1"),
            RawFact.canonical("Acme", "Ana Rodrigues", 90, "a/1"),
            RawFact.inferred("Acme", 150, "a/1"),
            RawFact.summary("Acme", 150, "a/1"),
            RawFact.canonical("Acme", "Pedro Fernandes", 150, "a/1")), 3, new ImportDiagnostics());

        assertThat(batch.getFacts()).hasSize(5);
        assertThat(batch.getAffectedCompanyKeys()).containsExactly("acme");
    }

    @Test
    void testDisplayNameIsFirstSpelling() {
        ImportBatch batch = deduplicator.deduplicate(List.of(
            RawFact.summary(" Acme, Lda. ", 30, "a/1"),
            RawFact.summary("ACME UNIPESSOAL", 45, "a/1")), 5, new ImportDiagnostics());

        assertThat(batch.getMonth()).isEqualTo(5);
        assertThat(batch.displayNameFor("acme")).isEqualTo("Acme, Lda.");
        assertThat(batch.getFacts()).extracting(ImportFact::companyKey).containsOnly("acme");
    }

    @Test
    void testUnusableFactsAreSkipped() {
        ImportBatch batch = deduplicator.deduplicate(List.of(
            RawFact.summary(" ", 30, "a/1"),
            RawFact.summary("Acme", 0, "a/1")), 1, new ImportDiagnostics());

        assertThat(batch.isEmpty()).isTrue();
    }

    @Test
    void testBatchRejectsInvalidMonth() {
        assertThatThrownBy(() -> new ImportBatch(13, List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
