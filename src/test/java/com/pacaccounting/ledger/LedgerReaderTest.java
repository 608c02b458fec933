package com.pacaccounting.ledger;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacaccounting.matching.TechnicianResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class LedgerReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LedgerReader reader = new LedgerReader(TechnicianResolver.withDefaultAliases());

    @TempDir
    Path tempDir;

    @Test
    void testDetectSchemas() throws IOException {
        assertThat(LedgerReader.detect(objectMapper.readTree("{}"))).isEqualTo(LedgerSchema.EMPTY);
        assertThat(LedgerReader.detect(objectMapper.readTree("[]"))).isEqualTo(LedgerSchema.UNREADABLE);
        assertThat(LedgerReader.detect(fixture("legacy_split.json"))).isEqualTo(LedgerSchema.LEGACY_SPLIT);
        assertThat(LedgerReader.detect(fixture("legacy_flat_hours.json"))).isEqualTo(LedgerSchema.LEGACY_FLAT_HOURS);
        assertThat(LedgerReader.detect(fixture("current.json"))).isEqualTo(LedgerSchema.CURRENT);
        assertThat(LedgerReader.detect(objectMapper.readTree("{\"2024\": {\"Acme\": {\"apagado\": true}}}")))
            .isEqualTo(LedgerSchema.CURRENT);
    }

    @Test
    void testCurrentFileNeedsNoMigration() throws IOException {
        LedgerReader.Result result = reader.read(fixture("current.json"));

        assertThat(result.schema()).isEqualTo(LedgerSchema.CURRENT);
        assertThat(result.migrated()).isFalse();
        TimeRecord acme = result.ledger().find(2024, "Acme, Lda.").orElseThrow();
        assertThat(acme.getMonthlyMinutes()).containsExactly(entry(1, 100), entry(2, 50));
        assertThat(acme.getExtraMonthlyMinutes()).isEqualTo(10);
        assertThat(acme.getCompanyDisplayName()).isEqualTo("Acme, Lda.");
        assertThat(result.ledger().totalMinutes()).isEqualTo(270);
    }

    @Test
    void testAliasKeysAndYearlyExtraAreMigrated() throws IOException {
        LedgerReader.Result result = reader.read(fixture("current_with_aliases.json"));

        assertThat(result.schema()).isEqualTo(LedgerSchema.CURRENT);
        assertThat(result.migrated()).isTrue();
        TimeRecord acme = result.ledger().find(2024, "Acme, Lda.").orElseThrow();
        assertThat(acme.getExtraMonthlyMinutes()).isEqualTo(10);
        assertThat(acme.getPerTechnicianMonthlyMinutes()).containsOnlyKeys("Ana Rodrigues");
        assertThat(acme.getPerTechnicianMonthlyMinutes().get("Ana Rodrigues")).containsExactly(entry(1, 100));

        TimeRecord beta = result.ledger().find(2024, "Beta").orElseThrow();
        assertThat(beta.isDeleted()).isTrue();
        assertThat(beta.getExtraMonthlyMinutes()).isEqualTo(15);
        assertThat(beta.getMonthlyMinutes()).isEmpty();
    }

    @Test
    void testLegacySplitSchema() throws IOException {
        LedgerReader.Result result = reader.read(fixture("legacy_split.json"));

        assertThat(result.schema()).isEqualTo(LedgerSchema.LEGACY_SPLIT);
        assertThat(result.migrated()).isTrue();
        Ledger ledger = result.ledger();
        TimeRecord acme = ledger.find(2023, "Acme, Lda.").orElseThrow();
        assertThat(acme.getMonthlyMinutes()).containsExactly(entry(1, 120), entry(2, 90));
        assertThat(acme.getExtraMonthlyMinutes()).isEqualTo(20);
        assertThat(ledger.find(2023, "Beta SA").orElseThrow().minutesFor(3)).isEqualTo(60);
        // extra without any month entry still becomes a record
        assertThat(ledger.find(2023, "Gama").orElseThrow().getExtraMonthlyMinutes()).isEqualTo(10);
        assertThat(ledger.totalMinutes()).isEqualTo(630);
    }

    @Test
    void testLegacyFlatHoursSchema() throws IOException {
        LedgerReader.Result result = reader.read(fixture("legacy_flat_hours.json"));

        assertThat(result.schema()).isEqualTo(LedgerSchema.LEGACY_FLAT_HOURS);
        assertThat(result.migrated()).isTrue();
        TimeRecord acme = result.ledger().find(2022, "Acme").orElseThrow();
        assertThat(acme.getMonthlyMinutes()).containsExactly(entry(1, 90), entry(2, 90));
        assertThat(result.ledger().find(2022, "Beta").orElseThrow().minutesFor(6)).isEqualTo(45);
    }

    @Test
    void testStoredValuesFollowDurationRules() throws IOException {
        assertThat(LedgerReader.minutes(objectMapper.readTree("150"))).isEqualTo(150);
        assertThat(LedgerReader.minutes(objectMapper.readTree("2.5"))).isEqualTo(150);
        assertThat(LedgerReader.minutes(objectMapper.readTree("\"2h30\""))).isEqualTo(150);
        assertThat(LedgerReader.minutes(objectMapper.readTree("-5"))).isZero();
        assertThat(LedgerReader.minutes(objectMapper.readTree("null"))).isZero();
        assertThat(LedgerReader.minutes(objectMapper.readTree("true"))).isZero();
    }

    @Test
    void testMissingAndCorruptFiles() throws IOException {
        assertThat(reader.read(tempDir.resolve("absent.json")).schema()).isEqualTo(LedgerSchema.EMPTY);

        Path corrupt = tempDir.resolve("corrupt.json");
        Files.writeString(corrupt, "{\"2024\": {\"Acme\": ", StandardCharsets.UTF_8);
        LedgerReader.Result result = reader.read(corrupt);

        assertThat(result.schema()).isEqualTo(LedgerSchema.UNREADABLE);
        assertThat(result.ledger().isEmpty()).isTrue();
        assertThat(result.migrated()).isFalse();
    }

    @Test
    void testWrittenLedgerReadsBackEqual() throws IOException {
        Ledger ledger = new Ledger();
        TimeRecord acme = ledger.getOrCreate(2024, "Acme, Lda.");
        acme.addMonthMinutes(3, 150);
        acme.addTechnicianMinutes("Ana Rodrigues", 3, 150);
        acme.setExtraMonthlyMinutes(30);
        ledger.getOrCreate(2024, "Beta").setDeleted(true);

        JsonNode written = objectMapper.readTree(objectMapper.writeValueAsString(ledger));
        LedgerReader.Result result = reader.read(written);

        assertThat(written.path("2024").path("Acme, Lda.").has("meses")).isTrue();
        assertThat(written.path("2024").path("Beta").path("apagado").asBoolean()).isTrue();
        assertThat(result.migrated()).isFalse();
        assertThat(result.ledger()).isEqualTo(ledger);
    }

    private JsonNode fixture(String name) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("ledgers/" + name)) {
            assertThat(is).withFailMessage("Missing fixture %s", name).isNotNull();
            return objectMapper.readTree(is);
        }
    }
}
