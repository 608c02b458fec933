package com.pacaccounting.processing;

import static org.assertj.core.api.Assertions.*;

import com.pacaccounting.matching.TechnicianResolver;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

class SpreadsheetParserTest {

    private final SpreadsheetParser parser =
        new SpreadsheetParser(TechnicianResolver.withDefaultAliases(), HeaderSynonyms.loadDefault());

    @Test
    void testTabularSheet() throws IOException {
        XSSFWorkbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet("Marco");
        CellStyle elapsed = workbook.createCellStyle();
        elapsed.setDataFormat(workbook.createDataFormat().getFormat("[h]:mm:ss"));

        row(sheet, 0, "Mapa mensal");
        row(sheet, 1, "Empresa", "Técnico", "Tempo (m)");
        row(sheet, 2, "Acme, Lda.", "Ana Catarina Lourenço Rodrigues", "2h30");
        row(sheet, 3, "Acme, Lda.", "", "200");
        row(sheet, 4, "Beta SA", null, "1:15");
        row(sheet, 5, "Gama", "Fulano de Tal", 60);
        row(sheet, 6, "Delta", "Armando Dias", 90);
        Row timed = row(sheet, 7, "Epsilon", "Pedro Fernandes");
        Cell time = timed.createCell(2);
        time.setCellValue(0.0625);
        time.setCellStyle(elapsed);
        row(sheet, 8, "Total", "", 600);

        ImportDiagnostics diagnostics = new ImportDiagnostics();
        List<RawFact> facts = parser.parse("marco.xlsx", toBytes(workbook), diagnostics);

        assertThat(facts).containsExactly(
            RawFact.canonical("Acme, Lda.", "Ana Rodrigues", 150, "marco.xlsx/Marco"),
            RawFact.inferred("Delta", 90, "marco.xlsx/Marco"),
            RawFact.canonical("Epsilon", "Pedro Fernandes", 90, "marco.xlsx/Marco"),
            RawFact.summary("Beta SA", 75, "marco.xlsx/Marco"));
        assertThat(diagnostics.getUnknownTechnicians()).containsEntry("Fulano de Tal", 60);
        assertThat(diagnostics.getIgnoredSummaryByCompany()).containsExactly(entry("Acme, Lda.", 200));
        assertThat(diagnostics.getIgnoredByCompany()).containsEntry("Gama", 60).containsEntry("Acme, Lda.", 200);
        assertThat(diagnostics.getFiles()).containsExactly("marco.xlsx");
        assertThat(diagnostics.getSheetLayouts()).containsEntry("marco.xlsx/Marco", SheetLayout.LayoutKind.TABULAR);
    }

    @Test
    void testWorkloadSheet() throws IOException {
        XSSFWorkbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet("Carga");
        CellStyle indented = workbook.createCellStyle();
        indented.setIndention((short) 1);

        row(sheet, 0, "Mapa de Tempo Trabalhado");
        row(sheet, 1, "Empresa", "Tempo");
        row(sheet, 2, "Acme Lda", "3h00");
        row(sheet, 3, "Pedro Fernandes", 120).getCell(0).setCellStyle(indented);
        row(sheet, 4, "    M. Luzia Moreira", "1h");
        row(sheet, 5, "Beta SA", 45);
        row(sheet, 6, "Total", 225);

        ImportDiagnostics diagnostics = new ImportDiagnostics();
        List<RawFact> facts = parser.parse("carga.xlsx", toBytes(workbook), diagnostics);

        assertThat(facts).containsExactly(
            RawFact.canonical("Acme Lda", "Pedro Fernandes", 120, "carga.xlsx/Carga"),
            RawFact.canonical("Acme Lda", "M Luzia Moreira", 60, "carga.xlsx/Carga"),
            RawFact.summary("Beta SA", 45, "carga.xlsx/Carga"));
        assertThat(diagnostics.getIgnoredSummaryByCompany()).containsExactly(entry("Acme Lda", 180));
        assertThat(diagnostics.getSheetLayouts()).containsEntry("carga.xlsx/Carga", SheetLayout.LayoutKind.WORKLOAD);
    }

    @Test
    void testEverySheetIsRead() throws IOException {
        XSSFWorkbook workbook = new XSSFWorkbook();
        Sheet first = workbook.createSheet("Jan");
        row(first, 0, "Cliente", "Colaborador", "Minutos");
        row(first, 1, "Acme", "Pedro Fernandes", 30);
        Sheet second = workbook.createSheet("Fev");
        row(second, 0, "Acme", 45);

        ImportDiagnostics diagnostics = new ImportDiagnostics();
        List<RawFact> facts = parser.parse("two.xlsx", toBytes(workbook), diagnostics);

        assertThat(facts).extracting(RawFact::source).containsExactly("two.xlsx/Jan", "two.xlsx/Fev");
        assertThat(diagnostics.getSheetLayouts()).hasSize(2);
    }

    @Test
    void testUnreadableWorkbook() {
        ImportDiagnostics diagnostics = new ImportDiagnostics();

        assertThatThrownBy(() -> parser.parse("notes.xlsx", "plain text".getBytes(StandardCharsets.UTF_8), diagnostics))
            .isInstanceOf(SpreadsheetParseException.class)
            .hasMessageStartingWith("notes.xlsx: ");
        assertThatThrownBy(() -> parser.parse("empty.xlsx", new byte[0], diagnostics))
            .isInstanceOf(SpreadsheetParseException.class)
            .extracting(e -> ((SpreadsheetParseException) e).getFileName())
            .isEqualTo("empty.xlsx");
        assertThat(diagnostics.getFiles()).isEmpty();
    }

    private static Row row(Sheet sheet, int index, Object... values) {
        Row row = sheet.createRow(index);
        for (int column = 0; column < values.length; column++) {
            Object value = values[column];
            if (value instanceof Number) {
                row.createCell(column).setCellValue(((Number) value).doubleValue());
            } else if (value != null) {
                row.createCell(column).setCellValue((String) value);
            }
        }
        return row;
    }

    private static byte[] toBytes(XSSFWorkbook workbook) throws IOException {
        try (workbook; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
