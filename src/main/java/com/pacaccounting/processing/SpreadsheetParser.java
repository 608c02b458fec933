package com.pacaccounting.processing;

import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.utils.Utils;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.openxml4j.exceptions.OpenXML4JRuntimeException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.util.RecordFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the timesheet workbooks of an upload into raw facts.
 * <p>
 * Every sheet is offered to the tabular layout first. Only when no header row is found
 * does the indented workload layout read it.
 */
public class SpreadsheetParser {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetParser.class);

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final List<SheetLayout> layouts;

    public SpreadsheetParser(TechnicianResolver technicianResolver, HeaderSynonyms headerSynonyms) {
        this(List.of(new TabularSheetLayout(technicianResolver, headerSynonyms),
                new WorkloadSheetLayout(technicianResolver)));
    }

    public SpreadsheetParser(List<SheetLayout> layouts) {
        this.layouts = List.copyOf(layouts);
    }

    /**
     * Parses every sheet of an xlsx (or xls) workbook.
     *
     * @param fileName    name of the uploaded file, used in fact sources and diagnostics
     * @param content     workbook bytes
     * @param diagnostics receives unknown technicians, ignored summaries and sheet layouts
     * @return the facts of all sheets, in sheet order
     * @throws SpreadsheetParseException when the workbook cannot be opened
     */
    public List<RawFact> parse(String fileName, byte[] content, ImportDiagnostics diagnostics)
            throws SpreadsheetParseException {
        if (content == null || content.length == 0) {
            throw new SpreadsheetParseException(fileName, "empty file", null);
        }
        List<RawFact> facts = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            diagnostics.recordFile(fileName);
            for (Sheet sheet : workbook) {
                String source = fileName + "/" + sheet.getSheetName();
                facts.addAll(parseSheet(source, readRows(sheet), diagnostics));
            }
        } catch (IOException | EncryptedDocumentException | IllegalArgumentException
                 | POIXMLException | OpenXML4JRuntimeException | RecordFormatException e) {
            // POI reports broken or foreign files with unchecked exceptions as well
            throw new SpreadsheetParseException(fileName, e.getMessage(), e);
        }
        logger.info("Read {} facts from {}", facts.size(), fileName);
        return facts;
    }

    List<RawFact> parseSheet(String source, List<SheetRow> rows, ImportDiagnostics diagnostics) {
        for (SheetLayout layout : layouts) {
            Optional<List<RawFact>> facts = layout.read(source, rows, diagnostics);
            if (facts.isPresent()) {
                diagnostics.recordLayout(source, layout.kind());
                logger.debug("Sheet {} read as {} ({} facts)", source, layout.kind(), facts.get().size());
                return facts.get();
            }
        }
        return List.of();
    }

    static List<SheetRow> readRows(Sheet sheet) {
        List<SheetRow> rows = new ArrayList<>();
        for (Row row : sheet) {
            short lastCell = row.getLastCellNum();
            if (lastCell <= 0) {
                continue;
            }
            List<String> cells = new ArrayList<>(lastCell);
            for (int column = 0; column < lastCell; column++) {
                cells.add(cellText(row.getCell(column)));
            }
            rows.add(new SheetRow(row.getRowNum(), cells, indentOf(row.getCell(0))));
        }
        return rows;
    }

    static String cellText(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return timeText(cell);
                }
                return numberText(cell.getNumericCellValue());
            case BOOLEAN:
                return Boolean.toString(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    private static String timeText(Cell cell) {
        double days = cell.getNumericCellValue();
        long minutes = Math.round(days * MINUTES_PER_DAY);
        String format = cell.getCellStyle().getDataFormatString();
        boolean elapsed = format != null && format.toLowerCase(Locale.ROOT).contains("[h");
        if (!elapsed) {
            // a date-time cell keeps only its time of day
            minutes = minutes % MINUTES_PER_DAY;
        }
        return Utils.formatMinutes(minutes);
    }

    private static String numberText(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        if (value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static int indentOf(Cell cell) {
        if (cell == null) {
            return 0;
        }
        CellStyle style = cell.getCellStyle();
        return style == null ? 0 : style.getIndention();
    }
}
