package com.pacaccounting.processing;

import com.pacaccounting.matching.TechnicianClassification;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.util.names.NameNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Legacy "workload" report: a non-indented row opens a company block with an optional
 * inline total in the second column, and the indented rows below it are the per-technician
 * lines of that company. A row is indented when its first cell starts with four blanks or a tab,
 * or when its cell style carries an indentation.
 * <p>
 * When a block closes with resolved technician lines, its inline total is redundant and is
 * reported as an ignored summary. A block without any resolved line keeps its inline total
 * as a company-level fact.
 */
public class WorkloadSheetLayout implements SheetLayout {

    private static final String HEADER_WORD = "empresa";
    private static final String REPORT_TITLE = "mapa de tempo trabalhado";
    private static final String INDENT = "    ";

    private final TechnicianResolver technicianResolver;

    public WorkloadSheetLayout(TechnicianResolver technicianResolver) {
        this.technicianResolver = technicianResolver;
    }

    @Override
    public LayoutKind kind() {
        return LayoutKind.WORKLOAD;
    }

    @Override
    public Optional<List<RawFact>> read(String source, List<SheetRow> rows, ImportDiagnostics diagnostics) {
        List<RawFact> facts = new ArrayList<>();
        Block block = null;

        for (SheetRow row : rows) {
            String text = row.cell(0);
            if (text == null || text.isBlank()) {
                continue;
            }
            String stripped = text.trim();
            String header = NameNormalizer.normalizeHeader(stripped);
            if (header.equals(HEADER_WORD) || header.contains(REPORT_TITLE) || NameNormalizer.isTotalMarker(stripped)) {
                continue;
            }

            if (isIndented(text, row)) {
                if (block == null) {
                    continue;
                }
                int minutes = DurationParser.toMinutes(row.cell(1));
                if (minutes <= 0) {
                    continue;
                }
                TechnicianClassification classification = technicianResolver.resolve(stripped);
                switch (classification.kind()) {
                    case UNKNOWN -> diagnostics.addUnknownTechnician(stripped, block.company, minutes);
                    case CANONICAL -> block.facts.add(
                            RawFact.canonical(block.company, classification.canonicalName(), minutes, source));
                    case INFERRED_FROM_CLIENT -> block.facts.add(RawFact.inferred(block.company, minutes, source));
                }
            } else {
                close(block, facts, diagnostics, source);
                block = new Block(stripped, DurationParser.toMinutes(row.cell(1)));
            }
        }
        close(block, facts, diagnostics, source);
        return Optional.of(facts);
    }

    private static void close(Block block, List<RawFact> facts, ImportDiagnostics diagnostics, String source) {
        if (block == null) {
            return;
        }
        if (!block.facts.isEmpty()) {
            if (block.inlineTotal > 0) {
                diagnostics.addIgnoredSummary(block.company, block.inlineTotal);
            }
            facts.addAll(block.facts);
        } else if (block.inlineTotal > 0) {
            facts.add(RawFact.summary(block.company, block.inlineTotal, source));
        }
    }

    private static boolean isIndented(String text, SheetRow row) {
        return row.firstIndent() > 0 || text.startsWith(INDENT) || text.startsWith("\t");
    }

    private static final class Block {

        private final String company;
        private final int inlineTotal;
        private final List<RawFact> facts = new ArrayList<>();

        private Block(String company, int inlineTotal) {
            this.company = company;
            this.inlineTotal = inlineTotal;
        }
    }
}
