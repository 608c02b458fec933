package com.pacaccounting.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.processing.DurationParser;
import com.pacaccounting.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.ObjIntConsumer;

/**
 * Reads the ledger file in any of its known shapes into a normalized {@link Ledger}.
 * <p>
 * Normalization runs on every read: minute values become non-negative integers through the
 * duration rules, zero months are dropped, missing flags default to false and per-technician
 * keys are canonicalized through the technician aliases, summing minutes on collision.
 * The result tells whether anything had to be migrated, in which case the file on disk no
 * longer matches what was read and should be rewritten.
 */
public class LedgerReader {

    private static final Logger logger = LoggerFactory.getLogger(LedgerReader.class);

    static final String MONTHS = "meses";
    static final String EXTRA_MONTHLY = "extra_mensal";
    static final String DELETED = "apagado";
    static final String PER_TECHNICIAN = "por_tecnico";
    static final String LEGACY_YEARLY_EXTRA = "extra";
    static final String LEGACY_TIMINGS = "timings";
    static final String LEGACY_EXTRAS = "timings_extra";
    static final String LEGACY_COMPANIES = "empresas";

    private static final Set<String> RECORD_FIELDS = Set.of(MONTHS, EXTRA_MONTHLY, DELETED, PER_TECHNICIAN,
            LEGACY_YEARLY_EXTRA);

    private final ObjectMapper objectMapper;
    private final TechnicianResolver technicianResolver;

    public LedgerReader(TechnicianResolver technicianResolver) {
        this(new ObjectMapper(), technicianResolver);
    }

    public LedgerReader(ObjectMapper objectMapper, TechnicianResolver technicianResolver) {
        this.objectMapper = objectMapper;
        this.technicianResolver = technicianResolver;
    }

    /**
     * Reads a ledger file. A missing file is an empty ledger; a file that cannot be parsed is
     * logged and read as an empty ledger as well.
     */
    public Result read(Path file) {
        if (!Files.exists(file)) {
            return new Result(new Ledger(), LedgerSchema.EMPTY, false);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            logger.warn("Ledger file {} is unreadable, using an empty ledger: {}", file, e.getMessage());
            return new Result(new Ledger(), LedgerSchema.UNREADABLE, false);
        }
        return read(root);
    }

    public Result read(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new Result(new Ledger(), LedgerSchema.EMPTY, false);
        }
        if (!root.isObject()) {
            logger.warn("Ledger document is a {} instead of an object, using an empty ledger", root.getNodeType());
            return new Result(new Ledger(), LedgerSchema.UNREADABLE, false);
        }

        LedgerSchema schema = detect(root);
        ReadState state = new ReadState();
        Ledger ledger = switch (schema) {
            case LEGACY_SPLIT -> readLegacySplit(root);
            case LEGACY_FLAT_HOURS -> readFlatHours(root);
            case CURRENT -> readCurrent(root, state);
            case EMPTY, UNREADABLE -> new Ledger();
        };
        boolean migrated = schema.isLegacy() || state.migrated;
        if (migrated) {
            logger.info("Ledger read from {} schema needs to be rewritten", schema);
        }
        return new Result(ledger, schema, migrated);
    }

    /**
     * Identifies the shape of a parsed ledger document by the first company entry that
     * tells the shapes apart.
     */
    public static LedgerSchema detect(JsonNode root) {
        if (root == null || !root.isObject()) {
            return LedgerSchema.UNREADABLE;
        }
        if (root.has(LEGACY_TIMINGS) || root.has(LEGACY_EXTRAS)) {
            return LedgerSchema.LEGACY_SPLIT;
        }
        if (root.isEmpty()) {
            return LedgerSchema.EMPTY;
        }
        for (JsonNode companies : root) {
            if (!companies.isObject()) {
                continue;
            }
            for (JsonNode record : companies) {
                if (!record.isObject() || record.isEmpty()) {
                    continue;
                }
                if (hasRecordField(record)) {
                    return LedgerSchema.CURRENT;
                }
                if (isMonthMap(record)) {
                    return LedgerSchema.LEGACY_FLAT_HOURS;
                }
            }
        }
        return LedgerSchema.CURRENT;
    }

    private Ledger readCurrent(JsonNode root, ReadState state) {
        Ledger ledger = new Ledger();
        for (Iterator<Map.Entry<String, JsonNode>> years = root.fields(); years.hasNext(); ) {
            Map.Entry<String, JsonNode> year = years.next();
            if (!year.getValue().isObject()) {
                continue;
            }
            ledger.ensureYear(year.getKey());
            for (Iterator<Map.Entry<String, JsonNode>> companies = year.getValue().fields(); companies.hasNext(); ) {
                Map.Entry<String, JsonNode> company = companies.next();
                if (company.getValue().isObject()) {
                    ledger.put(year.getKey(), company.getKey(), readRecord(company.getValue(), state));
                }
            }
        }
        return ledger;
    }

    private TimeRecord readRecord(JsonNode node, ReadState state) {
        TimeRecord record = new TimeRecord();
        readMonths(node.get(MONTHS), record::setMonthMinutes);

        JsonNode extra = node.get(EXTRA_MONTHLY);
        if (extra != null && !extra.isNull()) {
            record.setExtraMonthlyMinutes(minutes(extra));
        } else {
            JsonNode yearlyExtra = node.get(LEGACY_YEARLY_EXTRA);
            int yearlyMinutes = yearlyExtra == null ? 0 : minutes(yearlyExtra);
            if (yearlyMinutes > 0) {
                record.setExtraMonthlyMinutes(monthlyShare(yearlyMinutes));
                state.migrated = true;
            }
        }

        record.setDeleted(node.path(DELETED).asBoolean(false));

        JsonNode perTechnician = node.get(PER_TECHNICIAN);
        if (perTechnician != null && perTechnician.isObject()) {
            for (Iterator<Map.Entry<String, JsonNode>> it = perTechnician.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String stored = entry.getKey() == null ? "" : entry.getKey().trim();
                String canonical = technicianResolver.canonicalName(stored);
                int[] added = {0};
                readMonths(entry.getValue(), (month, minutes) -> {
                    record.addTechnicianMinutes(canonical, month, minutes);
                    added[0] = Utils.saturatedSum(added[0], minutes);
                });
                if (added[0] > 0 && !canonical.equals(entry.getKey())) {
                    state.migrated = true;
                }
            }
        }
        return record;
    }

    private Ledger readLegacySplit(JsonNode root) {
        Ledger ledger = new Ledger();
        JsonNode timings = root.path(LEGACY_TIMINGS);
        JsonNode extras = root.path(LEGACY_EXTRAS);

        for (Iterator<Map.Entry<String, JsonNode>> years = timings.fields(); years.hasNext(); ) {
            Map.Entry<String, JsonNode> year = years.next();
            JsonNode companies = year.getValue().path(LEGACY_COMPANIES);
            if (!companies.isObject()) {
                continue;
            }
            ledger.ensureYear(year.getKey());
            JsonNode yearExtras = extras.path(year.getKey()).path(LEGACY_COMPANIES);
            for (Iterator<Map.Entry<String, JsonNode>> it = companies.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> company = it.next();
                if (!company.getValue().isObject()) {
                    continue;
                }
                TimeRecord record = new TimeRecord();
                readMonths(company.getValue(), record::setMonthMinutes);
                JsonNode yearlyExtra = yearExtras.get(company.getKey());
                if (yearlyExtra != null) {
                    record.setExtraMonthlyMinutes(monthlyShare(minutes(yearlyExtra)));
                }
                ledger.put(year.getKey(), company.getKey(), record);
            }
        }

        // extras of companies without any month entry
        for (Iterator<Map.Entry<String, JsonNode>> years = extras.fields(); years.hasNext(); ) {
            Map.Entry<String, JsonNode> year = years.next();
            JsonNode companies = year.getValue().path(LEGACY_COMPANIES);
            for (Iterator<Map.Entry<String, JsonNode>> it = companies.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> company = it.next();
                boolean known = ledger.asMap().containsKey(year.getKey())
                        && ledger.asMap().get(year.getKey()).containsKey(company.getKey());
                int share = monthlyShare(minutes(company.getValue()));
                if (!known && share > 0) {
                    TimeRecord record = new TimeRecord();
                    record.setExtraMonthlyMinutes(share);
                    ledger.put(year.getKey(), company.getKey(), record);
                }
            }
        }
        return ledger;
    }

    private Ledger readFlatHours(JsonNode root) {
        Ledger ledger = new Ledger();
        for (Iterator<Map.Entry<String, JsonNode>> years = root.fields(); years.hasNext(); ) {
            Map.Entry<String, JsonNode> year = years.next();
            if (!year.getValue().isObject()) {
                continue;
            }
            ledger.ensureYear(year.getKey());
            for (Iterator<Map.Entry<String, JsonNode>> it = year.getValue().fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> company = it.next();
                if (!company.getValue().isObject()) {
                    continue;
                }
                TimeRecord record = new TimeRecord();
                readMonths(company.getValue(), record::setMonthMinutes);
                ledger.put(year.getKey(), company.getKey(), record);
            }
        }
        return ledger;
    }

    private static void readMonths(JsonNode months, ObjIntConsumer<Integer> target) {
        if (months == null || !months.isObject()) {
            return;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = months.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            Integer month = parseMonth(entry.getKey());
            if (month == null) {
                logger.debug("Skipping month key '{}'", entry.getKey());
                continue;
            }
            int minutes = minutes(entry.getValue());
            if (minutes > 0) {
                target.accept(month, minutes);
            }
        }
    }

    /**
     * Minutes of a stored value under the duration rules: integers are minutes, decimals up
     * to 24 are hours, text is parsed like a timesheet cell.
     */
    static int minutes(JsonNode value) {
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isIntegralNumber()) {
            return DurationParser.toMinutes(value.longValue());
        }
        if (value.isNumber()) {
            return DurationParser.toMinutes(value.doubleValue());
        }
        if (value.isTextual()) {
            return DurationParser.toMinutes(value.textValue());
        }
        return 0;
    }

    private static int monthlyShare(int yearlyMinutes) {
        return yearlyMinutes <= 0 ? 0 : (int) Math.round(yearlyMinutes / 12.0);
    }

    private static Integer parseMonth(String key) {
        try {
            int month = Integer.parseInt(key.trim());
            return month >= 1 && month <= 12 ? month : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean hasRecordField(JsonNode record) {
        for (Iterator<String> names = record.fieldNames(); names.hasNext(); ) {
            if (RECORD_FIELDS.contains(names.next())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isMonthMap(JsonNode record) {
        for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (parseMonth(entry.getKey()) == null || !entry.getValue().isValueNode()) {
                return false;
            }
        }
        return true;
    }

    /**
     * A read ledger with the shape it was read from.
     *
     * @param migrated whether the ledger differs from the file because of a legacy shape,
     *                 a yearly extra or a technician key that had to be canonicalized
     */
    public record Result(Ledger ledger, LedgerSchema schema, boolean migrated) {
    }

    private static final class ReadState {
        private boolean migrated;
    }
}
