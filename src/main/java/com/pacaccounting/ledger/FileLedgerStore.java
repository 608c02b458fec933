package com.pacaccounting.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.processing.ImportBatch;
import com.pacaccounting.processing.ImportFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link LedgerStore} over a single JSON file.
 * <p>
 * Writes go to a temporary sibling file that replaces the ledger file in one move. A guarded
 * write is refused when the new minute volume is below the retained ratio (half by default)
 * of the volume on disk. A timestamped backup of the file is taken once per store, before the
 * first save that follows a migration.
 */
public class FileLedgerStore implements LedgerStore {

    private static final Logger logger = LoggerFactory.getLogger(FileLedgerStore.class);

    public static final double DEFAULT_MIN_RETAINED_RATIO = 0.5;

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path file;
    private final LedgerReader reader;
    private final ObjectMapper objectMapper;
    private final double minRetainedRatio;
    private final Clock clock;

    private Ledger ledger = new Ledger();
    private LedgerSchema loadedSchema = LedgerSchema.EMPTY;
    private boolean backupPending;
    private boolean backupTaken;
    private boolean diskInSync = true;

    public FileLedgerStore(Path file, TechnicianResolver technicianResolver) {
        this(file, new LedgerReader(technicianResolver), DEFAULT_MIN_RETAINED_RATIO, Clock.systemDefaultZone());
    }

    public FileLedgerStore(Path file, LedgerReader reader, double minRetainedRatio, Clock clock) {
        this.file = file;
        this.reader = reader;
        this.minRetainedRatio = minRetainedRatio;
        this.clock = clock;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Ledger ledger() {
        return ledger;
    }

    public Path getFile() {
        return file;
    }

    public LedgerSchema getLoadedSchema() {
        return loadedSchema;
    }

    @Override
    public Ledger load() {
        LedgerReader.Result result = reader.read(file);
        ledger = result.ledger();
        loadedSchema = result.schema();
        diskInSync = !result.migrated() && result.schema() != LedgerSchema.UNREADABLE;
        logger.info("Loaded ledger {} ({} schema): {} years, {} companies, {} minutes",
                file, loadedSchema, ledger.years().size(), ledger.companyCount(), ledger.totalMinutes());

        if (result.migrated()) {
            backupPending = true;
            try {
                save();
            } catch (LedgerWriteRejectedException e) {
                // keep the migrated copy in memory, the file stays as it was
                logger.error("Migrated ledger not written: {}", e.getMessage());
            }
        }
        return ledger;
    }

    @Override
    public int applyImport(int year, int month, ImportBatch batch) {
        Ledger.yearKey(year);
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month must be within 1..12: " + month);
        }
        if (batch.getMonth() != month) {
            throw new IllegalArgumentException("Batch is for month " + batch.getMonth() + ", not " + month);
        }

        Map<String, TimeRecord> recordsByKey = new LinkedHashMap<>();
        for (String companyKey : batch.getAffectedCompanyKeys()) {
            String ledgerKey = ledger.findKeyByNormalizedName(year, companyKey)
                    .orElse(batch.displayNameFor(companyKey));
            TimeRecord record = ledger.getOrCreate(year, ledgerKey);
            // the batch is authoritative for this month
            record.clearMonth(month);
            recordsByKey.put(companyKey, record);
        }

        for (ImportFact fact : batch.getFacts()) {
            TimeRecord record = recordsByKey.get(fact.companyKey());
            record.addMonthMinutes(month, fact.minutes());
            if (fact.hasTechnician()) {
                record.addTechnicianMinutes(fact.technician(), month, fact.minutes());
            }
        }

        int reactivated = 0;
        for (TimeRecord record : recordsByKey.values()) {
            if (record.isDeleted() && record.minutesFor(month) > 0) {
                record.setDeleted(false);
                reactivated++;
            }
        }
        logger.info("Applied {} facts to {} companies for {}-{} ({} reactivated)",
                batch.getFacts().size(), recordsByKey.size(), year, month, reactivated);
        return recordsByKey.size();
    }

    @Override
    public void save(SaveMode mode) {
        long newTotal = ledger.totalMinutes();
        if (mode == SaveMode.GUARDED) {
            long previousTotal = diskTotalMinutes();
            if (previousTotal > 0 && newTotal < previousTotal * minRetainedRatio) {
                diskInSync = false;
                LedgerWriteRejectedException rejected = new LedgerWriteRejectedException(file, previousTotal, newTotal);
                logger.error(rejected.getMessage());
                throw rejected;
            }
        }

        if (backupPending && !backupTaken) {
            backup();
        }
        write();
        diskInSync = true;
        logger.info("Saved ledger to {} ({} minutes)", file.toAbsolutePath(), newTotal);
    }

    @Override
    public boolean isDiskInSync() {
        return diskInSync;
    }

    @Override
    public MigrationResult reloadAndMigrate() {
        long previousTotal = ledger.totalMinutes();
        LedgerReader.Result result = reader.read(file);
        Path backup = null;
        if (Files.exists(file)) {
            backup = copyToBackup();
            backupTaken = true;
            backupPending = false;
        }
        ledger = result.ledger();
        loadedSchema = result.schema();
        diskInSync = false;
        long migratedTotal = ledger.totalMinutes();
        logger.info("Migrated ledger {} from {} schema: {} -> {} minutes, backup {}",
                file, result.schema(), previousTotal, migratedTotal, backup);
        return new MigrationResult(result.schema(), previousTotal, migratedTotal, backup);
    }

    private long diskTotalMinutes() {
        if (!Files.exists(file)) {
            return 0;
        }
        return reader.read(file).ledger().totalMinutes();
    }

    private void backup() {
        if (!Files.exists(file)) {
            backupPending = false;
            return;
        }
        try {
            copyToBackup();
            backupTaken = true;
            backupPending = false;
        } catch (LedgerException e) {
            logger.warn("Backup of {} failed, saving without it: {}", file, e.getMessage());
        }
    }

    private Path copyToBackup() {
        String stamp = LocalDateTime.now(clock).format(BACKUP_STAMP);
        Path target = file.resolveSibling(file.getFileName() + ".bak." + stamp);
        for (int attempt = 1; Files.exists(target); attempt++) {
            target = file.resolveSibling(file.getFileName() + ".bak." + stamp + "-" + attempt);
        }
        try {
            Files.copy(file, target);
        } catch (IOException e) {
            throw new LedgerException("Cannot back up " + file + " to " + target, e);
        }
        logger.info("Ledger backup created: {}", target.toAbsolutePath());
        return target;
    }

    private void write() {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(temp.toFile(), ledger);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            logger.error("Failed to write ledger {}: {}", file, e.getMessage());
            throw new LedgerException("Cannot write ledger " + file, e);
        }
    }
}
