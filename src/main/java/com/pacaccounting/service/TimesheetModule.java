package com.pacaccounting.service;

import com.pacaccounting.ledger.FileLedgerStore;
import com.pacaccounting.ledger.LedgerReader;
import com.pacaccounting.ledger.LedgerStore;
import com.pacaccounting.matching.CompanyMatcher;
import com.pacaccounting.matching.TechnicianResolver;
import com.pacaccounting.registry.ClientRegistry;
import com.pacaccounting.registry.JsonClientRegistry;
import com.pacaccounting.reporting.ClientTimingReport;
import com.pacaccounting.reporting.TechnicianMapReport;
import com.pacaccounting.reporting.YearSummaryReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wires the timesheet services for a host application. The ledger is loaded once, when the
 * module is created, and shared by every service of the module.
 */
public class TimesheetModule {

    private static final Logger logger = LoggerFactory.getLogger(TimesheetModule.class);

    private final LedgerStore ledgerStore;
    private final TimesheetImportService importService;
    private final LedgerMaintenanceService maintenanceService;
    private final ClientTimingReport clientTimingReport;
    private final YearSummaryReport yearSummaryReport;
    private final TechnicianMapReport technicianMapReport;

    public TimesheetModule(TimesheetSettings settings) {
        TechnicianResolver technicianResolver = TechnicianResolver.withDefaultAliases();
        ClientRegistry clientRegistry = new JsonClientRegistry(settings.getClientsFile());

        FileLedgerStore store = new FileLedgerStore(settings.getLedgerFile(), new LedgerReader(technicianResolver),
                settings.getMinRetainedRatio(), Clock.systemDefaultZone());
        store.load();
        this.ledgerStore = store;

        this.importService = TimesheetImportService.create(technicianResolver, clientRegistry, store,
                settings.getImportReportFile());
        this.maintenanceService = new LedgerMaintenanceService(store, clientRegistry);
        this.clientTimingReport = new ClientTimingReport(store, clientRegistry,
                new CompanyMatcher(settings.getFuzzyThreshold(), settings.getFuzzyMargin()), technicianResolver);
        this.yearSummaryReport = new YearSummaryReport(store, clientRegistry, technicianResolver);
        this.technicianMapReport = new TechnicianMapReport(store, clientRegistry, technicianResolver);
        logger.info("Timesheet module ready, ledger {}", settings.getLedgerFile().toAbsolutePath());
    }

    public static TimesheetModule fromClasspathSettings() {
        return new TimesheetModule(TimesheetSettings.load());
    }

    public LedgerStore getLedgerStore() {
        return ledgerStore;
    }

    public TimesheetImportService getImportService() {
        return importService;
    }

    public LedgerMaintenanceService getMaintenanceService() {
        return maintenanceService;
    }

    public ClientTimingReport getClientTimingReport() {
        return clientTimingReport;
    }

    public YearSummaryReport getYearSummaryReport() {
        return yearSummaryReport;
    }

    public TechnicianMapReport getTechnicianMapReport() {
        return technicianMapReport;
    }
}
