package com.pacaccounting.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings of the timesheet module, read from {@code timesheet.properties} on the classpath.
 * A JVM system property with the same key overrides the file.
 */
public class TimesheetSettings {

    private static final Logger logger = LoggerFactory.getLogger(TimesheetSettings.class);

    public static final String RESOURCE = "/timesheet.properties";

    public static final String LEDGER_FILE = "timesheet.ledger.file";
    public static final String IMPORT_REPORT_FILE = "timesheet.import.report.file";
    public static final String CLIENTS_FILE = "timesheet.clients.file";
    public static final String MIN_RETAINED_RATIO = "timesheet.save.min.retained.ratio";
    public static final String FUZZY_THRESHOLD = "timesheet.matching.fuzzy.threshold";
    public static final String FUZZY_MARGIN = "timesheet.matching.fuzzy.margin";

    private final Properties properties;

    public TimesheetSettings(Properties properties) {
        this.properties = properties;
    }

    public static TimesheetSettings load() {
        Properties properties = new Properties();
        try (InputStream is = TimesheetSettings.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                logger.warn("Resource {} not found, using defaults", RESOURCE);
            } else {
                properties.load(is);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        return new TimesheetSettings(properties);
    }

    public Path getLedgerFile() {
        return Paths.get(get(LEDGER_FILE, "timings_data.json"));
    }

    public Path getImportReportFile() {
        return Paths.get(get(IMPORT_REPORT_FILE, "timings_import_report.json"));
    }

    public Path getClientsFile() {
        return Paths.get(get(CLIENTS_FILE, "clients.json"));
    }

    public double getMinRetainedRatio() {
        return getDouble(MIN_RETAINED_RATIO, 0.5);
    }

    public double getFuzzyThreshold() {
        return getDouble(FUZZY_THRESHOLD, 0.92);
    }

    public double getFuzzyMargin() {
        return getDouble(FUZZY_MARGIN, 0.03);
    }

    private String get(String key, String defaultValue) {
        String value = System.getProperty(key, properties.getProperty(key));
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private double getDouble(String key, double defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            logger.warn("Setting {}='{}' is not a number, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }
}
