package com.pacaccounting.processing;

import java.io.IOException;

/**
 * An uploaded workbook that cannot be opened or read.
 */
public class SpreadsheetParseException extends IOException {

    private final String fileName;

    public SpreadsheetParseException(String fileName, String message, Throwable cause) {
        super(fileName + ": " + message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
