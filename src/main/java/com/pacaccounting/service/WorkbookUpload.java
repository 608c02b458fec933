package com.pacaccounting.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One uploaded workbook file.
 */
public record WorkbookUpload(String fileName, byte[] content) {

    public WorkbookUpload {
        Objects.requireNonNull(fileName, "fileName");
        content = content == null ? new byte[0] : content;
    }

    public static WorkbookUpload of(Path file) throws IOException {
        return new WorkbookUpload(file.getFileName().toString(), Files.readAllBytes(file));
    }

    public boolean isEmpty() {
        return content.length == 0;
    }
}
