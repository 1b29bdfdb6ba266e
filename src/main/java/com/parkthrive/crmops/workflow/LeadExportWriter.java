package com.parkthrive.crmops.workflow;

import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the operator hand-off file: header {@code id,address,city,state,zipcode}, one row per lead.
 */
@Slf4j
@Component
public class LeadExportWriter {

    static final String[] HEADER = {"id", "address", "city", "state", "zipcode"};

    public void write(Writer out, List<LeadExportRow> rows) throws IOException {
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER, false);
            for (LeadExportRow row : rows) {
                writer.writeNext(row.toArray(), false);
            }
        }
    }

    public Path write(Path file, List<LeadExportRow> rows) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(out, rows);
        }
        log.info("Wrote {} leads to {}", rows.size(), file);
        return file;
    }
}
