package com.parkthrive.crmops.workflow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LeadExportWriterTest {

    private final LeadExportWriter writer = new LeadExportWriter();

    @Test
    void testWrite_HeaderThenRows() throws Exception {
        StringWriter out = new StringWriter();

        writer.write(out, List.of(
                LeadExportRow.builder().id("lead_1").address("12 Main St").city("Austin").state("TX").zipcode("78701").build(),
                LeadExportRow.builder().id("lead_2").build()));

        assertThat(out.toString().split("\n")).containsExactly(
                "id,address,city,state,zipcode",
                "lead_1,12 Main St,Austin,TX,78701",
                "lead_2,,,,");
    }

    @Test
    void testWrite_QuotesValuesWithCommas(@TempDir Path dir) throws Exception {
        Path file = writer.write(dir.resolve("out/export.csv"), List.of(
                LeadExportRow.builder().id("lead_1").address("Unit 4, 12 Main St").build()));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(1)).isEqualTo("lead_1,\"Unit 4, 12 Main St\",,,");
    }
}
