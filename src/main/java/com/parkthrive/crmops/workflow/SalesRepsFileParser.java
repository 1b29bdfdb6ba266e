package com.parkthrive.crmops.workflow;

import com.parkthrive.crmops.config.FatalConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the sales rep list: any text containing {@code "Name", "user_id"} pairs,
 * such as {@code [["Jane Doe", "user_abc"], ["John Roe", "user_def"]]}.
 */
@Slf4j
@Component
public class SalesRepsFileParser {

    private static final Pattern PAIR = Pattern.compile("\"([^\"]+)\",\\s*\"([^\"]+)\"");

    public List<SalesRep> parse(String content) {
        List<SalesRep> reps = new ArrayList<>();
        Matcher matcher = PAIR.matcher(content);
        while (matcher.find()) {
            reps.add(new SalesRep(matcher.group(1).trim(), matcher.group(2).trim()));
        }
        return reps;
    }

    public List<SalesRep> load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new FatalConfigException("Sales reps file not found: " + file.toAbsolutePath());
        }
        try {
            List<SalesRep> reps = parse(Files.readString(file, StandardCharsets.UTF_8));
            if (reps.isEmpty()) {
                throw new FatalConfigException("No sales reps found in " + file);
            }
            log.info("Loaded {} sales reps from {}", reps.size(), file);
            return reps;
        } catch (IOException e) {
            throw new FatalConfigException("Error reading sales reps file " + file + ": " + e.getMessage(), e);
        }
    }
}
