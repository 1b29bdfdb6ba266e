package com.parkthrive.crmops.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.config.CampaignProperties;
import com.parkthrive.crmops.paging.QueryLoader;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Resolves and checks the query document of each workflow ({@code crm.campaign.queries.<workflow>}).
 */
@Component
public class QueryFiles {

    private final CampaignProperties properties;
    private final QueryLoader loader;

    public QueryFiles(CampaignProperties properties, QueryLoader loader) {
        this.properties = properties;
        this.loader = loader;
    }

    public Optional<Path> pathFor(String workflow) {
        return Optional.ofNullable(properties.getQueries().get(workflow))
                .filter(p -> !p.isBlank())
                .map(Path::of);
    }

    public ObjectNode load(String workflow) {
        Path path = pathFor(workflow)
                .orElseThrow(() -> new IllegalStateException("No query configured for " + workflow));
        return loader.load(path);
    }

    /**
     * Problems with the query file at {@code path} (configured under {@code property}).
     */
    public List<String> check(String property, String path) {
        if (path == null || path.isBlank()) {
            return List.of(property + " is not set");
        }
        if (!Files.isRegularFile(Path.of(path))) {
            return List.of(property + " points to a missing file: " + path);
        }
        return List.of();
    }

    public List<String> check(String workflow) {
        return check("crm.campaign.queries." + workflow, properties.getQueries().get(workflow));
    }
}
