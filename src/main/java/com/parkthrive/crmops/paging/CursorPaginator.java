package com.parkthrive.crmops.paging;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.config.RetryProperties;
import com.parkthrive.crmops.crm.CrmRecord;
import com.parkthrive.crmops.crm.SearchResult;
import com.parkthrive.crmops.http.Sleeper;
import com.parkthrive.crmops.run.RunMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Follows a search cursor until the result set is exhausted.
 * <p>
 * The template is never modified: each page is requested with a copy carrying the current
 * cursor. The absence of a cursor is the only end-of-data signal, so empty pages with a cursor
 * are followed. A page that fails ends pagination with what was collected so far; callers
 * that cannot act on a partial set use {@link #fetchPages} and check {@link PagedResult#isComplete()}.
 */
@Slf4j
@Component
public class CursorPaginator {

    static final String CURSOR = "cursor";
    static final String LIMIT = "limit";
    static final int MAX_PAGE_SIZE = 100;

    private final RetryProperties retryProperties;
    private final Sleeper sleeper;
    private final RunMetrics metrics;

    public CursorPaginator(RetryProperties retryProperties, Sleeper sleeper, RunMetrics metrics) {
        this.retryProperties = retryProperties;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public List<CrmRecord> fetchAll(PageFetcher fetcher, ObjectNode template) {
        return fetchAll(fetcher, template, OptionalInt.empty());
    }

    /**
     * With a target, stops as soon as {@code target} items are collected and returns at most
     * that many. When the template has no {@code limit}, each page asks for
     * {@code min(100, remaining)} items.
     */
    public List<CrmRecord> fetchAll(PageFetcher fetcher, ObjectNode template, OptionalInt target) {
        return fetchPages(fetcher, template, target).getItems();
    }

    public PagedResult fetchPages(PageFetcher fetcher, ObjectNode template) {
        return fetchPages(fetcher, template, OptionalInt.empty());
    }

    public PagedResult fetchPages(PageFetcher fetcher, ObjectNode template, OptionalInt target) {
        List<CrmRecord> items = new ArrayList<>();
        String cursor = null;
        int page = 0;
        boolean complete = true;

        if (target.isPresent() && target.getAsInt() <= 0) {
            return new PagedResult(items, true);
        }

        while (true) {
            ObjectNode query = template.deepCopy();
            if (cursor != null) {
                query.put(CURSOR, cursor);
            }
            if (target.isPresent() && !template.has(LIMIT)) {
                query.put(LIMIT, Math.min(MAX_PAGE_SIZE, target.getAsInt() - items.size()));
            }

            if (page > 0) {
                sleeper.pause(retryProperties.pageDelay());
            }
            page++;

            SearchResult result = fetcher.fetch(query);
            if (!result.isOk()) {
                log.error("Search page {} failed ({}, HTTP {}); stopping with {} items",
                        page, result.getStatus(), result.getHttpStatus(), items.size());
                complete = false;
                break;
            }

            items.addAll(result.getItems());
            metrics.recordPage(result.getItems().size());
            log.debug("Page {}: {} items (total {})", page, result.getItems().size(), items.size());

            Optional<String> next = result.nextCursor();
            if (next.isEmpty()) {
                break;
            }
            if (target.isPresent() && items.size() >= target.getAsInt()) {
                log.debug("Target of {} items reached after {} pages", target.getAsInt(), page);
                break;
            }
            cursor = next.get();
        }

        if (target.isPresent() && items.size() > target.getAsInt()) {
            items = new ArrayList<>(items.subList(0, target.getAsInt()));
        }
        log.info("Fetched {} items in {} pages", items.size(), page);
        return new PagedResult(items, complete);
    }
}
