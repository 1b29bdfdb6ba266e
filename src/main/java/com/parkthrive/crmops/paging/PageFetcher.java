package com.parkthrive.crmops.paging;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.crm.SearchResult;

/**
 * Executes one page request for the given query document.
 */
@FunctionalInterface
public interface PageFetcher {

    SearchResult fetch(ObjectNode query);
}
