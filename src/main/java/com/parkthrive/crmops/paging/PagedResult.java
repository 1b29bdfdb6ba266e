package com.parkthrive.crmops.paging;

import com.parkthrive.crmops.crm.CrmRecord;
import lombok.Value;

import java.util.List;

/**
 * Items collected by the {@link CursorPaginator}. {@code complete} is false when a page failed
 * and the items are only a prefix of the result set.
 */
@Value
public class PagedResult {

    List<CrmRecord> items;
    boolean complete;

    public int size() {
        return items.size();
    }
}
