package com.parkthrive.crmops.crm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.http.ApiRequest;
import com.parkthrive.crmops.http.ApiResponse;
import com.parkthrive.crmops.http.RateAwareRequestExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the CRM endpoints of one account.
 * <p>
 * All calls go through the account's {@link RateAwareRequestExecutor}, so rate limits and
 * connection errors are already handled here; the results only distinguish success,
 * failure and an unusable body.
 */
@Slf4j
public class CrmClient {

    @Getter
    private final String account;
    private final RateAwareRequestExecutor executor;
    private final CrmRecordMapper mapper;

    public CrmClient(String account, RateAwareRequestExecutor executor, CrmRecordMapper mapper) {
        this.account = account;
        this.executor = executor;
        this.mapper = mapper;
    }

    // ==================== Reads ====================

    /**
     * One page of {@code POST /data/search/}. The query is sent as given, cursor included.
     */
    public SearchResult search(JsonNode query) {
        return toSearchResult(executor.execute(ApiRequest.query("/data/search/", query)));
    }

    public DetailResult getLead(String leadId) {
        return toDetailResult(executor.execute(ApiRequest.get("/lead/" + leadId + "/")));
    }

    public DetailResult getOpportunity(String opportunityId) {
        return toDetailResult(executor.execute(ApiRequest.get("/opportunity/" + opportunityId + "/")));
    }

    public SearchResult listOpportunities(String leadId) {
        ApiRequest request = ApiRequest.get("/opportunity/").toBuilder()
                .queryParam("lead_id", leadId)
                .build();
        return toSearchResult(executor.execute(request));
    }

    public DetailResult getContact(String contactId) {
        return toDetailResult(executor.execute(ApiRequest.get("/contact/" + contactId + "/")));
    }

    public SearchResult listEmailAccounts() {
        return toSearchResult(executor.execute(ApiRequest.get("/email_account/")));
    }

    public SearchResult listCustomFields(CampaignField.FieldScope scope) {
        return toSearchResult(executor.execute(ApiRequest.get("/custom_field/" + scope.objectType() + "/")));
    }

    /**
     * {@code POST /report/activity/}; each item is one row of the report (per user for comparison reports).
     */
    public SearchResult activityReport(ObjectNode query) {
        return toSearchResult(executor.execute(ApiRequest.query("/report/activity/", query)));
    }

    // ==================== Writes ====================

    public WriteResult updateLead(String leadId, Map<String, Object> changes) {
        return toWriteResult(executor.execute(ApiRequest.put("/lead/" + leadId + "/", changes)));
    }

    public WriteResult updateOpportunity(String opportunityId, Map<String, Object> changes) {
        return toWriteResult(executor.execute(ApiRequest.put("/opportunity/" + opportunityId + "/", changes)));
    }

    public WriteResult createNote(String leadId, String noteHtml) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lead_id", leadId);
        body.put("note_html", noteHtml);
        return toWriteResult(executor.execute(ApiRequest.post("/activity/note/", body)));
    }

    public WriteResult sendEmail(EmailDraft draft) {
        return toWriteResult(executor.execute(ApiRequest.post("/activity/email/", draft)));
    }

    /**
     * First phase of a file upload. Empty when the response lacks the upload or download section.
     */
    public Optional<UploadTarget> requestUpload(String filename, String contentType) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filename", filename);
        body.put("content_type", contentType);

        ApiResponse response = executor.execute(ApiRequest.post("/files/upload/", body));
        if (!response.isSuccess()) {
            log.error("[{}] Upload request for {} failed: HTTP {}", account, filename, response.getHttpStatus());
            return Optional.empty();
        }

        return response.payload()
                .filter(node -> node.hasNonNull("upload") && node.hasNonNull("download"))
                .map(node -> {
                    UploadTarget.UploadTargetBuilder target = UploadTarget.builder()
                            .uploadUrl(node.path("upload").path("url").asText())
                            .downloadUrl(node.path("download").path("url").asText());
                    Iterator<Map.Entry<String, JsonNode>> fields = node.path("upload").path("fields").fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        target.field(field.getKey(), field.getValue().asText());
                    }
                    return target.build();
                });
    }

    // ==================== Mapping ====================

    private SearchResult toSearchResult(ApiResponse response) {
        switch (response.getStatus()) {
            case FAILURE:
                return SearchResult.failed(response.getHttpStatus(), response.getErrorMessage());
            case MALFORMED:
                return SearchResult.malformed(response.getHttpStatus());
            default:
                break;
        }

        SearchResult.SearchResultBuilder builder = SearchResult.builder()
                .status(SearchResult.Status.OK)
                .httpStatus(response.getHttpStatus());

        response.payload().ifPresent(node -> {
            builder.items(mapper.fromArray(node.path("data")));
            JsonNode cursor = node.get("cursor");
            if (cursor != null && !cursor.isNull()) {
                builder.cursor(cursor.asText());
            }
        });
        return builder.build();
    }

    private DetailResult toDetailResult(ApiResponse response) {
        if (response.getStatus() == ApiResponse.Status.FAILURE) {
            return DetailResult.failed(response.getHttpStatus(), response.getErrorMessage());
        }
        return response.payload()
                .filter(JsonNode::isObject)
                .map(node -> DetailResult.found(response.getHttpStatus(), mapper.fromJson(node)))
                .orElseGet(() -> DetailResult.empty(response.getHttpStatus()));
    }

    private WriteResult toWriteResult(ApiResponse response) {
        if (response.isSuccess()) {
            return WriteResult.ok(response.getHttpStatus(), response.getBody());
        }
        return WriteResult.failed(response.getHttpStatus(), response.getErrorMessage());
    }
}
