package com.parkthrive.crmops.crm;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * First phase of a file upload: where to POST the file and where it will be downloadable.
 */
@Value
@Builder
public class UploadTarget {

    String uploadUrl;

    /** Form fields that must accompany the file in the upload POST */
    @Singular
    Map<String, String> fields;

    String downloadUrl;
}
