package com.parkthrive.crmops.crm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.nio.file.Path;

/**
 * Second phase of a file upload: multipart POST of the file to the storage URL handed out by
 * {@link CrmClient#requestUpload}. The storage service answers 201 on success.
 */
@Slf4j
public class FileUploader {

    private final RestClient restClient;

    public FileUploader(RestClient restClient) {
        this.restClient = restClient;
    }

    public boolean upload(UploadTarget target, Path file, MediaType contentType) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        target.getFields().forEach(parts::add);
        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(contentType);
        parts.add("file", new HttpEntity<>(new FileSystemResource(file), fileHeaders));

        try {
            return restClient.post()
                    .uri(URI.create(target.getUploadUrl()))
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(parts)
                    .exchange((req, resp) -> {
                        int status = resp.getStatusCode().value();
                        if (status != 201) {
                            log.error("File upload of {} failed: HTTP {}", file.getFileName(), status);
                            return false;
                        }
                        log.info("File {} uploaded", file.getFileName());
                        return true;
                    });
        } catch (Exception e) {
            log.error("Error uploading {}: {}", file.getFileName(), e.getMessage(), e);
            return false;
        }
    }
}
