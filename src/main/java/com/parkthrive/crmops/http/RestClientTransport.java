package com.parkthrive.crmops.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * {@link ApiTransport} over Spring's {@link RestClient}. Every status code is returned as-is;
 * only I/O failures are reported as transient.
 */
@Slf4j
public class RestClientTransport implements ApiTransport {

    private final RestClient restClient;

    public RestClientTransport(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public RawResponse exchange(ApiRequest request) throws TransientTransportException {
        try {
            RestClient.RequestBodyUriSpec uriSpec = restClient.method(request.getMethod());
            RestClient.RequestBodySpec spec;

            if (request.isAbsolute()) {
                spec = uriSpec.uri(absoluteUri(request));
            } else {
                spec = uriSpec.uri(builder -> {
                    builder.path(request.getPath());
                    request.getQueryParams().forEach(builder::queryParam);
                    return builder.build();
                });
            }

            if (request.getBody() != null) {
                if (request.getContentType() != null) {
                    spec = spec.contentType(request.getContentType());
                }
                spec = spec.body(request.getBody());
            }

            return spec.exchange((req, resp) -> {
                HttpHeaders headers = new HttpHeaders();
                headers.putAll(resp.getHeaders());
                String body = StreamUtils.copyToString(resp.getBody(), StandardCharsets.UTF_8);
                return new RawResponse(resp.getStatusCode().value(), headers, body);
            });

        } catch (ResourceAccessException e) {
            throw new TransientTransportException(request.describe() + ": " + e.getMessage(), e);
        }
    }

    private URI absoluteUri(ApiRequest request) {
        if (request.getQueryParams().isEmpty()) {
            return URI.create(request.getPath());
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(request.getPath());
        request.getQueryParams().forEach(builder::queryParam);
        return builder.build().encode().toUri();
    }
}
