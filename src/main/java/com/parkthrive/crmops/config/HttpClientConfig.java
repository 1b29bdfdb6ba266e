package com.parkthrive.crmops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkthrive.crmops.crm.CrmClient;
import com.parkthrive.crmops.crm.CrmRecordMapper;
import com.parkthrive.crmops.crm.FileUploader;
import com.parkthrive.crmops.http.RateAwareRequestExecutor;
import com.parkthrive.crmops.http.RateSignalClassifier;
import com.parkthrive.crmops.http.RestClientTransport;
import com.parkthrive.crmops.http.Sleeper;
import com.parkthrive.crmops.mail.LetterClient;
import com.parkthrive.crmops.mail.PostGridLetterClient;
import com.parkthrive.crmops.run.RunMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    static final String PRIMARY = "primary";
    static final String SECONDARY = "secondary";

    private final CrmApiProperties apiProperties;
    private final RetryProperties retryProperties;

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public RateSignalClassifier rateSignalClassifier(ObjectMapper objectMapper) {
        return new RateSignalClassifier(retryProperties, objectMapper);
    }

    @Bean
    public CrmClient primaryCrmClient(RateSignalClassifier classifier, Sleeper sleeper, ObjectMapper objectMapper,
                                      RunMetrics metrics, CrmRecordMapper mapper) {
        return crmClient(PRIMARY, apiProperties.getPrimaryApiKey(), classifier, sleeper, objectMapper, metrics, mapper);
    }

    @Bean
    public CrmClient secondaryCrmClient(RateSignalClassifier classifier, Sleeper sleeper, ObjectMapper objectMapper,
                                        RunMetrics metrics, CrmRecordMapper mapper) {
        return crmClient(SECONDARY, apiProperties.getSecondaryApiKey(), classifier, sleeper, objectMapper, metrics, mapper);
    }

    @Bean
    public FileUploader fileUploader() {
        return new FileUploader(RestClient.builder().requestFactory(requestFactory()).build());
    }

    @Bean
    public LetterClient letterClient(PostGridProperties postGridProperties, ObjectMapper objectMapper, Clock clock) {
        RestClient restClient = RestClient.builder()
                .baseUrl(postGridProperties.getBaseUrl())
                .requestFactory(requestFactory())
                .defaultHeaders(headers -> {
                    if (postGridProperties.getApiKey() != null) {
                        headers.set("x-api-key", postGridProperties.getApiKey());
                    }
                })
                .build();
        return new PostGridLetterClient(restClient, postGridProperties, objectMapper, clock);
    }

    private CrmClient crmClient(String account, String apiKey, RateSignalClassifier classifier, Sleeper sleeper,
                                ObjectMapper objectMapper, RunMetrics metrics, CrmRecordMapper mapper) {
        RestClient restClient = RestClient.builder()
                .baseUrl(apiProperties.getBaseUrl())
                .requestFactory(requestFactory())
                .defaultHeaders(headers -> {
                    // API key as user name, empty password
                    if (apiKey != null && !apiKey.isBlank()) {
                        headers.setBasicAuth(apiKey.trim(), "");
                    }
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                })
                .build();

        RateAwareRequestExecutor executor = new RateAwareRequestExecutor(account, new RestClientTransport(restClient),
                classifier, retryProperties, sleeper, objectMapper, metrics);
        return new CrmClient(account, executor, mapper);
    }

    private JdkClientHttpRequestFactory requestFactory() {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(apiProperties.getConnectTimeoutMs()))
                .build();
        var factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(apiProperties.getReadTimeoutMs()));
        return factory;
    }
}
