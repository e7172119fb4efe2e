package com.exitbot.assistant.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Builds pooled Apache HttpClient 5 backed RestClient builders, one per provider.
 *
 * The read timeout is the per-call bound on the upstream round-trip: when it fires
 * RestClient raises ResourceAccessException, which the adapters classify as TRANSIENT.
 * Every client handed out is closed, with its connection pool, when the context shuts down.
 */
@Component
@Slf4j
public class HttpClientConfig {

    private static final int MAX_CONNECTIONS_PER_ROUTE = 20;
    private static final int MAX_CONNECTIONS_TOTAL = 50;

    private final List<CloseableHttpClient> openClients = new CopyOnWriteArrayList<>();

    public RestClient.Builder restClientBuilder(Duration connectTimeout, Duration readTimeout) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnPerRoute(MAX_CONNECTIONS_PER_ROUTE)
                                .setMaxConnTotal(MAX_CONNECTIONS_TOTAL)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.of(connectTimeout))
                                        .setSocketTimeout(Timeout.of(readTimeout))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(readTimeout))
                        .build())
                .build();
        openClients.add(httpClient);

        log.debug("HttpClient configured [connectTimeout={}, readTimeout={}]", connectTimeout, readTimeout);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    @PreDestroy
    public void close() {
        for (CloseableHttpClient client : openClients) {
            try {
                client.close();
            } catch (IOException e) {
                log.warn("Failed to close HttpClient: {}", e.getMessage());
            }
        }
        log.debug("Closed {} HttpClient(s)", openClients.size());
        openClients.clear();
    }

    int openClientCount() {
        return openClients.size();
    }
}
