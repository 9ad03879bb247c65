package com.deepansh.recall.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Shared RestClient.Builder backed by a pooled Apache HttpClient 5.
 *
 * Every outbound dependency (chat completions, embeddings) clones this builder,
 * so they share one connection pool and one set of timeouts. The retrieval
 * deadline is enforced separately in RetrievalEngine.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${http.connect-timeout-ms:3000}")
    private long connectTimeoutMs;

    @Value("${http.response-timeout-ms:30000}")
    private long responseTimeoutMs;

    @Value("${http.max-connections:50}")
    private int maxConnections;

    @Bean
    public RestClient.Builder restClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .build();

        log.info("HttpClient configured [maxConnections={}, connectTimeout={}ms, responseTimeout={}ms]",
                maxConnections, connectTimeoutMs, responseTimeoutMs);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
