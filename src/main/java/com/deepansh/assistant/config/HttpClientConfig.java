package com.deepansh.assistant.config;

import com.deepansh.assistant.llm.ModelProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * RestClient on a pooled Apache HttpClient with the model call timeouts.
 *
 * A read timeout surfaces as a ResourceAccessException, which the gateway
 * reports as a retryable ModelUnavailableException.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder modelRestClientBuilder(ModelProperties props) {
        Timeout connectTimeout = Timeout.ofMilliseconds(props.getConnectTimeout().toMillis());
        Timeout readTimeout = Timeout.ofMilliseconds(props.getReadTimeout().toMillis());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(connectTimeout)
                                        .setSocketTimeout(readTimeout)
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(readTimeout)
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, readTimeout={}ms]",
                connectTimeout.toMilliseconds(), readTimeout.toMilliseconds());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
