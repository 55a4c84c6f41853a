package com.sds.phucth.sessioncontext.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used to deliver approved actions to the automation webhook.
 *
 * <p>Both timeouts are always bounded so a slow automation endpoint can never park a
 * resolving request thread indefinitely.
 */
@Configuration
@Slf4j
public class DispatchConfig {

    @Value("${app.dispatch.connectTimeoutMs:5000}")
    private int connectTimeoutMs;

    @Value("${app.dispatch.readTimeoutMs:30000}")
    private int readTimeoutMs;

    @Bean
    public RestClient dispatchRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        log.info("Dispatch client configured with connect timeout {}ms, read timeout {}ms", connectTimeoutMs, readTimeoutMs);
        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader("User-Agent", "session-context-dispatcher/1.0")
                .build();
    }
}
