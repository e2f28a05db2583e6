package com.example.delivery.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per external collaborator, each with its own socket timeouts.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient paymentWebClient(
            WebClient.Builder builder,
            @Value("${services.payment.base-url:http://localhost:8082}") String baseUrl,
            @Value("${services.payment.timeout-ms:8000}") int timeoutMs) {
        return createWebClient(builder, baseUrl, timeoutMs);
    }

    @Bean
    public WebClient notificationWebClient(
            WebClient.Builder builder,
            @Value("${services.notification.base-url:http://localhost:8084}") String baseUrl,
            @Value("${services.notification.timeout-ms:3000}") int timeoutMs) {
        return createWebClient(builder, baseUrl, timeoutMs);
    }

    @Bean
    public WebClient analyticsWebClient(
            WebClient.Builder builder,
            @Value("${services.analytics.base-url:http://localhost:8085}") String baseUrl,
            @Value("${services.analytics.timeout-ms:2000}") int timeoutMs) {
        return createWebClient(builder, baseUrl, timeoutMs);
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutMs) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 2000)
                .responseTimeout(Duration.ofMillis(timeoutMs))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        return builder
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
