package com.easyinstall.backup.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class WebClientConfig {

    private final BackupProperties backupProperties;

    @Bean
    public WebClient webClient() {
        BackupProperties.Http http = backupProperties.getHttp();
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(
                        HttpClient.create()
                                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, http.getConnectionTimeout())
                                .responseTimeout(Duration.ofMillis(http.getReadTimeout()))
                                .doOnConnected(conn ->
                                        conn.addHandlerLast(new ReadTimeoutHandler(http.getReadTimeout(), TimeUnit.MILLISECONDS))
                                                .addHandlerLast(new WriteTimeoutHandler(http.getReadTimeout(), TimeUnit.MILLISECONDS)))
                ))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(1024 * 1024))
                        .build())
                .filter(ExchangeFilterFunction.ofRequestProcessor(this::logRequest))
                .filter(ExchangeFilterFunction.ofResponseProcessor(this::logResponse))
                .build();
    }

    private Mono<ClientRequest> logRequest(ClientRequest request) {
        log.debug("Request: {} {}", request.method(), request.url());
        return Mono.just(request);
    }

    private Mono<ClientResponse> logResponse(ClientResponse response) {
        log.debug("Response Status: {}", response.statusCode());
        return Mono.just(response);
    }
}
