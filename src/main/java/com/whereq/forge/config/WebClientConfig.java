package com.whereq.forge.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient used by remote stage executors to reach the generation services
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_RESPONSE_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient generationWebClient(WebClient.Builder builder, ForgeProperties properties) {
        ForgeProperties.ExecutorConfig config = properties.getExecutors();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
            .responseTimeout(config.getDefaultTimeout());

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_RESPONSE_SIZE)) // stage data may embed whole scene scripts
            .build();
    }
}
