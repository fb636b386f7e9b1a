package com.signalfusion.fusion.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Outbound clients for the item gateway (news, forum and microblog fetchers) and the
 * sentiment inference endpoint. Both carry their own connect/read timeouts, so a hung
 * collaborator surfaces as an error the adapters turn into "no data".
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Bean
    public WebClient gatewayWebClient(WebClient.Builder builder, FusionProperties properties) {
        FusionProperties.Gateway gateway = properties.getGateway();
        return builder.clone()
            .baseUrl(gateway.getBaseUrl())
            .clientConnector(connector(gateway.getConnectTimeoutMillis(), gateway.getResponseTimeoutSeconds()))
            .filter(serverErrorFilter("Item gateway"))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient inferenceWebClient(WebClient.Builder builder, FusionProperties properties) {
        FusionProperties.Inference inference = properties.getInference();
        return builder.clone()
            .baseUrl(inference.getBaseUrl())
            .clientConnector(connector(inference.getConnectTimeoutMillis(), inference.getResponseTimeoutSeconds()))
            .filter(serverErrorFilter("Inference"))
            .filter(loggingFilter())
            .build();
    }

    private ReactorClientHttpConnector connector(int connectTimeoutMillis, int responseTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );
        return new ReactorClientHttpConnector(httpClient);
    }

    private ExchangeFilterFunction serverErrorFilter(String target) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(target + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
