package com.poolradar.client;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * {@link ApiTransport} on Spring WebClient. Non-2xx responses are returned, not thrown, so the gateway
 * can read the API's error body.
 */
public class WebClientApiTransport implements ApiTransport {

    private final WebClient webClient;

    public WebClientApiTransport(WebClient.Builder builder, String baseUrl) {
        this.webClient = builder.baseUrl(baseUrl).build();
    }

    @Override
    public Mono<TransportResponse> get(String endpoint, Map<String, String> params) {
        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(endpoint);
                    params.keySet().forEach(key -> uriBuilder.queryParam(key, "{" + key + "}"));
                    return uriBuilder.build(params);
                })
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new TransportResponse(response.statusCode().value(), body)))
                .onErrorMap(WebClientRequestException.class,
                        e -> new TransportException("GET " + endpoint + " failed: " + e.getMessage(), e));
    }
}
