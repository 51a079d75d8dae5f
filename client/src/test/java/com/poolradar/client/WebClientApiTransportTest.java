package com.poolradar.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientApiTransportTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private WebClientApiTransport transport(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> {
                    lastRequest.set(req);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
        return new WebClientApiTransport(builder, "https://api.dexpaprika.com");
    }

    @Test
    @DisplayName("builds the URL from base, endpoint and query parameters")
    void buildsUrl() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", "5");
        params.put("order_by", "volume_usd");

        TransportResponse response = transport(HttpStatus.OK, "{}").get("/networks/ethereum/pools", params).block();

        assertThat(response).isEqualTo(new TransportResponse(200, "{}"));
        URI uri = lastRequest.get().url();
        assertThat(uri.getHost()).isEqualTo("api.dexpaprika.com");
        assertThat(uri.getPath()).isEqualTo("/networks/ethereum/pools");
        assertThat(uri.getQuery()).isEqualTo("limit=5&order_by=volume_usd");
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
    }

    @Test
    @DisplayName("query values with reserved characters are encoded")
    void encodesQueryValues() {
        transport(HttpStatus.OK, "{}").get("/search", Map.of("query", "usd coin&more")).block();

        assertThat(lastRequest.get().url().getRawQuery()).isEqualTo("query=usd%20coin%26more");
    }

    @Test
    @DisplayName("error statuses are returned with their body instead of thrown")
    void errorStatusReturned() {
        TransportResponse response = transport(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"rate_limited\"}")
                .get("/stats", Map.of()).block();

        assertThat(response.status()).isEqualTo(429);
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.body()).contains("rate_limited");
    }

    @Test
    @DisplayName("connection errors become TransportException")
    void connectionError() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.error(new WebClientRequestException(
                        new ConnectException("Connection refused"), HttpMethod.GET, req.url(), HttpHeaders.EMPTY)));
        WebClientApiTransport transport = new WebClientApiTransport(builder, "https://api.dexpaprika.com");

        assertThatThrownBy(() -> transport.get("/stats", Map.of()).block())
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("GET /stats failed");
    }
}
