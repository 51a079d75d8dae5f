package com.poolradar.client;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * HTTP GET against the DexPaprika API. Abstracted so the gateway can be tested without a network.
 */
public interface ApiTransport {

    /**
     * Issue GET {@code endpoint} with the given query parameters.
     *
     * @param endpoint path relative to the API base URL, e.g. "/networks/ethereum/pools"
     * @param params   query parameters, never null
     * @return the response for every HTTP status; errors with {@link TransportException} when no
     * response was received
     */
    Mono<TransportResponse> get(String endpoint, Map<String, String> params);
}
