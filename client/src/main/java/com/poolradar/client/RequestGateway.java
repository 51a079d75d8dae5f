package com.poolradar.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolradar.cache.CacheMirror;
import com.poolradar.cache.MirroredValue;
import com.poolradar.cache.RequestFingerprint;
import com.poolradar.cache.ResponseCache;
import com.poolradar.domain.ApiErrorBody;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Issues one logical API request: cache lookup, then transport, decode and cache population.
 * <p>
 * Holds no state besides the shared {@link ResponseCache}, so it is safe to call from many threads; it
 * is the unit of work the batch dispatcher runs in parallel. Errors are never swallowed and never
 * retried here: {@link TransportException}, {@link RemoteApiException}, {@link DecodeException} and
 * {@link RequestCancelledException} reach the caller as-is. Decode failures are not cached.
 */
@Slf4j
public class RequestGateway {

    private final ApiTransport transport;
    private final ResponseCache cache;
    private final CacheMirror mirror;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final RateLimiter rateLimiter;

    public RequestGateway(ApiTransport transport, ResponseCache cache, CacheMirror mirror,
                          ObjectMapper objectMapper, Duration requestTimeout, RateLimiter rateLimiter) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.mirror = mirror != null ? mirror : CacheMirror.NONE;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.rateLimiter = rateLimiter;
    }

    public RequestGateway(ApiTransport transport, ResponseCache cache, ObjectMapper objectMapper, Duration requestTimeout) {
        this(transport, cache, CacheMirror.NONE, objectMapper, requestTimeout, null);
    }

    public <T> T fetch(String endpoint, Map<String, String> params, Class<T> type) {
        return fetch(endpoint, params, objectMapper.constructType(type), CancellationToken.create(), CacheMode.USE_CACHE);
    }

    public <T> T fetch(String endpoint, Map<String, String> params, JavaType type, CancellationToken token) {
        return fetch(endpoint, params, type, token, CacheMode.USE_CACHE);
    }

    /**
     * Fetch and decode {@code endpoint} as {@code type}.
     *
     * @throws RequestCancelledException token fired before the call was issued or while waiting for it
     * @throws TransportException        no response within the request timeout, or connection failure
     * @throws RemoteApiException        non-2xx status
     * @throws DecodeException           body does not match {@code type}
     */
    @SuppressWarnings("unchecked")
    public <T> T fetch(String endpoint, Map<String, String> params, JavaType type,
                       CancellationToken token, CacheMode cacheMode) {
        Map<String, String> query = params == null ? Map.of() : params;
        CancellationToken cancellation = token != null ? token : CancellationToken.create();
        String fingerprint = RequestFingerprint.of(endpoint, query);

        if (cacheMode != CacheMode.REFRESH) {
            Optional<Object> cached = cache.get(fingerprint);
            if (cached.isPresent()) {
                log.debug("Cache hit {} ({})", endpoint, fingerprint);
                return (T) cached.get();
            }
            Optional<MirroredValue<T>> mirrored = mirror.load(fingerprint, type);
            if (mirrored.isPresent()) {
                log.debug("Cache mirror hit {} ({})", endpoint, fingerprint);
                T restored = freeze(mirrored.get().value());
                cache.restore(fingerprint, restored, mirrored.get().capturedAt());
                return restored;
            }
        }

        cancellation.throwIfCancelled();
        acquirePermit(endpoint);
        log.debug("Cache miss {} {} ({})", endpoint, query, fingerprint);
        TransportResponse response = execute(endpoint, query, cancellation);
        if (!response.isSuccess()) {
            throw new RemoteApiException(response.status(), response.body(), parseErrorBody(response.body()));
        }
        T value = freeze(decode(endpoint, response.body(), type));
        cache.put(fingerprint, value);
        mirror.store(fingerprint, value);
        return value;
    }

    private void acquirePermit(String endpoint) {
        if (rateLimiter == null) {
            return;
        }
        if (!rateLimiter.acquirePermission()) {
            throw new TransportException("Client-side rate limit exceeded for " + endpoint);
        }
    }

    private TransportResponse execute(String endpoint, Map<String, String> query, CancellationToken token) {
        Duration timeout = requestTimeout;
        boolean deadlineBound = false;
        Optional<Duration> remaining = token.remaining();
        if (remaining.isPresent() && remaining.get().compareTo(requestTimeout) < 0) {
            timeout = remaining.get();
            deadlineBound = true;
        }
        final Duration effectiveTimeout = timeout;
        final boolean cancelledByDeadline = deadlineBound;

        Mono<TransportResponse> call = Mono.defer(() -> transport.get(endpoint, query))
                .timeout(effectiveTimeout)
                .onErrorMap(TimeoutException.class, e -> cancelledByDeadline
                        ? new RequestCancelledException("Deadline exceeded while calling " + endpoint, e)
                        : new TransportException("Timed out after " + effectiveTimeout.toMillis() + "ms calling " + endpoint, e));
        Mono<TransportResponse> cancelled = Mono.fromFuture(token.whenCancelled())
                .then(Mono.<TransportResponse>error(() -> new RequestCancelledException("Request cancelled while calling " + endpoint)));

        TransportResponse response;
        try {
            response = Mono.firstWithSignal(call, cancelled)
                    .onErrorMap(e -> !(e instanceof PaprikaApiException),
                            e -> new TransportException("GET " + endpoint + " failed: " + e.getMessage(), e))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new RequestCancelledException("Interrupted while calling " + endpoint, cause);
            }
            throw e;
        }
        if (response == null) {
            throw new TransportException("No response from " + endpoint);
        }
        return response;
    }

    private <T> T decode(String endpoint, String body, JavaType type) {
        if (body == null || body.isBlank()) {
            throw new DecodeException(endpoint, "empty body", null);
        }
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new DecodeException(endpoint, "null payload", null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new DecodeException(endpoint, e.getOriginalMessage(), e);
        }
    }

    /**
     * Cached values are handed to every caller, so list payloads are stored read-only.
     */
    @SuppressWarnings("unchecked")
    private static <T> T freeze(T value) {
        if (value instanceof List<?> list) {
            return (T) Collections.unmodifiableList(new ArrayList<>(list));
        }
        return value;
    }

    private ApiErrorBody parseErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            ApiErrorBody parsed = objectMapper.readValue(body, ApiErrorBody.class);
            return parsed != null && parsed.error() != null ? parsed : null;
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
