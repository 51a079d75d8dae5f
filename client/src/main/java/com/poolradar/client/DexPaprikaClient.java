package com.poolradar.client;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.poolradar.domain.DexPage;
import com.poolradar.domain.Network;
import com.poolradar.domain.OhlcvBar;
import com.poolradar.domain.Pool;
import com.poolradar.domain.PoolPage;
import com.poolradar.domain.SearchResult;
import com.poolradar.domain.SystemStats;
import com.poolradar.domain.Token;
import com.poolradar.domain.TransactionPage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to every DexPaprika endpoint. Each call goes through the {@link RequestGateway}, so
 * repeated calls inside the cache TTL do not hit the network.
 */
@Component
@RequiredArgsConstructor
public class DexPaprikaClient {

    private static final TypeFactory TYPES = TypeFactory.defaultInstance();
    private static final JavaType NETWORK_LIST = TYPES.constructCollectionType(List.class, Network.class);
    private static final JavaType OHLCV_LIST = TYPES.constructCollectionType(List.class, OhlcvBar.class);
    private static final JavaType POOL_PAGE = TYPES.constructType(PoolPage.class);
    private static final JavaType DEX_PAGE = TYPES.constructType(DexPage.class);
    private static final JavaType POOL = TYPES.constructType(Pool.class);
    private static final JavaType TRANSACTION_PAGE = TYPES.constructType(TransactionPage.class);
    private static final JavaType TOKEN = TYPES.constructType(Token.class);
    private static final JavaType SEARCH_RESULT = TYPES.constructType(SearchResult.class);
    private static final JavaType SYSTEM_STATS = TYPES.constructType(SystemStats.class);

    private final RequestGateway gateway;

    public List<Network> getNetworks() {
        return getNetworks(CancellationToken.create());
    }

    public List<Network> getNetworks(CancellationToken token) {
        return gateway.fetch("/networks", Map.of(), NETWORK_LIST, token);
    }

    public PoolPage getNetworkPools(String network, ApiQuery query) {
        return getNetworkPools(network, query, CancellationToken.create());
    }

    public PoolPage getNetworkPools(String network, ApiQuery query, CancellationToken token) {
        String endpoint = "/networks/" + segment(network, "network") + "/pools";
        return gateway.fetch(endpoint, params(query), POOL_PAGE, token);
    }

    public PoolPage getDexPools(String network, String dex, ApiQuery query) {
        return getDexPools(network, dex, query, CancellationToken.create());
    }

    public PoolPage getDexPools(String network, String dex, ApiQuery query, CancellationToken token) {
        String endpoint = "/networks/" + segment(network, "network") + "/dexes/" + segment(dex, "dex") + "/pools";
        return gateway.fetch(endpoint, params(query), POOL_PAGE, token);
    }

    public DexPage getNetworkDexes(String network, ApiQuery query) {
        return getNetworkDexes(network, query, CancellationToken.create());
    }

    public DexPage getNetworkDexes(String network, ApiQuery query, CancellationToken token) {
        String endpoint = "/networks/" + segment(network, "network") + "/dexes";
        return gateway.fetch(endpoint, params(query), DEX_PAGE, token);
    }

    public Pool getPoolDetails(String network, String poolAddress, boolean inversed) {
        return getPoolDetails(network, poolAddress, inversed, CancellationToken.create(), CacheMode.USE_CACHE);
    }

    /**
     * @param inversed ask the API to quote the pair the other way round
     */
    public Pool getPoolDetails(String network, String poolAddress, boolean inversed,
                               CancellationToken token, CacheMode cacheMode) {
        String endpoint = "/networks/" + segment(network, "network") + "/pools/" + segment(poolAddress, "poolAddress");
        Map<String, String> params = inversed ? Map.of("inversed", "true") : Map.of();
        return gateway.fetch(endpoint, params, POOL, token, cacheMode);
    }

    /**
     * OHLCV bars starting at {@code start}. {@code query} may add end, interval and limit; its start is
     * ignored in favour of the argument.
     */
    public List<OhlcvBar> getPoolOhlcv(String network, String poolAddress, String start, ApiQuery query) {
        return getPoolOhlcv(network, poolAddress, start, query, CancellationToken.create());
    }

    public List<OhlcvBar> getPoolOhlcv(String network, String poolAddress, String start, ApiQuery query,
                                       CancellationToken token) {
        if (start == null || start.isBlank()) {
            throw new IllegalArgumentException("start must not be blank");
        }
        String endpoint = "/networks/" + segment(network, "network") + "/pools/"
                + segment(poolAddress, "poolAddress") + "/ohlcv";
        Map<String, String> params = new LinkedHashMap<>(params(query));
        params.put("start", start);
        return gateway.fetch(endpoint, params, OHLCV_LIST, token);
    }

    public TransactionPage getPoolTransactions(String network, String poolAddress, ApiQuery query) {
        return getPoolTransactions(network, poolAddress, query, CancellationToken.create());
    }

    public TransactionPage getPoolTransactions(String network, String poolAddress, ApiQuery query,
                                               CancellationToken token) {
        String endpoint = "/networks/" + segment(network, "network") + "/pools/"
                + segment(poolAddress, "poolAddress") + "/transactions";
        return gateway.fetch(endpoint, params(query), TRANSACTION_PAGE, token);
    }

    public Token getTokenDetails(String network, String tokenAddress) {
        return getTokenDetails(network, tokenAddress, CancellationToken.create());
    }

    public Token getTokenDetails(String network, String tokenAddress, CancellationToken token) {
        String endpoint = "/networks/" + segment(network, "network") + "/tokens/" + segment(tokenAddress, "tokenAddress");
        return gateway.fetch(endpoint, Map.of(), TOKEN, token);
    }

    public PoolPage getTokenPools(String network, String tokenAddress, ApiQuery query) {
        return getTokenPools(network, tokenAddress, query, CancellationToken.create());
    }

    public PoolPage getTokenPools(String network, String tokenAddress, ApiQuery query, CancellationToken token) {
        String endpoint = "/networks/" + segment(network, "network") + "/tokens/"
                + segment(tokenAddress, "tokenAddress") + "/pools";
        return gateway.fetch(endpoint, params(query), POOL_PAGE, token);
    }

    public SearchResult search(String query) {
        return search(query, CancellationToken.create());
    }

    public SearchResult search(String query, CancellationToken token) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        return gateway.fetch("/search", Map.of("query", query), SEARCH_RESULT, token);
    }

    public SystemStats getStats() {
        return getStats(CancellationToken.create());
    }

    public SystemStats getStats(CancellationToken token) {
        return gateway.fetch("/stats", Map.of(), SYSTEM_STATS, token);
    }

    private static Map<String, String> params(ApiQuery query) {
        return query == null ? Map.of() : query.toParams();
    }

    private static String segment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value.strip();
    }
}
