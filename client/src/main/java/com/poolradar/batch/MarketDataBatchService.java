package com.poolradar.batch;

import com.poolradar.client.ApiQuery;
import com.poolradar.client.CancellationToken;
import com.poolradar.client.DexPaprikaClient;
import com.poolradar.domain.Pool;
import com.poolradar.domain.SearchResult;
import com.poolradar.domain.Token;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Concurrent multi-target lookups: pools for several networks, details for several tokens, several
 * searches. Every call returns one outcome per distinct target even when some of them fail.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketDataBatchService {

    private final DexPaprikaClient client;
    private final BatchDispatcher dispatcher;

    public Map<String, BatchOutcome<List<Pool>>> getMultiplePools(Collection<String> networks, int limit,
                                                                  CancellationToken token) {
        ApiQuery query = ApiQuery.ofLimit(limit);
        Map<String, BatchOutcome<List<Pool>>> results = dispatcher.dispatch(networks,
                network -> client.getNetworkPools(network, query, token).pools(), token);
        logSummary("pools", results);
        return results;
    }

    public Map<String, BatchOutcome<Token>> getTokenDataBatch(Collection<String> tokenAddresses, String network,
                                                              CancellationToken token) {
        Map<String, BatchOutcome<Token>> results = dispatcher.dispatch(tokenAddresses,
                address -> client.getTokenDetails(network, address, token), token);
        logSummary("token details on " + network, results);
        return results;
    }

    public Map<String, BatchOutcome<SearchResult>> batchSearch(Collection<String> queries, CancellationToken token) {
        Map<String, BatchOutcome<SearchResult>> results = dispatcher.dispatch(queries,
                q -> client.search(q, token), token);
        logSummary("search", results);
        return results;
    }

    private static void logSummary(String what, Map<String, ? extends BatchOutcome<?>> results) {
        long ok = results.values().stream().filter(BatchOutcome::isSuccess).count();
        log.info("Batch {}: {}/{} target(s) succeeded", what, ok, results.size());
    }
}
