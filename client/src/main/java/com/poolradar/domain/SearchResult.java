package com.poolradar.domain;

import java.util.List;

/**
 * Matches for a free-text query across tokens, pools and DEXes. Missing sections decode as empty lists.
 */
public record SearchResult(
        List<Token> tokens,
        List<Pool> pools,
        List<Dex> dexes
) {

    public SearchResult {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        pools = pools == null ? List.of() : List.copyOf(pools);
        dexes = dexes == null ? List.of() : List.copyOf(dexes);
    }

    public int totalMatches() {
        return tokens.size() + pools.size() + dexes.size();
    }
}
