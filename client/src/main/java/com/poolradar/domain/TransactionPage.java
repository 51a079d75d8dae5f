package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One page of pool transactions. Page info is either numbered or cursor based, so it is kept as a raw node.
 */
public record TransactionPage(
        List<Transaction> transactions,
        @JsonProperty("page_info") JsonNode pageInfo
) {

    public TransactionPage {
        transactions = List.copyOf(Objects.requireNonNull(transactions, "transactions must be present"));
    }

    /**
     * Cursor for the next page when the API paginates by cursor.
     */
    public Optional<String> nextCursor() {
        if (pageInfo == null) {
            return Optional.empty();
        }
        JsonNode next = pageInfo.path("next_cursor");
        if (next.isMissingNode() || next.isNull()) {
            next = pageInfo.path("cursor");
        }
        return next.isTextual() && !next.asText().isBlank() ? Optional.of(next.asText()) : Optional.empty();
    }
}
