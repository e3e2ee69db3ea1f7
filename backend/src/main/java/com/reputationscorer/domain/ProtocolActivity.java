package com.reputationscorer.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Transactions of one protocol family (e.g. "dexes", "lending") for a wallet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtocolActivity(
        @NotNull String protocolType,
        @NotNull @Valid List<@NotNull Transaction> transactions) {

    public static final String DEXES = "dexes";

    public ProtocolActivity {
        transactions = transactions == null ? null : List.copyOf(transactions);
    }
}
