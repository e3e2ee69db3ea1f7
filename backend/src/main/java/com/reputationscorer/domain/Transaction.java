package com.reputationscorer.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One on-chain action of a wallet. Only {@code action} and {@code timestamp} feed scoring;
 * pool/token/amount metadata is carried through untouched.
 *
 * @param timestamp epoch seconds, UTC
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Transaction(
        @JsonProperty("document_id") String documentId,
        @NotNull String action,
        @NotNull Long timestamp,
        @NotNull String caller,
        @NotNull String protocol,
        String poolId,
        String poolName,
        Map<String, Object> tokenIn,
        Map<String, Object> tokenOut,
        @JsonProperty("token_address") String tokenAddress,
        @Digits(integer = 20, fraction = 18) BigDecimal amount,
        @JsonProperty("block_number") Long blockNumber) {

    public static final String ADD_LIQUIDITY = "add_liquidity";
    public static final String REMOVE_LIQUIDITY = "remove_liquidity";
    public static final String SWAP = "swap";

    /** Minimal transaction with only the fields scoring reads. */
    public static Transaction of(String action, long timestamp) {
        return new Transaction(null, action, timestamp, "", "", null, null, null, null, null, null, null);
    }

    public boolean isLiquidityAction() {
        return ADD_LIQUIDITY.equals(action) || REMOVE_LIQUIDITY.equals(action);
    }

    public boolean isSwapAction() {
        return SWAP.equals(action);
    }
}
