package com.reputationscorer.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Inbound unit of work: one wallet with its activity grouped per protocol family.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletActivity(
        @JsonProperty("wallet_address") @NotNull String walletAddress,
        @NotNull @Valid List<@NotNull ProtocolActivity> data) {

    public WalletActivity {
        data = data == null ? null : List.copyOf(data);
    }

    /**
     * First protocol block of the given type, in delivery order.
     */
    public Optional<ProtocolActivity> findProtocol(String protocolType) {
        if (data == null) return Optional.empty();
        return data.stream()
                .filter(p -> protocolType.equals(p.protocolType()))
                .findFirst();
    }
}
