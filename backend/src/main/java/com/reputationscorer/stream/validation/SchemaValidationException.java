package com.reputationscorer.stream.validation;

import lombok.Getter;

/**
 * Inbound message failed structural or type validation.
 * Carries the wallet address when it could be read from the raw message.
 */
@Getter
public class SchemaValidationException extends RuntimeException {

    private final String walletAddress;

    public SchemaValidationException(String walletAddress, String message) {
        super(message);
        this.walletAddress = walletAddress;
    }

    public SchemaValidationException(String walletAddress, String message, Throwable cause) {
        super(message, cause);
        this.walletAddress = walletAddress;
    }
}
