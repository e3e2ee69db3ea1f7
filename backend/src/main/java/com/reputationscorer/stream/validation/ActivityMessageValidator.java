package com.reputationscorer.stream.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.reputationscorer.domain.WalletActivity;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses and validates a raw inbound message into {@link WalletActivity}.
 * Jackson handles types, Bean Validation handles required fields and amount precision.
 * Floats are read as BigDecimal so precision checks see the digits as sent.
 * Text fields accept only JSON strings; integer fields also accept whole-valued floats such as {@code 1672531200.0}.
 */
@Component
public class ActivityMessageValidator {

    public static final String UNKNOWN_WALLET = "N/A";

    private static final String WALLET_FIELD = "wallet_address";
    private static final List<String> INTEGER_TRANSACTION_FIELDS = List.of("timestamp", "block_number");

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public ActivityMessageValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.objectMapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        this.validator = validator;
    }

    /**
     * @throws SchemaValidationException with the best-known wallet address and a readable reason
     */
    public WalletActivity validate(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new SchemaValidationException(UNKNOWN_WALLET, "empty message payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException(UNKNOWN_WALLET, "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaValidationException(UNKNOWN_WALLET, "message must be a JSON object");
        }
        String walletAddress = bestKnownWalletAddress(root);
        normalizeWholeNumbers(root);

        WalletActivity activity;
        try {
            activity = objectMapper.treeToValue(root, WalletActivity.class);
        } catch (JsonMappingException e) {
            throw new SchemaValidationException(walletAddress, describe(e), e);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException(walletAddress, "malformed JSON: " + e.getOriginalMessage(), e);
        }

        Set<ConstraintViolation<WalletActivity>> violations = validator.validate(activity);
        if (!violations.isEmpty()) {
            String reason = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SchemaValidationException(walletAddress, reason);
        }
        return activity;
    }

    /**
     * Wallet address as sent, even if the rest of the message is invalid; "N/A" when missing or not text.
     */
    static String bestKnownWalletAddress(JsonNode root) {
        JsonNode wallet = root.get(WALLET_FIELD);
        return wallet != null && wallet.isTextual() ? wallet.asText() : UNKNOWN_WALLET;
    }

    /**
     * Rewrites whole-valued floats in integer transaction fields as longs. Fractional values are left for Jackson to reject.
     */
    private static void normalizeWholeNumbers(JsonNode root) {
        for (JsonNode protocol : root.path("data")) {
            for (JsonNode tx : protocol.path("transactions")) {
                if (!tx.isObject()) continue;
                for (String field : INTEGER_TRANSACTION_FIELDS) {
                    JsonNode value = tx.get(field);
                    if (value != null && value.isFloatingPointNumber()) {
                        toWholeLong(value.decimalValue())
                                .ifPresent(whole -> ((ObjectNode) tx).set(field, LongNode.valueOf(whole)));
                    }
                }
            }
        }
    }

    private static OptionalLong toWholeLong(BigDecimal value) {
        try {
            return OptionalLong.of(value.longValueExact());
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    private static String describe(JsonMappingException e) {
        String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."))
                .replace(".[", "[");
        return path.isEmpty()
                ? "invalid message: " + e.getOriginalMessage()
                : path + ": " + e.getOriginalMessage();
    }
}
