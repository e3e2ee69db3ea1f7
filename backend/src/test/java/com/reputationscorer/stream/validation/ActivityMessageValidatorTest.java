package com.reputationscorer.stream.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reputationscorer.domain.ProtocolActivity;
import com.reputationscorer.domain.Transaction;
import com.reputationscorer.domain.WalletActivity;
import jakarta.validation.Validation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ActivityMessageValidatorTest {

    private final ActivityMessageValidator validator = new ActivityMessageValidator(
            new ObjectMapper(), Validation.buildDefaultValidatorFactory().getValidator());

    @Test
    @DisplayName("valid message with optional metadata and unknown fields is accepted")
    void validMessage() {
        String json = """
                {"wallet_address":"0xabc","source":"indexer","data":[
                  {"protocolType":"dexes","transactions":[
                    {"document_id":"d1","action":"swap","timestamp":1672531200,"caller":"0xabc","protocol":"uniswap",
                     "poolId":"p1","tokenIn":{"symbol":"USDC"},"amount":"12.5","block_number":16308190,"extra":true}
                  ]},
                  {"protocolType":"lending","transactions":[]}
                ]}
                """;

        WalletActivity activity = validator.validate(json);

        assertThat(activity.walletAddress()).isEqualTo("0xabc");
        assertThat(activity.data()).hasSize(2);
        Transaction tx = activity.findProtocol(ProtocolActivity.DEXES).orElseThrow().transactions().get(0);
        assertThat(tx.action()).isEqualTo("swap");
        assertThat(tx.timestamp()).isEqualTo(1672531200L);
        assertThat(tx.amount()).isEqualByComparingTo(new BigDecimal("12.5"));
        assertThat(tx.blockNumber()).isEqualTo(16308190L);
        assertThat(tx.tokenIn()).containsEntry("symbol", "USDC");
    }

    @Test
    @DisplayName("missing wallet_address is rejected with unknown wallet")
    void missingWalletAddress() {
        String json = """
                {"data":[{"protocolType":"dexes","transactions":[]}]}
                """;

        SchemaValidationException e = catchThrowableOfType(() -> validator.validate(json), SchemaValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getWalletAddress()).isEqualTo(ActivityMessageValidator.UNKNOWN_WALLET);
        assertThat(e.getMessage()).contains("walletAddress");
    }

    @Test
    @DisplayName("missing required transaction field reports its path and keeps the wallet")
    void missingTransactionField() {
        String json = """
                {"wallet_address":"0xdef","data":[{"protocolType":"dexes","transactions":[
                  {"action":"swap","timestamp":1672531200,"protocol":"uniswap"}
                ]}]}
                """;

        SchemaValidationException e = catchThrowableOfType(() -> validator.validate(json), SchemaValidationException.class);

        assertThat(e.getWalletAddress()).isEqualTo("0xdef");
        assertThat(e.getMessage()).contains("data[0].transactions[0].caller");
    }

    @Test
    @DisplayName("non-integer timestamp is a type error")
    void badTimestamp() {
        String json = """
                {"wallet_address":"0xdef","data":[{"protocolType":"dexes","transactions":[
                  {"action":"swap","timestamp":"yesterday","caller":"0xdef","protocol":"uniswap"}
                ]}]}
                """;

        SchemaValidationException e = catchThrowableOfType(() -> validator.validate(json), SchemaValidationException.class);

        assertThat(e.getWalletAddress()).isEqualTo("0xdef");
        assertThat(e.getMessage()).startsWith("data[0].transactions[0].timestamp");
    }

    @Test
    @DisplayName("amount with more than 18 fractional digits is rejected")
    void amountPrecision() {
        String json = """
                {"wallet_address":"0xdef","data":[{"protocolType":"dexes","transactions":[
                  {"action":"swap","timestamp":1,"caller":"0xdef","protocol":"uniswap","amount":0.1234567890123456789}
                ]}]}
                """;

        SchemaValidationException e = catchThrowableOfType(() -> validator.validate(json), SchemaValidationException.class);

        assertThat(e.getMessage()).contains("amount");
    }

    @Test
    @DisplayName("numeric wallet_address is a type error, not converted to text")
    void numericWalletAddress() {
        String json = """
                {"wallet_address":12345,"data":[{"protocolType":"dexes","transactions":[]}]}
                """;

        SchemaValidationException e = catchThrowableOfType(() -> validator.validate(json), SchemaValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getWalletAddress()).isEqualTo(ActivityMessageValidator.UNKNOWN_WALLET);
        assertThat(e.getMessage()).startsWith("wallet_address");
    }

    @Test
    @DisplayName("numeric action and boolean caller are type errors")
    void scalarTextFieldsMustBeStrings() {
        String numericAction = """
                {"wallet_address":"0xdef","data":[{"protocolType":"dexes","transactions":[
                  {"action":7,"timestamp":1672531200,"caller":"0xdef","protocol":"uniswap"}
                ]}]}
                """;
        String booleanCaller = """
                {"wallet_address":"0xdef","data":[{"protocolType":"dexes","transactions":[
                  {"action":"swap","timestamp":1672531200,"caller":true,"protocol":"uniswap"}
                ]}]}
                """;
        String floatProtocol = """
                {"wallet_address":"0xdef","data":[{"protocolType":"dexes","transactions":[
                  {"action":"swap","timestamp":1672531200,"caller":"0xdef","protocol":1.5}
                ]}]}
                """;

        SchemaValidationException action = catchThrowableOfType(() -> validator.validate(numericAction), SchemaValidationException.class);
        SchemaValidationException caller = catchThrowableOfType(() -> validator.validate(booleanCaller), SchemaValidationException.class);
        SchemaValidationException protocol = catchThrowableOfType(() -> validator.validate(floatProtocol), SchemaValidationException.class);

        assertThat(action.getMessage()).startsWith("data[0].transactions[0].action");
        assertThat(action.getWalletAddress()).isEqualTo("0xdef");
        assertThat(caller.getMessage()).startsWith("data[0].transactions[0].caller");
        assertThat(protocol.getMessage()).startsWith("data[0].transactions[0].protocol");
    }

    @Test
    @DisplayName("whole-valued float timestamp and block number are accepted as integers")
    void wholeFloatIntegers() {
        String json = """
                {"wallet_address":"0xabc","data":[{"protocolType":"dexes","transactions":[
                  {"action":"swap","timestamp":1672531200.0,"caller":"0xabc","protocol":"uniswap","block_number":16308190.0}
                ]}]}
                """;

        Transaction tx = validator.validate(json).data().get(0).transactions().get(0);

        assertThat(tx.timestamp()).isEqualTo(1672531200L);
        assertThat(tx.blockNumber()).isEqualTo(16308190L);
    }

    @Test
    @DisplayName("fractional timestamp is a type error")
    void fractionalTimestamp() {
        String json = """
                {"wallet_address":"0xabc","data":[{"protocolType":"dexes","transactions":[
                  {"action":"swap","timestamp":1672531200.5,"caller":"0xabc","protocol":"uniswap"}
                ]}]}
                """;

        SchemaValidationException e = catchThrowableOfType(() -> validator.validate(json), SchemaValidationException.class);

        assertThat(e.getMessage()).startsWith("data[0].transactions[0].timestamp");
    }

    @Test
    @DisplayName("broken JSON, non-object and empty payloads are rejected")
    void unreadablePayloads() {
        assertThat(catchThrowableOfType(() -> validator.validate("{\"wallet_address\":"), SchemaValidationException.class)
                .getMessage()).startsWith("malformed JSON");
        assertThat(catchThrowableOfType(() -> validator.validate("[1,2]"), SchemaValidationException.class)
                .getMessage()).isEqualTo("message must be a JSON object");
        assertThat(catchThrowableOfType(() -> validator.validate(null), SchemaValidationException.class)
                .getWalletAddress()).isEqualTo("N/A");
    }
}
