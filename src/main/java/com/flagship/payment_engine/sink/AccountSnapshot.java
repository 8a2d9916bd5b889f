package com.flagship.payment_engine.sink;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.payment_engine.ledger.ClientAccount;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Output row for one account.
 *
 * Decimals are fixed to four fractional digits; balances keep full precision
 * inside the engine and are only rounded here.
 */
@Value
@Builder
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountSnapshot {

    public static final int SCALE = 4;

    @JsonProperty("client")
    int client;

    @JsonProperty("available")
    BigDecimal available;

    @JsonProperty("held")
    BigDecimal held;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("locked")
    boolean locked;

    public static AccountSnapshot from(ClientAccount account) {
        return AccountSnapshot.builder()
            .client(account.getClientId())
            .available(scaled(account.getAvailable()))
            .held(scaled(account.getHeld()))
            .total(scaled(account.getTotal()))
            .locked(account.isLocked())
            .build();
    }

    static BigDecimal scaled(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
