package com.positionalert.common.position;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;

@Builder(toBuilder = true)
public record Position(
        String ticker,
        @JsonProperty("option_type") OptionType optionType,
        BigDecimal strike,
        LocalDate expiration,
        int quantity,
        @JsonProperty("option_symbol") String optionSymbol,
        @JsonProperty("average_price") BigDecimal averagePrice) {

    /** Identity used to drop duplicate rows of the same contract. */
    public ContractKey contractKey() {
        return new ContractKey(ticker, strike == null ? null : strike.stripTrailingZeros(),
                expiration, optionType);
    }

    public record ContractKey(
            String ticker, BigDecimal strike, LocalDate expiration, OptionType optionType) {}
}
