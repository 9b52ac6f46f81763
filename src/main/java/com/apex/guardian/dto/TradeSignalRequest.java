package com.apex.guardian.dto;

import com.apex.guardian.model.Direction;
import com.apex.guardian.trading.pipeline.TradeSignal;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSignalRequest {

    @NotBlank
    private String symbol;

    @NotBlank
    @JsonAlias("trade")
    private String direction;

    @NotNull
    @Positive
    @JsonAlias("entry_price")
    private BigDecimal entry;

    @NotNull
    @Positive
    @JsonAlias("stop_price")
    private BigDecimal stop;

    @NotNull
    @Positive
    @JsonAlias("target_price")
    private BigDecimal target;

    @JsonAlias({"risk_reward", "riskReward"})
    private Double rr;

    private Double probability;

    private Integer tier;

    @JsonAlias({"signal_quality_score", "sqs"})
    private Double signalQualityScore;

    @JsonAlias({"strategy_id", "strategyId"})
    private String strategy;

    public TradeSignal toSignal() {
        if (entry.compareTo(stop) == 0) {
            throw new IllegalArgumentException("stop must differ from entry");
        }
        return new TradeSignal(
                symbol.trim().toUpperCase(Locale.ROOT),
                Direction.from(direction),
                entry,
                stop,
                target,
                rr,
                probability,
                tier,
                signalQualityScore,
                strategy);
    }
}
