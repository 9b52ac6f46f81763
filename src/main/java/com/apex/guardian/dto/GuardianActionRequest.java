package com.apex.guardian.dto;

import com.apex.guardian.service.execution.GuardianAction;
import com.apex.guardian.service.execution.GuardianCommand;
import com.apex.guardian.service.guardian.LevelMetadata;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuardianActionRequest {

    @NotBlank
    private String symbol;

    // close, adjust, adjust_target, adjust_both or half_close
    @NotBlank
    private String action;

    @Positive
    @JsonAlias("new_stop")
    private BigDecimal stop;

    @Positive
    @JsonAlias("new_target")
    private BigDecimal target;

    @JsonAlias("account_id")
    private String accountId;

    @JsonAlias("level_metadata")
    private LevelMetadata levelMetadata;

    @JsonAlias("move_to_break_even")
    private Boolean moveToBreakEven;

    public GuardianCommand toCommand() {
        return new GuardianCommand(symbol, GuardianAction.from(action), stop, target, accountId, levelMetadata,
                Boolean.TRUE.equals(moveToBreakEven));
    }
}
