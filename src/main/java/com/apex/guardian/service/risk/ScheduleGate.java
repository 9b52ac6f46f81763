package com.apex.guardian.service.risk;

import com.apex.guardian.trading.pipeline.AccountState;
import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskGate;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import com.apex.guardian.trading.pipeline.TradeSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.Map;

/**
 * Allows trades only inside the profile's UTC windows. Errors here let the trade through.
 */
@Slf4j
@Component
public class ScheduleGate implements RiskGate {

    @Override
    public String name() {
        return "schedule";
    }

    @Override
    public boolean failOpen() {
        return true;
    }

    @Override
    public RiskDecision evaluate(TradeSignal signal, RiskProfile profile, AccountState accountState) {
        if (!profile.scheduleEnabled()) {
            return RiskDecision.allow();
        }
        TradingSchedule schedule = profile.schedule();
        if (schedule == null || schedule.isMalformed()) {
            log.error("Schedule check skipped for account={} strategy={}: {}", profile.accountId(),
                    profile.strategyId(), schedule == null ? "no schedule" : schedule.parseError());
            return RiskDecision.allow();
        }
        if (schedule.allows(accountState.evaluatedAt())) {
            return RiskDecision.allow();
        }
        var utc = accountState.evaluatedAt().atZone(ZoneOffset.UTC);
        return RiskDecision.reject(RiskRejectCode.OUTSIDE_SCHEDULE,
                "Outside trading schedule",
                Map.of("day", utc.getDayOfWeek().name(), "timeUtc", utc.toLocalTime().withNano(0).toString()));
    }
}
