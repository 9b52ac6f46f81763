package com.apex.guardian.service.risk;

import com.apex.guardian.trading.pipeline.RiskDecision;
import com.apex.guardian.trading.pipeline.RiskRejectCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.apex.guardian.util.TestFixtures.longBtc;
import static com.apex.guardian.util.TestFixtures.profile;
import static com.apex.guardian.util.TestFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleGateTest {

    private static final String WEEKDAYS = "{\"Monday\":[[\"09:00\",\"17:00\"]],\"Tuesday\":[[\"00:00\",\"23:59\"]]}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScheduleGate gate = new ScheduleGate();

    @Test
    void allowsInsideWindow() {
        // 2024-01-01 is a Monday
        Instant monday = Instant.parse("2024-01-01T10:30:00Z");

        RiskDecision decision = gate.evaluate(longBtc(5), scheduled(WEEKDAYS), state("A", monday));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void windowEndIsInclusive() {
        Instant end = Instant.parse("2024-01-01T17:00:00Z");

        RiskDecision decision = gate.evaluate(longBtc(5), scheduled(WEEKDAYS), state("A", end));

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void secondsPastWindowEndAreOutside() {
        Instant justAfter = Instant.parse("2024-01-01T17:00:59Z");

        RiskDecision decision = gate.evaluate(longBtc(5), scheduled(WEEKDAYS), state("A", justAfter));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.code()).isEqualTo(RiskRejectCode.OUTSIDE_SCHEDULE);
    }

    @Test
    void rejectsOutsideWindow() {
        Instant evening = Instant.parse("2024-01-01T17:01:00Z");

        RiskDecision decision = gate.evaluate(longBtc(5), scheduled(WEEKDAYS), state("A", evening));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.code()).isEqualTo(RiskRejectCode.OUTSIDE_SCHEDULE);
        assertThat(decision.details()).containsEntry("day", "MONDAY");
    }

    @Test
    void weekdayWithoutWindowsRejects() {
        Instant saturday = Instant.parse("2024-01-06T12:00:00Z");

        RiskDecision decision = gate.evaluate(longBtc(5), scheduled(WEEKDAYS), state("A", saturday));

        assertThat(decision.code()).isEqualTo(RiskRejectCode.OUTSIDE_SCHEDULE);
    }

    @Test
    void malformedScheduleFailsOpen() {
        TradingSchedule broken = TradingSchedule.parse("{\"Monday\":[[\"9am\"]]}", objectMapper);

        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").schedule(broken).build(),
                state("A", Instant.parse("2024-01-06T12:00:00Z")));

        assertThat(broken.isMalformed()).isTrue();
        assertThat(decision.allowed()).isTrue();
        assertThat(gate.failOpen()).isTrue();
    }

    @Test
    void malformedScheduleRefusesDirectEvaluation() {
        TradingSchedule broken = TradingSchedule.parse("not json", objectMapper);

        assertThatThrownBy(() -> broken.allows(Instant.now())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void disabledScheduleAllowsAnyTime() {
        RiskDecision decision = gate.evaluate(longBtc(5), profile("A").build(),
                state("A", Instant.parse("2024-01-06T03:00:00Z")));

        assertThat(decision.allowed()).isTrue();
    }

    private RiskProfile scheduled(String json) {
        return profile("A").schedule(TradingSchedule.parse(json, objectMapper)).build();
    }
}
