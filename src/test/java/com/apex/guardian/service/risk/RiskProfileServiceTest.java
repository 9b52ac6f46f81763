package com.apex.guardian.service.risk;

import com.apex.guardian.config.RiskProperties;
import com.apex.guardian.exception.RiskProfileNotFoundException;
import com.apex.guardian.model.RiskProfileSettings;
import com.apex.guardian.repository.RiskProfileSettingsRepository;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RiskProfileServiceTest {

    private final RiskProfileSettingsRepository repository = mock(RiskProfileSettingsRepository.class);
    private final RiskProfileService service = new RiskProfileService(repository, new RiskProperties());

    @Test
    void appliesDefaultsForEmptyColumns() {
        when(repository.findByAccountIdAndStrategyId("A", "default")).thenReturn(Optional.of(RiskProfileSettings.builder()
                .accountId("A")
                .strategyId("default")
                .version(3L)
                .build()));

        RiskProfile profile = service.load("A", "default");

        assertThat(profile.enabled()).isTrue();
        assertThat(profile.tierFilterEnabled()).isFalse();
        assertThat(profile.tierCeiling()).isEqualTo(10);
        assertThat(profile.circuitBreaker()).isEqualTo(new RiskProfile.CircuitBreakerRule(false, 5, 1440, 240));
        assertThat(profile.dailyLoss()).isEqualTo(new RiskProfile.DailyLossRule(false, 5.0, 12));
        assertThat(profile.antiRepetitionWindowMinutes()).isZero();
        assertThat(profile.blacklistedSymbols()).isEmpty();
        assertThat(profile.riskPct()).isEqualTo(2.0);
        assertThat(profile.maxLeverage()).isEqualTo(20);
        assertThat(profile.unlimitedOpenPositions()).isTrue();
        assertThat(profile.guardianEnabled()).isTrue();
        assertThat(profile.halfCloseEnabled()).isFalse();
        assertThat(profile.version()).isEqualTo(3L);
    }

    @Test
    void parsesScheduleAndBlacklist() {
        when(repository.findByAccountIdAndStrategyId("A", "default")).thenReturn(Optional.of(RiskProfileSettings.builder()
                .accountId("A")
                .strategyId("default")
                .scheduleEnabled(true)
                .scheduleJson("{\"friday\":[[\"08:00\",\"12:00\"],[\"14:00\",\"18:00\"]]}")
                .blacklistedSymbols(" dogeusdt, PEPEUSDT ,,")
                .maxOpenPositions(3)
                .version(1L)
                .build()));

        RiskProfile profile = service.load("A", "default");

        assertThat(profile.schedule().windowsFor(DayOfWeek.FRIDAY)).hasSize(2);
        assertThat(profile.schedule().windowsFor(DayOfWeek.MONDAY)).isEmpty();
        assertThat(profile.blacklistedSymbols()).containsExactlyInAnyOrder("DOGEUSDT", "PEPEUSDT");
        assertThat(profile.maxOpenPositions()).isEqualTo(3);
    }

    @Test
    void keepsMalformedScheduleInsteadOfFailing() {
        when(repository.findByAccountIdAndStrategyId("A", "default")).thenReturn(Optional.of(RiskProfileSettings.builder()
                .accountId("A")
                .strategyId("default")
                .scheduleEnabled(true)
                .scheduleJson("{\"Funday\":[[\"08:00\",\"12:00\"]]}")
                .version(1L)
                .build()));

        RiskProfile profile = service.load("A", "default");

        assertThat(profile.schedule().isMalformed()).isTrue();
    }

    @Test
    void reusesParsedProfileUntilVersionChanges() {
        RiskProfileSettings v1 = RiskProfileSettings.builder().accountId("A").strategyId("default")
                .tierFilterEnabled(true).tierCeiling(7).version(1L).build();
        RiskProfileSettings v2 = RiskProfileSettings.builder().accountId("A").strategyId("default")
                .tierFilterEnabled(true).tierCeiling(9).version(2L).build();
        when(repository.findByAccountIdAndStrategyId("A", "default"))
                .thenReturn(Optional.of(v1), Optional.of(v1), Optional.of(v2));

        RiskProfile first = service.load("A", "default");
        RiskProfile second = service.load("A", "default");
        RiskProfile third = service.load("A", "default");

        assertThat(second).isSameAs(first);
        assertThat(third.tierCeiling()).isEqualTo(9);
        assertThat(first.tierCeiling()).isEqualTo(7);
    }

    @Test
    void missingProfileThrowsNotFound() {
        when(repository.findByAccountIdAndStrategyId("X", "default")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.load("X", "default")).isInstanceOf(RiskProfileNotFoundException.class);
        assertThat(service.find("X", "default")).isEmpty();
    }

    @Test
    void rejectsTierCeilingOutOfRange() {
        when(repository.findByAccountIdAndStrategyId("A", "default")).thenReturn(Optional.of(RiskProfileSettings.builder()
                .accountId("A").strategyId("default").tierCeiling(11).version(1L).build()));

        assertThatThrownBy(() -> service.load("A", "default")).isInstanceOf(IllegalArgumentException.class);
    }
}
