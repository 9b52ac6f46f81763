package com.apex.guardian.repository;

import com.apex.guardian.model.RiskProfileSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RiskProfileSettingsRepository extends JpaRepository<RiskProfileSettings, Long> {

    Optional<RiskProfileSettings> findByAccountIdAndStrategyId(String accountId, String strategyId);
}
