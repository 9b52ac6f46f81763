package com.apex.guardian.controller;

import com.apex.guardian.service.risk.TradePauseService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/risk/pauses")
@RequiredArgsConstructor
@Tag(name = "Risk")
public class RiskPauseController {

    private final TradePauseService tradePauseService;

    @DeleteMapping("/{accountId}/{strategyId}")
    @Operation(summary = "Clear a daily-loss trading pause")
    public ResponseEntity<PauseClearedResponse> clear(@PathVariable String accountId, @PathVariable String strategyId) {
        boolean cleared = tradePauseService.clearPause(accountId, strategyId);
        return ResponseEntity.ok(new PauseClearedResponse(accountId, strategyId, cleared));
    }

    public record PauseClearedResponse(String accountId, String strategyId, boolean cleared) {}
}
