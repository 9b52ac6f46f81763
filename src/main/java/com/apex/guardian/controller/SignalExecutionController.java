package com.apex.guardian.controller;

import com.apex.guardian.dto.TradeSignalRequest;
import com.apex.guardian.service.execution.DispatchResult;
import com.apex.guardian.service.execution.ExecutionCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Tag(name = "Signals")
public class SignalExecutionController {

    private final ExecutionCoordinator executionCoordinator;

    @PostMapping("/execute")
    @Operation(summary = "Execute a signal on every eligible account")
    public ResponseEntity<DispatchResult> execute(@Valid @RequestBody TradeSignalRequest request) {
        log.info("Signal received {} {} strategy={}", request.getDirection(), request.getSymbol(), request.getStrategy());
        DispatchResult result = executionCoordinator.dispatch(request.toSignal());
        HttpStatus status = result.anyExecuted() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }
}
