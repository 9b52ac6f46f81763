package com.apex.guardian.controller;

import com.apex.guardian.dto.GuardianActionRequest;
import com.apex.guardian.service.execution.GuardianDispatchResult;
import com.apex.guardian.service.execution.GuardianDispatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/guardian")
@RequiredArgsConstructor
@Tag(name = "Guardian")
public class GuardianController {

    private final GuardianDispatchService guardianDispatchService;

    @PostMapping("/actions")
    @Operation(summary = "Apply a guardian action to open positions")
    public ResponseEntity<GuardianDispatchResult> apply(@Valid @RequestBody GuardianActionRequest request) {
        log.info("Guardian action {} on {} account={}", request.getAction(), request.getSymbol(), request.getAccountId());
        return ResponseEntity.ok(guardianDispatchService.dispatch(request.toCommand()));
    }
}
