package com.truefi.backend.controllers;

import com.truefi.backend.dto.ApiResponse;
import com.truefi.backend.dto.income.ConfirmIncomeRequestDTO;
import com.truefi.backend.dto.income.IncomeDetectionOutcome;
import com.truefi.backend.dto.income.IncomeSummaryDTO;
import com.truefi.backend.dto.income.RecurringIncomeDTO;
import com.truefi.backend.services.income.IncomeDetectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/users/{userId}/income")
@RequiredArgsConstructor
public class IncomeController {

    private final IncomeDetectionService incomeDetectionService;

    @GetMapping
    public ResponseEntity<ApiResponse<IncomeSummaryDTO>> summary(@PathVariable UUID userId) {
        IncomeSummaryDTO summary = incomeDetectionService.getIncomeSummary(userId);
        return ResponseEntity.ok(ApiResponse.success(summary, "Income retrieved"));
    }

    @PostMapping("/detect")
    public ResponseEntity<ApiResponse<IncomeDetectionOutcome>> detect(@PathVariable UUID userId) {
        IncomeDetectionOutcome outcome = incomeDetectionService.detectAndPersist(userId);
        return ResponseEntity.ok(ApiResponse.success(outcome, outcome.getMessage()));
    }

    @PostMapping("/confirm")
    public ResponseEntity<ApiResponse<RecurringIncomeDTO>> confirm(
            @PathVariable UUID userId,
            @Valid @RequestBody ConfirmIncomeRequestDTO dto
    ) {
        RecurringIncomeDTO saved = incomeDetectionService.confirmIncome(userId, dto);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(saved, "Income confirmed"));
    }
}
