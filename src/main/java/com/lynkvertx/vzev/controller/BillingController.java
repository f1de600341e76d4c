package com.lynkvertx.vzev.controller;

import com.lynkvertx.vzev.dto.ApiResponse;
import com.lynkvertx.vzev.dto.BillingRunResultDTO;
import com.lynkvertx.vzev.dto.MonthAvailabilityDTO;
import com.lynkvertx.vzev.model.Bill;
import com.lynkvertx.vzev.service.BillingRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Billing REST Controller
 * Month availability, full billing runs and single-period bills
 */
@Slf4j
@RestController
@RequestMapping("/api/collectives/{id}")
@RequiredArgsConstructor
@Tag(name = "Billing", description = "vZEV billing APIs")
public class BillingController {

    private final BillingRunService billingRunService;

    @GetMapping("/months")
    @Operation(summary = "Month availability",
        description = "Lists each month of the billing range with its completeness verdict")
    public ResponseEntity<ApiResponse<List<MonthAvailabilityDTO>>> getMonths(@PathVariable Long id) {
        List<MonthAvailabilityDTO> months = billingRunService.monthOverview(id);
        List<String> warnings = months.stream()
            .filter(m -> !m.isBillable())
            .map(m -> m.getMonth() + " not billable: " + String.join("; ", m.getReasons()))
            .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success("success", months, warnings));
    }

    @PostMapping("/billing-runs")
    @Operation(summary = "Run billing",
        description = "Bills every complete period of the configured range; incomplete periods are listed as excluded")
    public ResponseEntity<ApiResponse<BillingRunResultDTO>> runBilling(@PathVariable Long id) {
        log.info("Billing run requested for collective {}", id);
        BillingRunResultDTO result = billingRunService.run(id);
        return ResponseEntity.ok(ApiResponse.success("Billing run completed", result, result.getWarnings()));
    }

    @GetMapping("/bills")
    @Operation(summary = "Bills for one period",
        description = "Aggregates all member bills for [start, end); 409 if any month of the period is incomplete")
    public ResponseEntity<ApiResponse<List<Bill>>> getBills(
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        List<Bill> bills = billingRunService.billForPeriod(id, start, end);
        return ResponseEntity.ok(ApiResponse.success(bills));
    }
}
