package com.example.spimex.controller;

import com.example.spimex.broker.TaskDispatcher;
import com.example.spimex.dto.ApiResponse;
import com.example.spimex.dto.LastTradingDates;
import com.example.spimex.dto.TaskAcceptedResponse;
import com.example.spimex.dto.TradingResultFilter;
import com.example.spimex.dto.TradingResultsList;
import com.example.spimex.service.BulletinImportService;
import com.example.spimex.service.TradingResultsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST API for SPIMEX trading results.
 * <p>
 * Reads are served from the store through the Redis cache; imports are handed to the
 * workers through the broker and answered with 202.
 */
@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api_v1/trading_results")
@Tag(name = "Trading Results", description = "SPIMEX oil products trading results")
public class TradingResultsController {

    static final String ORIGIN = "api";

    private final TradingResultsService tradingResultsService;
    private final BulletinImportService importService;
    private final TaskDispatcher dispatcher;

    @GetMapping("/last_trading_dates")
    @Operation(summary = "Last trading dates", description = "Dates with results among the last N calendar days, newest first")
    public ResponseEntity<ApiResponse<LastTradingDates>> getLastTradingDates(
            @Parameter(description = "Number of calendar days back from today, today included")
            @RequestParam @Min(1) @Max(365) int days) {

        return ResponseEntity.ok(ApiResponse.success(tradingResultsService.getLastTradingDates(days)));
    }

    @GetMapping("/trading_results_in_period")
    @Operation(summary = "Trading results in a period", description = "Results between two dates inclusive, optionally filtered")
    public ResponseEntity<ApiResponse<TradingResultsList>> getTradingResultsInPeriod(
            @RequestParam("start_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("end_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "oil_id", required = false) String oilId,
            @RequestParam(name = "delivery_type_id", required = false) String deliveryTypeId,
            @RequestParam(name = "delivery_basis_id", required = false) String deliveryBasisId) {

        var filter = TradingResultFilter.of(oilId, deliveryTypeId, deliveryBasisId);
        return ResponseEntity.ok(ApiResponse.success(tradingResultsService.getTradingResultsInPeriod(startDate, endDate, filter)));
    }

    @GetMapping("/last_trading_results")
    @Operation(summary = "Last trading results", description = "Results of the most recent trading date, optionally filtered")
    public ResponseEntity<ApiResponse<TradingResultsList>> getLastTradingResults(
            @RequestParam(name = "oil_id", required = false) String oilId,
            @RequestParam(name = "delivery_type_id", required = false) String deliveryTypeId,
            @RequestParam(name = "delivery_basis_id", required = false) String deliveryBasisId) {

        var filter = TradingResultFilter.of(oilId, deliveryTypeId, deliveryBasisId);
        return ResponseEntity.ok(ApiResponse.success(tradingResultsService.getLastTradingResults(filter)));
    }

    @PostMapping("/import")
    @Operation(summary = "Import bulletins", description = "Enqueue an import of every bulletin from today back to target_date")
    public ResponseEntity<ApiResponse<TaskAcceptedResponse>> importBulletins(
            @RequestParam("target_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate targetDate,
            @Parameter(description = "Re-import dates already stored")
            @RequestParam(defaultValue = "false") boolean force) {

        log.info("API: Import request since {} (force: {})", targetDate, force);
        importService.validateTargetDate(targetDate);

        var message = dispatcher.dispatchImport(targetDate, force, ORIGIN);
        var accepted = TaskAcceptedResponse.builder()
                .taskId(message.getId())
                .taskType(message.getType())
                .enqueuedAt(message.getEnqueuedAt())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(accepted, "Import enqueued"));
    }
}
