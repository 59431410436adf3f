package com.company.watchdog.controller;

import com.company.watchdog.config.WatchdogProperties;
import com.company.watchdog.dto.response.CheckAuditResponse;
import com.company.watchdog.dto.response.HistogramBucketResponse;
import com.company.watchdog.exception.CheckerNotFoundException;
import com.company.watchdog.plugin.CheckerConfigSource;
import com.company.watchdog.repository.CheckAuditRepository;
import com.company.watchdog.service.HistogramService;
import com.company.watchdog.util.TimeUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/checkers")
@RequiredArgsConstructor
@Validated
@Tag(name = "Checkers", description = "Checker audit and event reporting")
public class CheckerQueryController {

    private final CheckerConfigSource configSource;
    private final CheckAuditRepository auditRepository;
    private final HistogramService histogramService;
    private final WatchdogProperties properties;

    @GetMapping
    @Operation(summary = "List configured checkers")
    public ResponseEntity<List<String>> listCheckers() {
        return ResponseEntity.ok(configSource.listCheckerNames());
    }

    @GetMapping("/{name}/checks")
    @Operation(summary = "Most recently checked minutes of a checker")
    public ResponseEntity<List<CheckAuditResponse>> recentChecks(
            @PathVariable("name") String name,
            @RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(1000) int limit) {

        requireChecker(name);

        List<CheckAuditResponse> response = auditRepository.findRecent(name, limit).stream()
                .map(audit -> CheckAuditResponse.builder()
                        .checker(audit.getChecker())
                        .minuteEpoch(audit.getMinuteEpoch())
                        .minuteLocalTime(TimeUtils.formatLocal(audit.getMinuteEpoch(), properties.getZone()))
                        .build())
                .collect(Collectors.toList());

        return ResponseEntity.ok(response);
    }

    @GetMapping("/{name}/histogram")
    @Operation(summary = "Stored events bucketed by day of week and hour")
    public ResponseEntity<List<HistogramBucketResponse>> histogram(
            @PathVariable("name") String name,
            @RequestParam("lookbackSeconds") @Positive long lookbackSeconds,
            @RequestParam(value = "weekdaysOnly", defaultValue = "true") boolean weekdaysOnly) {

        requireChecker(name);
        return ResponseEntity.ok(histogramService.histogram(name, lookbackSeconds, weekdaysOnly));
    }

    private void requireChecker(String name) {
        if (!configSource.listCheckerNames().contains(name)) {
            throw new CheckerNotFoundException(name);
        }
    }
}
