package com.flagship.savings_circle.scheduling;

import com.flagship.savings_circle.cycle.ContributionService;
import com.flagship.savings_circle.cycle.dto.ContributionView;
import com.flagship.savings_circle.scheduling.dto.ScanRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Operator endpoints. Not exposed through the public gateway.
 */
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
@Slf4j
public class InternalOperationsController {

    private final ScheduledScanService scanService;
    private final ContributionService contributionService;

    @PostMapping("/scheduled-scan")
    public ResponseEntity<ScanReport> scheduledScan(@RequestBody(required = false) ScanRequest request) {
        ScanReport report = request == null
            ? scanService.runAll()
            : scanService.run(request.getAsOf(), request.getTasks());
        return ResponseEntity.ok(report);
    }

    @PostMapping("/contributions/{contributionId}/waive")
    public ResponseEntity<ContributionView> waive(@PathVariable("contributionId") UUID contributionId) {
        log.info("Waiver requested for contribution {}", contributionId);
        return ResponseEntity.ok(ContributionView.from(contributionService.waive(contributionId)));
    }
}
