package com.flagship.savings_circle.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process trigger for the scan. Off by default: deployments usually call
 * {@code POST /internal/scheduled-scan} from an external scheduler instead.
 */
@Component
@ConditionalOnProperty(name = "scan.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ScheduledScanJob {

    private final ScheduledScanService scanService;

    @Scheduled(cron = "${scan.scheduler.cron:0 0 * * * *}", zone = "UTC")
    public void scan() {
        try {
            scanService.runAll();
        } catch (Exception e) {
            log.error("Scheduled scan failed", e);
        }
    }
}
