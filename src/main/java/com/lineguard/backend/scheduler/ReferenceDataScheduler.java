package com.lineguard.backend.scheduler;

import com.lineguard.backend.service.MonitoringService;
import com.lineguard.backend.service.ReferenceDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataScheduler {

    private final ReferenceDataService referenceDataService;
    private final MonitoringService monitoringService;

    @Scheduled(cron = "${reference.sync.cron:0 30 3 * * *}")
    public void syncReferenceData() {
        log.info("⏰ Triggering scheduled reference data sync...");
        long startTime = System.currentTimeMillis();

        try {
            referenceDataService.syncLines();
            monitoringService.recordJobDuration("reference_sync", System.currentTimeMillis() - startTime, "SUCCESS");
        } catch (Exception e) {
            log.error("💥 Critical error during reference data sync", e);
            monitoringService.recordJobDuration("reference_sync", System.currentTimeMillis() - startTime, "FAILED");
        }
    }
}
