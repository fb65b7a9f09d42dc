package com.lineguard.backend.scheduler;

import com.lineguard.backend.service.AlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class AlertScheduler {

    private final AlertService alertService;

    /**
     * Run an alert cycle on the polling interval. Cycles never overlap, since
     * the default scheduler runs a single thread.
     */
    @Scheduled(fixedRateString = "${alerts.polling.interval:120000}", initialDelayString = "${alerts.polling.interval:120000}")
    public void checkDisruptions() {
        alertService.processAllRoutes();
    }
}
