package com.lineguard.backend.service;

public interface MonitoringService {
    /**
     * Records the duration and outcome of a scheduled job run.
     *
     * @param job        The job name (e.g., "alerts", "reference-sync")
     * @param durationMs The duration of the run in milliseconds
     * @param status     The outcome (e.g., "SUCCESS", "FAILED")
     */
    void recordJobDuration(String job, long durationMs, String status);

    /**
     * Records the alert outcomes of one cycle.
     */
    void recordAlertCounts(int sent, int suppressed, int errors);
}
