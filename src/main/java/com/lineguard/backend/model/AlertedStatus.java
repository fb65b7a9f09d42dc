package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A line status as it was last alerted, kept in the dedup state so a later
 * cycle can tell the user when the line is back to normal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertedStatus {
    private String lineId;
    private String lineName;
    private String mode;
    private int statusSeverity;
    private String statusSeverityDescription;
    private String reason;

    public static AlertedStatus from(Disruption disruption) {
        return AlertedStatus.builder()
                .lineId(disruption.getLineId())
                .lineName(disruption.getLineName())
                .mode(disruption.getMode())
                .statusSeverity(disruption.getStatusSeverity())
                .statusSeverityDescription(disruption.getStatusSeverityDescription())
                .reason(disruption.getReason())
                .build();
    }

    public Disruption toDisruption() {
        return Disruption.builder()
                .lineId(lineId)
                .lineName(lineName)
                .mode(mode)
                .statusSeverity(statusSeverity)
                .statusSeverityDescription(statusSeverityDescription)
                .reason(reason)
                .build();
    }
}
