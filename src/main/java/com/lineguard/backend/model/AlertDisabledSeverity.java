package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A (mode, severity) pair that never raises an alert. When {@code clearedState}
 * is set the pair also means the line is back to normal, so users alerted
 * earlier get a status update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDisabledSeverity {
    private String modeId;
    private int severityLevel;
    private String description;
    private boolean clearedState;

    public String pairKey() {
        return pairKey(modeId, severityLevel);
    }

    public static String pairKey(String modeId, int severityLevel) {
        return modeId + "_" + severityLevel;
    }
}
