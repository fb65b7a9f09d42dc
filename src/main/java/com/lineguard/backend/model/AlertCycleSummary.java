package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertCycleSummary {
    private int routesChecked;
    private int routesInWindow;
    private int alertsSent;
    private int alertsSuppressed;
    private int statusUpdatesSent;
    private int errors;
    private long processingTimeMs;
}
