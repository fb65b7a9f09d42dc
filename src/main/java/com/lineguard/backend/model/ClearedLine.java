package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A previously alerted line that is now reporting a cleared status such as
 * Good Service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClearedLine {
    private String lineId;
    private String lineName;
    private String mode;
    private int previousSeverity;
    private String previousStatus;
    private int currentSeverity;
    private String currentStatus;
}
