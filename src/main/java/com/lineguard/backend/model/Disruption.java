package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One reported line status that is not normal service. Fetched fresh every
 * polling cycle and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Disruption {
    private String lineId;
    private String lineName;
    private String mode;
    private int statusSeverity;
    private String statusSeverityDescription;
    private String reason;

    @Builder.Default
    private List<AffectedSection> affectedSections = new ArrayList<>();
}
