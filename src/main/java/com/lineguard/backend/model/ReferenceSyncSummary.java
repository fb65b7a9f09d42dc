package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceSyncSummary {
    private int linesProcessed;
    private int linesChanged;
    private int linesFailed;
    private int stationsChanged;
    private RebuildSummary indexRebuild;
    private long processingTimeMs;
}
