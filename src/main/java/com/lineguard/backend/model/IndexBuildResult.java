package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one index rebuild. A non-zero {@code pairsSkipped} means the
 * route is only partially covered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexBuildResult {
    private String routeId;
    private int entriesCreated;
    private int pairsProcessed;
    private int pairsSkipped;
    private int entriesSuperseded;

    public boolean isDegraded() {
        return pairsSkipped > 0;
    }
}
