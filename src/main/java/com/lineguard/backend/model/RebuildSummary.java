package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebuildSummary {
    private int rebuiltCount;
    private int failedCount;
    private int degradedCount;

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
