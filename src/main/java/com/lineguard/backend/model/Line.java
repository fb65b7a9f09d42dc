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
public class Line {
    private String id;
    private String name;
    private String modeName;

    // Published station sequences per direction/branch
    @Builder.Default
    private List<RouteVariant> routeVariants = new ArrayList<>();

    // Doubles as the data version stamped onto index entries
    private String lastUpdatedTime;
}
