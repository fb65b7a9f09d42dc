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
public class AffectedSection {
    private String name;
    private String direction;

    @Builder.Default
    private List<String> affectedStations = new ArrayList<>();
}
