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
public class RouteVariant {
    private String name;
    private String serviceType;
    private String direction;

    @Builder.Default
    private List<String> stations = new ArrayList<>();
}
