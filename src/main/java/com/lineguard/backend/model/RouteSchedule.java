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
public class RouteSchedule {
    private String id;

    // MON, TUE, ... SUN
    @Builder.Default
    private List<String> daysOfWeek = new ArrayList<>();

    // HH:mm in the route's timezone
    private String startTime;
    private String endTime;
}
