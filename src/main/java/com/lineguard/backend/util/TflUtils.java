package com.lineguard.backend.util;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class TflUtils {

    // TfL statusSeverity for "Good Service"
    public static final int GOOD_SERVICE_SEVERITY = 10;

    public static final List<String> ROUTE_DIRECTIONS = List.of("inbound", "outbound");

    public static List<String> parseModes(String modes) {
        if (modes == null) {
            return List.of();
        }
        return Arrays.stream(modes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public static String alertStateKey(String routeId, String userId, String scheduleId) {
        return "alert:" + routeId + ":" + userId + ":" + scheduleId;
    }

    public static String routeTopic(String routeId) {
        return "route_" + routeId;
    }
}
