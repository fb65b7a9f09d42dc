package com.lineguard.backend.client;

import java.util.List;
import java.util.Map;

/**
 * Raw TfL unified API calls. Responses are left as JSON maps; the services
 * map them onto the domain model.
 */
public interface TflApi {
    List<Map<String, Object>> getLinesByMode(String mode);

    Map<String, Object> getRouteSequence(String lineId, String direction);

    List<Map<String, Object>> getStopPointsByLine(String lineId);

    List<Map<String, Object>> getLineStatuses(String modes);
}
