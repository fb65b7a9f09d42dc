package com.lineguard.backend.service;

import com.lineguard.backend.model.ClearedLine;
import com.lineguard.backend.model.RouteDisruptionMatch;
import com.lineguard.backend.model.RouteSchedule;
import com.lineguard.backend.model.UserRoute;

import java.util.List;

/**
 * Delivers route alerts and status updates.
 */
public interface NotificationDispatcher {

    /**
     * @return true if the alert was handed to the delivery channel; only then
     *         is the alert recorded as sent
     */
    boolean dispatch(UserRoute route, RouteSchedule schedule, List<RouteDisruptionMatch> matches);

    /**
     * Tells the route owner that lines they were alerted about are back to
     * normal.
     *
     * @return true if the update was handed to the delivery channel
     */
    boolean dispatchStatusUpdate(UserRoute route, RouteSchedule schedule, List<ClearedLine> clearedLines);
}
