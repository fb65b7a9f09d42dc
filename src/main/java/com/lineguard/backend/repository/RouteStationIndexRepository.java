package com.lineguard.backend.repository;

import com.lineguard.backend.model.RouteStationIndexEntry;

import java.util.List;

/**
 * Storage for the route station index. Only active entries take part in
 * matching; superseded ones are kept for point-in-time inspection.
 */
public interface RouteStationIndexRepository {

    /**
     * Marks every active entry of the route inactive and inserts the given
     * entries, all in one transaction. Readers see either the old set or the
     * new set, never a mix.
     *
     * @return number of entries superseded
     * @throws IllegalStateException if the transaction could not be committed
     */
    int replaceActiveEntries(String routeId, List<RouteStationIndexEntry> entries);

    /**
     * @throws IllegalStateException if the store cannot be read; an unreadable
     *                               index never looks like an empty one
     */
    List<RouteStationIndexEntry> findActiveByRouteId(String routeId);

    /**
     * @throws IllegalStateException if the store cannot be read
     */
    List<RouteStationIndexEntry> findAllActive();
}
