package com.lineguard.backend.config;

import com.google.cloud.firestore.Firestore;
import com.lineguard.backend.model.AlertDisabledSeverity;
import com.lineguard.backend.model.Line;
import com.lineguard.backend.model.Station;
import com.lineguard.backend.model.UserRoute;
import com.lineguard.backend.repository.DataRepository;
import com.lineguard.backend.repository.RouteStationIndexRepository;
import com.lineguard.backend.repository.firestore.FirestoreRouteStationIndexRepository;
import com.lineguard.backend.repository.firestore.GenericFirestoreRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Repository beans, one Firestore collection each.
 */
@Configuration
public class RepositoryConfig {

    @Bean
    public DataRepository<Station, String> stationRepository(ObjectProvider<Firestore> firestore) {
        return new GenericFirestoreRepository<>(
                firestore.getIfAvailable(),
                "stations",
                Station.class,
                Station::getNaptanId);
    }

    @Bean
    public DataRepository<Line, String> lineRepository(ObjectProvider<Firestore> firestore) {
        return new GenericFirestoreRepository<>(
                firestore.getIfAvailable(),
                "lines",
                Line.class,
                Line::getId);
    }

    @Bean
    public DataRepository<UserRoute, String> userRouteRepository(ObjectProvider<Firestore> firestore) {
        return new GenericFirestoreRepository<>(
                firestore.getIfAvailable(),
                "userRoutes",
                UserRoute.class,
                UserRoute::getId);
    }

    @Bean
    public DataRepository<AlertDisabledSeverity, String> alertDisabledSeverityRepository(
            ObjectProvider<Firestore> firestore) {
        return new GenericFirestoreRepository<>(
                firestore.getIfAvailable(),
                "alertDisabledSeverities",
                AlertDisabledSeverity.class,
                AlertDisabledSeverity::pairKey);
    }

    @Bean
    public RouteStationIndexRepository routeStationIndexRepository(ObjectProvider<Firestore> firestore,
            Clock clock) {
        return new FirestoreRouteStationIndexRepository(
                firestore.getIfAvailable(),
                "routeStationIndex",
                clock);
    }
}
