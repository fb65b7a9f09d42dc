package com.lineguard.backend.repository.firestore;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.lineguard.backend.model.RouteStationIndexEntry;
import com.lineguard.backend.repository.RouteStationIndexRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;

@Slf4j
public class FirestoreRouteStationIndexRepository
        extends GenericFirestoreRepository<RouteStationIndexEntry, String>
        implements RouteStationIndexRepository {

    private final Clock clock;

    public FirestoreRouteStationIndexRepository(Firestore firestore, String collectionName, Clock clock) {
        super(firestore, collectionName, RouteStationIndexEntry.class, RouteStationIndexEntry::getId);
        this.clock = clock;
    }

    @Override
    public int replaceActiveEntries(String routeId, List<RouteStationIndexEntry> entries) {
        if (firestore == null) {
            throw new IllegalStateException("Firestore is not configured; cannot write index for route " + routeId);
        }
        try {
            // Reads must precede writes inside a Firestore transaction
            return firestore.runTransaction(transaction -> {
                CollectionReference col = collection();
                List<QueryDocumentSnapshot> current = transaction.get(activeForRoute(routeId)).get().getDocuments();

                String supersededAt = Instant.now(clock).toString();
                for (QueryDocumentSnapshot doc : current) {
                    transaction.update(doc.getReference(), "active", false, "supersededAt", supersededAt);
                }
                for (RouteStationIndexEntry entry : entries) {
                    DocumentReference ref = col.document();
                    entry.setId(ref.getId());
                    transaction.set(ref, entry);
                }
                return current.size();
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while replacing index for route " + routeId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to replace index for route " + routeId, e.getCause());
        }
    }

    @Override
    public List<RouteStationIndexEntry> findActiveByRouteId(String routeId) {
        if (firestore == null)
            return List.of();
        return runQuery(activeForRoute(routeId), "active route=" + routeId);
    }

    @Override
    public List<RouteStationIndexEntry> findAllActive() {
        if (firestore == null)
            return List.of();
        return runQuery(collection().whereEqualTo("active", true), "active");
    }

    private Query activeForRoute(String routeId) {
        return collection()
                .whereEqualTo("routeId", routeId)
                .whereEqualTo("active", true);
    }
}
