package com.lineguard.backend.repository.firestore;

import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;
import com.lineguard.backend.repository.DataRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Firestore-backed {@link DataRepository}. One instance per collection; the
 * document id comes from {@code idExtractor}.
 *
 * <p>When Firestore is not configured every read is empty and every write is
 * a no-op, so the application still starts without credentials. Once it is
 * configured, a failed read or write throws {@link IllegalStateException};
 * an unreachable store never reads as an empty collection.
 *
 * @param <T>  The entity type
 * @param <ID> The ID type
 */
@Slf4j
public class GenericFirestoreRepository<T, ID> implements DataRepository<T, ID> {

    // Firestore rejects batches above 500 writes
    private static final int MAX_BATCH_WRITES = 500;

    protected final Firestore firestore;
    protected final String collectionName;
    protected final Class<T> entityClass;
    protected final Function<T, String> idExtractor;

    public GenericFirestoreRepository(Firestore firestore, String collectionName,
            Class<T> entityClass, Function<T, String> idExtractor) {
        this.firestore = firestore;
        this.collectionName = collectionName;
        this.entityClass = entityClass;
        this.idExtractor = idExtractor;
    }

    protected CollectionReference collection() {
        return firestore.collection(collectionName);
    }

    @Override
    public void save(T entity) {
        if (firestore == null)
            return;
        String id = idExtractor.apply(entity);
        try {
            collection().document(id).set(entity).get();
            log.trace("Saved {} to {}", id, collectionName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while saving " + id + " to " + collectionName, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to save " + id + " to " + collectionName, e.getCause());
        }
    }

    @Override
    public void saveAll(List<T> entities) {
        if (firestore == null || entities.isEmpty())
            return;
        for (int from = 0; from < entities.size(); from += MAX_BATCH_WRITES) {
            List<T> chunk = entities.subList(from, Math.min(from + MAX_BATCH_WRITES, entities.size()));
            WriteBatch batch = firestore.batch();
            for (T entity : chunk) {
                DocumentReference docRef = collection().document(idExtractor.apply(entity));
                batch.set(docRef, entity);
            }
            try {
                batch.commit().get();
                log.info("Saved {} entities to {}", chunk.size(), collectionName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while saving batch to " + collectionName, e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Failed to save batch to " + collectionName, e.getCause());
            }
        }
    }

    @Override
    public Optional<T> findById(ID id) {
        if (firestore == null)
            return Optional.empty();
        try {
            DocumentSnapshot doc = collection().document(String.valueOf(id)).get().get();
            return doc.exists() ? Optional.ofNullable(doc.toObject(entityClass)) : Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading " + id + " from " + collectionName, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to read " + id + " from " + collectionName, e.getCause());
        }
    }

    @Override
    public List<T> findByField(String fieldName, Object fieldValue) {
        if (firestore == null)
            return new ArrayList<>();
        return runQuery(collection().whereEqualTo(fieldName, fieldValue), fieldName + "=" + fieldValue);
    }

    @Override
    public List<T> findAll() {
        if (firestore == null)
            return new ArrayList<>();
        return runQuery(collection(), "all");
    }

    protected List<T> runQuery(Query query, String description) {
        List<T> results = new ArrayList<>();
        try {
            for (QueryDocumentSnapshot doc : query.get().get().getDocuments()) {
                results.add(doc.toObject(entityClass));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while querying " + collectionName + " (" + description + ")", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to query " + collectionName + " (" + description + ")", e.getCause());
        }
        return results;
    }
}
