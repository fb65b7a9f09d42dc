package com.lineguard.backend.repository;

import java.util.List;
import java.util.Optional;

/**
 * Document-store repository for one entity type. Implementations are swappable
 * so services can be tested against mocks. A store that cannot be reached
 * throws {@link IllegalStateException} rather than reading as empty.
 *
 * @param <T>  The entity type
 * @param <ID> The ID type
 */
public interface DataRepository<T, ID> {

    void save(T entity);

    void saveAll(List<T> entities);

    Optional<T> findById(ID id);

    /**
     * Find all entities whose field equals the given value.
     */
    List<T> findByField(String fieldName, Object fieldValue);

    List<T> findAll();
}
