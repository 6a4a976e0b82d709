package personal.bookly.core.catalog.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Service
 */
public interface JpaBookableServiceRepository extends JpaRepository<BookableServiceEntity, Long> {

    Optional<BookableServiceEntity> findByIdAndTenantId(Long id, Long tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select s from BookableServiceEntity s where s.id = :id")
    Optional<BookableServiceEntity> findByIdForUpdate(@Param("id") Long id);
}
