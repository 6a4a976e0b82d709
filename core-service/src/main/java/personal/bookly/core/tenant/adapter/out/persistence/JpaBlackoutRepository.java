package personal.bookly.core.tenant.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Blackout
 */
public interface JpaBlackoutRepository extends JpaRepository<BlackoutEntity, Long> {

    Optional<BlackoutEntity> findByIdAndTenantId(Long id, Long tenantId);

    @Query("""
            select b from BlackoutEntity b
            where b.tenantId = :tenantId
              and b.active = true
              and b.startsAt < :to
              and b.endsAt > :from
              and (b.resourceId is null or b.resourceId = :resourceId)
              and (b.staffId is null or b.staffId = :staffId)
              and (b.serviceId is null or b.serviceId = :serviceId)
            order by b.startsAt asc, b.id asc
            """)
    List<BlackoutEntity> findActiveBlocking(@Param("tenantId") Long tenantId,
                                            @Param("from") Instant from,
                                            @Param("to") Instant to,
                                            @Param("serviceId") Long serviceId,
                                            @Param("staffId") Long staffId,
                                            @Param("resourceId") Long resourceId);

    @Query("""
            select b from BlackoutEntity b
            where b.tenantId = :tenantId
              and b.startsAt < :to
              and b.endsAt > :from
              and (:includeInactive = true or b.active = true)
            order by b.startsAt asc, b.id asc
            """)
    List<BlackoutEntity> findInRange(@Param("tenantId") Long tenantId,
                                     @Param("from") Instant from,
                                     @Param("to") Instant to,
                                     @Param("includeInactive") boolean includeInactive);
}
