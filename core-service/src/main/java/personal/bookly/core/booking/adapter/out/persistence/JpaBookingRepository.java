package personal.bookly.core.booking.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import personal.bookly.core.booking.domain.model.BookingStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 * 겹침 쿼리는 기준별로 고정되어 있고 excludeId 미지정 시 0을 전달한다
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    Optional<BookingEntity> findByIdAndTenantId(Long id, Long tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select b from BookingEntity b where b.id = :id and b.tenantId = :tenantId")
    Optional<BookingEntity> findByIdForUpdate(@Param("tenantId") Long tenantId, @Param("id") Long id);

    Optional<BookingEntity> findByTenantIdAndIdempotencyKey(Long tenantId, String idempotencyKey);

    @Query("""
            select b from BookingEntity b
            where b.tenantId = :tenantId and b.startTime >= :from and b.startTime < :to
            order by b.startTime, b.id
            """)
    List<BookingEntity> findStartingBetween(@Param("tenantId") Long tenantId,
                                            @Param("from") Instant from,
                                            @Param("to") Instant to);

    @Query("""
            select b from BookingEntity b
            where b.tenantId = :tenantId and b.serviceId = :serviceId
              and b.status in :statuses
              and b.startTime < :to and b.endTime > :from
              and b.id <> :excludeId
            order by b.startTime, b.id
            """)
    List<BookingEntity> findOverlappingByService(@Param("tenantId") Long tenantId,
                                                 @Param("serviceId") Long serviceId,
                                                 @Param("statuses") Collection<BookingStatus> statuses,
                                                 @Param("from") Instant from,
                                                 @Param("to") Instant to,
                                                 @Param("excludeId") Long excludeId,
                                                 Pageable pageable);

    @Query("""
            select b from BookingEntity b
            where b.tenantId = :tenantId and b.staffId = :staffId
              and b.status in :statuses
              and b.startTime < :to and b.endTime > :from
              and b.id <> :excludeId
            order by b.startTime, b.id
            """)
    List<BookingEntity> findOverlappingByStaff(@Param("tenantId") Long tenantId,
                                               @Param("staffId") Long staffId,
                                               @Param("statuses") Collection<BookingStatus> statuses,
                                               @Param("from") Instant from,
                                               @Param("to") Instant to,
                                               @Param("excludeId") Long excludeId,
                                               Pageable pageable);

    @Query("""
            select b from BookingEntity b
            where b.tenantId = :tenantId and b.resourceId = :resourceId
              and b.status in :statuses
              and b.startTime < :to and b.endTime > :from
              and b.id <> :excludeId
            order by b.startTime, b.id
            """)
    List<BookingEntity> findOverlappingByResource(@Param("tenantId") Long tenantId,
                                                  @Param("resourceId") Long resourceId,
                                                  @Param("statuses") Collection<BookingStatus> statuses,
                                                  @Param("from") Instant from,
                                                  @Param("to") Instant to,
                                                  @Param("excludeId") Long excludeId,
                                                  Pageable pageable);
}
