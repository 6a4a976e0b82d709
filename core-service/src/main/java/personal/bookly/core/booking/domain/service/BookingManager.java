package personal.bookly.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.bookly.core.booking.application.port.out.BookingLockPort;
import personal.bookly.core.booking.application.port.out.BookingRepository;
import personal.bookly.core.booking.domain.exception.BookingAccessDeniedException;
import personal.bookly.core.booking.domain.exception.BookingBlockedException;
import personal.bookly.core.booking.domain.exception.BookingConflictException;
import personal.bookly.core.booking.domain.exception.BookingNotFoundException;
import personal.bookly.core.booking.domain.model.Booking;
import personal.bookly.core.booking.domain.model.BookingDraft;
import personal.bookly.core.booking.domain.model.BookingStatus;
import personal.bookly.core.booking.domain.model.BookingStatusChange;
import personal.bookly.core.booking.domain.model.ConflictResult;
import personal.bookly.core.booking.domain.model.StoredBooking;
import personal.bookly.core.membership.application.port.in.BookingEntitlementUseCase;
import personal.bookly.core.membership.domain.model.EntitlementDebit;
import personal.bookly.core.tenant.application.port.in.CheckBlackoutUseCase;
import personal.bookly.core.tenant.domain.model.Blackout;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Booking Domain Service (Transaction Manager)
 * 트랜잭션 범위 분리를 위한 실행 전용 서비스
 * Safe Transaction Pattern: 잠금, 재검사, 저장, 원장 차감만 트랜잭션 안에서 수행하고
 * 알림(heartbeat, 이벤트)은 호출자가 커밋 이후에 보낸다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private static final int TRANSACTION_TIMEOUT_SECONDS = 10;

    private final BookingLockPort bookingLockPort;
    private final BookingRepository bookingRepository;
    private final ConflictChecker conflictChecker;
    private final CheckBlackoutUseCase checkBlackoutUseCase;
    private final BookingEntitlementUseCase bookingEntitlementUseCase;

    /**
     * 잠금 → 멱등 키 재확인 → 블랙아웃/충돌 재검사 → 이용권 선택 → 저장 → 예약 코드 → 원장 차감
     * 잠금 순서는 staff → resource, 둘 다 없으면 service 행
     */
    @Transactional(timeout = TRANSACTION_TIMEOUT_SECONDS)
    public StoredBooking createInTransaction(BookingDraft draft, ZoneId zoneId) {
        // 1. 잠금 기준 행 잠금
        lockAnchors(draft);

        // 2. 잠금 대기 중 같은 멱등 키의 요청이 커밋되었으면 그 예약을 반환
        if (draft.hasIdempotencyKey()) {
            Optional<Booking> existing = bookingRepository.findByIdempotencyKey(
                    draft.tenantId(), draft.idempotencyKey());
            if (existing.isPresent()) {
                log.info("Idempotent booking found after lock: tenantId={}, bookingId={}",
                        draft.tenantId(), existing.get().id());
                return StoredBooking.replayed(existing.get());
            }
        }

        // 3. 잠금 보유 상태에서 블랙아웃 재검사
        List<Blackout> blocking = checkBlackoutUseCase.findBlocking(draft.tenantId(), draft.startTime(),
                draft.endTime(), draft.serviceId(), draft.staffId(), draft.resourceId());
        if (!blocking.isEmpty()) {
            log.warn("Booking blocked in transaction: tenantId={}, blackoutId={}",
                    draft.tenantId(), blocking.get(0).id());
            throw new BookingBlockedException(blocking.get(0));
        }

        // 4. 충돌 재검사
        ConflictResult conflict = conflictChecker.check(draft.tenantId(), draft.serviceId(), draft.staffId(),
                draft.resourceId(), draft.startTime(), draft.endTime(), draft.capacity(), null);
        if (conflict.conflict()) {
            log.warn("Booking conflict in transaction: tenantId={}, staffId={}, resourceId={}, rows={}",
                    draft.tenantId(), draft.staffId(), draft.resourceId(), conflict.rows().size());
            throw new BookingConflictException(conflict.rows());
        }

        // 5. 이용권 잠금 및 차감 대상 결정
        Optional<EntitlementDebit> debit = bookingEntitlementUseCase.reserve(draft.tenantId(),
                draft.customer().id(), draft.serviceId(), draft.allowMembership(),
                draft.membershipRequest(), draft.durationMinutes());

        // 6. 저장 (idempotency_key 유니크 제약이 2차 방어선)
        Booking saved = bookingRepository.save(
                Booking.create(draft, debit.map(EntitlementDebit::membershipId).orElse(null)));

        // 7. id가 정해진 뒤 예약 코드 부여
        Booking coded = bookingRepository.save(saved.withBookingCode(zoneId));

        // 8. 원장 차감 (예약당 1건)
        debit.ifPresent(d -> bookingEntitlementUseCase.debitForBooking(draft.tenantId(), d, coded.id()));

        log.info("Booking stored: tenantId={}, bookingId={}, status={}, membershipId={}",
                coded.tenantId(), coded.id(), coded.status(), coded.customerMembershipId());
        return StoredBooking.created(coded);
    }

    /**
     * 상태 전이 (행 잠금)
     *
     * @param requiredEmail null이 아니면 예약 고객 이메일과 일치해야 한다 (고객 본인 취소)
     */
    @Transactional(timeout = TRANSACTION_TIMEOUT_SECONDS)
    public BookingStatusChange changeStatus(Long tenantId, Long bookingId, BookingStatus target, String requiredEmail) {
        Booking booking = bookingRepository.findByIdForUpdate(tenantId, bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (requiredEmail != null && !booking.belongsToEmail(requiredEmail)) {
            log.warn("Booking access denied: tenantId={}, bookingId={}", tenantId, bookingId);
            throw new BookingAccessDeniedException(bookingId);
        }

        // 같은 상태 요청은 변경 없이 성공
        if (booking.status() == target) {
            return new BookingStatusChange(booking, false);
        }

        Booking updated = bookingRepository.save(booking.transitionTo(target));
        log.info("Booking status changed: tenantId={}, bookingId={}, from={}, to={}",
                tenantId, bookingId, booking.status(), target);
        return new BookingStatusChange(updated, true);
    }

    private void lockAnchors(BookingDraft draft) {
        if (draft.staffId() != null) {
            bookingLockPort.lockStaff(draft.tenantId(), draft.staffId());
        }
        if (draft.resourceId() != null) {
            bookingLockPort.lockResource(draft.tenantId(), draft.resourceId());
        }
        if (draft.staffId() == null && draft.resourceId() == null) {
            bookingLockPort.lockService(draft.tenantId(), draft.serviceId());
        }
    }
}
