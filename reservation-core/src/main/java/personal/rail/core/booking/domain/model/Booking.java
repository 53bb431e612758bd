package personal.rail.core.booking.domain.model;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;
import personal.rail.core.booking.domain.exception.BookingAccessDeniedException;
import personal.rail.core.user.domain.model.User;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Booking Domain Model
 * 예약 도메인 모델 (불변)
 */
public record Booking(
        Long id,
        Long userId,
        Long trainId,
        int seatNumber,
        LocalDate travelDate,
        BookingStatus status,
        String idempotencyToken,
        String claimToken,
        LocalDateTime createdAt,
        LocalDateTime cancelledAt) {

    public Booking {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (trainId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Train ID cannot be null");
        }
        if (seatNumber < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat number must be positive");
        }
        if (travelDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Travel date cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
    }

    /**
     * 선점한 좌석으로 예약 생성 (정적 팩토리 메서드)
     *
     * @param userId           사용자 ID
     * @param claim            좌석 선점 정보
     * @param idempotencyToken 멱등성 토큰 (없으면 null)
     * @param now              생성 시각
     * @return 새로운 예약 (ACTIVE 상태, ID 없음)
     */
    public static Booking create(Long userId, SeatClaim claim, String idempotencyToken, LocalDateTime now) {
        return new Booking(
                null,
                userId,
                claim.key().trainId(),
                claim.seatNumber(),
                claim.key().travelDate(),
                BookingStatus.ACTIVE,
                idempotencyToken,
                claim.owner(),
                now,
                null);
    }

    /**
     * 예약 취소 (ACTIVE -> CANCELLED)
     */
    public Booking cancel(LocalDateTime at) {
        if (status != BookingStatus.ACTIVE) {
            throw new IllegalStateException(
                    String.format("Cannot cancel booking in %s status. Booking ID: %d", status, id));
        }
        return new Booking(id, userId, trainId, seatNumber, travelDate,
                BookingStatus.CANCELLED, idempotencyToken, claimToken, createdAt, at);
    }

    public boolean isActive() {
        return status == BookingStatus.ACTIVE;
    }

    public boolean isCancelled() {
        return status == BookingStatus.CANCELLED;
    }

    public LedgerKey ledgerKey() {
        return LedgerKey.of(trainId, travelDate);
    }

    /**
     * 이 예약을 만든 좌석 선점 정보 (취소 시 해제 대상)
     */
    public SeatClaim toClaim() {
        return new SeatClaim(ledgerKey(), seatNumber, claimToken);
    }

    /**
     * 같은 멱등성 토큰으로 들어온 재요청인지 확인
     */
    public boolean isSameRequest(Long requestUserId, Long requestTrainId, LocalDate requestTravelDate) {
        return Objects.equals(userId, requestUserId)
                && Objects.equals(trainId, requestTrainId)
                && Objects.equals(travelDate, requestTravelDate);
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 접근 권한 검증
     * 예약 소유자 또는 관리자만 허용
     *
     * @param requester 요청 사용자
     * @throws BookingAccessDeniedException 권한이 없을 때
     */
    public void ensureAccessibleBy(User requester) {
        if (!userId.equals(requester.id()) && !requester.admin()) {
            throw new BookingAccessDeniedException(id, requester.id());
        }
    }
}
