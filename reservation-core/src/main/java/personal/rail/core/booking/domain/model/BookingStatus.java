package personal.rail.core.booking.domain.model;

/**
 * Booking Status Enum
 * 예약 상태
 */
public enum BookingStatus {
    /**
     * 유효한 예약 (좌석 점유 중)
     */
    ACTIVE,

    /**
     * 취소됨 (종료 상태, 이력 보존을 위해 행은 삭제하지 않음)
     */
    CANCELLED
}
