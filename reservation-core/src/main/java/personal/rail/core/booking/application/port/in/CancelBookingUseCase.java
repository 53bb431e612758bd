package personal.rail.core.booking.application.port.in;

import personal.rail.core.booking.domain.model.Booking;

/**
 * Cancel Booking UseCase (Input Port)
 * 예약 취소 유스케이스
 */
public interface CancelBookingUseCase {

    /**
     * 예약 취소
     * 예약은 삭제하지 않고 CANCELLED 상태로 남기며, 좌석은 다시 예약 가능해진다.
     *
     * @param bookingId   예약 ID
     * @param requesterId 요청 사용자 ID (소유자 또는 관리자)
     * @return 취소된 예약
     * @throws personal.rail.core.booking.domain.exception.BookingNotFoundException 예약이 없을 때
     * @throws personal.rail.core.user.domain.exception.UserNotFoundException 요청 사용자가 없을 때
     * @throws personal.rail.core.booking.domain.exception.BookingAccessDeniedException 권한이 없을 때
     */
    Booking cancel(Long bookingId, Long requesterId);
}
