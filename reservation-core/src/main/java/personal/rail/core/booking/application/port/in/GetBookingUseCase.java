package personal.rail.core.booking.application.port.in;

import personal.rail.core.booking.domain.model.Booking;

/**
 * Get Booking UseCase (Input Port)
 * 예약 상세 조회 유스케이스
 */
public interface GetBookingUseCase {

    /**
     * 예약 ID로 예약 조회
     *
     * @param bookingId   예약 ID
     * @param requesterId 요청 사용자 ID (소유자 또는 관리자)
     * @return 예약 정보
     * @throws personal.rail.core.booking.domain.exception.BookingNotFoundException 예약을 찾을 수 없을 때
     * @throws personal.rail.core.booking.domain.exception.BookingAccessDeniedException 권한이 없을 때
     */
    Booking getBooking(Long bookingId, Long requesterId);
}
