package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Booking Access Denied Exception
 * 예약 소유자도 관리자도 아닌 사용자가 접근할 때 발생
 */
public class BookingAccessDeniedException extends BusinessException {
    public BookingAccessDeniedException(Long bookingId, Long userId) {
        super(ErrorCode.FORBIDDEN,
                String.format("User %d does not have access to booking %d", userId, bookingId));
    }
}
