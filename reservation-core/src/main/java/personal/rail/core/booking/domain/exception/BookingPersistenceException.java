package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Booking Persistence Exception
 * 저장소 인프라 오류로 예약을 저장/변경하지 못했을 때 발생
 */
public class BookingPersistenceException extends BusinessException {
    public BookingPersistenceException(String detail, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED,
                String.format("Booking persistence failed: %s", detail), cause);
    }
}
