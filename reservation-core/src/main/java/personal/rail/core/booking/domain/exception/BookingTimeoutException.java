package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Booking Timeout Exception
 * 제한 시간 안에 예약을 완료하지 못했거나 호출자가 예약 시도를 취소했을 때 발생
 * 이 예외를 받은 시점에는 부분 상태(선점만 남은 좌석, 저장만 된 예약)가 남지 않는다
 */
public class BookingTimeoutException extends BusinessException {
    public BookingTimeoutException(Long trainId, LocalDate travelDate, Duration timeout) {
        super(ErrorCode.BOOKING_TIMEOUT,
                String.format("Booking timed out: trainId=%d, travelDate=%s, timeoutMs=%d",
                        trainId, travelDate, timeout.toMillis()));
    }

    public BookingTimeoutException(Long trainId, LocalDate travelDate, String reason) {
        super(ErrorCode.BOOKING_TIMEOUT,
                String.format("Booking aborted: trainId=%d, travelDate=%s, reason=%s",
                        trainId, travelDate, reason));
    }
}
