package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Seat Taken Exception
 * 좌석이 이미 다른 요청에 의해 선점/예약된 경우 발생하는 예외
 * 동시 선점 경쟁에서 패배한 쪽이 받는다
 */
public class SeatTakenException extends BusinessException {
    public SeatTakenException(Long trainId, LocalDate travelDate, int seatNumber) {
        super(ErrorCode.SEAT_TAKEN,
                String.format("Seat already taken: trainId=%d, travelDate=%s, seatNumber=%d",
                        trainId, travelDate, seatNumber));
    }
}
