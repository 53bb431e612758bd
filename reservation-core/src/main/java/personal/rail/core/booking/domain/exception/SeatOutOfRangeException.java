package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Seat Out Of Range Exception
 * 좌석 번호가 1..totalSeats 범위를 벗어날 때 발생
 */
public class SeatOutOfRangeException extends BusinessException {
    public SeatOutOfRangeException(Long trainId, int seatNumber, int totalSeats) {
        super(ErrorCode.SEAT_OUT_OF_RANGE,
                String.format("Seat out of range: trainId=%d, seatNumber=%d, totalSeats=%d",
                        trainId, seatNumber, totalSeats));
    }
}
