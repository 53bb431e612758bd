package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Seat Constraint Violation Exception
 * DB Unique Index 위반 (좌석 원장이 막았어야 하는 경쟁을 저장소가 감지한 경우)
 */
public class SeatConstraintViolationException extends BusinessException {
    public SeatConstraintViolationException(String detail, Throwable cause) {
        super(ErrorCode.CONSTRAINT_VIOLATION,
                String.format("Booking constraint violated: %s", detail), cause);
    }
}
