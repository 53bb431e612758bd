package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Invalid Travel Date Exception
 * 운행일이 오늘보다 이전일 때 발생
 */
public class InvalidTravelDateException extends BusinessException {
    public InvalidTravelDateException(LocalDate travelDate, LocalDate today) {
        super(ErrorCode.INVALID_TRAVEL_DATE,
                String.format("Travel date is in the past: travelDate=%s, today=%s", travelDate, today));
    }
}
