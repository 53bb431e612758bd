package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Train Full Exception
 * 해당 운행일에 남은 좌석이 없을 때 발생
 */
public class TrainFullException extends BusinessException {
    public TrainFullException(Long trainId, LocalDate travelDate) {
        super(ErrorCode.TRAIN_FULL,
                String.format("No seats available: trainId=%d, travelDate=%s", trainId, travelDate));
    }
}
