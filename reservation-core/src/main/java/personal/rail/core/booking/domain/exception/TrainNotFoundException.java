package personal.rail.core.booking.domain.exception;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Train Not Found Exception
 * 열차를 찾을 수 없을 때 발생하는 예외
 */
public class TrainNotFoundException extends BusinessException {
    public TrainNotFoundException(Long trainId) {
        super(ErrorCode.TRAIN_NOT_FOUND, String.format("Train not found: trainId=%d", trainId));
    }
}
