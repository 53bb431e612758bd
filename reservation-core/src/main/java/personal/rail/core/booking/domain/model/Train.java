package personal.rail.core.booking.domain.model;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Train Domain Model
 * 열차 도메인 모델 (불변, 코어에서는 읽기 전용)
 */
public record Train(
        Long id,
        String trainNumber,
        String source,
        String destination,
        int totalSeats
) {
    public Train {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Train ID cannot be null");
        }
        if (trainNumber == null || trainNumber.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Train number cannot be null or blank");
        }
        if (totalSeats <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Total seats must be positive");
        }
    }

    /**
     * 좌석 번호가 열차 정원 범위(1..totalSeats) 안에 있는지 확인
     */
    public boolean hasSeat(int seatNumber) {
        return seatNumber >= 1 && seatNumber <= totalSeats;
    }
}
