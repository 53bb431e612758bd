package personal.rail.core.booking.domain.model;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Seat Ledger Key
 * 좌석 원장의 단위: (열차, 운행일)
 */
public record LedgerKey(Long trainId, LocalDate travelDate) {

    public LedgerKey {
        if (trainId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Train ID cannot be null");
        }
        if (travelDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Travel date cannot be null");
        }
    }

    public static LedgerKey of(Long trainId, LocalDate travelDate) {
        return new LedgerKey(trainId, travelDate);
    }

    /**
     * 외부 저장소 키로 사용하는 문자열 표현 (예: 7:2026-10-20)
     */
    public String asString() {
        return trainId + ":" + travelDate;
    }
}
