package personal.rail.core.booking.domain.model;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Seat Claim
 * 예약 시도 하나가 보유한 좌석 선점 정보
 *
 * @param key        (열차, 운행일)
 * @param seatNumber 좌석 번호
 * @param owner      선점 소유자 (예약 시도 ID)
 */
public record SeatClaim(LedgerKey key, int seatNumber, String owner) {

    public SeatClaim {
        if (key == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ledger key cannot be null");
        }
        if (owner == null || owner.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Claim owner cannot be null or blank");
        }
    }
}
