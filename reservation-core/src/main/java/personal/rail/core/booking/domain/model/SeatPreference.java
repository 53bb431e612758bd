package personal.rail.core.booking.domain.model;

import personal.rail.common.exception.BusinessException;
import personal.rail.common.exception.ErrorCode;

/**
 * Seat Preference
 * 특정 좌석 지정 또는 자동 배정(any)
 *
 * @param seatNumber 지정 좌석 번호 (자동 배정이면 null)
 */
public record SeatPreference(Integer seatNumber) {

    private static final SeatPreference ANY = new SeatPreference(null);

    public static SeatPreference any() {
        return ANY;
    }

    public static SeatPreference specific(int seatNumber) {
        return new SeatPreference(seatNumber);
    }

    public boolean isAny() {
        return seatNumber == null;
    }

    /**
     * 지정 좌석 번호 반환
     *
     * @throws BusinessException 자동 배정 선호일 때
     */
    public int requireSeatNumber() {
        if (seatNumber == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat preference is 'any'");
        }
        return seatNumber;
    }

    @Override
    public String toString() {
        return isAny() ? "any" : String.valueOf(seatNumber);
    }
}
