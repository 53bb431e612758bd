package personal.rail.core.booking.domain.service;

import personal.rail.core.booking.domain.model.SeatAvailability;

import java.util.OptionalInt;

/**
 * 가장 낮은 번호의 빈 좌석을 배정하는 기본 정책 (결정적)
 */
public class LowestSeatFirstPolicy implements SeatAssignmentPolicy {

    @Override
    public OptionalInt selectSeat(SeatAvailability availability) {
        return availability.lowestFree();
    }
}
