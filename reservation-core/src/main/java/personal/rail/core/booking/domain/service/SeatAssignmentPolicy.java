package personal.rail.core.booking.domain.service;

import personal.rail.core.booking.domain.model.SeatAvailability;

import java.util.OptionalInt;

/**
 * Seat Assignment Policy
 * 자동 배정(any) 시 어떤 빈 좌석을 고를지 결정하는 정책
 */
public interface SeatAssignmentPolicy {

    /**
     * @param availability 현재 좌석 현황
     * @return 배정할 좌석 번호, 빈 좌석이 없으면 OptionalInt.empty()
     */
    OptionalInt selectSeat(SeatAvailability availability);
}
