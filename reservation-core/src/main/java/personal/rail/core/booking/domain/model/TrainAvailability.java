package personal.rail.core.booking.domain.model;

import java.time.LocalDate;

/**
 * Train Availability
 * 노선 조회 결과: 열차와 운행일 기준 잔여 좌석 수
 */
public record TrainAvailability(
        Train train,
        LocalDate travelDate,
        int availableSeats
) {
    public static TrainAvailability of(Train train, SeatAvailability availability) {
        return new TrainAvailability(train, availability.key().travelDate(), availability.freeCount());
    }
}
