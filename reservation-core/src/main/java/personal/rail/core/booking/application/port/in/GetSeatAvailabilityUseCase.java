package personal.rail.core.booking.application.port.in;

import personal.rail.core.booking.domain.model.SeatAvailability;

import java.time.LocalDate;

/**
 * Get Seat Availability UseCase (Input Port)
 * 열차/운행일 좌석 현황 조회 유스케이스
 */
public interface GetSeatAvailabilityUseCase {

    /**
     * @param trainId    열차 ID
     * @param travelDate 운행일
     * @return 좌석 현황 (유효 예약 + 진행 중인 선점 제외)
     * @throws personal.rail.core.booking.domain.exception.TrainNotFoundException 열차가 없을 때
     */
    SeatAvailability availability(Long trainId, LocalDate travelDate);
}
