package personal.rail.core.booking.application.port.in;

import personal.rail.core.booking.domain.model.TrainAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * Search Trains UseCase (Input Port)
 * 노선(출발지 -> 도착지) 열차와 잔여 좌석 조회
 */
public interface SearchTrainsUseCase {

    List<TrainAvailability> searchTrains(String source, String destination, LocalDate travelDate);
}
