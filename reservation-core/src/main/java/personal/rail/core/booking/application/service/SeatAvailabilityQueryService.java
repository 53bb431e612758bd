package personal.rail.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.rail.core.booking.application.port.in.GetSeatAvailabilityUseCase;
import personal.rail.core.booking.application.port.in.SearchTrainsUseCase;
import personal.rail.core.booking.application.port.out.TrainRepository;
import personal.rail.core.booking.domain.model.SeatAvailability;
import personal.rail.core.booking.domain.model.TrainAvailability;
import personal.rail.core.booking.domain.service.SeatLedger;

import java.time.LocalDate;
import java.util.List;

/**
 * Seat Availability Query Service (SRP)
 * 단일 책임: 좌석 현황 / 노선 잔여 좌석 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatAvailabilityQueryService implements GetSeatAvailabilityUseCase, SearchTrainsUseCase {

    private final TrainRepository trainRepository;
    private final SeatLedger seatLedger;

    @Override
    public SeatAvailability availability(Long trainId, LocalDate travelDate) {
        return seatLedger.availability(trainId, travelDate);
    }

    @Override
    public List<TrainAvailability> searchTrains(String source, String destination, LocalDate travelDate) {
        var trains = trainRepository.findByRoute(source, destination);

        List<TrainAvailability> result = trains.stream()
                .map(train -> TrainAvailability.of(train, seatLedger.availability(train, travelDate)))
                .toList();

        log.debug("Trains searched: source={}, destination={}, travelDate={}, count={}",
                source, destination, travelDate, result.size());
        return result;
    }
}
