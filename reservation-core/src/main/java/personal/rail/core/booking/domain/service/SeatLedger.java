package personal.rail.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rail.core.booking.application.config.ReservationProperties;
import personal.rail.core.booking.application.port.out.BookingRepository;
import personal.rail.core.booking.application.port.out.SeatClaimRepository;
import personal.rail.core.booking.application.port.out.TrainRepository;
import personal.rail.core.booking.domain.exception.SeatOutOfRangeException;
import personal.rail.core.booking.domain.exception.SeatTakenException;
import personal.rail.core.booking.domain.exception.TrainNotFoundException;
import personal.rail.core.booking.domain.model.LedgerKey;
import personal.rail.core.booking.domain.model.SeatAvailability;
import personal.rail.core.booking.domain.model.SeatClaim;
import personal.rail.core.booking.domain.model.Train;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Seat Ledger (Domain Service)
 * (열차, 운행일)별 좌석 점유 원장
 *
 * 점유 = 유효(ACTIVE) 예약 행 + 진행 중인 예약 시도의 선점 마커.
 * 선점 마커는 예약 행이 커밋된 뒤에 해제되므로, 이후의 선점 시도는 항상 커밋된 행을 보게 된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeatLedger {

    private final TrainRepository trainRepository;
    private final BookingRepository bookingRepository;
    private final SeatClaimRepository seatClaimRepository;
    private final ReservationProperties properties;

    /**
     * 빈 좌석 조회
     *
     * @throws TrainNotFoundException 열차가 없을 때
     */
    public SeatAvailability availability(Long trainId, LocalDate travelDate) {
        return availability(loadTrain(trainId), travelDate);
    }

    /**
     * 빈 좌석 조회 (이미 조회한 열차 사용)
     */
    public SeatAvailability availability(Train train, LocalDate travelDate) {
        LedgerKey key = LedgerKey.of(train.id(), travelDate);

        Set<Integer> occupied = new HashSet<>(bookingRepository.findActiveSeatNumbers(train.id(), travelDate));
        occupied.addAll(seatClaimRepository.claimedSeats(key));

        SeatAvailability availability = SeatAvailability.of(train, travelDate, occupied);
        log.debug("Seat availability: {}", availability);
        return availability;
    }

    /**
     * 좌석 선점 (원자적)
     * 같은 (열차, 운행일, 좌석)에 대한 동시 선점 중 하나만 성공한다.
     *
     * @param trainId    열차 ID
     * @param travelDate 운행일
     * @param seatNumber 좌석 번호
     * @param owner      선점 소유자 (예약 시도 ID)
     * @return 선점 정보 (해제 시 사용)
     * @throws TrainNotFoundException  열차가 없을 때
     * @throws SeatOutOfRangeException 좌석 번호가 1..totalSeats 밖일 때
     * @throws SeatTakenException      이미 선점/예약된 좌석일 때
     */
    public SeatClaim claim(Long trainId, LocalDate travelDate, int seatNumber, String owner) {
        Train train = loadTrain(trainId);
        if (!train.hasSeat(seatNumber)) {
            throw new SeatOutOfRangeException(trainId, seatNumber, train.totalSeats());
        }

        SeatClaim claim = new SeatClaim(LedgerKey.of(trainId, travelDate), seatNumber, owner);

        // 1. 선점 마커 획득 (상호 배제 지점)
        if (!seatClaimRepository.tryClaim(claim, properties.booking().claimTtl())) {
            log.debug("Seat claim rejected (claimed by another attempt): trainId={}, travelDate={}, seat={}",
                    trainId, travelDate, seatNumber);
            throw new SeatTakenException(trainId, travelDate, seatNumber);
        }

        // 2. 이미 커밋된 유효 예약이 있으면 마커 반납
        boolean booked;
        try {
            booked = bookingRepository.existsActiveBooking(trainId, travelDate, seatNumber);
        } catch (RuntimeException e) {
            seatClaimRepository.release(claim);
            throw e;
        }
        if (booked) {
            seatClaimRepository.release(claim);
            log.debug("Seat claim rejected (already booked): trainId={}, travelDate={}, seat={}",
                    trainId, travelDate, seatNumber);
            throw new SeatTakenException(trainId, travelDate, seatNumber);
        }

        log.debug("Seat claimed: trainId={}, travelDate={}, seat={}, owner={}",
                trainId, travelDate, seatNumber, owner);
        return claim;
    }

    /**
     * 좌석 선점 해제
     * 보상 처리, 예약 커밋 후 정산, 예약 취소 시 호출된다.
     */
    public void release(SeatClaim claim) {
        boolean released = seatClaimRepository.release(claim);
        log.debug("Seat claim released: key={}, seat={}, owner={}, held={}",
                claim.key().asString(), claim.seatNumber(), claim.owner(), released);
    }

    private Train loadTrain(Long trainId) {
        return trainRepository.findById(trainId)
                .orElseThrow(() -> {
                    log.warn("Train not found: trainId={}", trainId);
                    return new TrainNotFoundException(trainId);
                });
    }
}
