package personal.rail.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rail.core.booking.application.config.ReservationProperties;
import personal.rail.core.booking.domain.exception.SeatTakenException;
import personal.rail.core.booking.domain.exception.TrainFullException;
import personal.rail.core.booking.domain.model.SeatAvailability;
import personal.rail.core.booking.domain.model.SeatClaim;
import personal.rail.core.booking.domain.model.Train;

import java.time.LocalDate;
import java.util.OptionalInt;

/**
 * Conflict Resolver (Domain Service)
 * 자동 배정 정책과 선점 경쟁 처리 규칙을 예약 엔진에서 분리
 *
 * 경쟁 규칙: 원장 선점이 먼저 성공한 쪽이 이긴다. 자동 배정 요청은 갱신된 빈 좌석으로
 * maxAssignAttempts 회까지 재시도한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictResolver {

    private final SeatLedger seatLedger;
    private final SeatAssignmentPolicy seatAssignmentPolicy;
    private final ReservationProperties properties;

    /**
     * 자동 배정할 좌석 선택
     *
     * @return 좌석 번호, 빈 좌석이 없으면 empty (호출자가 Full 로 처리)
     */
    public OptionalInt selectSeat(SeatAvailability availability) {
        if (availability.isFull()) {
            return OptionalInt.empty();
        }
        return seatAssignmentPolicy.selectSeat(availability);
    }

    /**
     * 자동 배정 + 선점 (제한된 재시도)
     *
     * @param train      열차
     * @param travelDate 운행일
     * @param owner      선점 소유자 (예약 시도 ID)
     * @param abortCheck 매 시도 전에 호출되는 중단 확인 (중단 시 예외를 던진다)
     * @return 선점 정보
     * @throws TrainFullException  빈 좌석이 없을 때
     * @throws SeatTakenException  재시도 횟수를 모두 소진했을 때
     */
    public SeatClaim claimAnySeat(Train train, LocalDate travelDate, String owner, Runnable abortCheck) {
        int maxAttempts = properties.booking().maxAssignAttempts();
        SeatTakenException lastConflict = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            abortCheck.run();

            SeatAvailability availability = seatLedger.availability(train, travelDate);
            OptionalInt seat = selectSeat(availability);
            if (seat.isEmpty()) {
                log.info("Train is full: trainId={}, travelDate={}, attempt={}", train.id(), travelDate, attempt);
                throw new TrainFullException(train.id(), travelDate);
            }

            try {
                return seatLedger.claim(train.id(), travelDate, seat.getAsInt(), owner);
            } catch (SeatTakenException e) {
                log.debug("Lost seat race, retrying: trainId={}, travelDate={}, seat={}, attempt={}/{}",
                        train.id(), travelDate, seat.getAsInt(), attempt, maxAttempts);
                lastConflict = e;
            }
        }

        log.warn("Seat assignment attempts exhausted: trainId={}, travelDate={}, attempts={}",
                train.id(), travelDate, maxAttempts);
        throw lastConflict;
    }
}
