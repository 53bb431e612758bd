package personal.rail.core.booking.application.port.in;

import personal.rail.core.booking.domain.model.Booking;

import java.util.concurrent.CompletableFuture;

/**
 * Book Seat UseCase (Input Port)
 * 좌석 예약 유스케이스
 */
public interface BookSeatUseCase {

    /**
     * 좌석 예약 (제한 시간까지 대기)
     * 좌석 선점 후 같은 트랜잭션 범위에서 예약을 저장한다. 실패 시 선점은 반드시 해제된다.
     *
     * @param command 예약 커맨드
     * @return 생성된 예약 (멱등성 토큰 재요청이면 기존 예약)
     * @throws personal.rail.core.user.domain.exception.UserNotFoundException 사용자가 없을 때
     * @throws personal.rail.core.booking.domain.exception.TrainNotFoundException 열차가 없을 때
     * @throws personal.rail.core.booking.domain.exception.InvalidTravelDateException 지난 운행일일 때
     * @throws personal.rail.core.booking.domain.exception.SeatOutOfRangeException 좌석 번호가 정원 범위 밖일 때
     * @throws personal.rail.core.booking.domain.exception.TrainFullException 남은 좌석이 없을 때
     * @throws personal.rail.core.booking.domain.exception.SeatTakenException 지정 좌석 경쟁에서 졌을 때
     * @throws personal.rail.core.booking.domain.exception.BookingTimeoutException 제한 시간 초과 시
     * @throws personal.rail.core.booking.domain.exception.BookingPersistenceException 저장 실패 시
     */
    Booking book(BookSeatCommand command);

    /**
     * 좌석 예약 (비동기)
     * 사용자/열차/운행일 검증은 호출 스레드에서 즉시 수행되어 예외로 던져진다.
     * 반환된 Future 를 cancel 하면 어느 시점이든 안전하게 예약 시도가 중단되고 보상 처리된다.
     *
     * @param command 예약 커맨드 (timeout 은 사용하지 않음)
     * @return 예약 결과 Future
     */
    CompletableFuture<Booking> bookAsync(BookSeatCommand command);
}
