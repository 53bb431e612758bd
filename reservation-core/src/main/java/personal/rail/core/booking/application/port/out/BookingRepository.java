package personal.rail.core.booking.application.port.out;

import personal.rail.core.booking.domain.model.Booking;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Booking Repository (Output Port)
 * bookings 테이블에 대한 트랜잭션 저장소 경계
 *
 * 모든 메서드는 Unique 제약 위반 시 SeatConstraintViolationException,
 * 그 밖의 저장소 오류 시 BookingPersistenceException 을 던진다.
 */
public interface BookingRepository {

    /**
     * 트랜잭션 범위 실행
     * work 안의 쓰기는 모두 커밋되거나 모두 롤백된다.
     * 성공/비즈니스 예외/인프라 오류 어떤 경우에도 트랜잭션 자원은 반환된다.
     *
     * @param work 트랜잭션 안에서 실행할 작업
     * @return work 의 결과
     */
    <T> T withTransaction(Supplier<T> work);

    /**
     * 예약 저장 (즉시 flush 하여 제약 위반을 호출 지점에서 드러낸다)
     *
     * @param booking ID 없는 신규 예약
     * @return 저장된 예약 (ID 포함)
     * @throws personal.rail.core.booking.domain.exception.SeatConstraintViolationException 좌석/토큰 중복 시
     */
    Booking insertBooking(Booking booking);

    /**
     * 예약 ID로 조회
     */
    Optional<Booking> findBooking(Long bookingId);

    /**
     * 멱등성 토큰으로 조회
     */
    Optional<Booking> findByIdempotencyToken(String idempotencyToken);

    /**
     * 조건부 취소 (ACTIVE 인 경우에만 CANCELLED 로 변경)
     *
     * @param bookingId   예약 ID
     * @param cancelledAt 취소 시각
     * @return 이번 호출로 취소되었으면 true, 이미 취소 상태였으면 false
     */
    boolean markCancelled(Long bookingId, LocalDateTime cancelledAt);

    /**
     * 보상 취소 (ACTIVE 인 경우에만 CANCELLED 로 변경하고 멱등성 토큰을 비운다)
     * 호출자가 Timeout 을 받은 뒤 커밋된 예약에만 사용한다
     *
     * @return 이번 호출로 취소되었으면 true
     */
    boolean markCompensated(Long bookingId, LocalDateTime cancelledAt);

    /**
     * (열차, 운행일)의 유효 예약 수
     */
    long countActiveBookings(Long trainId, LocalDate travelDate);

    /**
     * (열차, 운행일)의 유효 예약 좌석 번호 목록
     */
    List<Integer> findActiveSeatNumbers(Long trainId, LocalDate travelDate);

    /**
     * 특정 좌석에 유효 예약이 있는지 확인
     */
    boolean existsActiveBooking(Long trainId, LocalDate travelDate, int seatNumber);
}
