package personal.rail.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import personal.rail.core.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    Optional<BookingEntity> findByIdempotencyToken(String idempotencyToken);

    /**
     * (열차, 운행일)의 상태별 좌석 번호
     */
    @Query("SELECT b.seatNumber FROM BookingEntity b " +
            "WHERE b.trainId = :trainId AND b.bookingDate = :bookingDate AND b.status = :status")
    List<Integer> findSeatNumbers(@Param("trainId") Long trainId,
                                  @Param("bookingDate") LocalDate bookingDate,
                                  @Param("status") BookingStatus status);

    long countByTrainIdAndBookingDateAndStatus(Long trainId, LocalDate bookingDate, BookingStatus status);

    boolean existsByTrainIdAndBookingDateAndSeatNumberAndStatus(
            Long trainId, LocalDate bookingDate, Integer seatNumber, BookingStatus status);

    /**
     * 조건부 취소: ACTIVE 인 행만 CANCELLED 로 변경하고 active_marker 를 비운다
     *
     * @return 변경된 행 수 (0 또는 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BookingEntity b " +
            "SET b.status = personal.rail.core.booking.domain.model.BookingStatus.CANCELLED, " +
            "b.activeMarker = NULL, b.cancelledAt = :cancelledAt " +
            "WHERE b.id = :id AND b.status = personal.rail.core.booking.domain.model.BookingStatus.ACTIVE")
    int cancelIfActive(@Param("id") Long id, @Param("cancelledAt") LocalDateTime cancelledAt);

    /**
     * 보상 취소: 호출자가 떠난 뒤 커밋된 행을 CANCELLED 로 바꾸고 멱등성 토큰도 비운다
     * 같은 토큰의 재요청이 새 예약으로 처리되도록 한다
     *
     * @return 변경된 행 수 (0 또는 1)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BookingEntity b " +
            "SET b.status = personal.rail.core.booking.domain.model.BookingStatus.CANCELLED, " +
            "b.activeMarker = NULL, b.idempotencyToken = NULL, b.cancelledAt = :cancelledAt " +
            "WHERE b.id = :id AND b.status = personal.rail.core.booking.domain.model.BookingStatus.ACTIVE")
    int compensateIfActive(@Param("id") Long id, @Param("cancelledAt") LocalDateTime cancelledAt);
}
