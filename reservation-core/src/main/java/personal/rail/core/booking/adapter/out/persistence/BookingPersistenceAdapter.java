package personal.rail.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import personal.rail.core.booking.application.port.out.BookingRepository;
import personal.rail.core.booking.domain.exception.BookingPersistenceException;
import personal.rail.core.booking.domain.exception.SeatConstraintViolationException;
import personal.rail.core.booking.domain.model.Booking;
import personal.rail.core.booking.domain.model.BookingStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 * Spring 데이터 접근 예외를 도메인 예외로 변환한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private final JpaBookingRepository jpaBookingRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public <T> T withTransaction(Supplier<T> work) {
        return translate("transaction", () -> transactionTemplate.execute(status -> work.get()));
    }

    @Override
    public Booking insertBooking(Booking booking) {
        log.debug("Inserting booking: trainId={}, travelDate={}, seat={}",
                booking.trainId(), booking.travelDate(), booking.seatNumber());

        return translate("insertBooking", () -> {
            var saved = jpaBookingRepository.saveAndFlush(BookingEntity.fromDomain(booking));
            return saved.toDomain();
        });
    }

    @Override
    public Optional<Booking> findBooking(Long bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return translate("findBooking", () -> jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain));
    }

    @Override
    public Optional<Booking> findByIdempotencyToken(String idempotencyToken) {
        return translate("findByIdempotencyToken", () -> jpaBookingRepository.findByIdempotencyToken(idempotencyToken)
                .map(BookingEntity::toDomain));
    }

    @Override
    public boolean markCancelled(Long bookingId, LocalDateTime cancelledAt) {
        int updated = translate("markCancelled", () -> jpaBookingRepository.cancelIfActive(bookingId, cancelledAt));
        log.debug("Booking cancel update: bookingId={}, updated={}", bookingId, updated);
        return updated == 1;
    }

    @Override
    public boolean markCompensated(Long bookingId, LocalDateTime cancelledAt) {
        int updated = translate("markCompensated", () -> jpaBookingRepository.compensateIfActive(bookingId, cancelledAt));
        log.debug("Booking compensation update: bookingId={}, updated={}", bookingId, updated);
        return updated == 1;
    }

    @Override
    public long countActiveBookings(Long trainId, LocalDate travelDate) {
        return translate("countActiveBookings", () ->
                jpaBookingRepository.countByTrainIdAndBookingDateAndStatus(trainId, travelDate, BookingStatus.ACTIVE));
    }

    @Override
    public List<Integer> findActiveSeatNumbers(Long trainId, LocalDate travelDate) {
        return translate("findActiveSeatNumbers", () ->
                jpaBookingRepository.findSeatNumbers(trainId, travelDate, BookingStatus.ACTIVE));
    }

    @Override
    public boolean existsActiveBooking(Long trainId, LocalDate travelDate, int seatNumber) {
        return translate("existsActiveBooking", () ->
                jpaBookingRepository.existsByTrainIdAndBookingDateAndSeatNumberAndStatus(
                        trainId, travelDate, seatNumber, BookingStatus.ACTIVE));
    }

    private <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            log.warn("Booking constraint violated: operation={}, cause={}", operation, e.getMostSpecificCause().getMessage());
            throw new SeatConstraintViolationException(operation, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Booking persistence failed: operation={}", operation, e);
            throw new BookingPersistenceException(operation, e);
        }
    }
}
