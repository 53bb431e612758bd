package personal.rail.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.rail.core.booking.application.port.in.GetBookingUseCase;
import personal.rail.core.booking.application.port.out.BookingRepository;
import personal.rail.core.booking.domain.exception.BookingNotFoundException;
import personal.rail.core.booking.domain.model.Booking;
import personal.rail.core.user.application.port.in.ValidateUserUseCase;

/**
 * Booking Query Service (SRP)
 * 단일 책임: 예약 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService implements GetBookingUseCase {

    private final BookingRepository bookingRepository;
    private final ValidateUserUseCase validateUserUseCase;

    @Override
    public Booking getBooking(Long bookingId, Long requesterId) {
        var booking = bookingRepository.findBooking(bookingId)
                .orElseThrow(() -> {
                    log.warn("Booking not found: bookingId={}", bookingId);
                    return new BookingNotFoundException(bookingId);
                });

        booking.ensureAccessibleBy(validateUserUseCase.validateUser(requesterId));

        log.debug("Booking retrieved: bookingId={}", bookingId);
        return booking;
    }
}
