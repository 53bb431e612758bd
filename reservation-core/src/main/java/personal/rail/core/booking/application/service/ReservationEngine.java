package personal.rail.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import personal.rail.common.exception.BusinessException;
import personal.rail.core.booking.application.config.ReservationProperties;
import personal.rail.core.booking.application.port.in.BookSeatCommand;
import personal.rail.core.booking.application.port.in.BookSeatUseCase;
import personal.rail.core.booking.application.port.in.CancelBookingUseCase;
import personal.rail.core.booking.application.port.out.BookingRepository;
import personal.rail.core.booking.application.port.out.TrainRepository;
import personal.rail.core.booking.domain.exception.BookingNotFoundException;
import personal.rail.core.booking.domain.exception.BookingPersistenceException;
import personal.rail.core.booking.domain.exception.BookingTimeoutException;
import personal.rail.core.booking.domain.exception.IdempotencyTokenMismatchException;
import personal.rail.core.booking.domain.exception.InvalidTravelDateException;
import personal.rail.core.booking.domain.exception.SeatConstraintViolationException;
import personal.rail.core.booking.domain.exception.SeatOutOfRangeException;
import personal.rail.core.booking.domain.exception.SeatTakenException;
import personal.rail.core.booking.domain.exception.TrainFullException;
import personal.rail.core.booking.domain.exception.TrainNotFoundException;
import personal.rail.core.booking.domain.model.Booking;
import personal.rail.core.booking.domain.model.SeatClaim;
import personal.rail.core.booking.domain.model.Train;
import personal.rail.core.booking.domain.service.ConflictResolver;
import personal.rail.core.booking.domain.service.SeatLedger;
import personal.rail.core.user.application.port.in.ValidateUserUseCase;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reservation Engine (Application Service)
 * 좌석 예약/취소 처리
 *
 * 예약 흐름:
 * 1. 호출 스레드: 멱등성 재요청 확인 -> 사용자/열차/운행일/좌석 범위 검증
 * 2. bookingExecutor: 좌석 선점 -> 트랜잭션 안에서 예약 저장 -> 선점 해제
 * 3. 호출 스레드: 제한 시간까지 대기, 초과 시 시도를 중단하고 Timeout
 *
 * 선점 마커는 어떤 경로로 끝나든 작업 스레드의 finally 에서 해제된다.
 * 커밋 이후에 호출자가 떠난 경우 커밋된 예약을 취소 상태로 되돌린다 (최대 3회 시도).
 * 모든 시도가 실패하면 ERROR 로그와 함께 ACTIVE 예약이 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationEngine implements BookSeatUseCase, CancelBookingUseCase {

    private static final int COMPENSATION_ATTEMPTS = 3;

    private final ValidateUserUseCase validateUserUseCase;
    private final TrainRepository trainRepository;
    private final BookingRepository bookingRepository;
    private final SeatLedger seatLedger;
    private final ConflictResolver conflictResolver;
    private final ReservationProperties properties;
    private final Clock clock;
    private final TaskExecutor bookingExecutor;

    @Override
    public Booking book(BookSeatCommand command) {
        Duration timeout = command.timeout() != null
                ? command.timeout()
                : properties.booking().defaultTimeout();

        CompletableFuture<Booking> result = bookAsync(command);
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            if (result.cancel(true)) {
                log.warn("Booking timed out: userId={}, trainId={}, travelDate={}, timeoutMs={}",
                        command.userId(), command.trainId(), command.travelDate(), timeout.toMillis());
                throw new BookingTimeoutException(command.trainId(), command.travelDate(), timeout);
            }
            // 제한 시간과 동시에 완료된 경우
            return joinCompleted(result);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(true);
            throw new BookingTimeoutException(command.trainId(), command.travelDate(), "caller interrupted");

        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    @Override
    public CompletableFuture<Booking> bookAsync(BookSeatCommand command) {
        // 1. 멱등성 재요청
        if (command.hasIdempotencyToken()) {
            Optional<Booking> existing = bookingRepository.findByIdempotencyToken(command.idempotencyToken());
            if (existing.isPresent()) {
                log.info("Idempotent replay: token={}, bookingId={}",
                        command.idempotencyToken(), existing.get().id());
                return CompletableFuture.completedFuture(replay(command, existing.get()));
            }
        }

        // 2. 검증 (호출 스레드에서 즉시 실패)
        validateUserUseCase.validateUser(command.userId());
        Train train = loadTrain(command.trainId());
        validateTravelDate(command.travelDate());
        if (!command.seatPreference().isAny() && !train.hasSeat(command.seatPreference().requireSeatNumber())) {
            throw new SeatOutOfRangeException(train.id(), command.seatPreference().requireSeatNumber(),
                    train.totalSeats());
        }

        // 3. 작업 스레드에 예약 시도 위임
        BookingAttempt attempt = new BookingAttempt(command, train);
        CompletableFuture<Booking> result = new CompletableFuture<>();
        result.whenComplete((booking, error) -> {
            if (error instanceof CancellationException && attempt.abort()) {
                log.debug("Booking attempt aborted: attemptId={}", attempt.id());
            }
        });

        try {
            bookingExecutor.execute(() -> runAttempt(attempt, result));
        } catch (TaskRejectedException e) {
            log.warn("Booking executor saturated: trainId={}, travelDate={}", train.id(), command.travelDate());
            result.completeExceptionally(
                    new BookingTimeoutException(train.id(), command.travelDate(), "booking executor saturated"));
        }

        log.debug("Booking attempt submitted: attemptId={}, userId={}, trainId={}, travelDate={}, seat={}",
                attempt.id(), command.userId(), train.id(), command.travelDate(), command.seatPreference());
        return result;
    }

    @Override
    public Booking cancel(Long bookingId, Long requesterId) {
        Booking booking = bookingRepository.findBooking(bookingId)
                .orElseThrow(() -> {
                    log.warn("Booking not found: bookingId={}", bookingId);
                    return new BookingNotFoundException(bookingId);
                });

        var requester = validateUserUseCase.validateUser(requesterId);
        booking.ensureAccessibleBy(requester);

        if (booking.isCancelled()) {
            log.info("Booking already cancelled: bookingId={}", bookingId);
            return booking;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        boolean cancelled = bookingRepository.withTransaction(() -> bookingRepository.markCancelled(bookingId, now));
        if (!cancelled) {
            // 동시에 다른 취소 요청이 먼저 처리됨
            log.info("Booking cancelled concurrently: bookingId={}", bookingId);
            return bookingRepository.findBooking(bookingId).orElse(booking.cancel(now));
        }

        // 커밋 후 해제에 실패해 남은 선점 마커 정리
        if (booking.claimToken() != null) {
            seatLedger.release(booking.toClaim());
        }

        log.info("Booking cancelled: bookingId={}, requesterId={}, trainId={}, travelDate={}, seat={}",
                bookingId, requesterId, booking.trainId(), booking.travelDate(), booking.seatNumber());
        return booking.cancel(now);
    }

    /**
     * 작업 스레드에서 실행되는 예약 시도
     * 선점은 결과를 전달하기 전에 해제한다
     */
    private void runAttempt(BookingAttempt attempt, CompletableFuture<Booking> result) {
        BookSeatCommand command = attempt.command();
        Train train = attempt.train();
        SeatClaim claim = null;
        Booking saved = null;
        BusinessException failure = null;

        try {
            attempt.ensureRunning();

            // 1. 좌석 선점
            claim = claimSeat(attempt);
            attempt.ensureRunning();

            // 2. 예약 저장 (커밋 직전에 중단 여부를 최종 확인)
            SeatClaim held = claim;
            saved = bookingRepository.withTransaction(() -> {
                Booking inserted = bookingRepository.insertBooking(
                        Booking.create(command.userId(), held, command.idempotencyToken(), LocalDateTime.now(clock)));
                if (!attempt.beginCommit()) {
                    throw new BookingTimeoutException(train.id(), command.travelDate(), "attempt aborted before commit");
                }
                return inserted;
            });
            attempt.committed();

        } catch (RuntimeException e) {
            failure = translate(e);

        } finally {
            if (claim != null) {
                seatLedger.release(claim);
            }
        }

        // 3. 결과 전달, 호출자가 이미 떠났으면 보상
        if (failure != null) {
            fail(command, result, failure);
            return;
        }
        if (!result.complete(saved)) {
            compensate(saved);
            return;
        }
        log.info("Booking created: bookingId={}, userId={}, trainId={}, travelDate={}, seat={}",
                saved.id(), saved.userId(), saved.trainId(), saved.travelDate(), saved.seatNumber());
    }

    private SeatClaim claimSeat(BookingAttempt attempt) {
        BookSeatCommand command = attempt.command();
        Train train = attempt.train();

        if (command.seatPreference().isAny()) {
            return conflictResolver.claimAnySeat(train, command.travelDate(), attempt.id(), attempt::ensureRunning);
        }

        int seatNumber = command.seatPreference().requireSeatNumber();
        if (seatLedger.availability(train, command.travelDate()).isFull()) {
            log.info("Train is full: trainId={}, travelDate={}", train.id(), command.travelDate());
            throw new TrainFullException(train.id(), command.travelDate());
        }
        return seatLedger.claim(train.id(), command.travelDate(), seatNumber, attempt.id());
    }

    /**
     * 커밋 후 결과를 받을 호출자가 없는 예약을 취소 상태로 되돌린다
     * 멱등성 토큰도 비워서 같은 토큰의 재요청은 새 시도로 처리된다
     */
    private void compensate(Booking saved) {
        log.warn("Caller abandoned committed booking, compensating: bookingId={}, trainId={}, travelDate={}, seat={}",
                saved.id(), saved.trainId(), saved.travelDate(), saved.seatNumber());

        RuntimeException lastFailure = null;
        for (int round = 1; round <= COMPENSATION_ATTEMPTS; round++) {
            try {
                bookingRepository.withTransaction(
                        () -> bookingRepository.markCompensated(saved.id(), LocalDateTime.now(clock)));
                return;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Compensation attempt failed: bookingId={}, round={}/{}, cause={}",
                        saved.id(), round, COMPENSATION_ATTEMPTS, e.getMessage());
            }
        }
        log.error("Failed to compensate abandoned booking: bookingId={}, attempts={}",
                saved.id(), COMPENSATION_ATTEMPTS, lastFailure);
    }

    /**
     * 실패 전달
     * 같은 멱등성 토큰의 동시 요청이 먼저 저장된 경우에는 그 예약으로 응답한다
     */
    private void fail(BookSeatCommand command, CompletableFuture<Booking> result, BusinessException failure) {
        if (command.hasIdempotencyToken() && isRaceOutcome(failure)) {
            try {
                Optional<Booking> existing = bookingRepository.findByIdempotencyToken(command.idempotencyToken());
                if (existing.isPresent()) {
                    result.complete(replay(command, existing.get()));
                    return;
                }
            } catch (BusinessException e) {
                result.completeExceptionally(e);
                return;
            }
        }
        log.debug("Booking attempt failed: userId={}, trainId={}, travelDate={}, code={}",
                command.userId(), command.trainId(), command.travelDate(), failure.getErrorCode().getCode());
        result.completeExceptionally(failure);
    }

    private Booking replay(BookSeatCommand command, Booking existing) {
        if (!existing.isSameRequest(command.userId(), command.trainId(), command.travelDate())) {
            log.warn("Idempotency token reused with different request: token={}, bookingId={}",
                    command.idempotencyToken(), existing.id());
            throw new IdempotencyTokenMismatchException(command.idempotencyToken(), existing.id());
        }
        return existing;
    }

    private static boolean isRaceOutcome(BusinessException e) {
        return e instanceof SeatTakenException
                || e instanceof TrainFullException
                || e instanceof SeatConstraintViolationException;
    }

    private static BusinessException translate(RuntimeException e) {
        if (e instanceof BusinessException businessException) {
            return businessException;
        }
        log.error("Unexpected booking failure", e);
        return new BookingPersistenceException(e.getMessage(), e);
    }

    private Booking joinCompleted(CompletableFuture<Booking> result) {
        try {
            return result.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new BookingPersistenceException(String.valueOf(cause), cause);
    }

    private Train loadTrain(Long trainId) {
        return trainRepository.findById(trainId)
                .orElseThrow(() -> {
                    log.warn("Train not found: trainId={}", trainId);
                    return new TrainNotFoundException(trainId);
                });
    }

    private void validateTravelDate(LocalDate travelDate) {
        LocalDate today = LocalDate.now(clock);
        if (travelDate.isBefore(today)) {
            log.warn("Travel date in the past: travelDate={}, today={}", travelDate, today);
            throw new InvalidTravelDateException(travelDate, today);
        }
    }
}
