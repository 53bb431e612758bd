package personal.rail.core.booking.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import personal.rail.core.booking.application.config.ReservationProperties;
import personal.rail.core.booking.application.port.in.BookSeatCommand;
import personal.rail.core.booking.application.port.out.BookingRepository;
import personal.rail.core.booking.application.port.out.TrainRepository;
import personal.rail.core.booking.domain.exception.BookingAccessDeniedException;
import personal.rail.core.booking.domain.exception.BookingNotFoundException;
import personal.rail.core.booking.domain.exception.BookingPersistenceException;
import personal.rail.core.booking.domain.exception.BookingTimeoutException;
import personal.rail.core.booking.domain.exception.IdempotencyTokenMismatchException;
import personal.rail.core.booking.domain.exception.InvalidTravelDateException;
import personal.rail.core.booking.domain.exception.SeatConstraintViolationException;
import personal.rail.core.booking.domain.exception.SeatOutOfRangeException;
import personal.rail.core.booking.domain.exception.SeatTakenException;
import personal.rail.core.booking.domain.exception.TrainFullException;
import personal.rail.core.booking.domain.model.Booking;
import personal.rail.core.booking.domain.model.BookingStatus;
import personal.rail.core.booking.domain.model.LedgerKey;
import personal.rail.core.booking.domain.model.SeatAvailability;
import personal.rail.core.booking.domain.model.SeatClaim;
import personal.rail.core.booking.domain.model.SeatPreference;
import personal.rail.core.booking.domain.model.Train;
import personal.rail.core.booking.domain.service.ConflictResolver;
import personal.rail.core.booking.domain.service.SeatLedger;
import personal.rail.core.user.application.port.in.ValidateUserUseCase;
import personal.rail.core.user.domain.model.User;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationEngine 단위 테스트")
class ReservationEngineTest {

    private static final Long USER_ID = 1L;
    private static final Long OTHER_USER_ID = 2L;
    private static final Long ADMIN_ID = 3L;
    private static final Long TRAIN_ID = 7L;
    private static final Long BOOKING_ID = 100L;
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 18);
    private static final LocalDate TRAVEL_DATE = LocalDate.of(2026, 11, 1);
    private static final LedgerKey KEY = LedgerKey.of(TRAIN_ID, TRAVEL_DATE);

    @Mock
    private ValidateUserUseCase validateUserUseCase;
    @Mock
    private TrainRepository trainRepository;
    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private SeatLedger seatLedger;
    @Mock
    private ConflictResolver conflictResolver;

    private final List<Runnable> deferredTasks = new ArrayList<>();
    private Train train;
    private User user;

    @BeforeEach
    void setUp() {
        train = new Train(TRAIN_ID, "KTX-101", "Seoul", "Busan", 3);
        user = new User(USER_ID, "user", "user@test.com", false);

        lenient().when(bookingRepository.withTransaction(any())).thenAnswer(invocation -> {
            Supplier<?> work = invocation.getArgument(0);
            return work.get();
        });
    }

    private ReservationEngine engine(TaskExecutor executor) {
        ReservationProperties properties = new ReservationProperties(
                new ReservationProperties.Booking(Duration.ofSeconds(2), Duration.ofSeconds(30), 3),
                new ReservationProperties.Executor(1, 1, 0, "booking-"));
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T00:00:00Z"), ZoneOffset.UTC);
        return new ReservationEngine(validateUserUseCase, trainRepository, bookingRepository,
                seatLedger, conflictResolver, properties, clock, executor);
    }

    private ReservationEngine syncEngine() {
        return engine(Runnable::run);
    }

    private ReservationEngine deferredEngine() {
        return engine(deferredTasks::add);
    }

    private void givenValidRequest() {
        given(validateUserUseCase.validateUser(USER_ID)).willReturn(user);
        given(trainRepository.findById(TRAIN_ID)).willReturn(Optional.of(train));
    }

    private void givenSeatClaimable(int seat) {
        given(seatLedger.availability(train, TRAVEL_DATE))
                .willReturn(SeatAvailability.of(train, TRAVEL_DATE, List.of()));
        given(seatLedger.claim(eq(TRAIN_ID), eq(TRAVEL_DATE), eq(seat), anyString()))
                .willAnswer(invocation -> new SeatClaim(KEY, seat, invocation.getArgument(3)));
    }

    private void givenInsertSucceeds() {
        given(bookingRepository.insertBooking(any())).willAnswer(invocation -> {
            Booking booking = invocation.getArgument(0);
            return new Booking(BOOKING_ID, booking.userId(), booking.trainId(), booking.seatNumber(),
                    booking.travelDate(), booking.status(), booking.idempotencyToken(), booking.claimToken(),
                    booking.createdAt(), null);
        });
    }

    private Booking existingBooking(Long ownerId, BookingStatus status) {
        return new Booking(BOOKING_ID, ownerId, TRAIN_ID, 2, TRAVEL_DATE, status,
                "token-1", "attempt-1", LocalDateTime.of(2026, 10, 17, 10, 0),
                status == BookingStatus.CANCELLED ? LocalDateTime.of(2026, 10, 17, 11, 0) : null);
    }

    @Nested
    @DisplayName("좌석 예약")
    class Book {

        @Test
        @DisplayName("지정 좌석 예약 성공 - 저장 후 선점을 해제한다")
        void specificSeat_Success() {
            // given
            givenValidRequest();
            givenSeatClaimable(2);
            givenInsertSucceeds();
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when
            Booking booking = syncEngine().book(command);

            // then
            assertThat(booking.id()).isEqualTo(BOOKING_ID);
            assertThat(booking.seatNumber()).isEqualTo(2);
            assertThat(booking.status()).isEqualTo(BookingStatus.ACTIVE);
            assertThat(booking.createdAt()).isEqualTo(LocalDateTime.of(2026, 10, 18, 0, 0));
            verify(seatLedger).release(booking.toClaim());
        }

        @Test
        @DisplayName("자동 배정 예약 성공 - ConflictResolver 에 위임")
        void anySeat_Success() {
            // given
            givenValidRequest();
            givenInsertSucceeds();
            given(conflictResolver.claimAnySeat(eq(train), eq(TRAVEL_DATE), anyString(), any()))
                    .willAnswer(invocation -> new SeatClaim(KEY, 1, invocation.getArgument(2)));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.any());

            // when
            Booking booking = syncEngine().book(command);

            // then
            assertThat(booking.seatNumber()).isEqualTo(1);
            verify(seatLedger).release(booking.toClaim());
        }

        @Test
        @DisplayName("예약 실패 - 지난 운행일")
        void pastDate() {
            // given
            givenValidRequest();
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TODAY.minusDays(1), SeatPreference.any());

            // when & then
            assertThatThrownBy(() -> syncEngine().book(command))
                    .isInstanceOf(InvalidTravelDateException.class);
            verifyNoInteractions(seatLedger, conflictResolver);
        }

        @Test
        @DisplayName("예약 성공 - 당일 운행은 허용")
        void today_Allowed() {
            // given
            given(validateUserUseCase.validateUser(USER_ID)).willReturn(user);
            given(trainRepository.findById(TRAIN_ID)).willReturn(Optional.of(train));
            given(seatLedger.availability(train, TODAY))
                    .willReturn(SeatAvailability.of(train, TODAY, List.of()));
            given(seatLedger.claim(eq(TRAIN_ID), eq(TODAY), eq(1), anyString()))
                    .willAnswer(invocation -> new SeatClaim(LedgerKey.of(TRAIN_ID, TODAY), 1, invocation.getArgument(3)));
            givenInsertSucceeds();

            // when
            Booking booking = syncEngine().book(
                    BookSeatCommand.of(USER_ID, TRAIN_ID, TODAY, SeatPreference.specific(1)));

            // then
            assertThat(booking.travelDate()).isEqualTo(TODAY);
        }

        @Test
        @DisplayName("예약 실패 - 정원 범위 밖 좌석은 만석 여부보다 먼저 검사")
        void outOfRange() {
            // given
            givenValidRequest();
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(5));

            // when & then
            assertThatThrownBy(() -> syncEngine().book(command))
                    .isInstanceOf(SeatOutOfRangeException.class)
                    .hasMessageContaining("seatNumber=5");
            verifyNoInteractions(seatLedger);
        }

        @Test
        @DisplayName("예약 실패 - 만석")
        void full() {
            // given
            givenValidRequest();
            given(seatLedger.availability(train, TRAVEL_DATE))
                    .willReturn(SeatAvailability.of(train, TRAVEL_DATE, List.of(1, 2, 3)));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when & then
            assertThatThrownBy(() -> syncEngine().book(command))
                    .isInstanceOf(TrainFullException.class);
            verify(seatLedger, never()).claim(any(), any(), anyInt(), anyString());
            verify(seatLedger, never()).release(any());
        }

        @Test
        @DisplayName("예약 실패 - 지정 좌석 경쟁에서 패배")
        void seatTaken() {
            // given
            givenValidRequest();
            given(seatLedger.availability(train, TRAVEL_DATE))
                    .willReturn(SeatAvailability.of(train, TRAVEL_DATE, List.of(2)));
            given(seatLedger.claim(eq(TRAIN_ID), eq(TRAVEL_DATE), eq(2), anyString()))
                    .willThrow(new SeatTakenException(TRAIN_ID, TRAVEL_DATE, 2));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when & then
            assertThatThrownBy(() -> syncEngine().book(command))
                    .isInstanceOf(SeatTakenException.class);
            verify(bookingRepository, never()).insertBooking(any());
        }

        @Test
        @DisplayName("저장 실패 - 제약 위반이어도 선점은 해제된다")
        void constraintViolation_ReleasesClaim() {
            // given
            givenValidRequest();
            givenSeatClaimable(2);
            given(bookingRepository.insertBooking(any()))
                    .willThrow(new SeatConstraintViolationException("insertBooking", new RuntimeException()));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when & then
            assertThatThrownBy(() -> syncEngine().book(command))
                    .isInstanceOf(SeatConstraintViolationException.class);
            verify(seatLedger).release(any(SeatClaim.class));
        }

        @Test
        @DisplayName("저장 실패 - 예상하지 못한 오류는 PersistenceFailed 로 변환")
        void unexpectedFailure() {
            // given
            givenValidRequest();
            givenSeatClaimable(2);
            given(bookingRepository.insertBooking(any())).willThrow(new IllegalStateException("boom"));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when & then
            assertThatThrownBy(() -> syncEngine().book(command))
                    .isInstanceOf(BookingPersistenceException.class);
            verify(seatLedger).release(any(SeatClaim.class));
        }

        @Test
        @DisplayName("실행기 포화 - Timeout")
        void executorSaturated() {
            // given
            givenValidRequest();
            ReservationEngine engine = engine(task -> {
                throw new TaskRejectedException("queue full");
            });
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.any());

            // when & then
            assertThatThrownBy(() -> engine.book(command))
                    .isInstanceOf(BookingTimeoutException.class);
            verifyNoInteractions(seatLedger, conflictResolver);
        }
    }

    @Nested
    @DisplayName("멱등성")
    class Idempotency {

        @Test
        @DisplayName("같은 토큰 재요청 - 기존 예약을 그대로 반환")
        void replay() {
            // given
            Booking existing = existingBooking(USER_ID, BookingStatus.ACTIVE);
            given(bookingRepository.findByIdempotencyToken("token-1")).willReturn(Optional.of(existing));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.any())
                    .withIdempotencyToken("token-1");

            // when
            Booking booking = syncEngine().book(command);

            // then
            assertThat(booking).isEqualTo(existing);
            verifyNoInteractions(validateUserUseCase, seatLedger, conflictResolver);
        }

        @Test
        @DisplayName("같은 토큰, 다른 요청 - IDEMPOTENCY_TOKEN_MISMATCH")
        void mismatch() {
            // given
            Booking existing = existingBooking(OTHER_USER_ID, BookingStatus.ACTIVE);
            given(bookingRepository.findByIdempotencyToken("token-1")).willReturn(Optional.of(existing));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.any())
                    .withIdempotencyToken("token-1");

            // when & then
            assertThatThrownBy(() -> syncEngine().book(command))
                    .isInstanceOf(IdempotencyTokenMismatchException.class);
        }

        @Test
        @DisplayName("같은 토큰 동시 요청 - 먼저 저장된 예약으로 응답")
        void concurrentSameToken() {
            // given
            givenValidRequest();
            givenSeatClaimable(2);
            Booking winner = existingBooking(USER_ID, BookingStatus.ACTIVE);
            given(bookingRepository.findByIdempotencyToken("token-1"))
                    .willReturn(Optional.empty())
                    .willReturn(Optional.of(winner));
            given(bookingRepository.insertBooking(any()))
                    .willThrow(new SeatConstraintViolationException("insertBooking", new RuntimeException()));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2))
                    .withIdempotencyToken("token-1");

            // when
            Booking booking = syncEngine().book(command);

            // then
            assertThat(booking.id()).isEqualTo(BOOKING_ID);
            verify(seatLedger).release(any(SeatClaim.class));
        }
    }

    @Nested
    @DisplayName("제한 시간 / 취소")
    class TimeoutAndAbort {

        private final AtomicReference<CompletableFuture<Booking>> pendingFuture = new AtomicReference<>();

        @Test
        @DisplayName("제한 시간 초과 - 시도가 시작되기 전이면 선점하지 않는다")
        void timeoutBeforeStart() {
            // given
            givenValidRequest();
            ReservationEngine engine = deferredEngine();
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2))
                    .withTimeout(Duration.ofMillis(50));

            // when
            assertThatThrownBy(() -> engine.book(command))
                    .isInstanceOf(BookingTimeoutException.class);
            deferredTasks.forEach(Runnable::run);

            // then
            verifyNoInteractions(seatLedger);
            verify(bookingRepository, never()).insertBooking(any());
        }

        @Test
        @DisplayName("호출자 취소 - 커밋 직전이면 롤백하고 선점을 해제한다")
        void cancelBeforeCommit() {
            // given
            givenValidRequest();
            givenSeatClaimable(2);
            ReservationEngine engine = deferredEngine();
            AtomicReference<CompletableFuture<Booking>> future = new AtomicReference<>();
            given(bookingRepository.insertBooking(any())).willAnswer(invocation -> {
                future.get().cancel(true);
                return invocation.getArgument(0);
            });
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when
            future.set(engine.bookAsync(command));
            deferredTasks.forEach(Runnable::run);

            // then
            assertThat(future.get()).isCancelled();
            verify(seatLedger).release(any(SeatClaim.class));
            verify(bookingRepository, never()).markCancelled(any(), any());
        }

        @Test
        @DisplayName("호출자 취소 - 이미 커밋되었으면 예약을 취소 상태로 보상하고 토큰을 비운다")
        void cancelAfterCommit_Compensates() {
            // given
            ReservationEngine engine = givenCommitThenCallerLeaves();
            given(bookingRepository.markCompensated(eq(BOOKING_ID), any())).willReturn(true);
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2))
                    .withIdempotencyToken("token-1");

            // when
            pendingFuture.set(engine.bookAsync(command));
            deferredTasks.forEach(Runnable::run);

            // then
            assertThat(pendingFuture.get()).isCancelled();
            verify(bookingRepository).markCompensated(eq(BOOKING_ID), any());
            verify(bookingRepository, never()).markCancelled(any(), any());
            verify(seatLedger).release(any(SeatClaim.class));
        }

        @Test
        @DisplayName("보상 실패 - 다시 시도하여 성공하면 멈춘다")
        void compensation_RetriesUntilSuccess() {
            // given
            ReservationEngine engine = givenCommitThenCallerLeaves();
            given(bookingRepository.markCompensated(eq(BOOKING_ID), any()))
                    .willThrow(new BookingPersistenceException("markCompensated", new IllegalStateException("db down")))
                    .willReturn(true);
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when
            pendingFuture.set(engine.bookAsync(command));
            deferredTasks.forEach(Runnable::run);

            // then
            verify(bookingRepository, times(2)).markCompensated(eq(BOOKING_ID), any());
        }

        @Test
        @DisplayName("보상 실패 - 정해진 횟수만 시도하고 예외를 밖으로 던지지 않는다")
        void compensation_GivesUpAfterBoundedAttempts() {
            // given
            ReservationEngine engine = givenCommitThenCallerLeaves();
            given(bookingRepository.markCompensated(eq(BOOKING_ID), any()))
                    .willThrow(new BookingPersistenceException("markCompensated", new IllegalStateException("db down")));
            BookSeatCommand command = BookSeatCommand.of(USER_ID, TRAIN_ID, TRAVEL_DATE, SeatPreference.specific(2));

            // when
            pendingFuture.set(engine.bookAsync(command));
            deferredTasks.forEach(Runnable::run);

            // then
            assertThat(pendingFuture.get()).isCancelled();
            verify(bookingRepository, times(3)).markCompensated(eq(BOOKING_ID), any());
        }

        /**
         * 첫 트랜잭션(예약 저장)이 커밋된 직후 호출자가 future 를 취소한다
         */
        private ReservationEngine givenCommitThenCallerLeaves() {
            givenValidRequest();
            givenSeatClaimable(2);
            givenInsertSucceeds();
            willAnswer(invocation -> {
                Supplier<?> work = invocation.getArgument(0);
                Object result = work.get();
                pendingFuture.get().cancel(true);
                return result;
            }).willAnswer(invocation -> {
                Supplier<?> work = invocation.getArgument(0);
                return work.get();
            }).given(bookingRepository).withTransaction(any());
            return deferredEngine();
        }
    }

    @Nested
    @DisplayName("예약 취소")
    class Cancel {

        @Test
        @DisplayName("소유자 취소 성공 - CANCELLED 로 변경하고 좌석을 해제한다")
        void owner_Success() {
            // given
            Booking booking = existingBooking(USER_ID, BookingStatus.ACTIVE);
            given(bookingRepository.findBooking(BOOKING_ID)).willReturn(Optional.of(booking));
            given(validateUserUseCase.validateUser(USER_ID)).willReturn(user);
            given(bookingRepository.markCancelled(eq(BOOKING_ID), any())).willReturn(true);

            // when
            Booking cancelled = syncEngine().cancel(BOOKING_ID, USER_ID);

            // then
            assertThat(cancelled.status()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(cancelled.cancelledAt()).isNotNull();
            verify(seatLedger).release(booking.toClaim());
        }

        @Test
        @DisplayName("관리자 취소 성공")
        void admin_Success() {
            // given
            Booking booking = existingBooking(USER_ID, BookingStatus.ACTIVE);
            given(bookingRepository.findBooking(BOOKING_ID)).willReturn(Optional.of(booking));
            given(validateUserUseCase.validateUser(ADMIN_ID))
                    .willReturn(new User(ADMIN_ID, "admin", "admin@test.com", true));
            given(bookingRepository.markCancelled(eq(BOOKING_ID), any())).willReturn(true);

            // when
            Booking cancelled = syncEngine().cancel(BOOKING_ID, ADMIN_ID);

            // then
            assertThat(cancelled.isCancelled()).isTrue();
        }

        @Test
        @DisplayName("취소 실패 - 다른 사용자")
        void otherUser_Forbidden() {
            // given
            given(bookingRepository.findBooking(BOOKING_ID))
                    .willReturn(Optional.of(existingBooking(USER_ID, BookingStatus.ACTIVE)));
            given(validateUserUseCase.validateUser(OTHER_USER_ID))
                    .willReturn(new User(OTHER_USER_ID, "other", "other@test.com", false));

            // when & then
            assertThatThrownBy(() -> syncEngine().cancel(BOOKING_ID, OTHER_USER_ID))
                    .isInstanceOf(BookingAccessDeniedException.class);
            verify(bookingRepository, never()).markCancelled(any(), any());
        }

        @Test
        @DisplayName("취소 실패 - 예약 없음")
        void notFound() {
            // given
            given(bookingRepository.findBooking(BOOKING_ID)).willReturn(Optional.empty());

            // when & then
            assertThatThrownBy(() -> syncEngine().cancel(BOOKING_ID, USER_ID))
                    .isInstanceOf(BookingNotFoundException.class);
        }

        @Test
        @DisplayName("이미 취소된 예약 - 변경 없이 그대로 반환")
        void alreadyCancelled() {
            // given
            Booking cancelled = existingBooking(USER_ID, BookingStatus.CANCELLED);
            given(bookingRepository.findBooking(BOOKING_ID)).willReturn(Optional.of(cancelled));
            given(validateUserUseCase.validateUser(USER_ID)).willReturn(user);

            // when
            Booking result = syncEngine().cancel(BOOKING_ID, USER_ID);

            // then
            assertThat(result).isEqualTo(cancelled);
            verify(bookingRepository, never()).markCancelled(any(), any());
            verifyNoInteractions(seatLedger);
        }
    }
}
